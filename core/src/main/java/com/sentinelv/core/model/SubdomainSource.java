package com.sentinelv.core.model;

/** 서브도메인 후보 출처 */
public enum SubdomainSource {
    CT_LOG,
    WORDLIST_COMMON,
    WORDLIST_EXTENDED
}
