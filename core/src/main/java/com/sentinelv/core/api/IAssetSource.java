package com.sentinelv.core.api;

import com.sentinelv.core.model.ScanConfig;
import com.sentinelv.core.model.SubdomainSource;

import java.util.Set;

/** 서브도메인 후보 소스 최소 계약. 실패는 빈 집합으로 흡수하는 것을 권장. */
public interface IAssetSource {
    SubdomainSource kind();

    /** 후보 호스트명(정규화 전일 수 있음). 인터럽트만 예외로 전파. */
    Set<String> collect(String domain, ScanConfig config) throws InterruptedException;
}
