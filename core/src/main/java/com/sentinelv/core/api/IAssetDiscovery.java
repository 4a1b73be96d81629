package com.sentinelv.core.api;

import com.sentinelv.core.model.ScanConfig;

import java.util.SortedSet;

/** 자산 탐색 최소 계약: 루트 도메인을 받아 정렬된 호스트명 집합을 돌려준다. */
public interface IAssetDiscovery {
    SortedSet<String> discover(String domain, ScanConfig config) throws InterruptedException;
}
