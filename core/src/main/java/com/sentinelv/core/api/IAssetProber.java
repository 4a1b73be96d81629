package com.sentinelv.core.api;

import com.sentinelv.core.model.ProbeResult;
import com.sentinelv.core.model.ScanConfig;

/** 자산 1건 탐침 최소 계약: 실패는 센티널 값으로 돌려주고 던지지 않는다(인터럽트 제외). */
public interface IAssetProber {
    ProbeResult probe(String hostname, ScanConfig config) throws InterruptedException;
}
