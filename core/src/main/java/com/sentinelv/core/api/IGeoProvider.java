package com.sentinelv.core.api;

import com.sentinelv.core.model.GeoRecord;

import java.util.Optional;

/** 지리 정보 제공자 전략. 실패(비 200, 타임아웃, 잘못된 페이로드)는 empty. */
public interface IGeoProvider {
    String name();

    Optional<GeoRecord> lookup(String ip) throws InterruptedException;
}
