package com.sentinelv.core.config;

import java.util.Objects;

/**
 * 외부 협력 서비스 URL 템플릿. {domain} / {ip} 자리표시자를 치환한다.
 * 테스트에서는 로컬 HttpServer 주소로 바꿔 끼운다.
 */
public record ProviderEndpoints(String ctLogUrl, String primaryGeoUrl, String secondaryGeoUrl) {

    public static final String DEFAULT_CT = "https://crt.sh/?q=%25.{domain}&output=json";
    public static final String DEFAULT_PRIMARY_GEO = "http://ip-api.com/json/{ip}";
    public static final String DEFAULT_SECONDARY_GEO = "https://ipapi.co/{ip}/json/";

    public ProviderEndpoints {
        Objects.requireNonNull(ctLogUrl, "ctLogUrl");
        Objects.requireNonNull(primaryGeoUrl, "primaryGeoUrl");
        Objects.requireNonNull(secondaryGeoUrl, "secondaryGeoUrl");
    }

    public static ProviderEndpoints defaults() {
        return new ProviderEndpoints(DEFAULT_CT, DEFAULT_PRIMARY_GEO, DEFAULT_SECONDARY_GEO);
    }

    public String ctLogUrlFor(String domain) { return ctLogUrl.replace("{domain}", domain); }
    public String primaryGeoUrlFor(String ip) { return primaryGeoUrl.replace("{ip}", ip); }
    public String secondaryGeoUrlFor(String ip) { return secondaryGeoUrl.replace("{ip}", ip); }

    public ProviderEndpoints withCtLogUrl(String v) { return new ProviderEndpoints(v, primaryGeoUrl, secondaryGeoUrl); }
    public ProviderEndpoints withPrimaryGeoUrl(String v) { return new ProviderEndpoints(ctLogUrl, v, secondaryGeoUrl); }
    public ProviderEndpoints withSecondaryGeoUrl(String v) { return new ProviderEndpoints(ctLogUrl, primaryGeoUrl, v); }
}
