package com.sentinelv.core.model;

/**
 * 지리 정보. 조회 실패는 예외가 아니라 센티널 값(0.0/0.0, "Unknown", resolved=false)으로 표현한다.
 *
 * @param ip        DNS 결과 IP (DNS 실패 시 "N/A")
 * @param resolved  지리 정보 제공자 중 하나라도 성공했는지
 * @param source    응답한 제공자 이름 ("none" = 전부 실패, "disabled" = 조회 안 함)
 */
public record GeoRecord(
        String ip,
        double latitude,
        double longitude,
        String country,
        String city,
        String isp,
        String timezone,
        boolean resolved,
        String source
) {
    public static final String UNKNOWN = "Unknown";
    public static final String NO_IP = "N/A";

    /** DNS 해석 자체가 실패한 경우 */
    public static GeoRecord unresolved() {
        return sentinel(NO_IP, "none");
    }

    /** IP는 있으나 모든 제공자가 실패한 경우 */
    public static GeoRecord unknown(String ip) {
        return sentinel(ip, "none");
    }

    /** 설정상 지리 조회를 끈 경우 */
    public static GeoRecord disabled(String ip) {
        return sentinel(ip, "disabled");
    }

    private static GeoRecord sentinel(String ip, String source) {
        return new GeoRecord(ip == null ? NO_IP : ip, 0.0, 0.0, UNKNOWN, UNKNOWN, UNKNOWN, UNKNOWN, false, source);
    }

    public boolean hasIp() { return ip != null && !NO_IP.equals(ip); }
}
