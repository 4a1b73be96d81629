package com.sentinelv.core.util;

import java.util.Locale;
import java.util.regex.Pattern;

/** 호스트/도메인 이름 정규화와 문법 검사 */
public final class DomainNames {
    private DomainNames() {}

    // RFC 1123 라벨: 영숫자로 시작/끝, 중간 하이픈 허용, 63자 이하
    private static final Pattern LABEL = Pattern.compile("[a-z0-9]([a-z0-9-]{0,61}[a-z0-9])?");

    /** 소문자, 앞뒤 공백 및 끝 '.' 제거. null이면 "" */
    public static String normalize(String name) {
        if (name == null) return "";
        String s = name.trim().toLowerCase(Locale.ROOT);
        while (s.endsWith(".")) s = s.substring(0, s.length() - 1);
        return s;
    }

    public static boolean isValidHostname(String name) {
        if (name == null || name.isEmpty() || name.length() > 253) return false;
        String[] labels = name.split("\\.", -1);
        for (String l : labels) {
            if (!LABEL.matcher(l).matches()) return false;
        }
        return true;
    }

    /** 감사 대상 도메인: 라벨 2개 이상 + 문법 유효 */
    public static boolean isValidDomain(String name) {
        return isValidHostname(name) && name.indexOf('.') > 0;
    }

    /** 정규화 후 검증. 잘못된 도메인이면 IllegalArgumentException */
    public static String requireDomain(String domain) {
        String d = normalize(domain);
        if (!isValidDomain(d)) {
            throw new IllegalArgumentException("invalid domain: '" + domain + "'");
        }
        return d;
    }

    /** host 가 domain 자신이거나 그 하위인지 */
    public static boolean isWithin(String host, String domain) {
        return host.equals(domain) || host.endsWith("." + domain);
    }
}
