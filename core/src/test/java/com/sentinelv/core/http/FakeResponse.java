package com.sentinelv.core.http;

import javax.net.ssl.SSLSession;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** 테스트용 HttpResponse<String> */
public final class FakeResponse implements HttpResponse<String> {
    private final int code;
    private final Map<String, List<String>> headers;
    private final String body;

    public FakeResponse(int code, Map<String, List<String>> headers, String body) {
        this.code = code;
        this.headers = headers;
        this.body = body;
    }

    public static FakeResponse ok(String body) { return new FakeResponse(200, Map.of(), body); }
    public static FakeResponse status(int code) { return new FakeResponse(code, Map.of(), ""); }

    @Override public int statusCode() { return code; }
    @Override public HttpRequest request() { return null; }
    @Override public Optional<HttpResponse<String>> previousResponse() { return Optional.empty(); }
    @Override public HttpHeaders headers() { return HttpHeaders.of(headers, (a, b) -> true); }
    @Override public String body() { return body; }
    @Override public Optional<SSLSession> sslSession() { return Optional.empty(); }
    @Override public URI uri() { return URI.create("https://example.com"); }
    @Override public HttpClient.Version version() { return HttpClient.Version.HTTP_1_1; }
}
