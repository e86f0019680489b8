package com.siqiu.scriptmonitor.network;

import java.util.Map;

public record FetchRequest(
        String url,
        String method,
        Map<String, String> headers,
        String body,
        Long timeoutMs
) {
    public FetchRequest {
        method = method == null || method.isBlank() ? "GET" : method;
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public static FetchRequest get(String url) {
        return new FetchRequest(url, "GET", Map.of(), null, null);
    }
}
