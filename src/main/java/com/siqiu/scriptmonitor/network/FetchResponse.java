package com.siqiu.scriptmonitor.network;

import java.util.Map;

public record FetchResponse(
        int status,
        String statusText,
        String url,
        boolean redirected,
        Map<String, String> headers,
        String body
) {
    public boolean ok() {
        return status >= 200 && status < 300;
    }
}
