package com.klinevault.data.transport;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Backend-neutral HTTP request. Query parameters keep insertion order.
 */
public record TransportRequest(
    String method,
    String url,
    Map<String, String> params,
    Map<String, String> headers,
    Duration timeout
) {
    public TransportRequest {
        if (method == null || url == null) {
            throw new IllegalArgumentException("method and url are required");
        }
        params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
        headers = headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }

    public static TransportRequest get(String url) {
        return new TransportRequest("GET", url, null, null, null);
    }

    public TransportRequest withParam(String name, Object value) {
        Map<String, String> copy = new LinkedHashMap<>(params);
        copy.put(name, String.valueOf(value));
        return new TransportRequest(method, url, copy, headers, timeout);
    }

    public TransportRequest withHeader(String name, String value) {
        Map<String, String> copy = new LinkedHashMap<>(headers);
        copy.put(name, value);
        return new TransportRequest(method, url, params, copy, timeout);
    }

    public TransportRequest withTimeout(Duration newTimeout) {
        return new TransportRequest(method, url, params, headers, newTimeout);
    }

    /**
     * URL including the encoded query string.
     */
    public String fullUrl() {
        if (params.isEmpty()) {
            return url;
        }
        StringBuilder sb = new StringBuilder(url).append(url.contains("?") ? '&' : '?');
        boolean first = true;
        for (Map.Entry<String, String> e : params.entrySet()) {
            if (!first) sb.append('&');
            first = false;
            sb.append(URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8))
              .append('=')
              .append(URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8));
        }
        return sb.toString();
    }

    /**
     * Timeout to apply, falling back to the given default.
     */
    public Duration timeoutOr(Duration defaultTimeout) {
        return timeout != null ? timeout : defaultTimeout;
    }
}
