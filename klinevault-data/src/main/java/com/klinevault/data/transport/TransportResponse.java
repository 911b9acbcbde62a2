package com.klinevault.data.transport;

import com.klinevault.core.error.ClientErrorException;
import com.klinevault.core.error.RateLimitedException;
import com.klinevault.core.error.ResponseException;
import com.klinevault.core.error.ServerErrorException;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Backend-neutral HTTP response. Header lookup is case-insensitive.
 */
public record TransportResponse(int status, Map<String, List<String>> headers, byte[] body, String url) {

    private static final int MAX_ERROR_BODY_CHARS = 200;

    public TransportResponse {
        headers = headers == null ? Map.of() : headers;
        body = body == null ? new byte[0] : body;
    }

    public boolean isSuccessful() {
        return status >= 200 && status < 300;
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    /**
     * First value of a header, or null.
     */
    public String header(String name) {
        for (Map.Entry<String, List<String>> e : headers.entrySet()) {
            if (e.getKey() != null && e.getKey().equalsIgnoreCase(name) && !e.getValue().isEmpty()) {
                return e.getValue().get(0);
            }
        }
        return null;
    }

    /**
     * Return this response if successful, otherwise throw the matching response error.
     */
    public TransportResponse requireSuccess() throws ResponseException {
        if (isSuccessful()) {
            return this;
        }
        String detail = "HTTP " + status + " from " + url + errorSnippet();
        if (status == 429 || status == 418) {
            throw new RateLimitedException(status, url, parseRetryAfter(header("Retry-After")));
        }
        if (status >= 500) {
            throw new ServerErrorException(status, url, detail);
        }
        throw new ClientErrorException(status, url, detail);
    }

    private String errorSnippet() {
        if (body.length == 0) return "";
        String text = bodyAsString().strip();
        return " - " + (text.length() > MAX_ERROR_BODY_CHARS ? text.substring(0, MAX_ERROR_BODY_CHARS) + "..." : text);
    }

    static Duration parseRetryAfter(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Duration.ofSeconds(Long.parseLong(value.trim()));
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
