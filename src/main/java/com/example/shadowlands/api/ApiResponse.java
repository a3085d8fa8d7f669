package com.example.shadowlands.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Uniform response envelope: {@code {success, data?, error?, message?}} plus the status code
 * the transport should answer with.
 */
public record ApiResponse(boolean success, int status, Map<String, Object> data, String error, String message) {

    public ApiResponse {
        data = data != null ? Collections.unmodifiableMap(new LinkedHashMap<>(data)) : null;
    }

    public static ApiResponse ok(Map<String, Object> data, String message) {
        return new ApiResponse(true, 200, data, null, message);
    }

    public static ApiResponse failure(int status, String error, String message) {
        return new ApiResponse(false, status, null, error, message);
    }

    /**
     * Envelope as a plain map, absent fields left out.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("success", success);
        if (data != null) out.put("data", data);
        if (error != null) out.put("error", error);
        if (message != null) out.put("message", message);
        return out;
    }
}
