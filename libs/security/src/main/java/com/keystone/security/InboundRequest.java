package com.keystone.security;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * The parts of an inbound request the access-control core reads: headers and path.
 *
 * <p>Header names are case-insensitive. Only the first value of a repeated header is kept.
 */
public final class InboundRequest {

    private final String path;
    private final Map<String, String> headers;

    private InboundRequest(String path, Map<String, String> headers) {
        this.path = path;
        this.headers = headers;
    }

    public static InboundRequest of(String path, Map<String, String> headers) {
        Map<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            headers.forEach((name, value) -> {
                if (name != null && value != null) {
                    copy.putIfAbsent(name, value);
                }
            });
        }
        return new InboundRequest(path == null ? "/" : path, Collections.unmodifiableMap(copy));
    }

    public static InboundRequest of(String path) {
        return of(path, Map.of());
    }

    public String path() {
        return path;
    }

    /** Value of header {@code name}, empty if absent or blank. */
    public Optional<String> header(String name) {
        String value = headers.get(name);
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.strip());
    }

    public Optional<String> bearerToken() {
        return BearerTokenExtractor.extract(headers.get(SecurityHeaders.AUTHORIZATION));
    }

    @Override
    public String toString() {
        return "InboundRequest[path=" + path + ", headers=" + headers.keySet() + "]";
    }
}
