package com.example.signature;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The values a signature covers, as observed from the request: the derived {@code @authority} and
 * {@code @path} components plus any header fields listed by name. Field names are held lowercase.
 */
public record RequestComponents(String authority, String path, Map<String, String> fields) {

    public RequestComponents {
        Objects.requireNonNull(authority, "authority");
        Objects.requireNonNull(path, "path");
        Map<String, String> normalized = new LinkedHashMap<>();
        fields.forEach((name, value) -> {
            if (name == null || value == null) {
                throw new IllegalArgumentException("Field names and values must not be null");
            }
            normalized.put(name.toLowerCase(Locale.ROOT), value);
        });
        fields = Map.copyOf(normalized);
    }

    public static RequestComponents of(String authority, String path) {
        return new RequestComponents(authority, path, Map.of());
    }

    public RequestComponents withField(String name, String value) {
        Map<String, String> copy = new LinkedHashMap<>(fields);
        copy.put(name, value);
        return new RequestComponents(authority, path, copy);
    }

    /**
     * Value of a covered component, or empty when the request does not carry it.
     */
    public Optional<String> valueOf(String component) {
        if (SignatureContext.AUTHORITY.equals(component)) {
            return Optional.of(authority);
        }
        if (SignatureContext.PATH.equals(component)) {
            return Optional.of(path);
        }
        return Optional.ofNullable(fields.get(component));
    }

}
