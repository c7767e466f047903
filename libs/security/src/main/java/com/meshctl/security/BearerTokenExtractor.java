package com.meshctl.security;

import java.util.Optional;

/**
 * Extracts bearer tokens from HTTP Authorization headers.
 * <p>
 * WHY a utility class: identity resolution falls back to the bearer token when the controller
 * runs behind a local auth proxy. Centralising the parsing avoids subtle prefix bugs.
 */
public final class BearerTokenExtractor {

    private static final String SCHEME = "bearer";

    private BearerTokenExtractor() {
        // utility class
    }

    /**
     * Extracts the bearer token from an Authorization header value.
     * <p>
     * Expects format: {@code "Bearer <token>"}; the scheme is case-insensitive and must be
     * followed by whitespace.
     *
     * @param authorizationHeader the full Authorization header value (may be null)
     * @return the token string, or empty if the header is missing/malformed
     */
    public static Optional<String> extract(String authorizationHeader) {
        if (authorizationHeader == null || authorizationHeader.isBlank()) {
            return Optional.empty();
        }
        String trimmed = authorizationHeader.strip();
        if (trimmed.length() <= SCHEME.length()
                || !trimmed.regionMatches(true, 0, SCHEME, 0, SCHEME.length())
                || !Character.isWhitespace(trimmed.charAt(SCHEME.length()))) {
            return Optional.empty();
        }
        String token = trimmed.substring(SCHEME.length()).strip();
        return token.isEmpty() ? Optional.empty() : Optional.of(token);
    }
}
