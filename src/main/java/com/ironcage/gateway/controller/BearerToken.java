package com.ironcage.gateway.controller;

/**
 * Extracts the token from an {@code Authorization: Bearer ...} header.
 */
final class BearerToken {

    private static final String BEARER_PREFIX = "Bearer ";

    private BearerToken() {
    }

    /**
     * @return the token, or null when the header is missing or not a bearer header
     */
    static String from(String authorizationHeader) {
        if (authorizationHeader == null || !authorizationHeader.startsWith(BEARER_PREFIX)) {
            return null;
        }
        return authorizationHeader.substring(BEARER_PREFIX.length()).trim();
    }
}
