package com.ironcage.gateway.provider;

public record ChatMessage(String role, String content) {

    public static final String SYSTEM = "system";

    public boolean isSystem() {
        return SYSTEM.equals(role);
    }
}
