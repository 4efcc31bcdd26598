package com.ironcage.gateway.security;

public record IssuedToken(String agentId, String tokenId, String token) {

    @Override
    public String toString() {
        return "IssuedToken[agentId=" + agentId + ", tokenId=" + tokenId + ", token=<redacted>]";
    }
}
