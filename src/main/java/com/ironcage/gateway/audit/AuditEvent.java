package com.ironcage.gateway.audit;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One audit/cost record. Carries identifiers and amounts only, never prompt content or credentials.
 */
public record AuditEvent(AuditEventType type,
                         Instant timestamp,
                         String requestId,
                         String agentId,
                         Map<String, Object> attributes) {

    public AuditEvent {
        attributes = Map.copyOf(attributes);
    }

    public static Builder builder(AuditEventType type, Instant timestamp) {
        return new Builder(type, timestamp);
    }

    public static final class Builder {

        private final AuditEventType type;
        private final Instant timestamp;
        private String requestId;
        private String agentId;
        private final Map<String, Object> attributes = new LinkedHashMap<>();

        private Builder(AuditEventType type, Instant timestamp) {
            this.type = type;
            this.timestamp = timestamp;
        }

        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        public Builder agentId(String agentId) {
            this.agentId = agentId;
            return this;
        }

        /**
         * Null values are skipped.
         */
        public Builder attribute(String name, Object value) {
            if (value != null) {
                attributes.put(name, value);
            }
            return this;
        }

        public AuditEvent build() {
            return new AuditEvent(type, timestamp, requestId, agentId, attributes);
        }
    }
}
