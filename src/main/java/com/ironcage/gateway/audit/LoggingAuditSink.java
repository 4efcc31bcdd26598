package com.ironcage.gateway.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Writes each event as one JSON line to the {@code AUDIT} logger, leaving shipping and
 * retention to the logging backend.
 */
@Slf4j
public class LoggingAuditSink implements AuditSink {

    private static final Logger AUDIT = LoggerFactory.getLogger("AUDIT");

    private final ObjectMapper objectMapper;

    public LoggingAuditSink(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void write(List<AuditEvent> batch) {
        for (AuditEvent event : batch) {
            try {
                AUDIT.info(objectMapper.writeValueAsString(toJson(event)));
            } catch (JsonProcessingException e) {
                log.error("Error serializing audit event {}", event.type(), e);
            }
        }
    }

    private ObjectNode toJson(AuditEvent event) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("type", event.type().name());
        node.put("timestamp", event.timestamp().toString());
        node.put("requestId", event.requestId());
        node.put("agentId", event.agentId());
        node.set("attributes", objectMapper.valueToTree(event.attributes()));
        return node;
    }
}
