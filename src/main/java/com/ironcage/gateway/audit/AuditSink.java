package com.ironcage.gateway.audit;

import java.util.List;

/**
 * Destination of drained audit events. Called from the publisher's drain thread only.
 */
public interface AuditSink {

    void write(List<AuditEvent> batch);
}
