package com.bbthechange.mobilelogin.service;

import com.bbthechange.mobilelogin.model.AuditEvent;
import com.bbthechange.mobilelogin.model.AuditEventKind;
import com.bbthechange.mobilelogin.repository.AuditEventRepository;
import com.bbthechange.mobilelogin.util.TimeOrderedIds;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Map;

/**
 * Append-only audit trail of connection activity. A failed audit write is logged and
 * counted but never fails the request that triggered it.
 */
@Service
public class AuditService {

    private static final Logger logger = LoggerFactory.getLogger(AuditService.class);

    private final AuditEventRepository auditEventRepository;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public AuditService(AuditEventRepository auditEventRepository, MeterRegistry meterRegistry, Clock clock) {
        this.auditEventRepository = auditEventRepository;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    public void record(AuditEventKind kind, String socketId, String eventType, String mobileNumber,
                       String status, Map<String, String> attributes) {
        AuditEvent event = AuditEvent.builder()
                .eventId(TimeOrderedIds.next(clock).toString())
                .socketId(socketId)
                .eventType(eventType)
                .mobileNumber(mobileNumber)
                .status(status)
                .attributes(attributes == null || attributes.isEmpty() ? null : attributes)
                .timestamp(clock.instant())
                .build();
        try {
            auditEventRepository.save(kind, event);
        } catch (RuntimeException e) {
            meterRegistry.counter("audit.write.failed", "kind", kind.name()).increment();
            logger.warn("Dropped {} audit event for socket {}: {}", kind, socketId, e.getMessage());
        }
    }
}
