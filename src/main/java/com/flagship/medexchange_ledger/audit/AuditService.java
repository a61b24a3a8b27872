package com.flagship.medexchange_ledger.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.medexchange_ledger.observability.CorrelationContext;
import com.flagship.medexchange_ledger.security.CallerContext;
import com.flagship.medexchange_ledger.security.CallerIdentity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;

/**
 * Writes audit records inside the transaction of the action they describe,
 * so an action and its audit row commit together or not at all.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuditService {

    public static final String SYSTEM_ACTOR = "system";

    private final AuditLogRepository repository;
    private final ObjectMapper objectMapper;

    /**
     * Records an action by the current caller, or by {@value #SYSTEM_ACTOR}
     * when running outside a request (schedulers, consumers, webhooks).
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void record(AuditAction action, String resourceType, Object resourceId, Map<String, ?> details) {
        String actor = CallerContext.current().map(CallerIdentity::getUserId).orElse(SYSTEM_ACTOR);
        recordAs(actor, action, resourceType, resourceId, details);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void recordAs(String actorId, AuditAction action, String resourceType,
                         Object resourceId, Map<String, ?> details) {
        AuditLogEntity entity = AuditLogEntity.create(
            actorId,
            action,
            resourceType,
            String.valueOf(resourceId),
            serialize(details),
            MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY)
        );
        repository.save(entity);
        log.debug("Audit {} on {}/{} by {}", action, resourceType, resourceId, actorId);
    }

    private String serialize(Map<String, ?> details) {
        if (details == null || details.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(details);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Audit details are not serializable", e);
        }
    }
}
