package com.flagship.medexchange_ledger.workflow;

import com.flagship.medexchange_ledger.audit.AuditAction;
import com.flagship.medexchange_ledger.audit.AuditService;
import com.flagship.medexchange_ledger.error.FailedPreconditionException;
import com.flagship.medexchange_ledger.error.InvalidArgumentException;
import com.flagship.medexchange_ledger.error.NotFoundException;
import com.flagship.medexchange_ledger.error.PermissionDeniedException;
import com.flagship.medexchange_ledger.observability.LedgerMetrics;
import com.flagship.medexchange_ledger.outbox.OutboxService;
import com.flagship.medexchange_ledger.security.CallerContext;
import com.flagship.medexchange_ledger.security.CallerIdentity;
import com.flagship.medexchange_ledger.security.CallerRole;
import com.flagship.medexchange_ledger.workflow.dto.CreateExchangeRequest;
import com.flagship.medexchange_ledger.workflow.dto.ExchangeItemRequest;
import com.flagship.medexchange_ledger.workflow.dto.ExchangeOverrideRequest;
import com.flagship.medexchange_ledger.workflow.event.ExchangeAcceptedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Exchange lifecycle as driven by its parties, plus the steps the delivery
 * drives on the exchange's behalf.
 *
 * Every transition is looked up in {@link WorkflowRules#EXCHANGE}; a missing
 * transition is FAILED_PRECONDITION, a caller without the required relation
 * is PERMISSION_DENIED.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExchangeService {

    static final String AGGREGATE_TYPE = "exchange";

    private final ExchangeRepository repository;
    private final AuditService auditService;
    private final OutboxService outboxService;
    private final LedgerMetrics metrics;
    private final Clock clock;

    @Transactional
    public ExchangeEntity create(CreateExchangeRequest request) {
        CallerIdentity caller = CallerContext.require();
        if (caller.getRole() != CallerRole.PARTY) {
            throw new PermissionDeniedException("Only parties can open exchanges");
        }

        List<ExchangeItem> items = new ArrayList<>();
        addItems(items, ItemSide.REQUESTED, request.getRequestedItems());
        addItems(items, ItemSide.OFFERED, request.getOfferedItems());

        ExchangeStatus initial = request.isSubmit() ? ExchangeStatus.PENDING : ExchangeStatus.DRAFT;
        ExchangeEntity exchange = repository.saveAndFlush(ExchangeEntity.create(
                caller.getUserId(),
                Location.of(request.getCityId(), request.getCountryCode()),
                request.getNotes(),
                items,
                initial));

        auditService.record(AuditAction.EXCHANGE_CREATED, AGGREGATE_TYPE, exchange.getId(), Map.of(
                "cityId", request.getCityId(),
                "status", initial.name(),
                "items", items.size()));
        log.info("Exchange {} created by {} in {} as {}",
                exchange.getId(), caller.getUserId(), request.getCityId(), initial);
        return exchange;
    }

    @Transactional(readOnly = true)
    public ExchangeEntity getVisible(UUID exchangeId) {
        CallerIdentity caller = CallerContext.require();
        ExchangeEntity exchange = repository.findById(exchangeId)
                .orElseThrow(() -> new NotFoundException("Exchange not found: " + exchangeId));
        if (!WorkflowRules.canView(caller, exchange.currentState())) {
            throw new PermissionDeniedException("Exchange " + exchangeId + " is not visible to " + caller.getUserId());
        }
        return exchange;
    }

    /**
     * Unanswered exchanges of the caller's city, excluding the caller's own.
     */
    @Transactional(readOnly = true)
    public List<ExchangeEntity> openInCallerCity() {
        CallerIdentity caller = CallerContext.require();
        if (caller.getCityId() == null) {
            return List.of();
        }
        return repository.findOpenInCity(caller.getCityId()).stream()
                .filter(exchange -> !caller.is(exchange.getRequesterId()))
                .toList();
    }

    @Transactional
    public ExchangeEntity submit(UUID exchangeId) {
        return transition(exchangeId, ExchangeStatus.PENDING, exchange -> requireStatus(exchange, ExchangeStatus.DRAFT));
    }

    @Transactional
    public ExchangeEntity reopen(UUID exchangeId) {
        return transition(exchangeId, ExchangeStatus.PENDING, exchange -> requireStatus(exchange, ExchangeStatus.REJECTED));
    }

    /**
     * The caller becomes the responder. A delivery is created asynchronously
     * from the ExchangeAccepted event.
     */
    @Transactional
    public ExchangeEntity accept(UUID exchangeId) {
        CallerIdentity caller = CallerContext.require();
        ExchangeEntity exchange = transition(exchangeId, ExchangeStatus.ACCEPTED,
                entity -> entity.attachResponder(caller.getUserId()));

        outboxService.saveEvent(AGGREGATE_TYPE, exchange.getId(), ExchangeAcceptedEvent.EVENT_TYPE,
                ExchangeAcceptedEvent.of(exchange.getId(), exchange.getRequesterId(), exchange.getResponderId(),
                        exchange.getLocation().getCityId(), exchange.getLocation().getCountryCode(),
                        clock.instant()));
        return exchange;
    }

    @Transactional
    public ExchangeEntity reject(UUID exchangeId) {
        return transition(exchangeId, ExchangeStatus.REJECTED, exchange -> { });
    }

    /**
     * Changes requester and/or location. The only path that may; the write
     * policy rejects it without an administrator and a justification.
     */
    @Transactional
    public ExchangeEntity override(UUID exchangeId, ExchangeOverrideRequest request) {
        CallerIdentity admin = CallerContext.requireAdmin();
        if (request.getJustification() == null || request.getJustification().isBlank()) {
            throw new InvalidArgumentException("A justification is required for an override");
        }
        boolean locationGiven = request.getCityId() != null || request.getCountryCode() != null;
        if (locationGiven && (request.getCityId() == null || request.getCountryCode() == null)) {
            throw new InvalidArgumentException("City and country must be overridden together");
        }
        if (request.getRequesterId() == null && !locationGiven) {
            throw new InvalidArgumentException("Nothing to override");
        }

        ExchangeEntity exchange = lock(exchangeId);
        ExchangeState before = exchange.currentState();
        exchange.override(
                request.getRequesterId(),
                locationGiven ? Location.of(request.getCityId(), request.getCountryCode()) : null,
                request.getJustification());
        repository.flush();
        ExchangeState after = exchange.currentState();

        Map<String, Object> details = new HashMap<>();
        details.put("justification", request.getJustification());
        details.put("before", Map.of("requesterId", before.requesterId(),
                "cityId", before.cityId(), "countryCode", before.countryCode()));
        details.put("after", Map.of("requesterId", after.requesterId(),
                "cityId", after.cityId(), "countryCode", after.countryCode()));
        auditService.recordAs(admin.getUserId(), AuditAction.ADMIN_OVERRIDE, AGGREGATE_TYPE, exchangeId, details);
        log.warn("Administrator {} overrode exchange {}: {}", admin.getUserId(), exchangeId, request.getJustification());
        return exchange;
    }

    /**
     * Records the courier that accepted the exchange's delivery.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void assignCourier(UUID exchangeId, String courierId) {
        ExchangeEntity exchange = lock(exchangeId);
        if (exchange.getStatus() != ExchangeStatus.ACCEPTED) {
            throw new FailedPreconditionException("Exchange " + exchangeId + " is " + exchange.getStatus());
        }
        exchange.assignCourier(courierId);
        repository.flush();
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void markInTransit(UUID exchangeId) {
        transition(exchangeId, ExchangeStatus.IN_TRANSIT, exchange -> { });
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void complete(UUID exchangeId) {
        transition(exchangeId, ExchangeStatus.COMPLETED, exchange -> { });
    }

    @Transactional(readOnly = true)
    public ExchangeEntity get(UUID exchangeId) {
        return repository.findById(exchangeId)
                .orElseThrow(() -> new NotFoundException("Exchange not found: " + exchangeId));
    }

    private ExchangeEntity transition(UUID exchangeId, ExchangeStatus target, Consumer<ExchangeEntity> change) {
        CallerIdentity caller = CallerContext.require();
        ExchangeEntity exchange = lock(exchangeId);
        ExchangeState state = exchange.currentState();

        if (!WorkflowRules.EXCHANGE.allows(state.status(), target)) {
            throw new FailedPreconditionException(String.format(
                    "Exchange %s cannot move from %s to %s", exchangeId, state.status(), target));
        }
        if (!WorkflowRules.EXCHANGE.permits(state.status(), target, WorkflowRules.relationsTo(caller, state))) {
            throw new PermissionDeniedException(String.format(
                    "%s may not move exchange %s from %s to %s", caller.getUserId(), exchangeId, state.status(), target));
        }

        change.accept(exchange);
        exchange.moveTo(target);
        repository.flush();

        auditService.recordAs(caller.getUserId(), AuditAction.EXCHANGE_TRANSITIONED, AGGREGATE_TYPE, exchangeId, Map.of(
                "from", state.status().name(),
                "to", target.name()));
        metrics.recordTransition(AGGREGATE_TYPE, target.name());
        log.info("Exchange {} moved {} -> {} by {}", exchangeId, state.status(), target, caller.getUserId());
        return exchange;
    }

    private ExchangeEntity lock(UUID exchangeId) {
        return repository.findByIdForUpdate(exchangeId)
                .orElseThrow(() -> new NotFoundException("Exchange not found: " + exchangeId));
    }

    private static void requireStatus(ExchangeEntity exchange, ExchangeStatus expected) {
        if (exchange.getStatus() != expected) {
            throw new FailedPreconditionException(String.format(
                    "Exchange %s is %s, expected %s", exchange.getId(), exchange.getStatus(), expected));
        }
    }

    private static void addItems(List<ExchangeItem> target, ItemSide side, List<ExchangeItemRequest> requested) {
        if (requested == null) {
            return;
        }
        for (ExchangeItemRequest item : requested) {
            target.add(ExchangeItem.of(side, item.getMedicineId(), item.getName(), item.getQuantity()));
        }
    }
}
