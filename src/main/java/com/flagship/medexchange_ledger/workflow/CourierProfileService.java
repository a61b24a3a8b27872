package com.flagship.medexchange_ledger.workflow;

import com.flagship.medexchange_ledger.audit.AuditAction;
import com.flagship.medexchange_ledger.audit.AuditService;
import com.flagship.medexchange_ledger.error.NotFoundException;
import com.flagship.medexchange_ledger.error.PermissionDeniedException;
import com.flagship.medexchange_ledger.security.CallerContext;
import com.flagship.medexchange_ledger.security.CallerIdentity;
import com.flagship.medexchange_ledger.workflow.dto.RegisterCourierRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Courier service areas. Only administrators register couriers; the area
 * decides which deliveries a courier may see and accept.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CourierProfileService {

    private final CourierProfileRepository repository;
    private final AuditService auditService;

    @Transactional
    public CourierProfileEntity register(String courierId, RegisterCourierRequest request) {
        CallerIdentity admin = CallerContext.requireAdmin();
        Set<String> cities = new TreeSet<>(request.getCityIds());
        boolean active = request.getActive() == null || request.getActive();

        CourierProfileEntity profile = repository.findById(courierId)
                .map(existing -> {
                    existing.updateServiceArea(cities, active);
                    return existing;
                })
                .orElseGet(() -> {
                    CourierProfileEntity created = CourierProfileEntity.create(courierId, request.getCountryCode(), cities);
                    created.updateServiceArea(cities, active);
                    return created;
                });
        profile = repository.saveAndFlush(profile);

        auditService.recordAs(admin.getUserId(), AuditAction.COURIER_REGISTERED, "courier", courierId, Map.of(
                "countryCode", profile.getCountryCode(),
                "cityIds", cities,
                "active", active));
        log.info("Courier {} serves {} (active={})", courierId, cities, active);
        return profile;
    }

    @Transactional(readOnly = true)
    public CourierProfileEntity get(String courierId) {
        CallerIdentity caller = CallerContext.require();
        if (!caller.isAdmin() && !caller.is(courierId)) {
            throw new PermissionDeniedException(
                    "Courier profile " + courierId + " is not visible to " + caller.getUserId());
        }
        return repository.findById(courierId)
                .orElseThrow(() -> new NotFoundException("Courier not registered: " + courierId));
    }
}
