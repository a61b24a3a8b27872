package com.flagship.medexchange_ledger.earnings;

import com.flagship.medexchange_ledger.security.CallerContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;

@RestController
@RequestMapping("/api/admin/earnings")
@RequiredArgsConstructor
@Slf4j
public class EarningsAdminController {

    private final EarningsReleaseService releaseService;
    private final Clock clock;

    /**
     * Manual maturation run, e.g. after a failed scheduled run.
     */
    @PostMapping("/release")
    public ResponseEntity<ReleaseSummary> release() {
        String adminId = CallerContext.requireAdmin().getUserId();
        log.info("Manual earnings release triggered by {}", adminId);
        return ResponseEntity.ok(releaseService.releaseAllMatured(clock.instant()));
    }
}
