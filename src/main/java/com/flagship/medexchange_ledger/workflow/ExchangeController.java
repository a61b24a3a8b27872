package com.flagship.medexchange_ledger.workflow;

import com.flagship.medexchange_ledger.workflow.dto.CreateExchangeRequest;
import com.flagship.medexchange_ledger.workflow.dto.ExchangeResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/exchanges")
@RequiredArgsConstructor
@Slf4j
public class ExchangeController {

    private final ExchangeService exchangeService;

    @PostMapping
    public ResponseEntity<ExchangeResponse> create(@Valid @RequestBody CreateExchangeRequest request) {
        ExchangeEntity exchange = exchangeService.create(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(ExchangeResponse.from(exchange));
    }

    /**
     * Pending exchanges in the caller's city that the caller could answer.
     */
    @GetMapping
    public List<ExchangeResponse> open() {
        return exchangeService.openInCallerCity().stream()
                .map(ExchangeResponse::from)
                .toList();
    }

    @GetMapping("/{id}")
    public ExchangeResponse get(@PathVariable UUID id) {
        return ExchangeResponse.from(exchangeService.getVisible(id));
    }

    @PostMapping("/{id}/submit")
    public ExchangeResponse submit(@PathVariable UUID id) {
        return ExchangeResponse.from(exchangeService.submit(id));
    }

    @PostMapping("/{id}/accept")
    public ExchangeResponse accept(@PathVariable UUID id) {
        log.info("Exchange {} accept requested", id);
        return ExchangeResponse.from(exchangeService.accept(id));
    }

    @PostMapping("/{id}/reject")
    public ExchangeResponse reject(@PathVariable UUID id) {
        return ExchangeResponse.from(exchangeService.reject(id));
    }

    @PostMapping("/{id}/reopen")
    public ExchangeResponse reopen(@PathVariable UUID id) {
        return ExchangeResponse.from(exchangeService.reopen(id));
    }
}
