package com.carestock.controller;

import com.carestock.dto.ManualRestockRequest;
import com.carestock.dto.RestockRequestResponse;
import com.carestock.dto.RestockStatus;
import com.carestock.dto.StatusUpdateRequest;
import com.carestock.dto.SweepResultResponse;
import com.carestock.service.RestockRequestLedger;
import com.carestock.service.RestockSweepService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1/restock")
@RequiredArgsConstructor
public class RestockController {

    private final RestockRequestLedger ledger;
    private final RestockSweepService  sweepService;

    @PostMapping("/requests")
    public ResponseEntity<RestockRequestResponse> createRequest(@Valid @RequestBody ManualRestockRequest request) {
        log.info("POST /restock/requests | itemId={} | quantity={} | priority={}",
                 request.getItemId(), request.getQuantity(), request.getPriority());
        return ResponseEntity.status(HttpStatus.CREATED).body(ledger.createManual(request));
    }

    @GetMapping("/requests")
    public ResponseEntity<List<RestockRequestResponse>> listRequests(
            @RequestParam(required = false) RestockStatus status,
            @RequestParam(required = false) Long facilityId) {
        return ResponseEntity.ok(ledger.list(status, facilityId));
    }

    @GetMapping("/requests/{id}")
    public ResponseEntity<RestockRequestResponse> getRequest(@PathVariable Long id) {
        return ResponseEntity.ok(ledger.get(id));
    }

    @PutMapping("/requests/{id}/status")
    public ResponseEntity<RestockRequestResponse> updateStatus(
            @PathVariable Long id, @Valid @RequestBody StatusUpdateRequest update) {
        log.info("PUT /restock/requests/{}/status | target={}", id, update.getStatus());
        return ResponseEntity.ok(ledger.transition(id, update.getStatus(), update.getComments()));
    }

    @GetMapping("/sweep/preview")
    public ResponseEntity<SweepResultResponse> previewSweep() {
        return ResponseEntity.ok(sweepService.preview());
    }

    @PostMapping("/auto-restock-check")
    public ResponseEntity<SweepResultResponse> autoRestockCheck() {
        log.info("POST /restock/auto-restock-check");
        return ResponseEntity.ok(sweepService.commit());
    }
}
