package com.carestock.controller;

import com.carestock.client.TriageClient;
import com.carestock.config.RequestGuardFilter;
import com.carestock.dto.TriageResponse;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@Slf4j
@RestController
@RequestMapping("/api/v1/triage")
@RequiredArgsConstructor
public class TriageController {

    private final TriageClient triageClient;

    @GetMapping("/{patientId}")
    public Mono<ResponseEntity<TriageResponse>> triage(
            @PathVariable String patientId, HttpServletRequest httpRequest) {
        String requestId = RequestGuardFilter.requestIdOf(httpRequest);
        log.info("GET /triage/{} | requestId={}", patientId, requestId);
        return triageClient.assess(patientId, requestId)
            .map(a -> ResponseEntity.ok(TriageResponse.builder()
                .patientId(patientId)
                .urgencyLevel(a.urgencyLevel())
                .tier(a.tier())
                .recommendedActions(a.recommendedActions())
                .reasoning(a.reasoning())
                .build()));
    }
}
