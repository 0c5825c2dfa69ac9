package com.cropadvisor.orchestrator.controller;

import com.cropadvisor.common.exception.ProfileIncompleteException;
import com.cropadvisor.common.exception.UnsupportedIntentException;
import com.cropadvisor.common.model.IntentRequest;
import com.cropadvisor.common.trace.TraceContextUtil;
import com.cropadvisor.orchestrator.controller.dto.ChatResponse;
import com.cropadvisor.orchestrator.pipeline.DecisionPipelineEngine;
import com.cropadvisor.orchestrator.service.DecisionOrchestratorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Chat entry point for the NLU collaborator. Always answers 200 with a well-formed body;
 * failures are mapped to fallback responses here, never surfaced raw.
 */
@RestController
@RequestMapping("/api/v1/advisory")
public class AdvisoryController {

    private static final Logger log = LoggerFactory.getLogger(AdvisoryController.class);

    public static final String TRACE_HEADER = "X-Trace-Id";
    public static final String ONBOARDING_HEADER = "X-Onboarding-Required";

    static final String UNSUPPORTED_TEXT =
        "Sorry, I can't help with that yet. Ask me about irrigation, weather, your crop's stage or harvest timing.";
    static final String ONBOARDING_TEXT =
        "Please complete your farm profile first: I need your %s to answer this.";

    private final DecisionOrchestratorService orchestratorService;

    public AdvisoryController(DecisionOrchestratorService orchestratorService) {
        this.orchestratorService = orchestratorService;
    }

    @PostMapping("/chat")
    public Mono<ResponseEntity<ChatResponse>> chat(
            @RequestBody IntentRequest request,
            @RequestHeader(value = TRACE_HEADER, required = false) String suppliedTraceId) {
        String traceId = TraceContextUtil.resolve(suppliedTraceId);
        return orchestratorService.decide(request, traceId)
            .map(outcome -> ResponseEntity.ok()
                .header(TRACE_HEADER, traceId)
                .body(ChatResponse.of(outcome.decision())))
            .onErrorResume(UnsupportedIntentException.class, e -> Mono.just(ResponseEntity.ok()
                .header(TRACE_HEADER, traceId)
                .body(ChatResponse.fallback(UNSUPPORTED_TEXT, "Intent '" + e.getIntent() + "' is not supported."))))
            .onErrorResume(ProfileIncompleteException.class, e -> Mono.just(ResponseEntity.ok()
                .header(TRACE_HEADER, traceId)
                .header(ONBOARDING_HEADER, "true")
                .body(ChatResponse.fallback(String.format(ONBOARDING_TEXT, e.getMissing()),
                                            "Profile incomplete: missing " + e.getMissing() + "."))))
            .onErrorResume(e -> {
                TraceContextUtil.withMdc(traceId, () ->
                    log.error("Advisory request failed. traceId={}", traceId, e));
                return Mono.just(ResponseEntity.ok()
                    .header(TRACE_HEADER, traceId)
                    .body(ChatResponse.fallback(DecisionPipelineEngine.INSUFFICIENT_DATA_TEXT,
                                                "Run failed before a decision was reached.")));
            });
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
