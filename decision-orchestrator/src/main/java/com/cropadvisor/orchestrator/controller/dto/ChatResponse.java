package com.cropadvisor.orchestrator.controller.dto;

import com.cropadvisor.common.model.Decision;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Body of {@code POST /api/v1/advisory/chat}. {@code reasoning} is the decision's reasoning
 * trace joined one step per line.
 */
public record ChatResponse(
    @JsonProperty("response")     String response,
    @JsonProperty("confidence")   double confidence,
    @JsonProperty("reasoning")    String reasoning,
    @JsonProperty("data_sources") List<String> dataSources,
    @JsonProperty("alerts")       List<String> alerts
) {
    public static ChatResponse of(Decision decision) {
        return new ChatResponse(decision.recommendation(), decision.confidence(),
                                String.join("\n", decision.reasoning()),
                                decision.dataSources(), decision.alerts());
    }

    public static ChatResponse fallback(String response, String reasoning) {
        return new ChatResponse(response, Decision.CONFIDENCE_FLOOR, reasoning, List.of(), List.of());
    }
}
