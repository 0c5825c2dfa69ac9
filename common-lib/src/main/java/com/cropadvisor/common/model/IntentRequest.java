package com.cropadvisor.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Structured request handed over by the NLU collaborator. {@code intent} stays a raw string
 * so an unknown value reaches the orchestrator and fails there with a polite fallback
 * instead of a deserialization error.
 */
public record IntentRequest(
    @JsonProperty("intent")    String intent,
    @JsonProperty("farmer_id") Long farmerId,
    @JsonProperty("raw_text")  String rawText,
    @JsonProperty("locale")    String locale,
    @JsonProperty("entities")  Map<String, String> entities
) {
    public IntentRequest {
        entities = entities == null ? Map.of() : Map.copyOf(entities);
    }

    public String entity(String name) {
        return entities.get(name);
    }
}
