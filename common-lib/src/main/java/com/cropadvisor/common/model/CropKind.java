package com.cropadvisor.common.model;

import com.cropadvisor.common.exception.UnknownCropKindException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Map;

/**
 * Crops the advisory engine supports. Keys match the crop knowledge base.
 */
public enum CropKind {
    RICE("rice"),
    WHEAT("wheat"),
    MAIZE("maize"),
    COTTON("cotton"),
    TOMATO("tomato"),
    ONION("onion");

    private static final Map<String, CropKind> ALIASES = Map.of(
        "corn",  MAIZE,
        "paddy", RICE
    );

    private final String key;

    CropKind(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }

    /**
     * Resolves a free-form crop name ("Rice", "corn", "paddy") to a crop kind.
     *
     * @throws UnknownCropKindException when the name is not a supported crop
     */
    @JsonCreator
    public static CropKind fromKey(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new UnknownCropKindException(String.valueOf(raw));
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace(' ', '_').replace('-', '_');
        for (CropKind kind : values()) {
            if (kind.key.equals(normalized)) return kind;
        }
        CropKind alias = ALIASES.get(normalized);
        if (alias != null) return alias;
        throw new UnknownCropKindException(raw);
    }
}
