package com.cropadvisor.orchestrator.controller.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import lombok.Data;

@Data
public class FarmProfileRequest {

    @Positive(message = "landSizeAcres must be positive")
    private double landSizeAcres;

    private String irrigationType;

    @DecimalMin(value = "-90.0", message = "latitude out of range")
    @DecimalMax(value = "90.0", message = "latitude out of range")
    private Double latitude;

    @DecimalMin(value = "-180.0", message = "longitude out of range")
    @DecimalMax(value = "180.0", message = "longitude out of range")
    private Double longitude;

    private String locationName;

    private String language;
}
