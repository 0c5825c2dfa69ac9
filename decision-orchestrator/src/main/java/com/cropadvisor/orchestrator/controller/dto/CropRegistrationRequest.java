package com.cropadvisor.orchestrator.controller.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.time.LocalDate;

@Data
public class CropRegistrationRequest {

    @NotBlank(message = "cropType is required")
    private String cropType;

    private String variety;

    /** May be left out; the crop then gets no stage tracking until it is set. */
    private LocalDate sowingDate;
}
