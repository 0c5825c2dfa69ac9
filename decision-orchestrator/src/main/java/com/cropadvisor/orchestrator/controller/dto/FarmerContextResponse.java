package com.cropadvisor.orchestrator.controller.dto;

import com.cropadvisor.common.model.CropRecord;
import com.cropadvisor.common.model.FarmProfile;
import com.cropadvisor.common.model.WeatherSnapshot;
import com.fasterxml.jackson.annotation.JsonProperty;

public record FarmerContextResponse(
    @JsonProperty("profile")     FarmProfile profile,
    @JsonProperty("activeCrop")  CropRecord activeCrop,
    @JsonProperty("lastWeather") WeatherSnapshot lastWeather
) {}
