package com.cropadvisor.evaluator.cropstage;

import com.cropadvisor.common.model.CropRecord;
import com.cropadvisor.common.model.GeoLocation;

import java.time.LocalDate;

/**
 * @param location may be {@code null}; the stage is then derived from the stored GDD
 * @param asOf     the run's calendar day; history is folded up to the day before
 */
public record CropStageInput(CropRecord crop, GeoLocation location, LocalDate asOf) {}
