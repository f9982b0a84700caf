package com.tony.gridironAnalytics.model.dto;

import com.tony.gridironAnalytics.model.GamePrediction;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

/**
 * Prédictions à confronter au marché. Les seuils absents reprennent la configuration betting.*.
 */
public record ValueBetRequest(@NotEmpty List<GamePrediction> predictions,
                              @DecimalMin("0.0") @DecimalMax("1.0") Double minEdge,
                              @DecimalMin("0.0") @DecimalMax("1.0") Double minConfidence) {
}
