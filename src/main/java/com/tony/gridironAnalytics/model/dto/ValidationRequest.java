package com.tony.gridironAnalytics.model.dto;

import com.tony.gridironAnalytics.model.GamePrediction;
import jakarta.validation.constraints.NotNull;

import java.util.List;

// actualWinners aligné sur predictions, null pour un résultat inconnu
public record ValidationRequest(@NotNull List<GamePrediction> predictions,
                                @NotNull List<String> actualWinners) {
}
