package com.tony.gridironAnalytics.model.dto;

/**
 * Bilan d'un backtest modèle vs marché.
 */
public record ValidationMetrics(int totalPredictions,
                                double agreementRate,
                                double avgProbabilityDifference,
                                double calibrationError,
                                double modelAccuracy,
                                double marketAccuracy,
                                int betsPlaced,
                                double kellyRoi,
                                double sharpeRatio,
                                double maxDrawdown) {

    public static ValidationMetrics empty() {
        return new ValidationMetrics(0, 0.0, 0.0, 0.0, 0.0, 0.0, 0, 0.0, 0.0, 0.0);
    }
}
