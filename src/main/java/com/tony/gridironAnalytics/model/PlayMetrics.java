package com.tony.gridironAnalytics.model;

import lombok.Builder;
import lombok.Value;

/**
 * Métriques avancées d'une action (EPA, WPA...). Calculées une fois, jamais modifiées.
 */
@Value
@Builder
public class PlayMetrics {
    PlayOutcome outcome;

    // Expected Points
    double expectedPointsBefore;
    double expectedPointsAfter;
    double epa;

    // Win Probability
    double winProbabilityBefore;
    double winProbabilityAfter;
    double wpa;

    // Situationnel
    double leverage;     // |WPA|, plancher à 0.02
    double clutchIndex;

    // Efficacité
    double successRate;  // 1.0 ou 0.0
    boolean explosivePlay;

    public boolean isSuccessful() {
        return successRate == 1.0;
    }
}
