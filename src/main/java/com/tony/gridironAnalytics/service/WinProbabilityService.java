package com.tony.gridironAnalytics.service;

import com.tony.gridironAnalytics.model.Situation;
import org.springframework.stereotype.Service;

/**
 * Probabilité de victoire de l'attaque, modèle heuristique (non appris).
 * Le résultat reste dans [0.01, 0.99] pour ne jamais atteindre 0 ou 1.
 */
@Service
public class WinProbabilityService {

    private static final double MIN_WP = 0.01;
    private static final double MAX_WP = 0.99;

    private static final double WP_PER_POINT = 0.02;
    private static final double FIELD_POSITION_WEIGHT = 0.002;
    private static final double CONVERSION_WEIGHT = 0.1;

    public double calculateWinProbability(Situation situation) {
        int scoreDiff = situation.scoreDifferential() != null ? situation.scoreDifferential() : 0;
        int seconds = situation.gameSecondsRemaining() != null ? situation.gameSecondsRemaining() : 1800;
        int yardline = situation.yardline100() != null ? situation.yardline100() : 50;

        double baseWp = 0.5 + (scoreDiff * WP_PER_POINT);

        // Le score pèse de plus en plus lourd à mesure que le temps s'écoule
        double timeFactor;
        if (seconds > 1800) timeFactor = 0.8;
        else if (seconds > 900) timeFactor = 1.0;
        else if (seconds > 120) timeFactor = 1.3;
        else timeFactor = 2.0;

        double fieldPositionBonus = (100 - yardline) * FIELD_POSITION_WEIGHT;
        double downBonus = (estimateConversionProbability(situation) - 0.5) * CONVERSION_WEIGHT;

        double wp = baseWp + (scoreDiff * WP_PER_POINT * timeFactor) + fieldPositionBonus + downBonus;
        return Math.max(MIN_WP, Math.min(MAX_WP, wp));
    }

    /**
     * Chance de convertir la tentative en cours. Sert uniquement de signal au modèle WP.
     */
    double estimateConversionProbability(Situation situation) {
        int down = situation.down() != null ? situation.down() : 1;
        int ydstogo = situation.yardsToGo() != null ? situation.yardsToGo() : 10;

        return switch (down) {
            case 1 -> 0.75 - (ydstogo * 0.02);
            case 2 -> 0.65 - (ydstogo * 0.03);
            case 3 -> 0.45 - (ydstogo * 0.04);
            default -> 0.25 - (ydstogo * 0.05);
        };
    }
}
