package com.tony.gridironAnalytics.service;

import com.tony.gridironAnalytics.model.Situation;
import org.springframework.stereotype.Service;

/**
 * Modèle heuristique d'Expected Points : table (tentative, position) + ajustements temps / écart.
 */
@Service
public class ExpectedPointsService {

    // Multiplicateur par tentative (index = down)
    private static final double[] DOWN_MULTIPLIER = {0.0, 1.00, 0.85, 0.60, 0.30};

    private static final int GOAL_LINE = 5;
    private static final int RED_ZONE = 20;

    private static final int LATE_GAME_SECONDS = 120;
    private static final int EARLY_GAME_SECONDS = 3000;
    private static final int BLOWOUT_MARGIN = 14;

    // --- Valeurs par défaut si la situation est incomplète ---
    private static final int DEFAULT_DOWN = 1;
    private static final int DEFAULT_YARDLINE = 50;
    private static final int DEFAULT_SECONDS = 1800;
    private static final int DEFAULT_SCORE_DIFF = 0;

    // [down][yardline], yardline 0 hors table
    private final double[][] epTable = buildTable();

    private static double[][] buildTable() {
        double[][] table = new double[5][101];
        for (int yardLine = 1; yardLine <= 100; yardLine++) {
            // Base linéaire : la valeur décroît avec la distance à l'en-but
            double baseEp = Math.max(0, 7 - (yardLine * 0.07));

            // Bandes spéciales : ligne de but puis red zone
            if (yardLine <= GOAL_LINE) {
                baseEp = 6.8 - (yardLine * 0.3);
            } else if (yardLine <= RED_ZONE) {
                baseEp = 4.5 - (yardLine * 0.15);
            }

            for (int down = 1; down <= 4; down++) {
                table[down][yardLine] = baseEp * DOWN_MULTIPLIER[down];
            }
        }
        return table;
    }

    public double calculateExpectedPoints(Situation situation) {
        int down = situation.down() != null ? situation.down() : DEFAULT_DOWN;
        int yardline = situation.yardline100() != null ? situation.yardline100() : DEFAULT_YARDLINE;
        int seconds = situation.gameSecondsRemaining() != null ? situation.gameSecondsRemaining() : DEFAULT_SECONDS;
        int scoreDiff = situation.scoreDifferential() != null ? situation.scoreDifferential() : DEFAULT_SCORE_DIFF;

        double baseEp = lookup(down, yardline);

        double adjustment = 1.0;
        if (seconds < LATE_GAME_SECONDS) {
            adjustment = 1.15; // Urgence de fin de match
        } else if (seconds > EARLY_GAME_SECONDS) {
            adjustment = 0.95;
        }

        // Match plié : la valeur d'une possession diminue
        if (Math.abs(scoreDiff) > BLOWOUT_MARGIN) {
            adjustment *= 0.8;
        }

        return baseEp * adjustment;
    }

    private double lookup(int down, int yardline) {
        if (down < 1 || down > 4 || yardline < 1 || yardline > 100) return 0.0;
        return epTable[down][yardline];
    }
}
