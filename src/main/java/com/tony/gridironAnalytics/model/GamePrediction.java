package com.tony.gridironAnalytics.model;

import java.time.LocalDate;

/**
 * Sortie du classifieur externe pour un match programmé. Traitée comme une boîte noire.
 */
public record GamePrediction(String gameId,
                             String homeTeam,
                             String awayTeam,
                             LocalDate gameDate,
                             String predictedWinner,
                             double winProbability,
                             double homeWinProbability,
                             double awayWinProbability,
                             double confidence) {

    public GamePrediction {
        requireProbability("winProbability", winProbability);
        requireProbability("homeWinProbability", homeWinProbability);
        requireProbability("awayWinProbability", awayWinProbability);
        requireProbability("confidence", confidence);
    }

    /**
     * Construit une prédiction à partir de la seule probabilité domicile.
     */
    public static GamePrediction fromHomeProbability(String gameId, String homeTeam, String awayTeam,
                                                     LocalDate gameDate, double homeWinProbability) {
        double away = 1.0 - homeWinProbability;
        boolean homeFavored = homeWinProbability >= 0.5;
        double max = Math.max(homeWinProbability, away);
        return new GamePrediction(gameId, homeTeam, awayTeam, gameDate,
                homeFavored ? homeTeam : awayTeam, max, homeWinProbability, away, max);
    }

    public double probabilityFor(BetSide side) {
        return switch (side) {
            case HOME -> homeWinProbability;
            case AWAY -> awayWinProbability;
            default -> throw new IllegalArgumentException("Pas de probabilité modèle pour le côté " + side);
        };
    }

    private static void requireProbability(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(name + " doit être dans [0, 1] : " + value);
        }
    }
}
