package com.tony.gridironAnalytics.service;

import com.tony.gridironAnalytics.model.GamePrediction;

import java.time.LocalDate;

/**
 * Classifieur externe de probabilité de victoire (entraîné hors de ce service).
 * Passé explicitement aux appels qui en ont besoin.
 */
@FunctionalInterface
public interface GameOutcomePredictor {

    GamePrediction predictGame(String gameId, String homeTeam, String awayTeam, LocalDate gameDate, int season);
}
