package com.tony.gridironAnalytics.model.dto;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Analyse d'un match. Quand aucun play-by-play n'existe, seuls le score final et les conditions
 * sont renseignés (playByPlayAvailable = false), le reste est à zéro.
 */
@Value
@Builder
public class GameInsight {
    String gameId;
    String homeTeam;
    String awayTeam;
    LocalDate gameDate;
    Integer homeScore;
    Integer awayScore;
    boolean playByPlayAvailable;

    // --- FLUX DU MATCH ---
    double excitementIndex;
    double competitiveness;
    int momentumSwings;

    // --- PERFORMANCE ---
    double homeTeamEpa;
    double awayTeamEpa;
    double passingGameDominance; // > 0 : domicile meilleur dans le jeu aérien
    double rushingGameDominance;

    // --- MOMENTS CLÉS ---
    double biggestPlayEpa;
    String biggestEpaPlayId;
    double biggestPlayWpa;
    String biggestWpaPlayId;
    int turningPointQuarter;

    // --- DUELS SITUATIONNELS ---
    String redZoneBattle;
    String thirdDownBattle;
    String turnoverBattle;

    // --- RÉSUMÉ SCORE (toujours renseigné si le match est joué) ---
    int totalPoints;
    int pointDifferential;
    boolean closeGame;
    boolean highScoring;
    double homeFieldAdvantage;

    // --- CONDITIONS ---
    String roof;
    String surface;
    Integer temperature;
    Integer wind;
}
