package com.tony.gridironAnalytics.model.dto;

import com.tony.gridironAnalytics.model.BetSide;
import com.tony.gridironAnalytics.model.BetType;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Recommandation de pari à valeur positive. Produite à la volée, jamais stockée.
 */
@Value
@Builder
public class ValueBet {
    String gameId;
    String homeTeam;
    String awayTeam;
    LocalDate gameDate;
    BetType betType;
    BetSide recommendation;
    String sportsbook;     // Bookmaker offrant la meilleure cote
    int odds;
    double modelProbability;
    double marketProbability;
    double edge;
    double expectedValue;
    double kellyFraction;
    double confidence;
    String reasoning;
}
