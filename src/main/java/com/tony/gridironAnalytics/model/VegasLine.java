package com.tony.gridironAnalytics.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * Une cote d'un bookmaker pour un match. Plusieurs lignes peuvent exister par match (une par bookmaker).
 */
@Value
@Builder
public class VegasLine {
    String gameId;
    String sportsbook;
    BetType betType;

    // Spread
    Double homeLine;
    Double awayLine;

    // Moneyline (cotes américaines)
    Integer homeOdds;
    Integer awayOdds;

    // Total
    Double total;
    Integer overOdds;
    Integer underOdds;

    LocalDateTime timestamp;

    public Integer oddsFor(BetSide side) {
        return switch (side) {
            case HOME -> homeOdds;
            case AWAY -> awayOdds;
            case OVER -> overOdds;
            case UNDER -> underOdds;
        };
    }
}
