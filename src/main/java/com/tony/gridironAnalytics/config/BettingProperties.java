package com.tony.gridironAnalytics.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "betting")
@Data
public class BettingProperties {
    // --- Scan de value bets ---
    private double minEdge = 0.05;        // Écart minimum modèle vs marché
    private double minConfidence = 0.6;   // Probabilité modèle minimum pour parier un côté

    // --- Backtest ---
    private double backtestEdge = 0.05;   // On ne simule une mise Kelly qu'au-dessus de cet écart

    // --- Marché simulé ---
    private List<String> sportsbooks = new ArrayList<>(List.of("DraftKings", "FanDuel", "BetMGM", "Caesars"));
}
