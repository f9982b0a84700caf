package com.tony.gridironAnalytics.model.dto;

import java.util.List;
import java.util.Map;

/**
 * Comparaison de deux équipes sur les métriques phares.
 * Un avantage n'est compté que si l'écart dépasse le seuil de significativité.
 */
public record TeamComparison(String team1,
                             String team2,
                             int season,
                             Map<String, MetricComparison> metrics,
                             Map<String, List<String>> advantages) {

    public record MetricComparison(double team1Value, double team2Value, String leader, double difference) {}
}
