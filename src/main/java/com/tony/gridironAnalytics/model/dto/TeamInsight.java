package com.tony.gridironAnalytics.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bilan avancé d'une équipe sur une saison. Reconstruit à chaque appel depuis les plays.
 * Les métriques défensives sont exprimées en EPA concédé : plus bas = meilleure défense.
 */
@Value
@Builder
public class TeamInsight {

    // Noms publics des métriques, dans l'ordre de getMetrics()
    public static final List<String> METRIC_NAMES = List.of(
            "offensive_epa_per_play", "passing_epa_per_play", "rushing_epa_per_play",
            "red_zone_efficiency", "third_down_conversion_rate", "success_rate", "explosive_play_rate",
            "defense_epa_per_play", "pass_defense_epa", "run_defense_epa",
            "red_zone_td_rate_allowed", "third_down_rate_allowed",
            "two_minute_drill_efficiency", "clutch_performance", "turnover_margin",
            "garbage_time_adjusted_epa", "strength_of_schedule", "home_field_advantage",
            "early_season_performance", "late_season_performance", "improvement_trajectory"
    );

    String teamAbbr;
    int season;
    int offensivePlays;
    int defensivePlays;

    // --- ATTAQUE ---
    double offensiveEpaPerPlay;
    double passingEpaPerPlay;
    double rushingEpaPerPlay;
    double redZoneEfficiency;
    double thirdDownConversionRate;
    double successRate;
    double explosivePlayRate;

    // --- DÉFENSE (concédé) ---
    double defenseEpaPerPlay;
    double passDefenseEpa;
    double runDefenseEpa;
    double redZoneTdRateAllowed;
    double thirdDownRateAllowed;

    // --- SITUATIONS SPÉCIALES ---
    double twoMinuteDrillEfficiency;
    double clutchPerformance;
    double turnoverMargin;

    // --- CONTEXTE (transformations linéaires des EPA principaux) ---
    double garbageTimeAdjustedEpa;
    double strengthOfSchedule;
    double homeFieldAdvantage;

    // --- TENDANCE ---
    double earlySeasonPerformance;
    double lateSeasonPerformance;
    double improvementTrajectory;

    /**
     * Toutes les métriques numériques, indexées par leur nom public.
     */
    @JsonIgnore
    public Map<String, Double> getMetrics() {
        Map<String, Double> m = new LinkedHashMap<>();
        m.put("offensive_epa_per_play", offensiveEpaPerPlay);
        m.put("passing_epa_per_play", passingEpaPerPlay);
        m.put("rushing_epa_per_play", rushingEpaPerPlay);
        m.put("red_zone_efficiency", redZoneEfficiency);
        m.put("third_down_conversion_rate", thirdDownConversionRate);
        m.put("success_rate", successRate);
        m.put("explosive_play_rate", explosivePlayRate);
        m.put("defense_epa_per_play", defenseEpaPerPlay);
        m.put("pass_defense_epa", passDefenseEpa);
        m.put("run_defense_epa", runDefenseEpa);
        m.put("red_zone_td_rate_allowed", redZoneTdRateAllowed);
        m.put("third_down_rate_allowed", thirdDownRateAllowed);
        m.put("two_minute_drill_efficiency", twoMinuteDrillEfficiency);
        m.put("clutch_performance", clutchPerformance);
        m.put("turnover_margin", turnoverMargin);
        m.put("garbage_time_adjusted_epa", garbageTimeAdjustedEpa);
        m.put("strength_of_schedule", strengthOfSchedule);
        m.put("home_field_advantage", homeFieldAdvantage);
        m.put("early_season_performance", earlySeasonPerformance);
        m.put("late_season_performance", lateSeasonPerformance);
        m.put("improvement_trajectory", improvementTrajectory);
        return m;
    }

    public double metric(String name) {
        requireKnownMetric(name);
        return getMetrics().get(name);
    }

    public static void requireKnownMetric(String name) {
        if (!METRIC_NAMES.contains(name)) {
            throw new IllegalArgumentException("Métrique inconnue : " + name);
        }
    }

    /**
     * Pour les métriques défensives / concédées, la valeur la plus basse est la meilleure.
     */
    public static boolean isLowerBetter(String metricName) {
        return metricName.contains("defense") || metricName.contains("allowed");
    }
}
