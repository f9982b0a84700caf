package com.tony.gridironAnalytics.model.dto;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TeamInsightTest {

    @Test
    @DisplayName("Métriques défensives et concédées : plus bas = meilleur")
    void lowerIsBetterForDefensiveMetrics() {
        assertThat(TeamInsight.isLowerBetter("defense_epa_per_play")).isTrue();
        assertThat(TeamInsight.isLowerBetter("pass_defense_epa")).isTrue();
        assertThat(TeamInsight.isLowerBetter("red_zone_td_rate_allowed")).isTrue();
        assertThat(TeamInsight.isLowerBetter("offensive_epa_per_play")).isFalse();
        assertThat(TeamInsight.isLowerBetter("turnover_margin")).isFalse();
    }

    @Test
    @DisplayName("Accès aux métriques par nom")
    void metricByName() {
        TeamInsight insight = TeamInsight.builder().teamAbbr("KC").season(2024).redZoneEfficiency(0.62).build();

        assertThat(insight.metric("red_zone_efficiency")).isEqualTo(0.62);
        assertThat(insight.getMetrics()).hasSize(21);
        assertThatThrownBy(() -> insight.metric("passer_rating")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Les noms publics correspondent exactement aux métriques exposées")
    void metricNamesMatchExposedMetrics() {
        TeamInsight insight = TeamInsight.builder().teamAbbr("KC").season(2024).build();

        assertThat(insight.getMetrics().keySet()).containsExactlyElementsOf(TeamInsight.METRIC_NAMES);
        assertThatThrownBy(() -> TeamInsight.requireKnownMetric("passer_rating"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
