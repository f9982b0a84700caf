package com.tony.gridironAnalytics.service;

import com.tony.gridironAnalytics.model.Team;
import com.tony.gridironAnalytics.model.dto.LeaderboardEntry;
import com.tony.gridironAnalytics.model.dto.TeamComparison;
import com.tony.gridironAnalytics.model.dto.TeamInsight;
import com.tony.gridironAnalytics.repository.TeamRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LeagueRankingServiceTest {

    @Mock
    private TeamRepository teamRepository;
    @Mock
    private TeamInsightService teamInsightService;

    @InjectMocks
    private LeagueRankingService service;

    private TeamInsight insight(String abbr, double offense, double defense, double redZone, double thirdDown) {
        return TeamInsight.builder()
                .teamAbbr(abbr)
                .season(2024)
                .offensiveEpaPerPlay(offense)
                .defenseEpaPerPlay(defense)
                .redZoneEfficiency(redZone)
                .thirdDownConversionRate(thirdDown)
                .build();
    }

    private void stubLeague() {
        when(teamRepository.findAllByOrderByTeamAbbrAsc()).thenReturn(List.of(
                new Team("BUF", "Buffalo", "Bills"),
                new Team("KC", "Kansas City", "Chiefs"),
                new Team("NYJ", "New York", "Jets"),
                new Team("SF", "San Francisco", "49ers")
        ));
        when(teamInsightService.generateTeamInsights("BUF", 2024)).thenReturn(Optional.of(insight("BUF", 0.15, -0.2, 0.5, 0.4)));
        when(teamInsightService.generateTeamInsights("KC", 2024)).thenReturn(Optional.of(insight("KC", 0.2, -0.1, 0.6, 0.45)));
        when(teamInsightService.generateTeamInsights("NYJ", 2024)).thenReturn(Optional.empty());
        when(teamInsightService.generateTeamInsights("SF", 2024)).thenReturn(Optional.of(insight("SF", 0.05, 0.0, 0.55, 0.5)));
    }

    @Test
    @DisplayName("Classement offensif décroissant, limité et sans les équipes sans bilan")
    void offensiveLeadersAreSortedDescending() {
        stubLeague();

        List<LeaderboardEntry> leaders = service.getLeagueLeaders(2024, "offensive_epa_per_play", 2);

        assertThat(leaders).extracting(LeaderboardEntry::teamAbbr).containsExactly("KC", "BUF");
        assertThat(leaders).extracting(LeaderboardEntry::rank).containsExactly(1, 2);
        assertThat(leaders.get(0).teamName()).isEqualTo("Kansas City Chiefs");
        assertThat(leaders.get(0).value()).isEqualTo(0.2);
    }

    @Test
    @DisplayName("Métrique défensive : l'EPA concédé le plus bas est premier")
    void defensiveLeadersAreSortedAscending() {
        stubLeague();

        List<LeaderboardEntry> leaders = service.getLeagueLeaders(2024, "defense_epa_per_play", 10);

        assertThat(leaders).extracting(LeaderboardEntry::teamAbbr).containsExactly("BUF", "KC", "SF");
    }

    @Test
    @DisplayName("Ligue vide : classement vide")
    void emptyLeague() {
        when(teamRepository.findAllByOrderByTeamAbbrAsc()).thenReturn(List.of());

        assertThat(service.getLeagueLeaders(2024, "offensive_epa_per_play", 5)).isEmpty();
    }

    @Test
    @DisplayName("Une limite nulle est refusée")
    void nonPositiveLimitIsRejected() {
        assertThatThrownBy(() -> service.getLeagueLeaders(2024, "offensive_epa_per_play", 0))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(teamRepository, teamInsightService);
    }

    @Test
    @DisplayName("Une métrique inconnue est refusée avant toute lecture de la ligue")
    void unknownMetricIsRejected() {
        assertThatThrownBy(() -> service.getLeagueLeaders(2024, "passer_rating", 5))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("passer_rating");
        verifyNoInteractions(teamRepository, teamInsightService);
    }

    @Test
    @DisplayName("Comparaison : leader par métrique, avantage seulement au-delà de 0.05 d'écart")
    void compareTeams() {
        when(teamInsightService.generateTeamInsights("KC", 2024)).thenReturn(Optional.of(insight("KC", 0.3, -0.1, 0.6, 0.40)));
        when(teamInsightService.generateTeamInsights("BUF", 2024)).thenReturn(Optional.of(insight("BUF", 0.1, -0.2, 0.6, 0.42)));

        TeamComparison comparison = service.compareTeams("KC", "BUF", 2024).orElseThrow();

        assertThat(comparison.metrics()).containsOnlyKeys(LeagueRankingService.HEADLINE_METRICS.toArray(new String[0]));
        assertThat(comparison.metrics().get("offensive_epa_per_play").leader()).isEqualTo("KC");
        assertThat(comparison.metrics().get("defense_epa_per_play").leader()).isEqualTo("BUF");
        assertThat(comparison.metrics().get("third_down_conversion_rate").leader()).isEqualTo("BUF");
        // Valeurs identiques : personne ne mène
        assertThat(comparison.metrics().get("red_zone_efficiency").leader()).isEqualTo(GameInsightService.EVEN);
        assertThat(comparison.metrics().get("clutch_performance").leader()).isEqualTo(GameInsightService.EVEN);

        assertThat(comparison.advantages().get("KC")).containsExactly("offensive_epa_per_play");
        assertThat(comparison.advantages().get("BUF")).containsExactly("defense_epa_per_play");
    }

    @Test
    @DisplayName("Comparaison impossible si une équipe n'a pas de bilan")
    void compareWithMissingTeam() {
        when(teamInsightService.generateTeamInsights("KC", 2024)).thenReturn(Optional.of(insight("KC", 0.3, -0.1, 0.6, 0.4)));
        when(teamInsightService.generateTeamInsights("XXX", 2024)).thenReturn(Optional.empty());

        assertThat(service.compareTeams("KC", "XXX", 2024)).isEmpty();
    }
}
