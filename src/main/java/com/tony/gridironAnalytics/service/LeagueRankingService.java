package com.tony.gridironAnalytics.service;

import com.tony.gridironAnalytics.model.Team;
import com.tony.gridironAnalytics.model.dto.LeaderboardEntry;
import com.tony.gridironAnalytics.model.dto.TeamComparison;
import com.tony.gridironAnalytics.model.dto.TeamComparison.MetricComparison;
import com.tony.gridironAnalytics.model.dto.TeamInsight;
import com.tony.gridironAnalytics.repository.TeamRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class LeagueRankingService {

    private final TeamRepository teamRepository;
    private final TeamInsightService teamInsightService;

    static final List<String> HEADLINE_METRICS = List.of(
            "offensive_epa_per_play",
            "defense_epa_per_play",
            "red_zone_efficiency",
            "third_down_conversion_rate",
            "clutch_performance"
    );

    // En dessous de cet écart, la différence est rapportée mais pas comptée comme avantage
    private static final double SIGNIFICANT_DIFFERENCE = 0.05;

    /**
     * Classement de la ligue sur une métrique avancée.
     * Tri décroissant, sauf métriques défensives / concédées (plus bas = meilleur).
     */
    public List<LeaderboardEntry> getLeagueLeaders(int season, String metric, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit doit être positif : " + limit);
        }
        TeamInsight.requireKnownMetric(metric);

        List<Team> teams = teamRepository.findAllByOrderByTeamAbbrAsc();
        if (teams.isEmpty()) return List.of();

        record Scored(Team team, double value) {}
        List<Scored> scored = new ArrayList<>();
        for (Team team : teams) {
            teamInsightService.generateTeamInsights(team.getTeamAbbr(), season)
                    .ifPresent(insight -> scored.add(new Scored(team, insight.metric(metric))));
        }

        Comparator<Scored> order = Comparator.comparingDouble(Scored::value);
        if (!TeamInsight.isLowerBetter(metric)) {
            order = order.reversed();
        }
        scored.sort(order);

        List<LeaderboardEntry> leaders = new ArrayList<>();
        int rank = 1;
        for (Scored s : scored) {
            if (rank > limit) break;
            leaders.add(new LeaderboardEntry(rank++, s.team().getTeamAbbr(), s.team().getFullName(), metric, s.value()));
        }

        log.info("🏆 Leaders {} {} : {} équipes classées", season, metric, leaders.size());
        return leaders;
    }

    /**
     * Duel de deux équipes sur les métriques phares. Vide si l'une des deux n'a pas de bilan.
     */
    public Optional<TeamComparison> compareTeams(String team1, String team2, int season) {
        Optional<TeamInsight> insights1 = teamInsightService.generateTeamInsights(team1, season);
        Optional<TeamInsight> insights2 = teamInsightService.generateTeamInsights(team2, season);
        if (insights1.isEmpty() || insights2.isEmpty()) {
            return Optional.empty();
        }

        Map<String, MetricComparison> metrics = new LinkedHashMap<>();
        Map<String, List<String>> advantages = new LinkedHashMap<>();
        advantages.put(team1, new ArrayList<>());
        advantages.put(team2, new ArrayList<>());

        for (String metric : HEADLINE_METRICS) {
            double val1 = insights1.get().metric(metric);
            double val2 = insights2.get().metric(metric);

            boolean team1Leads = TeamInsight.isLowerBetter(metric) ? val1 < val2 : val1 > val2;
            String leader = val1 == val2 ? GameInsightService.EVEN : (team1Leads ? team1 : team2);
            double difference = Math.abs(val1 - val2);

            metrics.put(metric, new MetricComparison(val1, val2, leader, difference));
            if (val1 != val2 && difference > SIGNIFICANT_DIFFERENCE) {
                advantages.get(leader).add(metric);
            }
        }

        return Optional.of(new TeamComparison(team1, team2, season, metrics, advantages));
    }
}
