package com.tony.gridironAnalytics.controller;

import com.tony.gridironAnalytics.model.PlayInput;
import com.tony.gridironAnalytics.model.PlayMetrics;
import com.tony.gridironAnalytics.model.dto.GameInsight;
import com.tony.gridironAnalytics.model.dto.LeaderboardEntry;
import com.tony.gridironAnalytics.model.dto.TeamComparison;
import com.tony.gridironAnalytics.model.dto.TeamInsight;
import com.tony.gridironAnalytics.service.GameInsightService;
import com.tony.gridironAnalytics.service.LeagueRankingService;
import com.tony.gridironAnalytics.service.PlayMetricsService;
import com.tony.gridironAnalytics.service.SeasonNarrativeService;
import com.tony.gridironAnalytics.service.TeamInsightService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/insights")
@RequiredArgsConstructor
public class InsightController {
    private final TeamInsightService teamInsightService;
    private final GameInsightService gameInsightService;
    private final LeagueRankingService leagueRankingService;
    private final SeasonNarrativeService seasonNarrativeService;
    private final PlayMetricsService playMetricsService;

    @GetMapping("/teams/{teamAbbr}")
    public ResponseEntity<TeamInsight> getTeamInsights(@PathVariable String teamAbbr, @RequestParam int season) {
        return teamInsightService.generateTeamInsights(teamAbbr, season)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/teams/{teamAbbr}/narrative")
    public ResponseEntity<String> getSeasonNarrative(@PathVariable String teamAbbr, @RequestParam int season) {
        return ResponseEntity.ok(seasonNarrativeService.generateSeasonNarrative(teamAbbr, season));
    }

    @GetMapping("/games/{gameId}")
    public ResponseEntity<GameInsight> getGameInsights(@PathVariable String gameId) {
        return gameInsightService.generateGameInsights(gameId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    // Ex : GET /api/v1/insights/leaders?season=2024&metric=offensive_epa_per_play&limit=5
    @GetMapping("/leaders")
    public ResponseEntity<List<LeaderboardEntry>> getLeagueLeaders(
            @RequestParam int season,
            @RequestParam(defaultValue = "offensive_epa_per_play") String metric,
            @RequestParam(defaultValue = "10") int limit) {
        return ResponseEntity.ok(leagueRankingService.getLeagueLeaders(season, metric, limit));
    }

    @GetMapping("/compare")
    public ResponseEntity<TeamComparison> compareTeams(
            @RequestParam String team1,
            @RequestParam String team2,
            @RequestParam int season) {
        return leagueRankingService.compareTeams(team1, team2, season)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/plays/metrics")
    public ResponseEntity<PlayMetrics> computePlayMetrics(@RequestBody PlayInput play) {
        return ResponseEntity.ok(playMetricsService.calculatePlayMetrics(play));
    }
}
