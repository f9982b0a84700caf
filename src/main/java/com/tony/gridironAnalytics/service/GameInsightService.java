package com.tony.gridironAnalytics.service;

import com.tony.gridironAnalytics.model.Game;
import com.tony.gridironAnalytics.model.Play;
import com.tony.gridironAnalytics.model.PlayInput;
import com.tony.gridironAnalytics.model.PlayMetrics;
import com.tony.gridironAnalytics.model.dto.GameInsight;
import com.tony.gridironAnalytics.repository.GameRepository;
import com.tony.gridironAnalytics.repository.PlayRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class GameInsightService {

    private final GameRepository gameRepository;
    private final PlayRepository playRepository;
    private final PlayMetricsService playMetricsService;

    static final String EVEN = "Even";

    private static final double MOMENTUM_SWING_THRESHOLD = 0.15;
    private static final double MAX_EXCITEMENT = 10.0;
    private static final double COMPETITIVE_GAP = 35.0;
    private static final int CLOSE_GAME_MARGIN = 7;
    private static final int HIGH_SCORING_TOTAL = 50;

    /**
     * Analyse d'un match. Vide si le match est inconnu ; version réduite (score final seul)
     * si aucun play-by-play n'est disponible.
     */
    @Transactional(readOnly = true)
    public Optional<GameInsight> generateGameInsights(String gameId) {
        Optional<Game> found = gameRepository.findByGameId(gameId);
        if (found.isEmpty()) {
            log.warn("⚠️ Match {} introuvable", gameId);
            return Optional.empty();
        }
        Game game = found.get();

        List<Play> plays = playRepository.findByGameIdOrderByIdAsc(gameId);
        if (plays.isEmpty()) {
            log.warn("Aucun play pour le match {}, analyse basique sur le score final", gameId);
            return Optional.of(basicInsight(game).build());
        }

        TeamTally home = new TeamTally();
        TeamTally away = new TeamTally();

        double maxEpa = 0.0;
        double maxWpa = 0.0;
        String maxEpaPlayId = null;
        String maxWpaPlayId = null;
        int turningPointQuarter = 0;
        int momentumSwings = 0;
        double lastWp = 0.5;

        for (Play play : plays) {
            PlayMetrics metrics = playMetricsService.calculatePlayMetrics(PlayInput.fromPlay(play));

            if (game.getHomeTeam().equals(play.getPosteam())) {
                home.add(play, metrics);
            } else if (game.getAwayTeam().equals(play.getPosteam())) {
                away.add(play, metrics);
            }

            // Actions décisives
            if (Math.abs(metrics.getEpa()) > Math.abs(maxEpa)) {
                maxEpa = metrics.getEpa();
                maxEpaPlayId = play.getPlayId();
            }
            if (Math.abs(metrics.getWpa()) > Math.abs(maxWpa)) {
                maxWpa = metrics.getWpa();
                maxWpaPlayId = play.getPlayId();
                turningPointQuarter = play.getQtr() != null ? play.getQtr() : 0;
            }

            // Bascule de momentum : saut de WP par rapport à l'action précédente
            double currentWp = metrics.getWinProbabilityAfter();
            if (Math.abs(currentWp - lastWp) > MOMENTUM_SWING_THRESHOLD) {
                momentumSwings++;
            }
            lastWp = currentWp;
        }

        double excitement = Math.min(MAX_EXCITEMENT, Math.abs(home.epa) + Math.abs(away.epa) + momentumSwings);
        double competitiveness = game.isScored()
                ? Math.max(0, 1 - (Math.abs(game.getHomeScore() - game.getAwayScore()) / COMPETITIVE_GAP))
                : 0.5;

        log.info("📊 Match {} : {} plays, {} bascules, excitation {}",
                gameId, plays.size(), momentumSwings, String.format("%.2f", excitement));

        return Optional.of(basicInsight(game)
                .playByPlayAvailable(true)
                .excitementIndex(excitement)
                .competitiveness(competitiveness)
                .momentumSwings(momentumSwings)
                .homeTeamEpa(home.epa)
                .awayTeamEpa(away.epa)
                .passingGameDominance(home.passEpaPerPlay() - away.passEpaPerPlay())
                .rushingGameDominance(home.runEpaPerPlay() - away.runEpaPerPlay())
                .biggestPlayEpa(maxEpa)
                .biggestEpaPlayId(maxEpaPlayId)
                .biggestPlayWpa(maxWpa)
                .biggestWpaPlayId(maxWpaPlayId)
                .turningPointQuarter(turningPointQuarter)
                .redZoneBattle(winner(game, home.redZoneRate(), away.redZoneRate()))
                .thirdDownBattle(winner(game, home.thirdDownRate(), away.thirdDownRate()))
                // Moins de ballons perdus = duel gagné
                .turnoverBattle(winner(game, away.turnovers, home.turnovers))
                .build());
    }

    /**
     * Socle commun : identité, score final et conditions. Les champs play-by-play restent à zéro.
     */
    private GameInsight.GameInsightBuilder basicInsight(Game game) {
        boolean scored = game.isScored();
        int homeScore = scored ? game.getHomeScore() : 0;
        int awayScore = scored ? game.getAwayScore() : 0;
        int totalPoints = homeScore + awayScore;
        int pointDiff = Math.abs(homeScore - awayScore);

        return GameInsight.builder()
                .gameId(game.getGameId())
                .homeTeam(game.getHomeTeam())
                .awayTeam(game.getAwayTeam())
                .gameDate(game.getGameDate())
                .homeScore(game.getHomeScore())
                .awayScore(game.getAwayScore())
                .playByPlayAvailable(false)
                .totalPoints(totalPoints)
                .pointDifferential(pointDiff)
                .closeGame(scored && pointDiff <= CLOSE_GAME_MARGIN)
                .highScoring(scored && totalPoints > HIGH_SCORING_TOTAL)
                .homeFieldAdvantage(scored && homeScore > awayScore ? 3.0 : 0.0)
                .redZoneBattle(EVEN)
                .thirdDownBattle(EVEN)
                .turnoverBattle(EVEN)
                .roof(game.getRoof())
                .surface(game.getSurface())
                .temperature(game.getTemp())
                .wind(game.getWind());
    }

    private String winner(Game game, double homeValue, double awayValue) {
        if (homeValue > awayValue) return game.getHomeTeam();
        if (awayValue > homeValue) return game.getAwayTeam();
        return EVEN;
    }

    /**
     * Compteurs d'une équipe sur le match (EPA cumulé, red zone, 3e tentatives, pertes de balle).
     */
    private static class TeamTally {
        double epa;
        double passEpa;
        int passPlays;
        double runEpa;
        int runPlays;
        int redZonePlays;
        int redZoneTouchdowns;
        int thirdDowns;
        int thirdDownConversions;
        int turnovers;

        void add(Play play, PlayMetrics metrics) {
            epa += metrics.getEpa();
            if ("pass".equals(play.getPlayType())) {
                passEpa += metrics.getEpa();
                passPlays++;
            } else if ("run".equals(play.getPlayType())) {
                runEpa += metrics.getEpa();
                runPlays++;
            }
            if (play.isInRedZone()) {
                redZonePlays++;
                if (play.isTouchdownPlay()) redZoneTouchdowns++;
            }
            if (play.isThirdDown()) {
                thirdDowns++;
                if (play.isConverted()) thirdDownConversions++;
            }
            if (play.isGiveaway()) turnovers++;
        }

        double passEpaPerPlay() { return passPlays == 0 ? 0.0 : passEpa / passPlays; }
        double runEpaPerPlay() { return runPlays == 0 ? 0.0 : runEpa / runPlays; }
        double redZoneRate() { return redZonePlays == 0 ? 0.0 : (double) redZoneTouchdowns / redZonePlays; }
        double thirdDownRate() { return thirdDowns == 0 ? 0.0 : (double) thirdDownConversions / thirdDowns; }
    }
}
