package com.tony.gridironAnalytics.service;

import com.tony.gridironAnalytics.config.BettingProperties;
import com.tony.gridironAnalytics.model.BetType;
import com.tony.gridironAnalytics.model.Game;
import com.tony.gridironAnalytics.model.GamePrediction;
import com.tony.gridironAnalytics.model.VegasLine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;

/**
 * Marché simulé quand aucun flux de cotes n'est branché.
 * Le bruit est seedé par l'identifiant du match (et du bookmaker) : mêmes lignes à chaque appel.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MockMarketService {

    private final OddsService oddsService;
    private final BettingProperties properties;

    // Force relative des équipes (à remplacer par un historique réel)
    private static final Map<String, Double> TEAM_STRENGTHS = Map.of(
            "KC", 0.65, "BUF", 0.62, "SF", 0.60, "DAL", 0.58,
            "PHI", 0.56, "MIA", 0.54, "CIN", 0.52, "JAX", 0.50
    );
    private static final double DEFAULT_STRENGTH = 0.50;
    private static final double HOME_FIELD_BONUS = 0.03;
    private static final double MAX_HOME_STRENGTH = 0.85;

    private static final double GAME_NOISE = 0.05;
    private static final double BOOK_NOISE = 0.02;

    public List<VegasLine> createMockLines(List<Game> games) {
        List<VegasLine> lines = new ArrayList<>();

        for (Game game : games) {
            double homeStrength = Math.min(MAX_HOME_STRENGTH,
                    TEAM_STRENGTHS.getOrDefault(game.getHomeTeam(), DEFAULT_STRENGTH) + HOME_FIELD_BONUS);
            double awayStrength = TEAM_STRENGTHS.getOrDefault(game.getAwayTeam(), DEFAULT_STRENGTH);

            double totalStrength = homeStrength + awayStrength;
            double homeWinProb = totalStrength > 0 ? homeStrength / totalStrength : 0.5;

            // Inefficience du marché, reproductible pour un même match
            Random gameRandom = new Random(game.getGameId().hashCode());
            homeWinProb = clamp(homeWinProb + uniform(gameRandom, GAME_NOISE));

            for (String sportsbook : properties.getSportsbooks()) {
                Random bookRandom = new Random(Objects.hash(game.getGameId(), sportsbook));
                double bookHomeProb = clamp(homeWinProb + uniform(bookRandom, BOOK_NOISE));

                lines.add(VegasLine.builder()
                        .gameId(game.getGameId())
                        .sportsbook(sportsbook)
                        .betType(BetType.MONEYLINE)
                        .homeOdds(oddsService.probabilityToOdds(bookHomeProb))
                        .awayOdds(oddsService.probabilityToOdds(1 - bookHomeProb))
                        .timestamp(LocalDateTime.now().minusHours(1 + bookRandom.nextInt(48)))
                        .build());
            }
        }

        log.debug("Marché simulé : {} lignes pour {} matchs", lines.size(), games.size());
        return lines;
    }

    /**
     * Lignes pour des prédictions reçues de l'extérieur : seuls l'identifiant et les équipes comptent.
     */
    public List<VegasLine> createMockLinesForPredictions(List<GamePrediction> predictions) {
        List<Game> games = predictions.stream()
                .map(p -> {
                    Game game = new Game();
                    game.setGameId(p.gameId());
                    game.setHomeTeam(p.homeTeam());
                    game.setAwayTeam(p.awayTeam());
                    game.setGameDate(p.gameDate());
                    return game;
                })
                .toList();
        return createMockLines(games);
    }

    private double uniform(Random random, double amplitude) {
        return (random.nextDouble() * 2 - 1) * amplitude;
    }

    private double clamp(double probability) {
        return Math.max(0.1, Math.min(0.9, probability));
    }
}
