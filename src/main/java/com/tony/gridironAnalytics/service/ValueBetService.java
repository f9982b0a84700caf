package com.tony.gridironAnalytics.service;

import com.tony.gridironAnalytics.config.BettingProperties;
import com.tony.gridironAnalytics.model.BetSide;
import com.tony.gridironAnalytics.model.BetType;
import com.tony.gridironAnalytics.model.Game;
import com.tony.gridironAnalytics.model.GamePrediction;
import com.tony.gridironAnalytics.model.VegasLine;
import com.tony.gridironAnalytics.model.dto.ValueBet;
import com.tony.gridironAnalytics.repository.GameRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class ValueBetService {

    private final OddsService oddsService;
    private final MockMarketService mockMarketService;
    private final GameRepository gameRepository;
    private final BettingProperties properties;

    public List<ValueBet> findValueBets(List<GamePrediction> predictions, List<VegasLine> lines) {
        return findValueBets(predictions, lines, properties.getMinEdge(), properties.getMinConfidence());
    }

    /**
     * Cherche les paris à valeur positive : meilleure cote disponible par côté, edge minimum
     * et espérance strictement positive. Trié par espérance décroissante.
     */
    public List<ValueBet> findValueBets(List<GamePrediction> predictions, List<VegasLine> lines,
                                        double minEdge, double minConfidence) {
        Map<String, List<VegasLine>> linesByGame = lines.stream()
                .filter(l -> l.getBetType() == BetType.MONEYLINE)
                .collect(Collectors.groupingBy(VegasLine::getGameId));

        List<ValueBet> valueBets = new ArrayList<>();

        for (GamePrediction prediction : predictions) {
            List<VegasLine> gameLines = linesByGame.get(prediction.gameId());
            if (gameLines == null || gameLines.isEmpty()) continue;

            for (BetSide side : List.of(BetSide.HOME, BetSide.AWAY)) {
                double modelProb = prediction.probabilityFor(side);
                Optional<VegasLine> best = bestLine(gameLines, side);

                if (best.isEmpty() || modelProb < minConfidence) continue;

                int odds = best.get().oddsFor(side);
                double marketProb = oddsService.oddsToProbability(odds);
                double edge = modelProb - marketProb;
                if (edge < minEdge) continue;

                double expectedValue = oddsService.calculateExpectedValue(modelProb, odds);
                if (expectedValue <= 0) continue;

                valueBets.add(ValueBet.builder()
                        .gameId(prediction.gameId())
                        .homeTeam(prediction.homeTeam())
                        .awayTeam(prediction.awayTeam())
                        .gameDate(prediction.gameDate())
                        .betType(BetType.MONEYLINE)
                        .recommendation(side)
                        .sportsbook(best.get().getSportsbook())
                        .odds(odds)
                        .modelProbability(modelProb)
                        .marketProbability(marketProb)
                        .edge(edge)
                        .expectedValue(expectedValue)
                        .kellyFraction(oddsService.kellyCriterion(modelProb, odds))
                        .confidence(prediction.confidence())
                        .reasoning(String.format(Locale.US, "Modèle : %.3f vs Marché : %.3f (Edge : %.3f) @ %s %+d",
                                modelProb, marketProb, edge, best.get().getSportsbook(), odds))
                        .build());
            }
        }

        valueBets.sort(Comparator.comparingDouble(ValueBet::getExpectedValue).reversed());
        return valueBets;
    }

    /**
     * Value bets des matchs à venir : le classifieur est fourni par l'appelant,
     * le marché est simulé faute de flux de cotes.
     */
    public List<ValueBet> getUpcomingValueBets(GameOutcomePredictor predictor, int season, LocalDate from,
                                               int weeksAhead, double minEdge) {
        if (weeksAhead < 1) {
            throw new IllegalArgumentException("weeksAhead doit être >= 1 : " + weeksAhead);
        }
        List<Game> upcoming = gameRepository.findUpcomingGames(season, from, from.plusWeeks(weeksAhead));
        if (upcoming.isEmpty()) {
            log.info("Aucun match à venir entre {} et {}", from, from.plusWeeks(weeksAhead));
            return List.of();
        }

        List<GamePrediction> predictions = new ArrayList<>();
        for (Game game : upcoming) {
            GamePrediction prediction;
            try {
                prediction = predictor.predictGame(game.getGameId(), game.getHomeTeam(), game.getAwayTeam(),
                        game.getGameDate(), season);
            } catch (RuntimeException e) {
                log.warn("Prédiction impossible pour {} : {}", game.getGameId(), e.getMessage());
                continue;
            }
            if (prediction == null) {
                log.warn("Aucune prédiction renvoyée pour {}, match ignoré", game.getGameId());
                continue;
            }
            predictions.add(prediction);
        }

        List<ValueBet> bets = findValueBets(predictions, mockMarketService.createMockLines(upcoming),
                minEdge, properties.getMinConfidence());
        log.info("💰 {} value bets sur {} matchs à venir", bets.size(), upcoming.size());
        return bets;
    }

    // Meilleure cote pour le parieur = la plus haute (+120 > +110, -105 > -110)
    private Optional<VegasLine> bestLine(List<VegasLine> lines, BetSide side) {
        return lines.stream()
                .filter(l -> l.oddsFor(side) != null)
                .max(Comparator.comparingInt(l -> l.oddsFor(side)));
    }
}
