package com.tony.gridironAnalytics.service;

import com.tony.gridironAnalytics.config.BettingProperties;
import com.tony.gridironAnalytics.model.BetSide;
import com.tony.gridironAnalytics.model.BetType;
import com.tony.gridironAnalytics.model.Game;
import com.tony.gridironAnalytics.model.GamePrediction;
import com.tony.gridironAnalytics.model.VegasLine;
import com.tony.gridironAnalytics.model.dto.ValidationMetrics;
import com.tony.gridironAnalytics.repository.GameRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class VegasValidationService {

    private final OddsService oddsService;
    private final MockMarketService mockMarketService;
    private final GameRepository gameRepository;
    private final BettingProperties properties;

    static final String CONSENSUS_BOOK = "Consensus";

    /**
     * Confronte les prédictions au marché et aux résultats réels, puis simule une mise Kelly
     * sur chaque match où le modèle a un edge suffisant.
     *
     * @param actualWinners vainqueur réel de chaque match (null si inconnu), aligné sur predictions
     */
    public ValidationMetrics validatePredictions(List<GamePrediction> predictions,
                                                 List<VegasLine> lines,
                                                 List<String> actualWinners) {
        if (predictions.size() != actualWinners.size()) {
            throw new IllegalArgumentException("predictions (" + predictions.size()
                    + ") et actualWinners (" + actualWinners.size() + ") doivent avoir la même taille");
        }

        Map<String, List<VegasLine>> linesByGame = lines.stream()
                .filter(l -> l.getBetType() == BetType.MONEYLINE)
                .collect(Collectors.groupingBy(VegasLine::getGameId));

        int evaluable = 0;
        int agreements = 0;
        int modelCorrect = 0;
        int marketCorrect = 0;
        double sumProbabilityGap = 0.0;
        double sumStatedConfidence = 0.0;
        List<Double> kellyReturns = new ArrayList<>();
        List<CalibrationData> calibrationList = new ArrayList<>();

        for (int i = 0; i < predictions.size(); i++) {
            GamePrediction prediction = predictions.get(i);
            String actualWinner = actualWinners.get(i);
            List<VegasLine> gameLines = linesByGame.get(prediction.gameId());

            // Sans cote ou sans résultat, le match n'est pas évaluable
            if (gameLines == null || actualWinner == null) continue;

            OptionalInt homeOdds = bestOdds(gameLines, BetSide.HOME);
            OptionalInt awayOdds = bestOdds(gameLines, BetSide.AWAY);
            if (homeOdds.isEmpty() || awayOdds.isEmpty()) continue;

            evaluable++;
            double marketHome = oddsService.oddsToProbability(homeOdds.getAsInt());
            double marketAway = oddsService.oddsToProbability(awayOdds.getAsInt());
            String marketFavorite = marketHome > marketAway ? prediction.homeTeam() : prediction.awayTeam();
            String modelFavorite = prediction.predictedWinner();

            if (marketFavorite.equals(modelFavorite)) agreements++;

            boolean modelOnHome = prediction.homeTeam().equals(modelFavorite);
            double modelProb = modelOnHome ? prediction.homeWinProbability() : prediction.awayWinProbability();
            double marketProb = modelOnHome ? marketHome : marketAway;
            int odds = modelOnHome ? homeOdds.getAsInt() : awayOdds.getAsInt();

            sumProbabilityGap += Math.abs(modelProb - marketProb);
            sumStatedConfidence += prediction.winProbability();

            boolean modelWon = actualWinner.equals(modelFavorite);
            if (modelWon) modelCorrect++;
            if (actualWinner.equals(marketFavorite)) marketCorrect++;
            calibrationList.add(new CalibrationData(prediction.winProbability(), modelWon ? 1.0 : 0.0));

            // Mise Kelly simulée uniquement avec un edge suffisant
            if (modelProb - marketProb >= properties.getBacktestEdge()) {
                double stake = oddsService.kellyCriterion(modelProb, odds);
                kellyReturns.add(modelWon ? stake * oddsService.payoutPerUnit(odds) : -stake);
            }
        }

        if (evaluable == 0) {
            log.warn("Aucun match évaluable sur la fenêtre demandée.");
            return ValidationMetrics.empty();
        }

        double modelAccuracy = (double) modelCorrect / evaluable;
        double calibrationError = Math.abs(modelAccuracy - sumStatedConfidence / evaluable);

        DescriptiveStatistics returns = new DescriptiveStatistics();
        kellyReturns.forEach(returns::addValue);
        double roi = returns.getSum();
        double sharpe = 0.0;
        if (returns.getN() > 1 && returns.getStandardDeviation() > 0) {
            sharpe = returns.getMean() / returns.getStandardDeviation();
        }

        ValidationMetrics metrics = new ValidationMetrics(
                evaluable,
                (double) agreements / evaluable,
                sumProbabilityGap / evaluable,
                calibrationError,
                modelAccuracy,
                (double) marketCorrect / evaluable,
                kellyReturns.size(),
                roi,
                sharpe,
                maxDrawdown(kellyReturns)
        );

        log.info("📊 --- RÉSULTATS DU BACKTEST ---");
        log.info("🏟️  Matchs évalués : {} | Accord marché : {}", evaluable, String.format("%.3f", metrics.agreementRate()));
        log.info("🎯 Précision modèle : {} | Erreur de calibration : {}",
                String.format("%.3f", modelAccuracy), String.format("%.4f", calibrationError));
        log.info("💰 Paris Kelly : {} | ROI : {} | Sharpe : {} | Drawdown max : {}", kellyReturns.size(),
                String.format("%.4f", roi), String.format("%.3f", sharpe), String.format("%.4f", metrics.maxDrawdown()));
        printCalibrationReport(calibrationList);

        return metrics;
    }

    /**
     * Backtest d'une saison : matchs terminés de la base, prédictions du classifieur fourni,
     * cote de clôture stockée si présente, marché simulé sinon.
     */
    @Transactional(readOnly = true)
    public ValidationMetrics validateSeason(GameOutcomePredictor predictor, int season, LocalDate from, LocalDate to) {
        List<Game> finished = gameRepository.findFinishedGames(season, from, to);

        List<GamePrediction> predictions = new ArrayList<>();
        List<String> winners = new ArrayList<>();
        List<VegasLine> lines = new ArrayList<>();
        List<Game> withoutLine = new ArrayList<>();

        for (Game game : finished) {
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
            winners.add(game.getWinner());

            if (game.getHomeMoneyline() != null && game.getAwayMoneyline() != null) {
                lines.add(VegasLine.builder()
                        .gameId(game.getGameId())
                        .sportsbook(CONSENSUS_BOOK)
                        .betType(BetType.MONEYLINE)
                        .homeOdds(game.getHomeMoneyline())
                        .awayOdds(game.getAwayMoneyline())
                        .build());
            } else {
                withoutLine.add(game);
            }
        }
        lines.addAll(mockMarketService.createMockLines(withoutLine));

        log.info("🔄 Backtest {} du {} au {} : {} matchs terminés ({} sans cote réelle)",
                season, from, to, finished.size(), withoutLine.size());
        return validatePredictions(predictions, lines, winners);
    }

    // Plus grande baisse du cumul des retours depuis son plus haut
    double maxDrawdown(List<Double> returns) {
        if (returns.isEmpty()) return 0.0;

        double cumulative = 0.0;
        double peak = returns.get(0);
        double maxDrawdown = 0.0;
        for (double r : returns) {
            cumulative += r;
            peak = Math.max(peak, cumulative);
            maxDrawdown = Math.max(maxDrawdown, peak - cumulative);
        }
        return maxDrawdown;
    }

    private OptionalInt bestOdds(List<VegasLine> lines, BetSide side) {
        return lines.stream()
                .map(l -> l.oddsFor(side))
                .filter(o -> o != null)
                .mapToInt(Integer::intValue)
                .max();
    }

    /**
     * Rapport de calibration par tranches de 10%.
     */
    private void printCalibrationReport(List<CalibrationData> data) {
        log.info("🎯 --- RAPPORT DE CALIBRATION ---");
        log.info(String.format("%-15s | %-12s | %-12s | %-8s", "Tranche Prob", "Moy. Prédite", "Fréq. Réelle", "Nb Cas"));

        for (int i = 0; i < 10; i++) {
            double lower = i / 10.0;
            double upper = (i + 1) / 10.0;

            List<CalibrationData> bin = data.stream()
                    .filter(d -> d.predictedProb() >= lower && (d.predictedProb() < upper || (upper == 1.0 && d.predictedProb() == 1.0)))
                    .toList();

            if (!bin.isEmpty()) {
                double avgPredicted = bin.stream().mapToDouble(CalibrationData::predictedProb).average().orElse(0.0);
                double actualFreq = bin.stream().mapToDouble(CalibrationData::actualOutcome).average().orElse(0.0);
                log.info(String.format("[%2.0f%% - %2.0f%%]   | %-12.2f | %-12.2f | %-8d",
                        lower * 100, upper * 100, avgPredicted * 100, actualFreq * 100, bin.size()));
            }
        }
    }

    record CalibrationData(double predictedProb, double actualOutcome) {}
}
