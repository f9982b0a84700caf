package com.tony.gridironAnalytics.service;

import com.tony.gridironAnalytics.config.BettingProperties;
import com.tony.gridironAnalytics.model.BetSide;
import com.tony.gridironAnalytics.model.BetType;
import com.tony.gridironAnalytics.model.Game;
import com.tony.gridironAnalytics.model.GamePrediction;
import com.tony.gridironAnalytics.model.VegasLine;
import com.tony.gridironAnalytics.model.dto.ValueBet;
import com.tony.gridironAnalytics.repository.GameRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ValueBetServiceTest {

    private static final LocalDate KICKOFF = LocalDate.of(2024, 9, 8);

    @Mock
    private MockMarketService mockMarketService;
    @Mock
    private GameRepository gameRepository;

    private ValueBetService service;

    @BeforeEach
    void setUp() {
        service = new ValueBetService(new OddsService(), mockMarketService, gameRepository, new BettingProperties());
    }

    private GamePrediction prediction(String gameId, double homeProbability) {
        return GamePrediction.fromHomeProbability(gameId, "KC", "BUF", KICKOFF, homeProbability);
    }

    private VegasLine moneyline(String gameId, String book, int homeOdds, int awayOdds) {
        return VegasLine.builder()
                .gameId(gameId)
                .sportsbook(book)
                .betType(BetType.MONEYLINE)
                .homeOdds(homeOdds)
                .awayOdds(awayOdds)
                .build();
    }

    @Test
    @DisplayName("La meilleure cote disponible est retenue (+120 plutôt que +110)")
    void bestOddsAreSelected() {
        List<ValueBet> bets = service.findValueBets(
                List.of(prediction("g1", 0.65)),
                List.of(moneyline("g1", "DraftKings", 110, -130), moneyline("g1", "FanDuel", 120, -140)));

        assertThat(bets).hasSize(1);
        ValueBet bet = bets.get(0);
        assertThat(bet.getRecommendation()).isEqualTo(BetSide.HOME);
        assertThat(bet.getSportsbook()).isEqualTo("FanDuel");
        assertThat(bet.getOdds()).isEqualTo(120);
        assertThat(bet.getMarketProbability()).isCloseTo(100.0 / 220, within(1e-9));
        assertThat(bet.getEdge()).isCloseTo(0.65 - 100.0 / 220, within(1e-9));
        assertThat(bet.getExpectedValue()).isCloseTo(0.65 * 1.2 - 0.35, within(1e-9));
        assertThat(bet.getKellyFraction()).isBetween(0.0, OddsService.MAX_KELLY_FRACTION);
        assertThat(bet.getReasoning()).contains("FanDuel +120");
    }

    @Test
    @DisplayName("Tri par espérance décroissante, edge insuffisant écarté")
    void sortedByExpectedValue() {
        List<ValueBet> bets = service.findValueBets(
                List.of(prediction("g1", 0.70), prediction("g2", 0.65), prediction("g3", 0.62)),
                List.of(moneyline("g1", "Caesars", -110, -110),
                        moneyline("g2", "BetMGM", 120, -140),
                        moneyline("g3", "BetMGM", -150, 130)));

        assertThat(bets).extracting(ValueBet::getGameId).containsExactly("g2", "g1");
        assertThat(bets.get(0).getExpectedValue()).isGreaterThan(bets.get(1).getExpectedValue());
    }

    @Test
    @DisplayName("Côté sous le seuil de confiance jamais recommandé")
    void lowConfidenceSideIsSkipped() {
        // BUF à 0.45 avec une cote très généreuse : edge énorme mais confiance trop faible
        List<ValueBet> bets = service.findValueBets(
                List.of(prediction("g1", 0.55)),
                List.of(moneyline("g1", "DraftKings", -105, 300)));

        assertThat(bets).isEmpty();
        assertThat(service.findValueBets(List.of(prediction("g1", 0.55)),
                List.of(moneyline("g1", "DraftKings", -105, 300)), 0.05, 0.4))
                .extracting(ValueBet::getRecommendation).containsExactly(BetSide.AWAY);
    }

    @Test
    @DisplayName("Match sans ligne moneyline ignoré")
    void gameWithoutMoneylineIsIgnored() {
        VegasLine spread = VegasLine.builder()
                .gameId("g1").sportsbook("DraftKings").betType(BetType.SPREAD)
                .homeLine(-3.5).awayLine(3.5).homeOdds(150).awayOdds(-110)
                .build();

        assertThat(service.findValueBets(List.of(prediction("g1", 0.8)), List.of(spread))).isEmpty();
    }

    @Test
    @DisplayName("Fenêtre à venir : au moins une semaine")
    void weeksAheadMustBePositive() {
        assertThatThrownBy(() -> service.getUpcomingValueBets((id, h, a, d, s) -> null, 2024, KICKOFF, 0, 0.05))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(gameRepository, mockMarketService);
    }

    @Test
    @DisplayName("Matchs à venir : un échec du classifieur n'interrompt pas le scan")
    void upcomingSkipsFailedPredictions() {
        Game kcGame = new Game("g1", 2024, KICKOFF, "KC", "BUF");
        Game nyjGame = new Game("g2", 2024, KICKOFF, "NYJ", "NE");
        List<Game> upcoming = List.of(kcGame, nyjGame);
        when(gameRepository.findUpcomingGames(2024, KICKOFF, KICKOFF.plusWeeks(1))).thenReturn(upcoming);
        when(mockMarketService.createMockLines(upcoming)).thenReturn(List.of(moneyline("g1", "FanDuel", 120, -140)));

        GameOutcomePredictor predictor = (gameId, home, away, date, season) -> {
            if ("NYJ".equals(home)) throw new IllegalStateException("features indisponibles");
            return GamePrediction.fromHomeProbability(gameId, home, away, date, 0.7);
        };

        List<ValueBet> bets = service.getUpcomingValueBets(predictor, 2024, KICKOFF, 1, 0.05);

        assertThat(bets).extracting(ValueBet::getGameId).containsExactly("g1");
    }

    @Test
    @DisplayName("Aucun match à venir : liste vide")
    void noUpcomingGames() {
        when(gameRepository.findUpcomingGames(2024, KICKOFF, KICKOFF.plusWeeks(2))).thenReturn(List.of());

        assertThat(service.getUpcomingValueBets((id, h, a, d, s) -> null, 2024, KICKOFF, 2, 0.05)).isEmpty();
        verifyNoInteractions(mockMarketService);
    }

    @Test
    @DisplayName("Matchs à venir : une prédiction absente est ignorée comme un échec")
    void upcomingSkipsMissingPredictions() {
        Game kcGame = new Game("g1", 2024, KICKOFF, "KC", "BUF");
        Game nyjGame = new Game("g2", 2024, KICKOFF, "NYJ", "NE");
        List<Game> upcoming = List.of(kcGame, nyjGame);
        when(gameRepository.findUpcomingGames(2024, KICKOFF, KICKOFF.plusWeeks(1))).thenReturn(upcoming);
        when(mockMarketService.createMockLines(upcoming)).thenReturn(List.of(
                moneyline("g1", "FanDuel", 120, -140), moneyline("g2", "FanDuel", 150, -170)));

        GameOutcomePredictor predictor = (gameId, home, away, date, season) ->
                "NYJ".equals(home) ? null : GamePrediction.fromHomeProbability(gameId, home, away, date, 0.7);

        List<ValueBet> bets = service.getUpcomingValueBets(predictor, 2024, KICKOFF, 1, 0.05);

        assertThat(bets).extracting(ValueBet::getGameId).containsExactly("g1");
    }
}
