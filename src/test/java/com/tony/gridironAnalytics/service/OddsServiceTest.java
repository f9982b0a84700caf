package com.tony.gridironAnalytics.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class OddsServiceTest {

    private OddsService oddsService;

    @BeforeEach
    void setUp() {
        oddsService = new OddsService();
    }

    @Test
    @DisplayName("Probabilité implicite des cotes favori / outsider")
    void impliedProbability() {
        assertThat(oddsService.oddsToProbability(-110)).isCloseTo(0.5238, within(1e-4));
        assertThat(oddsService.oddsToProbability(150)).isCloseTo(0.4, within(1e-9));
        assertThat(oddsService.oddsToProbability(-100)).isCloseTo(0.5, within(1e-9));
    }

    @Test
    @DisplayName("Favori en cote négative, outsider en cote positive")
    void probabilityToOddsSign() {
        assertThat(oddsService.probabilityToOdds(0.8)).isEqualTo(-400);
        assertThat(oddsService.probabilityToOdds(0.3)).isEqualTo(233);
        assertThat(oddsService.probabilityToOdds(0.5)).isEqualTo(-100);
    }

    @ParameterizedTest
    @ValueSource(doubles = {0.3, 0.45, 0.5, 0.55, 0.7, 0.8})
    @DisplayName("Aller-retour probabilité -> cote -> probabilité, à la troncature près")
    void roundTrip(double probability) {
        int odds = oddsService.probabilityToOdds(probability);
        assertThat(oddsService.oddsToProbability(odds)).isCloseTo(probability, within(0.005));
    }

    @Test
    @DisplayName("Espérance : nulle à cote juste, positive avec un edge")
    void expectedValue() {
        assertThat(oddsService.calculateExpectedValue(0.5, 100)).isCloseTo(0.0, within(1e-9));
        assertThat(oddsService.calculateExpectedValue(0.6, 100)).isCloseTo(0.2, within(1e-9));
        assertThat(oddsService.calculateExpectedValue(0.6, 100, 50.0)).isCloseTo(10.0, within(1e-9));
        assertThat(oddsService.calculateExpectedValue(0.4, -200)).isNegative();
    }

    @Test
    @DisplayName("Kelly : formule classique puis plafond à 25%")
    void kellyFraction() {
        assertThat(oddsService.kellyCriterion(0.6, 100)).isCloseTo(0.2, within(1e-9));
        assertThat(oddsService.kellyCriterion(0.9, 200)).isEqualTo(OddsService.MAX_KELLY_FRACTION);
    }

    @Test
    @DisplayName("Kelly : aucune mise sans edge")
    void kellyIsZeroWithoutEdge() {
        assertThat(oddsService.kellyCriterion(0.4, 150)).isZero();
        assertThat(oddsService.kellyCriterion(0.5, -100)).isZero();
        assertThat(oddsService.kellyCriterion(0.3, -200)).isZero();
    }

    @Test
    @DisplayName("Gain net par unité misée")
    void payoutPerUnit() {
        assertThat(oddsService.payoutPerUnit(150)).isCloseTo(1.5, within(1e-9));
        assertThat(oddsService.payoutPerUnit(-200)).isCloseTo(0.5, within(1e-9));
    }

    @Test
    @DisplayName("Entrées invalides refusées")
    void invalidInputsAreRejected() {
        assertThatThrownBy(() -> oddsService.oddsToProbability(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> oddsService.probabilityToOdds(0.0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> oddsService.probabilityToOdds(1.0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> oddsService.calculateExpectedValue(1.2, 100)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> oddsService.kellyCriterion(-0.1, 100)).isInstanceOf(IllegalArgumentException.class);
    }

    @ParameterizedTest
    @ValueSource(ints = {50, -50, 99, -99, Integer.MIN_VALUE, Integer.MAX_VALUE})
    @DisplayName("Cotes hors du domaine américain (|cote| < 100 ou extrêmes) refusées partout")
    void outOfDomainOddsAreRejected(int odds) {
        assertThatThrownBy(() -> oddsService.oddsToProbability(odds)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> oddsService.payoutPerUnit(odds)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> oddsService.kellyCriterion(0.5, odds)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> oddsService.calculateExpectedValue(0.5, odds)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Très grosses cotes : probabilité calculée en double, sans débordement")
    void largeOddsStayInRange() {
        assertThat(oddsService.oddsToProbability(Integer.MAX_VALUE - 1)).isBetween(0.0, 1e-6);
        assertThat(oddsService.oddsToProbability(Integer.MIN_VALUE + 1)).isBetween(1 - 1e-6, 1.0);
        assertThat(oddsService.kellyCriterion(0.5, 100)).isZero();
    }
}
