package com.tony.gridironAnalytics.service;

import org.springframework.stereotype.Service;

/**
 * Conversions cotes américaines / probabilités, espérance de gain et critère de Kelly.
 */
@Service
public class OddsService {

    // Jamais plus d'un quart de la bankroll, quel que soit l'edge
    public static final double MAX_KELLY_FRACTION = 0.25;

    /**
     * Probabilité implicite d'une cote américaine (ex: -110 -> 0.524, +150 -> 0.4).
     */
    public double oddsToProbability(int odds) {
        requireOdds(odds);
        if (odds > 0) {
            return 100.0 / (odds + 100.0);
        }
        double favorite = -(double) odds;
        return favorite / (favorite + 100.0);
    }

    /**
     * Cote américaine équivalente, tronquée à l'entier. Favori (p >= 0.5) en négatif.
     */
    public int probabilityToOdds(double probability) {
        if (Double.isNaN(probability) || probability <= 0.0 || probability >= 1.0) {
            throw new IllegalArgumentException("Probabilité hors de ]0, 1[ : " + probability);
        }
        if (probability >= 0.5) {
            return (int) (-100 * probability / (1 - probability));
        }
        return (int) (100 * (1 - probability) / probability);
    }

    /**
     * Gain net pour une mise d'une unité (cote décimale - 1).
     */
    public double payoutPerUnit(int odds) {
        requireOdds(odds);
        return odds > 0 ? odds / 100.0 : 100.0 / -(double) odds;
    }

    public double calculateExpectedValue(double modelProbability, int odds) {
        return calculateExpectedValue(modelProbability, odds, 1.0);
    }

    public double calculateExpectedValue(double modelProbability, int odds, double stake) {
        requireProbability(modelProbability);
        double payout = stake * payoutPerUnit(odds);
        return (modelProbability * payout) - ((1 - modelProbability) * stake);
    }

    /**
     * Fraction de bankroll à miser : f = (b.p - q) / b, bornée à [0, 0.25].
     */
    public double kellyCriterion(double modelProbability, int odds) {
        requireProbability(modelProbability);
        // Pas d'edge, pas de mise
        if (modelProbability <= oddsToProbability(odds)) {
            return 0.0;
        }
        double b = payoutPerUnit(odds);
        double q = 1 - modelProbability;
        double kellyFraction = (b * modelProbability - q) / b;
        return Math.max(0.0, Math.min(kellyFraction, MAX_KELLY_FRACTION));
    }

    // Une cote américaine vaut au moins 100 en valeur absolue (-100 et +100 = pari à égalité)
    private void requireOdds(int odds) {
        if (Math.abs((long) odds) < 100 || odds == Integer.MIN_VALUE || odds == Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Cote américaine invalide : " + odds);
        }
    }

    private void requireProbability(double p) {
        if (Double.isNaN(p) || p < 0.0 || p > 1.0) {
            throw new IllegalArgumentException("Probabilité hors de [0, 1] : " + p);
        }
    }
}
