package com.tony.gridironAnalytics.service;

import com.tony.gridironAnalytics.model.PlayInput;
import com.tony.gridironAnalytics.model.PlayMetrics;
import com.tony.gridironAnalytics.model.PlayOutcome;
import com.tony.gridironAnalytics.model.Situation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Moteur de métriques par action : situation avant -> issue -> situation après -> EPA / WPA.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PlayMetricsService {

    private final ExpectedPointsService expectedPointsService;
    private final WinProbabilityService winProbabilityService;

    private static final double TOUCHDOWN_EP = 7.0;
    private static final double TOUCHDOWN_WP_BOOST = 0.15;
    private static final double TOUCHDOWN_WP_CAP = 0.95;

    private static final int PLAY_CLOCK_SECONDS = 40;
    private static final double MIN_LEVERAGE = 0.02;
    private static final int EXPLOSIVE_YARDS = 20;

    private static final int CLUTCH_SECONDS = 300;
    private static final int CLOSE_GAME_MARGIN = 7;

    public PlayMetrics calculatePlayMetrics(PlayInput play) {
        Situation before = new Situation(
                orDefault(play.getDown(), 1),
                orDefault(play.getYdstogo(), 10),
                orDefault(play.getYardline100(), 50),
                orDefault(play.getQtr(), 1),
                orDefault(play.getGameSecondsRemaining(), 3600),
                orDefault(play.getScoreDifferential(), 0),
                orDefault(play.getTimeoutsRemaining(), 3),
                play.getPlayType() != null ? play.getPlayType() : "pass"
        );
        int yardsGained = orDefault(play.getYardsGained(), 0);
        boolean touchdown = Boolean.TRUE.equals(play.getTouchdown());
        boolean turnover = Boolean.TRUE.equals(play.getInterception()) || Boolean.TRUE.equals(play.getFumbleLost());

        double epBefore = expectedPointsService.calculateExpectedPoints(before);
        double wpBefore = winProbabilityService.calculateWinProbability(before);

        PlayOutcome outcome = classify(before, yardsGained, touchdown, turnover);

        double epAfter;
        double wpAfter;
        switch (outcome) {
            case TOUCHDOWN -> {
                epAfter = TOUCHDOWN_EP;
                wpAfter = Math.min(TOUCHDOWN_WP_CAP, wpBefore + TOUCHDOWN_WP_BOOST);
            }
            case TURNOVER -> {
                // L'adversaire récupère le ballon : on inverse depuis le cadre de l'attaque d'origine
                epAfter = -epBefore;
                wpAfter = 1 - wpBefore;
            }
            case TURNOVER_ON_DOWNS -> {
                Situation after = advance(before, yardsGained);
                epAfter = -expectedPointsService.calculateExpectedPoints(after);
                wpAfter = 1 - winProbabilityService.calculateWinProbability(after);
            }
            default -> {
                Situation after = advance(before, yardsGained);
                epAfter = expectedPointsService.calculateExpectedPoints(after);
                wpAfter = winProbabilityService.calculateWinProbability(after);
            }
        }

        double epa = epAfter - epBefore;
        double wpa = wpAfter - wpBefore;
        double leverage = Math.max(Math.abs(wpa), MIN_LEVERAGE);

        boolean success = isSuccessful(before, yardsGained);

        double clutchMultiplier = 1.0;
        if (before.gameSecondsRemaining() < CLUTCH_SECONDS) clutchMultiplier = 1.5;
        if (Math.abs(before.scoreDifferential()) <= CLOSE_GAME_MARGIN) clutchMultiplier *= 1.3;
        double clutchIndex = success ? epa * clutchMultiplier : epa * clutchMultiplier * 0.5;

        boolean explosive = yardsGained >= EXPLOSIVE_YARDS || touchdown;

        log.debug("Play {} : EPA={} WPA={}", outcome, epa, wpa);

        return PlayMetrics.builder()
                .outcome(outcome)
                .expectedPointsBefore(epBefore)
                .expectedPointsAfter(epAfter)
                .epa(epa)
                .winProbabilityBefore(wpBefore)
                .winProbabilityAfter(wpAfter)
                .wpa(wpa)
                .leverage(leverage)
                .clutchIndex(clutchIndex)
                .successRate(success ? 1.0 : 0.0)
                .explosivePlay(explosive)
                .build();
    }

    PlayOutcome classify(Situation before, int yardsGained, boolean touchdown, boolean turnover) {
        if (touchdown) return PlayOutcome.TOUCHDOWN;
        if (turnover) return PlayOutcome.TURNOVER;
        return nextDown(before, yardsGained) > 4 ? PlayOutcome.TURNOVER_ON_DOWNS : PlayOutcome.NORMAL_GAIN;
    }

    /**
     * Situation après une action sans changement de possession immédiat (le down est re-borné à 4).
     */
    private Situation advance(Situation before, int yardsGained) {
        boolean firstDown = yardsGained >= before.yardsToGo();
        return new Situation(
                nextDown(before, yardsGained),
                firstDown ? 10 : before.yardsToGo() - yardsGained,
                Math.max(0, before.yardline100() - yardsGained),
                before.quarter(),
                Math.max(0, before.gameSecondsRemaining() - PLAY_CLOCK_SECONDS),
                before.scoreDifferential(),
                before.timeoutsRemaining(),
                before.playType()
        );
    }

    private int nextDown(Situation before, int yardsGained) {
        return yardsGained >= before.yardsToGo() ? 1 : before.down() + 1;
    }

    // Tentatives 1-2 : au moins 4 yards ou la moitié de la distance ; 3-4 : la distance complète
    private boolean isSuccessful(Situation before, int yardsGained) {
        if (before.down() <= 2) {
            return yardsGained >= Math.max(4, before.yardsToGo() * 0.5);
        }
        return yardsGained >= before.yardsToGo();
    }

    private int orDefault(Integer value, int fallback) {
        return value != null ? value : fallback;
    }
}
