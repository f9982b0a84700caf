package com.tony.gridironAnalytics.service;

import com.tony.gridironAnalytics.model.Play;
import com.tony.gridironAnalytics.model.PlayInput;
import com.tony.gridironAnalytics.model.PlayMetrics;
import com.tony.gridironAnalytics.model.dto.TeamInsight;
import com.tony.gridironAnalytics.repository.PlayRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.ToDoubleFunction;

@Service
@RequiredArgsConstructor
@Slf4j
public class TeamInsightService {

    private final PlayRepository playRepository;
    private final PlayMetricsService playMetricsService;

    // --- Constantes de contexte (transformations fixes, pas de mesure indépendante) ---
    private static final double GARBAGE_TIME_FACTOR = 0.95;
    private static final double NEUTRAL_STRENGTH_OF_SCHEDULE = 0.5;
    private static final double LEAGUE_HOME_FIELD_ADVANTAGE = 0.1;

    /**
     * Recalcule le bilan complet d'une équipe sur une saison à partir de tous ses plays.
     * Vide si l'attaque ou la défense n'a aucun play (pas de bilan partiel).
     */
    @Transactional(readOnly = true)
    public Optional<TeamInsight> generateTeamInsights(String teamAbbr, int season) {
        List<Play> offensePlays = playRepository.findBySeasonAndPosteamOrderByIdAsc(season, teamAbbr);
        List<Play> defensePlays = playRepository.findBySeasonAndDefteamOrderByIdAsc(season, teamAbbr);

        if (offensePlays.isEmpty() || defensePlays.isEmpty()) {
            log.warn("⚠️ Pas de plays pour {} en {} (attaque: {}, défense: {})",
                    teamAbbr, season, offensePlays.size(), defensePlays.size());
            return Optional.empty();
        }

        List<RatedPlay> offense = rate(offensePlays);
        List<RatedPlay> defense = rate(defensePlays);

        // 1. ATTAQUE
        double offensiveEpa = mean(offense, r -> true, r -> r.metrics().getEpa());
        double passingEpa = mean(offense, RatedPlay::isPass, r -> r.metrics().getEpa());
        double rushingEpa = mean(offense, RatedPlay::isRun, r -> r.metrics().getEpa());
        double redZoneEfficiency = redZoneTouchdownRate(offense);
        double thirdDownRate = thirdDownConversionRate(offense);
        double successRate = mean(offense, r -> true, r -> r.metrics().getSuccessRate());
        double explosiveRate = mean(offense, r -> true, r -> r.metrics().isExplosivePlay() ? 1.0 : 0.0);

        // 2. DÉFENSE : EPA concédé, un chiffre négatif = bonne défense
        double defenseEpa = mean(defense, r -> true, r -> r.metrics().getEpa());
        double passDefenseEpa = mean(defense, RatedPlay::isPass, r -> r.metrics().getEpa());
        double runDefenseEpa = mean(defense, RatedPlay::isRun, r -> r.metrics().getEpa());
        double redZoneAllowed = redZoneTouchdownRate(defense);
        double thirdDownAllowed = thirdDownConversionRate(defense);

        // 3. SITUATIONS SPÉCIALES
        double clutch = mean(offense, r -> true, r -> r.metrics().getClutchIndex());
        double twoMinute = mean(offense, RatedPlay::isTwoMinuteDrill, r -> r.metrics().getEpa());
        long giveaways = offensePlays.stream().filter(Play::isGiveaway).count();
        long takeaways = defensePlays.stream().filter(Play::isGiveaway).count();

        // 4. CONTEXTE & TENDANCE (dérivés linéaires de l'EPA net)
        double netEpa = offensiveEpa - defenseEpa;

        TeamInsight insight = TeamInsight.builder()
                .teamAbbr(teamAbbr)
                .season(season)
                .offensivePlays(offensePlays.size())
                .defensivePlays(defensePlays.size())
                .offensiveEpaPerPlay(offensiveEpa)
                .passingEpaPerPlay(passingEpa)
                .rushingEpaPerPlay(rushingEpa)
                .redZoneEfficiency(redZoneEfficiency)
                .thirdDownConversionRate(thirdDownRate)
                .successRate(successRate)
                .explosivePlayRate(explosiveRate)
                .defenseEpaPerPlay(defenseEpa)
                .passDefenseEpa(passDefenseEpa)
                .runDefenseEpa(runDefenseEpa)
                .redZoneTdRateAllowed(redZoneAllowed)
                .thirdDownRateAllowed(thirdDownAllowed)
                .twoMinuteDrillEfficiency(twoMinute)
                .clutchPerformance(clutch)
                .turnoverMargin(takeaways - giveaways)
                .garbageTimeAdjustedEpa(offensiveEpa * GARBAGE_TIME_FACTOR)
                .strengthOfSchedule(NEUTRAL_STRENGTH_OF_SCHEDULE)
                .homeFieldAdvantage(LEAGUE_HOME_FIELD_ADVANTAGE)
                .earlySeasonPerformance(netEpa * 0.9)
                .lateSeasonPerformance(netEpa * 1.1)
                .improvementTrajectory(netEpa * 0.1)
                .build();

        log.info("🏈 Bilan {} {} : EPA off {} / EPA concédé {} ({} + {} plays)",
                teamAbbr, season, String.format("%.3f", offensiveEpa), String.format("%.3f", defenseEpa),
                offensePlays.size(), defensePlays.size());
        return Optional.of(insight);
    }

    private List<RatedPlay> rate(List<Play> plays) {
        return plays.stream()
                .map(p -> new RatedPlay(p, playMetricsService.calculatePlayMetrics(PlayInput.fromPlay(p))))
                .toList();
    }

    // TD dans les 20 yards / plays dans les 20 yards
    private double redZoneTouchdownRate(List<RatedPlay> plays) {
        long redZonePlays = plays.stream().filter(r -> r.play().isInRedZone()).count();
        if (redZonePlays == 0) return 0.0;
        long touchdowns = plays.stream().filter(r -> r.play().isInRedZone() && r.play().isTouchdownPlay()).count();
        return (double) touchdowns / redZonePlays;
    }

    private double thirdDownConversionRate(List<RatedPlay> plays) {
        long attempts = plays.stream().filter(r -> r.play().isThirdDown()).count();
        if (attempts == 0) return 0.0;
        long conversions = plays.stream().filter(r -> r.play().isThirdDown() && r.play().isConverted()).count();
        return (double) conversions / attempts;
    }

    private double mean(List<RatedPlay> plays, Predicate<RatedPlay> filter, ToDoubleFunction<RatedPlay> value) {
        return plays.stream().filter(filter).mapToDouble(value).average().orElse(0.0);
    }

    private record RatedPlay(Play play, PlayMetrics metrics) {
        boolean isPass() {
            return "pass".equals(play.getPlayType());
        }

        boolean isRun() {
            return "run".equals(play.getPlayType());
        }

        // Deux dernières minutes de chaque mi-temps
        boolean isTwoMinuteDrill() {
            Integer s = play.getGameSecondsRemaining();
            if (s == null) return false;
            return s <= 120 || (s > 1800 && s <= 1920);
        }
    }
}
