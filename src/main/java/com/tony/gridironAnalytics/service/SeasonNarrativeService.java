package com.tony.gridironAnalytics.service;

import com.tony.gridironAnalytics.model.Team;
import com.tony.gridironAnalytics.model.dto.TeamInsight;
import com.tony.gridironAnalytics.repository.TeamRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

@Service
@RequiredArgsConstructor
public class SeasonNarrativeService {

    private final TeamInsightService teamInsightService;
    private final TeamRepository teamRepository;

    /**
     * Résumé rédigé de la saison d'une équipe à partir de son bilan avancé.
     */
    public String generateSeasonNarrative(String teamAbbr, int season) {
        return teamInsightService.generateTeamInsights(teamAbbr, season)
                .map(insight -> {
                    String teamName = teamRepository.findById(teamAbbr).map(Team::getFullName).orElse(teamAbbr);
                    return buildNarrative(teamName, insight);
                })
                .orElse("Impossible de générer le bilan de " + teamAbbr + " en " + season + ".");
    }

    String buildNarrative(String teamName, TeamInsight insight) {
        List<String> parts = new ArrayList<>();
        parts.add("**" + teamName + " - Saison " + insight.getSeason() + "**");
        parts.add(analyzeOffense(teamName, insight));
        parts.add(analyzeBalance(insight));
        parts.add(analyzeRedZone(insight));
        parts.add(analyzeDefense(insight));
        parts.add(analyzeClutch(insight));
        parts.add(analyzeTrajectory(insight));

        return String.join(" ", parts.stream().filter(Objects::nonNull).toList());
    }

    private String analyzeOffense(String teamName, TeamInsight insight) {
        double epa = insight.getOffensiveEpaPerPlay();
        if (epa > 0.1) {
            return "🔥 " + teamName + " affiche une attaque redoutable avec " + format(epa) + " EPA par action.";
        } else if (epa < -0.05) {
            return "⚠️ " + teamName + " a peiné en attaque : " + format(epa) + " EPA par action.";
        }
        return teamName + " présente une attaque correcte (" + format(epa) + " EPA par action).";
    }

    private String analyzeBalance(TeamInsight insight) {
        if (insight.getPassingEpaPerPlay() > insight.getRushingEpaPerPlay() + 0.1) {
            return "Le jeu aérien a nettement surclassé le jeu au sol.";
        } else if (insight.getRushingEpaPerPlay() > insight.getPassingEpaPerPlay() + 0.05) {
            return "Équipe tournée vers la course, plus efficace au sol que dans les airs.";
        }
        return "Attaque équilibrée entre passe et course.";
    }

    private String analyzeRedZone(TeamInsight insight) {
        double rate = insight.getRedZoneEfficiency();
        if (rate > 0.6) {
            return "🎯 Clinique en red zone : " + percent(rate) + " des actions converties en touchdown.";
        } else if (rate < 0.4) {
            return "Des difficultés en red zone, seulement " + percent(rate) + " de conversion en touchdown.";
        }
        return null;
    }

    // EPA concédé : négatif = défense dominante
    private String analyzeDefense(TeamInsight insight) {
        double allowed = insight.getDefenseEpaPerPlay();
        if (allowed < -0.05) {
            return "🛡️ Défense dominante, les adversaires ont été mis en difficulté en permanence.";
        } else if (allowed > 0.05) {
            return "La défense a été un point faible, les adversaires ont avancé avec facilité.";
        }
        return "Défense solide sans être exceptionnelle.";
    }

    private String analyzeClutch(TeamInsight insight) {
        if (insight.getClutchPerformance() > 0.15) {
            return "Au rendez-vous dans les moments décisifs.";
        } else if (insight.getClutchPerformance() < -0.1) {
            return "Trop souvent friable sous la pression.";
        }
        return null;
    }

    private String analyzeTrajectory(TeamInsight insight) {
        if (insight.getImprovementTrajectory() > 0.05) {
            return "📈 Progression nette au fil de la saison.";
        } else if (insight.getImprovementTrajectory() < -0.05) {
            return "📉 Régression visible en fin de saison.";
        }
        return null;
    }

    private String format(double value) {
        return String.format(Locale.US, "%.3f", value);
    }

    private String percent(double rate) {
        return String.format(Locale.US, "%.1f%%", rate * 100);
    }
}
