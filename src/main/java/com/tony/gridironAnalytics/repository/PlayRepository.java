package com.tony.gridironAnalytics.repository;

import com.tony.gridironAnalytics.model.Play;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface PlayRepository extends JpaRepository<Play, Long> {

    // Plays offensifs d'une équipe sur la saison
    List<Play> findBySeasonAndPosteamOrderByIdAsc(Integer season, String posteam);

    // Plays subis par la défense d'une équipe sur la saison
    List<Play> findBySeasonAndDefteamOrderByIdAsc(Integer season, String defteam);

    // Déroulé complet d'un match, dans l'ordre chronologique
    List<Play> findByGameIdOrderByIdAsc(String gameId);
}
