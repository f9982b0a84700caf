package com.tony.gridironAnalytics.repository;

import com.tony.gridironAnalytics.model.Game;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface GameRepository extends JpaRepository<Game, Long> {

    Optional<Game> findByGameId(String gameId);

    // Matchs à venir (score NULL) sur une fenêtre de dates
    @Query("SELECT g FROM Game g WHERE g.season = :season AND g.homeScore IS NULL " +
            "AND g.gameDate >= :from AND g.gameDate <= :to ORDER BY g.gameDate ASC")
    List<Game> findUpcomingGames(@Param("season") Integer season,
                                 @Param("from") LocalDate from,
                                 @Param("to") LocalDate to);

    // Matchs terminés sur une fenêtre de dates (backtest)
    @Query("SELECT g FROM Game g WHERE g.season = :season AND g.homeScore IS NOT NULL AND g.awayScore IS NOT NULL " +
            "AND g.gameDate >= :from AND g.gameDate <= :to ORDER BY g.gameDate ASC")
    List<Game> findFinishedGames(@Param("season") Integer season,
                                 @Param("from") LocalDate from,
                                 @Param("to") LocalDate to);
}
