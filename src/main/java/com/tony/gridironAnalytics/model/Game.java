package com.tony.gridironAnalytics.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Entity
@Table(name = "games")
@Data
@NoArgsConstructor
public class Game {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "game_id", unique = true, nullable = false, length = 20)
    private String gameId; // Ex: "2024_01_BAL_KC"

    @Column(nullable = false)
    private Integer season;

    private String seasonType; // REG, POST, PRE
    private Integer week;

    @Column(nullable = false)
    private LocalDate gameDate;

    @Column(nullable = false, length = 3)
    private String homeTeam;

    @Column(nullable = false, length = 3)
    private String awayTeam;

    // Scores (null tant que le match n'est pas joué)
    private Integer homeScore;
    private Integer awayScore;

    // --- CONDITIONS ---
    private String roof;    // dome, outdoors, closed, open
    private String surface; // grass, fieldturf...
    private Integer temp;   // °F
    private Integer wind;   // mph

    // --- LIGNES DE CLÔTURE (consensus) ---
    private Double homeSpread;
    private Double totalLine;
    private Integer homeMoneyline;
    private Integer awayMoneyline;

    private Boolean gameFinished = false;

    public Game(String gameId, Integer season, LocalDate gameDate, String homeTeam, String awayTeam) {
        this.gameId = gameId;
        this.season = season;
        this.gameDate = gameDate;
        this.homeTeam = homeTeam;
        this.awayTeam = awayTeam;
    }

    public boolean isScored() {
        return homeScore != null && awayScore != null;
    }

    /**
     * Vainqueur réel, null si match non joué ou nul.
     */
    public String getWinner() {
        if (!isScored() || homeScore.equals(awayScore)) return null;
        return homeScore > awayScore ? homeTeam : awayTeam;
    }
}
