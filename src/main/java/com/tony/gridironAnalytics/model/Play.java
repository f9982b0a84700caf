package com.tony.gridironAnalytics.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

@Entity
@Table(name = "plays", indexes = {
        @Index(columnList = "game_id"),
        @Index(columnList = "season, posteam"),
        @Index(columnList = "season, defteam")
})
@Data
@NoArgsConstructor
public class Play {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "play_id", length = 30)
    private String playId;

    @Column(name = "game_id", nullable = false, length = 20)
    private String gameId;

    @Column(nullable = false)
    private Integer season;
    private Integer week;

    @Column(length = 3)
    private String posteam; // Équipe en possession
    @Column(length = 3)
    private String defteam; // Équipe en défense

    // --- SITUATION AVANT L'ACTION ---
    private Integer qtr;                 // 1-4, 5 = prolongation
    private Integer gameSecondsRemaining;
    @Column(name = "yardline_100")
    private Integer yardline100;         // Distance à la ligne d'en-but adverse
    private Integer ydstogo;
    private Integer down;
    private Integer scoreDifferential;   // Point de vue de l'attaque
    private Integer timeoutsRemaining;

    // --- RÉSULTAT ---
    private String playType;             // pass, run, punt, field_goal...
    private Integer yardsGained;
    private Boolean touchdown = false;
    private Boolean interception = false;
    private Boolean fumbleLost = false;

    @Column(columnDefinition = "TEXT")
    private String description;

    public boolean isTouchdownPlay() {
        return Boolean.TRUE.equals(touchdown);
    }

    public boolean isGiveaway() {
        return Boolean.TRUE.equals(interception) || Boolean.TRUE.equals(fumbleLost);
    }

    public boolean isInRedZone() {
        return yardline100 != null && yardline100 <= 20;
    }

    public boolean isThirdDown() {
        return down != null && down == 3;
    }

    public boolean isConverted() {
        int gained = yardsGained != null ? yardsGained : 0;
        int toGo = ydstogo != null ? ydstogo : 10;
        return gained >= toGo;
    }
}
