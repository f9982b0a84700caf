package com.tony.gridironAnalytics.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Attributs bruts d'une action, tels que fournis par la base.
 * Tous les champs sont optionnels : le moteur applique des valeurs par défaut.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlayInput {
    private Integer down;
    private Integer ydstogo;
    private Integer yardline100;
    private Integer qtr;
    private Integer gameSecondsRemaining;
    private Integer scoreDifferential;
    private Integer timeoutsRemaining;
    private String playType;
    private Integer yardsGained;
    private Boolean touchdown;
    private Boolean interception;
    private Boolean fumbleLost;

    /**
     * Conversion d'une ligne play-by-play. Si l'horloge manque, on l'approxime
     * à partir du quart-temps (début de quart).
     */
    public static PlayInput fromPlay(Play play) {
        Integer clock = play.getGameSecondsRemaining();
        if (clock == null) {
            int qtr = play.getQtr() != null ? play.getQtr() : 1;
            clock = 3600 - ((qtr - 1) * 900);
        }
        return PlayInput.builder()
                .down(play.getDown())
                .ydstogo(play.getYdstogo())
                .yardline100(play.getYardline100())
                .qtr(play.getQtr())
                .gameSecondsRemaining(clock)
                .scoreDifferential(play.getScoreDifferential())
                .timeoutsRemaining(play.getTimeoutsRemaining())
                .playType(play.getPlayType())
                .yardsGained(play.getYardsGained())
                .touchdown(play.getTouchdown())
                .interception(play.getInterception())
                .fumbleLost(play.getFumbleLost())
                .build();
    }
}
