package com.tony.gridironAnalytics.model;

/**
 * Photographie d'une situation de jeu, du point de vue de l'attaque.
 * Les champs bornés sont ramenés dans leurs limites à la construction (jamais après).
 * Un champ null signifie "inconnu" : chaque estimateur applique ses propres valeurs par défaut.
 */
public record Situation(Integer down,
                        Integer yardsToGo,
                        Integer yardline100,
                        Integer quarter,
                        Integer gameSecondsRemaining,
                        Integer scoreDifferential,
                        Integer timeoutsRemaining,
                        String playType) {

    public Situation {
        if (down != null) down = Math.max(1, Math.min(4, down));
        if (yardsToGo != null) yardsToGo = Math.max(0, yardsToGo);
        if (yardline100 != null) yardline100 = Math.max(0, Math.min(100, yardline100));
    }
}
