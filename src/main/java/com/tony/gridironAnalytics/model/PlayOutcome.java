package com.tony.gridironAnalytics.model;

/**
 * Issue d'une action. Chaque branche porte sa propre convention de signe
 * lors d'un changement de possession.
 */
public enum PlayOutcome {
    TOUCHDOWN,
    TURNOVER,           // Interception ou fumble perdu
    TURNOVER_ON_DOWNS,  // 4e tentative ratée
    NORMAL_GAIN
}
