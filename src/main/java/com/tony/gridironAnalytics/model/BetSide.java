package com.tony.gridironAnalytics.model;

public enum BetSide {
    HOME,
    AWAY,
    OVER,
    UNDER
}
