package com.tony.gridironAnalytics.model;

public enum BetType {
    MONEYLINE,
    SPREAD,
    TOTAL
}
