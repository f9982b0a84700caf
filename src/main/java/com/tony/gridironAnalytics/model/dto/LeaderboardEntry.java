package com.tony.gridironAnalytics.model.dto;

public record LeaderboardEntry(int rank, String teamAbbr, String teamName, String metric, double value) {}
