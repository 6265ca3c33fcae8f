package com.gnovoa.gridiron.sim;

public record GameResult(
        String homeTeamId,
        String awayTeamId,
        int homeScore,
        int awayScore,
        boolean overtime,
        BoxScore boxScore
) {
    public boolean isTie() { return homeScore == awayScore; }

    /** Null for a tie. */
    public String winnerId() {
        if (isTie()) return null;
        return homeScore > awayScore ? homeTeamId : awayTeamId;
    }

    /** Null for a tie. */
    public String loserId() {
        if (isTie()) return null;
        return homeScore > awayScore ? awayTeamId : homeTeamId;
    }
}
