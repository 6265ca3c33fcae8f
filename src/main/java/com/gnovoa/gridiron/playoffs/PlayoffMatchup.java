package com.gnovoa.gridiron.playoffs;

import com.gnovoa.gridiron.model.Conference;

/** One postseason game. {@code conference} is null for the Super Bowl. */
public record PlayoffMatchup(
        String matchupId,
        PlayoffRound round,
        Conference conference,
        int homeSeed,
        int awaySeed,
        String homeTeamId,
        String awayTeamId,
        Integer homeScore,
        Integer awayScore,
        String winnerId
) {
    public static PlayoffMatchup scheduled(String id, PlayoffRound round, Conference conference,
                                           int homeSeed, int awaySeed, String homeTeamId, String awayTeamId) {
        return new PlayoffMatchup(id, round, conference, homeSeed, awaySeed, homeTeamId, awayTeamId, null, null, null);
    }

    public boolean isComplete() { return winnerId != null; }

    public String loserId() {
        if (winnerId == null) return null;
        return winnerId.equals(homeTeamId) ? awayTeamId : homeTeamId;
    }

    public int winnerSeed() {
        return homeTeamId.equals(winnerId) ? homeSeed : awaySeed;
    }

    /**
     * @throws IllegalArgumentException for a tied or negative score; playoff games always have a winner
     */
    public PlayoffMatchup withResult(int home, int away) {
        if (home < 0 || away < 0) throw new IllegalArgumentException("Negative score in " + matchupId);
        if (home == away) throw new IllegalArgumentException("Playoff game " + matchupId + " cannot end tied");
        return new PlayoffMatchup(matchupId, round, conference, homeSeed, awaySeed, homeTeamId, awayTeamId,
                home, away, home > away ? homeTeamId : awayTeamId);
    }
}
