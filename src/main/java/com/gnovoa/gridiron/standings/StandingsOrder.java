package com.gnovoa.gridiron.standings;

import java.util.Comparator;

/**
 * Tiebreak chain: win%, division win%, conference win%, point differential. Team id is the last
 * key, so the order is total and fully equal teams still sort the same way every time.
 */
public final class StandingsOrder {

    public static final Comparator<TeamStanding> BEST_FIRST = Comparator
            .comparingDouble(TeamStanding::winPercentage).reversed()
            .thenComparing(Comparator.comparingDouble(TeamStanding::divisionWinPercentage).reversed())
            .thenComparing(Comparator.comparingDouble(TeamStanding::conferenceWinPercentage).reversed())
            .thenComparing(Comparator.comparingInt(TeamStanding::pointDifferential).reversed())
            .thenComparing(TeamStanding::teamId);

    private StandingsOrder() {}

    /** True when two teams are equal on every football tiebreak (only the id separates them). */
    public static boolean fullyTied(TeamStanding a, TeamStanding b) {
        return a.winPercentage() == b.winPercentage()
                && a.divisionWinPercentage() == b.divisionWinPercentage()
                && a.conferenceWinPercentage() == b.conferenceWinPercentage()
                && a.pointDifferential() == b.pointDifferential();
    }
}
