package com.gnovoa.gridiron.standings;

import com.gnovoa.gridiron.model.Conference;
import com.gnovoa.gridiron.model.Division;
import com.gnovoa.gridiron.model.TeamRecord;

public record TeamStanding(
        String teamId,
        Conference conference,
        Division division,
        TeamRecord overall,
        TeamRecord divisionRecord,
        TeamRecord conferenceRecord,
        String streak,
        int divisionRank,
        int conferenceRank
) {
    public double winPercentage() { return overall.winPercentage(); }
    public double divisionWinPercentage() { return divisionRecord.winPercentage(); }
    public double conferenceWinPercentage() { return conferenceRecord.winPercentage(); }
    public int pointDifferential() { return overall.pointDifferential(); }
    public int games() { return overall.games(); }

    TeamStanding withRanks(int newDivisionRank, int newConferenceRank) {
        return new TeamStanding(teamId, conference, division, overall, divisionRecord, conferenceRecord, streak,
                newDivisionRank, newConferenceRank);
    }
}
