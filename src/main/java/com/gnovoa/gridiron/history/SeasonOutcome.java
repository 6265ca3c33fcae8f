package com.gnovoa.gridiron.history;

import com.gnovoa.gridiron.draft.DraftOrder;
import com.gnovoa.gridiron.model.LeagueState;
import com.gnovoa.gridiron.playoffs.PlayoffBracket;
import com.gnovoa.gridiron.standings.LeagueStandings;

/**
 * One played season. {@code state} carries the completed schedule, the season's records in each
 * team's current record and the playoff seeds; records are not yet folded into the all-time
 * record.
 */
public record SeasonOutcome(LeagueState state, LeagueStandings standings, PlayoffBracket bracket, DraftOrder draftOrder) {

    public String championId() { return bracket.championId(); }

    public String runnerUpId() { return bracket.runnerUpId(); }
}
