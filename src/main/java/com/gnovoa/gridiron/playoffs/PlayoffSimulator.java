package com.gnovoa.gridiron.playoffs;

import com.gnovoa.gridiron.sim.GameResult;
import com.gnovoa.gridiron.sim.QuickGameSimulator;
import com.gnovoa.gridiron.sim.TeamStrength;

import java.util.Map;

/** Plays a seeded bracket to completion with the playoff game model. */
public final class PlayoffSimulator {

    private final PlayoffGenerator generator;
    private final QuickGameSimulator games;

    public PlayoffSimulator(PlayoffGenerator generator, QuickGameSimulator games) {
        this.generator = generator;
        this.games = games;
    }

    public PlayoffBracket playOut(PlayoffBracket seeded, Map<String, TeamStrength> strengths) {
        PlayoffBracket bracket = seeded;
        while (!bracket.isComplete()) {
            bracket = generator.advance(bracket);
            for (PlayoffMatchup m : bracket.currentMatchups()) {
                GameResult r = games.simulatePlayoff(strengths.get(m.homeTeamId()), strengths.get(m.awayTeamId()));
                bracket = generator.recordResult(bracket, m.matchupId(), r.homeScore(), r.awayScore());
            }
        }
        return bracket;
    }
}
