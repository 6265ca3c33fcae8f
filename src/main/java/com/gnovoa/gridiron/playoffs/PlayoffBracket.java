package com.gnovoa.gridiron.playoffs;

import com.gnovoa.gridiron.model.Conference;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable bracket snapshot. Holds the seeds and every matchup created so far; the current round's
 * matchups are the ones tagged with {@link #round()}.
 */
public record PlayoffBracket(
        int year,
        PlayoffRound round,
        Map<Conference, List<String>> seeds,
        List<PlayoffMatchup> matchups
) {
    public PlayoffBracket {
        Map<Conference, List<String>> copy = new EnumMap<>(Conference.class);
        seeds.forEach((c, ids) -> copy.put(c, List.copyOf(ids)));
        seeds = Collections.unmodifiableMap(copy);
        matchups = List.copyOf(matchups);
    }

    public List<PlayoffMatchup> matchupsIn(PlayoffRound r) {
        return matchups.stream().filter(m -> m.round() == r).toList();
    }

    public List<PlayoffMatchup> currentMatchups() {
        return matchupsIn(round);
    }

    public boolean currentRoundComplete() {
        return currentMatchups().stream().allMatch(PlayoffMatchup::isComplete);
    }

    public boolean isComplete() {
        return round == PlayoffRound.COMPLETE;
    }

    /** 1-based seed inside the team's conference, or 0 if the team did not qualify. */
    public int seedOf(String teamId) {
        for (List<String> ids : seeds.values()) {
            int i = ids.indexOf(teamId);
            if (i >= 0) return i + 1;
        }
        return 0;
    }

    public List<String> participants() {
        List<String> all = new ArrayList<>();
        for (Conference c : Conference.values()) all.addAll(seeds.getOrDefault(c, List.of()));
        return all;
    }

    /** Round in which the team lost, or null if it did not lose (champion, non-qualifier, still alive). */
    public PlayoffRound eliminatedIn(String teamId) {
        for (PlayoffMatchup m : matchups) {
            if (teamId.equals(m.loserId())) return m.round();
        }
        return null;
    }

    public String championId() {
        return superBowl() == null ? null : superBowl().winnerId();
    }

    public String runnerUpId() {
        return superBowl() == null ? null : superBowl().loserId();
    }

    /**
     * @throws IllegalStateException if the bracket is not complete
     */
    public PlayoffOutcome outcome() {
        if (!isComplete()) throw new IllegalStateException("Playoffs " + year + " are still in " + round);
        return new PlayoffOutcome(championId(), runnerUpId(), participants());
    }

    PlayoffBracket withRound(PlayoffRound newRound, List<PlayoffMatchup> added) {
        List<PlayoffMatchup> all = new ArrayList<>(matchups);
        all.addAll(added);
        return new PlayoffBracket(year, newRound, seeds, all);
    }

    PlayoffBracket withMatchup(PlayoffMatchup updated) {
        List<PlayoffMatchup> all = new ArrayList<>(matchups.size());
        for (PlayoffMatchup m : matchups) all.add(m.matchupId().equals(updated.matchupId()) ? updated : m);
        return new PlayoffBracket(year, round, seeds, all);
    }

    private PlayoffMatchup superBowl() {
        List<PlayoffMatchup> sb = matchupsIn(PlayoffRound.SUPER_BOWL);
        return sb.isEmpty() ? null : sb.get(0);
    }
}
