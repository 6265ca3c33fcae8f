package com.gnovoa.gridiron.playoffs;

import com.gnovoa.gridiron.model.Conference;
import com.gnovoa.gridiron.standings.LeagueStandings;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Seeds the bracket and drives its state machine.
 *
 * <p>{@link #advance(PlayoffBracket)} moves to the next round and creates its matchups. It refuses
 * to leave a round while any matchup in it has no winner.
 */
public final class PlayoffGenerator {

    public static final int SEEDS_PER_CONFERENCE = 7;

    public PlayoffBracket seed(LeagueStandings standings) {
        Map<Conference, List<String>> seeds = new EnumMap<>(Conference.class);
        for (Conference c : Conference.values()) {
            List<String> confSeeds = standings.playoffSeeds(c);
            if (confSeeds.size() != SEEDS_PER_CONFERENCE) {
                throw new IllegalArgumentException(c + " has " + confSeeds.size() + " playoff teams, expected " + SEEDS_PER_CONFERENCE);
            }
            seeds.put(c, confSeeds);
        }
        return new PlayoffBracket(standings.year(), PlayoffRound.SEEDED, seeds, List.of());
    }

    /**
     * @throws IllegalStateException if the current round is unfinished or the bracket is complete
     */
    public PlayoffBracket advance(PlayoffBracket bracket) {
        if (bracket.isComplete()) throw new IllegalStateException("Playoffs " + bracket.year() + " are already complete");
        if (!bracket.currentRoundComplete()) {
            throw new IllegalStateException("Round " + bracket.round() + " of " + bracket.year() + " has unfinished games");
        }

        PlayoffRound next = bracket.round().next();
        List<PlayoffMatchup> created = new ArrayList<>();
        if (next == PlayoffRound.WILD_CARD) {
            for (Conference c : Conference.values()) created.addAll(wildCard(bracket, c));
        } else if (next == PlayoffRound.DIVISIONAL) {
            for (Conference c : Conference.values()) created.addAll(divisional(bracket, c));
        } else if (next == PlayoffRound.CONFERENCE_CHAMPIONSHIP) {
            for (Conference c : Conference.values()) created.add(conferenceChampionship(bracket, c));
        } else if (next == PlayoffRound.SUPER_BOWL) {
            created.add(superBowl(bracket));
        }
        return bracket.withRound(next, created);
    }

    /**
     * @throws IllegalArgumentException for an unknown matchup or a tied score
     * @throws IllegalStateException if the matchup is not in the current round
     */
    public PlayoffBracket recordResult(PlayoffBracket bracket, String matchupId, int homeScore, int awayScore) {
        PlayoffMatchup m = bracket.matchups().stream()
                .filter(x -> x.matchupId().equals(matchupId))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown matchup " + matchupId));
        if (m.round() != bracket.round()) {
            throw new IllegalStateException("Matchup " + matchupId + " belongs to " + m.round() + ", bracket is in " + bracket.round());
        }
        return bracket.withMatchup(m.withResult(homeScore, awayScore));
    }

    /**
     * Reseeding rule: the surviving seeds are sorted, and the best remaining seed plays the worst,
     * the second best plays the second worst. The better seed hosts.
     *
     * @param survivingSeeds an even number of seeds
     * @return pairs of {home seed, away seed}
     */
    static List<int[]> reseed(List<Integer> survivingSeeds) {
        List<Integer> sorted = new ArrayList<>(survivingSeeds);
        sorted.sort(Comparator.naturalOrder());
        List<int[]> pairs = new ArrayList<>();
        for (int i = 0, j = sorted.size() - 1; i < j; i++, j--) {
            pairs.add(new int[] {sorted.get(i), sorted.get(j)});
        }
        return pairs;
    }

    private List<PlayoffMatchup> wildCard(PlayoffBracket bracket, Conference c) {
        List<PlayoffMatchup> out = new ArrayList<>();
        int[][] pairs = {{2, 7}, {3, 6}, {4, 5}};
        for (int[] p : pairs) out.add(matchup(bracket, PlayoffRound.WILD_CARD, c, p[0], p[1]));
        return out;
    }

    private List<PlayoffMatchup> divisional(PlayoffBracket bracket, Conference c) {
        List<Integer> surviving = new ArrayList<>();
        surviving.add(1);
        for (PlayoffMatchup m : bracket.matchupsIn(PlayoffRound.WILD_CARD)) {
            if (m.conference() == c) surviving.add(m.winnerSeed());
        }
        List<PlayoffMatchup> out = new ArrayList<>();
        for (int[] p : reseed(surviving)) out.add(matchup(bracket, PlayoffRound.DIVISIONAL, c, p[0], p[1]));
        return out;
    }

    private PlayoffMatchup conferenceChampionship(PlayoffBracket bracket, Conference c) {
        List<Integer> surviving = new ArrayList<>();
        for (PlayoffMatchup m : bracket.matchupsIn(PlayoffRound.DIVISIONAL)) {
            if (m.conference() == c) surviving.add(m.winnerSeed());
        }
        int[] pair = reseed(surviving).get(0);
        return matchup(bracket, PlayoffRound.CONFERENCE_CHAMPIONSHIP, c, pair[0], pair[1]);
    }

    /** Home designation alternates by year: AFC in odd years, NFC in even years. */
    private PlayoffMatchup superBowl(PlayoffBracket bracket) {
        Map<Conference, PlayoffMatchup> champs = new EnumMap<>(Conference.class);
        for (PlayoffMatchup m : bracket.matchupsIn(PlayoffRound.CONFERENCE_CHAMPIONSHIP)) champs.put(m.conference(), m);

        Conference host = Math.floorMod(bracket.year(), 2) == 1 ? Conference.AFC : Conference.NFC;
        PlayoffMatchup home = champs.get(host);
        PlayoffMatchup away = champs.get(host.other());
        return PlayoffMatchup.scheduled(bracket.year() + "-SB", PlayoffRound.SUPER_BOWL, null,
                home.winnerSeed(), away.winnerSeed(), home.winnerId(), away.winnerId());
    }

    private PlayoffMatchup matchup(PlayoffBracket bracket, PlayoffRound round, Conference c, int homeSeed, int awaySeed) {
        List<String> seeds = bracket.seeds().get(c);
        String id = bracket.year() + "-" + round.name() + "-" + c + "-" + homeSeed + "v" + awaySeed;
        return PlayoffMatchup.scheduled(id, round, c, homeSeed, awaySeed, seeds.get(homeSeed - 1), seeds.get(awaySeed - 1));
    }
}
