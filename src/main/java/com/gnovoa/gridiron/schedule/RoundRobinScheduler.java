package com.gnovoa.gridiron.schedule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Circle-method round robin over an even number of team ids.
 *
 * <p>Used by the randomized fallback: the first 17 rounds of a shuffled 32-team round robin give
 * every team 17 distinct opponents, which are then spread over 18 weeks.
 */
public final class RoundRobinScheduler {

    /** A game pairing inside one round. */
    public record Pairing(String homeTeamId, String awayTeamId) {}

    /** One round: every team appears in exactly one pairing. */
    public record Round(int roundIndex, List<Pairing> pairings) {}

    /**
     * Generates a single round robin using the circle method.
     *
     * <p>The first team stays fixed while the others rotate; home and away flip on odd rounds so
     * nobody is at home every week.
     *
     * @param teamIds an even number (at least 2) of distinct team ids
     * @return {@code teamIds.size() - 1} rounds of {@code teamIds.size() / 2} pairings
     * @throws IllegalArgumentException if the team count is odd or below 2
     */
    public List<Round> singleRoundRobin(List<String> teamIds) {
        int n = teamIds.size();
        if (n < 2 || n % 2 != 0) throw new IllegalArgumentException("Expected an even number of teams, got " + n);

        List<String> list = new ArrayList<>(teamIds);
        String fixed = list.remove(0);
        int rotating = list.size();
        int perRound = n / 2;

        List<Round> rounds = new ArrayList<>(n - 1);

        for (int round = 0; round < n - 1; round++) {
            List<String> left = new ArrayList<>();
            List<String> right = new ArrayList<>();

            left.add(fixed);
            left.addAll(list.subList(0, rotating / 2));

            right.addAll(list.subList(rotating / 2, rotating));
            Collections.reverse(right);

            List<Pairing> pairings = new ArrayList<>(perRound);
            for (int i = 0; i < perRound; i++) {
                String a = left.get(i);
                String b = right.get(i);
                boolean flip = (round % 2 == 1);
                pairings.add(flip ? new Pairing(b, a) : new Pairing(a, b));
            }

            rounds.add(new Round(round + 1, pairings));

            String last = list.remove(list.size() - 1);
            list.add(0, last);
        }

        return rounds;
    }

    /**
     * First {@code count} rounds of a single round robin.
     *
     * @throws IllegalArgumentException if fewer than {@code count} rounds exist
     */
    public List<Round> partialRoundRobin(List<String> teamIds, int count) {
        List<Round> all = singleRoundRobin(teamIds);
        if (count > all.size()) {
            throw new IllegalArgumentException("Need " + count + " rounds but " + teamIds.size() + " teams only give " + all.size());
        }
        return List.copyOf(all.subList(0, count));
    }
}
