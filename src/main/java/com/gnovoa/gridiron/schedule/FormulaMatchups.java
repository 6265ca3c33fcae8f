package com.gnovoa.gridiron.schedule;

import com.gnovoa.gridiron.model.Conference;
import com.gnovoa.gridiron.model.Division;
import com.gnovoa.gridiron.model.Team;
import com.gnovoa.gridiron.schedule.RoundRobinScheduler.Pairing;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Opponent formula for a 2 x 4 x 4 league.
 *
 * <p>Per team: 6 division games (home and away), 4 against a rotating division of the same
 * conference, 4 against a rotating division of the other conference, 2 against same-place
 * finishers of the remaining two same-conference divisions, and a 17th game against the same-place
 * finisher of the other-conference division met two years earlier.
 */
final class FormulaMatchups {

    static final int DIVISIONAL_ROUNDS = 6;

    /** [division][year % 3] = same-conference division to play in full. */
    private static final int[][] INTRA_ROTATION = {
            {2, 1, 3},
            {3, 0, 2},
            {0, 3, 1},
            {1, 2, 0}
    };

    /** [year % 4][AFC division] = NFC division to play in full. */
    private static final int[][] INTER_ROTATION = {
            {3, 2, 1, 0},
            {2, 1, 0, 3},
            {1, 0, 3, 2},
            {0, 3, 2, 1}
    };

    /** Division pairings of the six divisional rounds; the last three flip home and away. */
    private static final int[][][] DIVISION_ROUNDS = {
            {{0, 1}, {2, 3}},
            {{2, 0}, {1, 3}},
            {{0, 3}, {2, 1}}
    };

    /** Division games split by round, plus the eleven other games of every team. */
    record Matchups(List<List<Pairing>> divisionalRounds, List<Pairing> remainder) {}

    private final Team[][][] grid; // [conference][division][slot]
    private final DivisionFinishOrder finish;
    private final int year;

    private FormulaMatchups(Team[][][] grid, DivisionFinishOrder finish, int year) {
        this.grid = grid;
        this.finish = finish;
        this.year = year;
    }

    /** True when every division holds exactly four teams with distinct known finishing places. */
    static boolean supports(List<Team> teams, DivisionFinishOrder finish) {
        return layout(teams, finish) != null;
    }

    /**
     * @throws IllegalArgumentException if the league does not fit the formula
     */
    static Matchups build(List<Team> teams, DivisionFinishOrder finish, int year) {
        Team[][][] grid = layout(teams, finish);
        if (grid == null) throw new IllegalArgumentException("League does not have 2 conferences of 4 four-team divisions");
        return new FormulaMatchups(grid, finish, year).build();
    }

    private static Team[][][] layout(List<Team> teams, DivisionFinishOrder finish) {
        if (teams.size() != 32 || finish == null) return null;
        Team[][][] grid = new Team[2][4][];
        for (Conference c : Conference.values()) {
            for (Division d : Division.values()) {
                List<Team> members = teams.stream()
                        .filter(t -> t.conference() == c && t.division() == d)
                        .sorted(Comparator.comparing(Team::teamId))
                        .toList();
                if (members.size() != 4) return null;
                Set<Integer> places = new HashSet<>();
                for (Team t : members) {
                    Integer place = finish.finishOf(t.teamId());
                    if (place == null || place < 0 || place > 3 || !places.add(place)) return null;
                }
                grid[c.ordinal()][d.ordinal()] = members.toArray(new Team[0]);
            }
        }
        return grid;
    }

    private Matchups build() {
        List<List<Pairing>> rounds = divisionalRounds();
        List<Pairing> rest = new ArrayList<>();
        for (int conf = 0; conf < 2; conf++) {
            intraConferenceRotation(conf, rest);
            sameFinishIntraConference(conf, rest);
        }
        interConferenceRotation(rest);
        seventeenthGame(rest);
        return new Matchups(rounds, rest);
    }

    private List<List<Pairing>> divisionalRounds() {
        List<List<Pairing>> rounds = new ArrayList<>();
        for (int half = 0; half < 2; half++) {
            for (int[][] round : DIVISION_ROUNDS) {
                List<Pairing> games = new ArrayList<>();
                for (Team[][] conference : grid) {
                    for (Team[] division : conference) {
                        for (int[] pair : round) {
                            Team home = division[pair[half]];
                            Team away = division[pair[1 - half]];
                            games.add(new Pairing(home.teamId(), away.teamId()));
                        }
                    }
                }
                rounds.add(games);
            }
        }
        return rounds;
    }

    private void intraConferenceRotation(int conf, List<Pairing> out) {
        int column = Math.floorMod(year, 3);
        for (int d = 0; d < 4; d++) {
            int partner = INTRA_ROTATION[d][column];
            if (partner < d) continue;
            fullDivisionSeries(grid[conf][d], grid[conf][partner], out);
        }
    }

    private void interConferenceRotation(List<Pairing> out) {
        int[] row = INTER_ROTATION[Math.floorMod(year, 4)];
        for (int d = 0; d < 4; d++) {
            fullDivisionSeries(grid[0][d], grid[1][row[d]], out);
        }
    }

    /** Four games per team, checkerboard home and away, flipped every other year. */
    private void fullDivisionSeries(Team[] first, Team[] second, List<Pairing> out) {
        int parity = Math.floorMod(year, 2);
        for (int i = 0; i < 4; i++) {
            for (int j = 0; j < 4; j++) {
                boolean firstHome = (i + j + parity) % 2 == 0;
                out.add(firstHome
                        ? new Pairing(first[i].teamId(), second[j].teamId())
                        : new Pairing(second[j].teamId(), first[i].teamId()));
            }
        }
    }

    /**
     * The four non-rotation division pairs of a conference form the cycle a - c - b - e - a where
     * {a, b} and {c, e} are this year's rotation pairs. Walking the cycle in one direction gives every
     * team one home and one away game.
     */
    private void sameFinishIntraConference(int conf, List<Pairing> out) {
        int column = Math.floorMod(year, 3);
        int a = 0;
        int b = INTRA_ROTATION[0][column];
        int[] others = Arrays.stream(new int[] {0, 1, 2, 3}).filter(d -> d != a && d != b).toArray();
        int c = others[0];
        int e = others[1];
        int[][] cycle = {{a, c}, {c, b}, {b, e}, {e, a}};

        for (int[] edge : cycle) {
            for (int place = 0; place < 4; place++) {
                Team from = byFinish(grid[conf][edge[0]], place);
                Team to = byFinish(grid[conf][edge[1]], place);
                boolean fromHome = (year + place) % 2 == 0;
                out.add(fromHome
                        ? new Pairing(from.teamId(), to.teamId())
                        : new Pairing(to.teamId(), from.teamId()));
            }
        }
    }

    private void seventeenthGame(List<Pairing> out) {
        int[] row = INTER_ROTATION[Math.floorMod(year - 2, 4)];
        boolean afcHosts = Math.floorMod(year, 2) == 1;
        for (int d = 0; d < 4; d++) {
            for (int place = 0; place < 4; place++) {
                Team afc = byFinish(grid[0][d], place);
                Team nfc = byFinish(grid[1][row[d]], place);
                out.add(afcHosts
                        ? new Pairing(afc.teamId(), nfc.teamId())
                        : new Pairing(nfc.teamId(), afc.teamId()));
            }
        }
    }

    private Team byFinish(Team[] division, int place) {
        for (Team t : division) {
            if (finish.finishOf(t.teamId()) == place) return t;
        }
        throw new IllegalStateException("No team finished " + place + " in division of " + division[0].teamId());
    }
}
