package com.gnovoa.gridiron.schedule;

import com.gnovoa.gridiron.model.ScheduleStrategy;
import com.gnovoa.gridiron.model.ScheduledGame;
import com.gnovoa.gridiron.model.SeasonSchedule;
import com.gnovoa.gridiron.model.Team;
import com.gnovoa.gridiron.schedule.RoundRobinScheduler.Pairing;
import com.gnovoa.gridiron.schedule.RoundRobinScheduler.Round;
import com.gnovoa.gridiron.schedule.WeekColoring.Edge;
import com.gnovoa.gridiron.sim.RandomSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the 18-week regular season.
 *
 * <p>The formula path places the six division rounds in fixed weeks and colours the other eleven
 * games of every team into the twelve weeks in between, which puts every bye in weeks 3 to 14. When
 * the league or the previous standings do not fit the formula, or its result fails validation, a
 * randomized pairing is used instead. That path always succeeds for an even league of at least 18
 * teams.
 */
public final class ScheduleGenerator {

    private static final Logger log = LoggerFactory.getLogger(ScheduleGenerator.class);

    private static final int[] DIVISIONAL_WEEKS = {1, 2, 15, 16, 17, 18};
    private static final int FIRST_ROTATION_WEEK = 3;
    private static final int ROTATION_WEEKS = 12;

    private final RandomSource rnd;
    private final RoundRobinScheduler roundRobin;
    private final ScheduleValidator validator;
    private final int maxTeamsPerByeWeek;

    public ScheduleGenerator(RandomSource rnd, RoundRobinScheduler roundRobin, ScheduleValidator validator, int maxTeamsPerByeWeek) {
        this.rnd = rnd;
        this.roundRobin = roundRobin;
        this.validator = validator;
        this.maxTeamsPerByeWeek = maxTeamsPerByeWeek;
    }

    public SeasonSchedule generate(List<Team> teams, DivisionFinishOrder previous, int year) {
        List<String> ids = teams.stream().map(Team::teamId).toList();

        if (FormulaMatchups.supports(teams, previous)) {
            SeasonSchedule formula = formulaSchedule(teams, previous, year);
            List<String> problems = validator.validate(formula, ids);
            if (problems.isEmpty()) {
                checkByeSpread(formula, ROTATION_WEEKS);
                return formula;
            }
            log.warn("Formula schedule for {} failed validation ({}); using randomized pairing", year, problems.get(0));
        } else {
            log.warn("League layout or previous standings do not fit the schedule formula for {}; using randomized pairing", year);
        }
        return generateRandomized(teams, year);
    }

    /**
     * Randomized pairing: shuffled circle-method opponents spread over 18 weeks.
     *
     * @throws IllegalArgumentException if the team count is odd or below 18
     */
    public SeasonSchedule generateRandomized(List<Team> teams, int year) {
        List<String> ids = new ArrayList<>(teams.stream().map(Team::teamId).toList());
        if (ids.size() < SeasonSchedule.GAMES_PER_TEAM + 1) {
            throw new IllegalArgumentException("Need at least 18 teams for a 17-game season, got " + ids.size());
        }
        rnd.shuffle(ids);

        List<Pairing> pairings = new ArrayList<>();
        for (Round r : roundRobin.partialRoundRobin(ids, SeasonSchedule.GAMES_PER_TEAM)) pairings.addAll(r.pairings());

        List<Integer> weeks = new ArrayList<>();
        for (int w = 1; w <= SeasonSchedule.WEEKS; w++) weeks.add(w);

        Map<Pairing, Integer> placed = colourIntoWeeks(ids, pairings, weeks);
        SeasonSchedule schedule = assemble(year, ids, placed, ScheduleStrategy.RANDOMIZED_FALLBACK);

        List<String> problems = validator.validate(schedule, ids);
        if (!problems.isEmpty()) {
            throw new IllegalStateException("Randomized schedule for " + year + " is invalid: " + problems);
        }
        checkByeSpread(schedule, SeasonSchedule.WEEKS);
        return schedule;
    }

    private SeasonSchedule formulaSchedule(List<Team> teams, DivisionFinishOrder previous, int year) {
        List<String> ids = teams.stream().map(Team::teamId).toList();
        FormulaMatchups.Matchups m = FormulaMatchups.build(teams, previous, year);

        Map<Pairing, Integer> placed = new LinkedHashMap<>();
        List<List<Pairing>> rounds = m.divisionalRounds();
        for (int r = 0; r < rounds.size(); r++) {
            for (Pairing p : rounds.get(r)) placed.put(p, DIVISIONAL_WEEKS[r]);
        }

        List<Integer> weeks = new ArrayList<>();
        for (int w = FIRST_ROTATION_WEEK; w < FIRST_ROTATION_WEEK + ROTATION_WEEKS; w++) weeks.add(w);
        placed.putAll(colourIntoWeeks(ids, m.remainder(), weeks));

        return assemble(year, ids, placed, ScheduleStrategy.FORMULA);
    }

    /** Edge-colours the pairings with one colour per available week, then evens out byes. */
    private Map<Pairing, Integer> colourIntoWeeks(List<String> ids, List<Pairing> pairings, List<Integer> weeks) {
        Map<String, Integer> vertex = new HashMap<>();
        for (int i = 0; i < ids.size(); i++) vertex.put(ids.get(i), i);

        List<Edge> edges = new ArrayList<>(pairings.size());
        for (Pairing p : pairings) edges.add(new Edge(vertex.get(p.homeTeamId()), vertex.get(p.awayTeamId())));

        int[] colours = WeekColoring.color(ids.size(), edges, weeks.size(), rnd);
        colours = WeekColoring.balanceMissing(ids.size(), edges, colours, weeks.size(), maxTeamsPerByeWeek);

        List<Integer> shuffledWeeks = new ArrayList<>(weeks);
        rnd.shuffle(shuffledWeeks);

        Map<Pairing, Integer> placed = new LinkedHashMap<>();
        for (int i = 0; i < pairings.size(); i++) placed.put(pairings.get(i), shuffledWeeks.get(colours[i]));
        return placed;
    }

    private SeasonSchedule assemble(int year, List<String> ids, Map<Pairing, Integer> placed, ScheduleStrategy strategy) {
        List<Map.Entry<Pairing, Integer>> entries = new ArrayList<>(placed.entrySet());
        entries.sort(Map.Entry.comparingByValue());

        List<ScheduledGame> games = new ArrayList<>(entries.size());
        int week = 0;
        int slot = 0;
        for (var e : entries) {
            if (e.getValue() != week) {
                week = e.getValue();
                slot = 0;
            }
            slot++;
            String id = String.format("g%d-w%02d-%02d", year, week, slot);
            games.add(ScheduledGame.unplayed(id, week, e.getKey().homeTeamId(), e.getKey().awayTeamId()));
        }

        Map<String, Integer> byes = new LinkedHashMap<>();
        for (String team : ids) {
            boolean[] plays = new boolean[SeasonSchedule.WEEKS + 1];
            for (ScheduledGame g : games) {
                if (g.involves(team)) plays[g.week()] = true;
            }
            for (int w = 1; w <= SeasonSchedule.WEEKS; w++) {
                if (!plays[w]) {
                    byes.put(team, w);
                    break;
                }
            }
        }
        return new SeasonSchedule(year, games, byes, strategy);
    }

    /** Logs a bye week above the limit; the balancing step only leaves one when the limit is out of reach. */
    private void checkByeSpread(SeasonSchedule schedule, int byeWeeks) {
        Map<Integer, Integer> perWeek = new HashMap<>();
        schedule.byeWeeks().values().forEach(w -> perWeek.merge(w, 1, Integer::sum));
        int max = perWeek.values().stream().mapToInt(Integer::intValue).max().orElse(0);
        if (max <= maxTeamsPerByeWeek) return;

        int reachable = WeekColoring.lowestReachableMaxMissing(schedule.byeWeeks().size(), byeWeeks);
        if (maxTeamsPerByeWeek < reachable) {
            log.warn("Bye limit {} is out of reach for {} teams over {} bye weeks; schedule {} puts {} teams on bye in one week",
                    maxTeamsPerByeWeek, schedule.byeWeeks().size(), byeWeeks, schedule.year(), max);
        } else {
            log.warn("Schedule {} puts {} teams on bye in one week (limit {})", schedule.year(), max, maxTeamsPerByeWeek);
        }
    }

    /** The lowest per-week bye limit the generator can meet for {@code teams} teams on the given path. */
    public static int lowestReachableByeLimit(int teams, ScheduleStrategy strategy) {
        int byeWeeks = strategy == ScheduleStrategy.FORMULA ? ROTATION_WEEKS : SeasonSchedule.WEEKS;
        return WeekColoring.lowestReachableMaxMissing(teams, byeWeeks);
    }
}
