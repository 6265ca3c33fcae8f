package com.gnovoa.gridiron.draft;

import com.gnovoa.gridiron.model.Team;
import com.gnovoa.gridiron.model.TeamRecord;
import com.gnovoa.gridiron.playoffs.PlayoffBracket;
import com.gnovoa.gridiron.playoffs.PlayoffRound;
import com.gnovoa.gridiron.standings.LeagueStandings;
import com.gnovoa.gridiron.standings.TeamStanding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Draft order in two steps.
 *
 * <p>{@link #computePrimary} derives what standings and playoff results say: non-playoff teams
 * worst first, then playoff teams by elimination round, Super Bowl loser and champion last.
 * {@link #reconcile} guarantees the result names every team exactly once.
 */
public final class DraftOrderCalculator {

    private static final Logger log = LoggerFactory.getLogger(DraftOrderCalculator.class);

    /** Win% used for a team that has not played. */
    static final double NO_GAMES_WIN_PERCENTAGE = 0.5;

    private static final Comparator<TeamStanding> WORST_FIRST = Comparator
            .comparingDouble(TeamStanding::winPercentage)
            .thenComparingInt(TeamStanding::pointDifferential)
            .thenComparing(TeamStanding::teamId);

    private static final List<PlayoffRound> ELIMINATION_ORDER = List.of(
            PlayoffRound.WILD_CARD, PlayoffRound.DIVISIONAL, PlayoffRound.CONFERENCE_CHAMPIONSHIP);

    public DraftOrder calculate(LeagueStandings standings, PlayoffBracket bracket, Collection<Team> teams) {
        return reconcile(computePrimary(standings, bracket), teams);
    }

    /**
     * Teams whose slot cannot be derived, for instance because the bracket is unfinished, are left
     * out; {@link #reconcile} puts them back.
     */
    public PartialDraftOrder computePrimary(LeagueStandings standings, PlayoffBracket bracket) {
        Set<String> participants = bracket == null ? Set.of() : new LinkedHashSet<>(bracket.participants());
        List<String> order = new ArrayList<>();

        standings.byTeam().values().stream()
                .filter(s -> !participants.contains(s.teamId()))
                .sorted(WORST_FIRST)
                .forEach(s -> order.add(s.teamId()));

        if (bracket != null) {
            for (PlayoffRound round : ELIMINATION_ORDER) {
                participants.stream()
                        .filter(id -> bracket.eliminatedIn(id) == round)
                        .filter(standings.byTeam()::containsKey)
                        .map(standings::standing)
                        .sorted(WORST_FIRST)
                        .forEach(s -> order.add(s.teamId()));
            }
            if (bracket.runnerUpId() != null) order.add(bracket.runnerUpId());
            if (bracket.championId() != null) order.add(bracket.championId());
        }
        return new PartialDraftOrder(standings.year(), order);
    }

    /**
     * Drops unknown and repeated ids, then appends every missing team by ascending win% (0.5 for a
     * team without games), then id.
     */
    public DraftOrder reconcile(PartialDraftOrder partial, Collection<Team> teams) {
        Map<String, Team> known = teams.stream()
                .collect(Collectors.toMap(Team::teamId, Function.identity(), (a, b) -> a, LinkedHashMap::new));

        LinkedHashSet<String> order = new LinkedHashSet<>();
        for (String id : partial.teamIds()) {
            if (known.containsKey(id)) order.add(id);
        }

        List<String> missing = known.values().stream()
                .filter(t -> !order.contains(t.teamId()))
                .sorted(Comparator.comparingDouble((Team t) -> fallbackWinPercentage(t.currentRecord()))
                        .thenComparing(Team::teamId))
                .map(Team::teamId)
                .toList();

        if (!missing.isEmpty()) {
            log.warn("Draft order {} was missing {} team(s); appended by record: {}", partial.year(), missing.size(), missing);
        }
        order.addAll(missing);
        return new DraftOrder(partial.year(), new ArrayList<>(order), missing);
    }

    private static double fallbackWinPercentage(TeamRecord record) {
        return record.games() == 0 ? NO_GAMES_WIN_PERCENTAGE : record.winPercentage();
    }
}
