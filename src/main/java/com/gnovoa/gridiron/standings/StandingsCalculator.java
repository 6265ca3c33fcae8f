package com.gnovoa.gridiron.standings;

import com.gnovoa.gridiron.model.Conference;
import com.gnovoa.gridiron.model.Division;
import com.gnovoa.gridiron.model.ScheduledGame;
import com.gnovoa.gridiron.model.Team;
import com.gnovoa.gridiron.model.TeamRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Pure function from completed games to ordered standings. Incomplete games are ignored. */
public final class StandingsCalculator {

    public LeagueStandings calculate(int year, Collection<ScheduledGame> games, Collection<Team> teams) {
        Map<String, Team> teamById = new LinkedHashMap<>();
        for (Team t : teams) teamById.put(t.teamId(), t);

        Map<String, TeamRecord> overall = new LinkedHashMap<>();
        Map<String, TeamRecord> division = new LinkedHashMap<>();
        Map<String, TeamRecord> conference = new LinkedHashMap<>();
        Map<String, List<Character>> results = new LinkedHashMap<>();
        for (String id : teamById.keySet()) {
            overall.put(id, TeamRecord.EMPTY);
            division.put(id, TeamRecord.EMPTY);
            conference.put(id, TeamRecord.EMPTY);
            results.put(id, new ArrayList<>());
        }

        List<ScheduledGame> played = games.stream()
                .filter(ScheduledGame::completed)
                .sorted(Comparator.comparingInt(ScheduledGame::week))
                .toList();

        for (ScheduledGame g : played) {
            Team home = teamById.get(g.homeTeamId());
            Team away = teamById.get(g.awayTeamId());
            if (home == null || away == null) continue;

            int hs = g.homeScore();
            int as = g.awayScore();
            overall.compute(home.teamId(), (k, r) -> r.withGame(hs, as));
            overall.compute(away.teamId(), (k, r) -> r.withGame(as, hs));

            if (home.conference() == away.conference()) {
                conference.compute(home.teamId(), (k, r) -> r.withGame(hs, as));
                conference.compute(away.teamId(), (k, r) -> r.withGame(as, hs));
                if (home.division() == away.division()) {
                    division.compute(home.teamId(), (k, r) -> r.withGame(hs, as));
                    division.compute(away.teamId(), (k, r) -> r.withGame(as, hs));
                }
            }
            results.get(home.teamId()).add(hs > as ? 'W' : hs < as ? 'L' : 'T');
            results.get(away.teamId()).add(as > hs ? 'W' : as < hs ? 'L' : 'T');
        }

        Map<String, TeamStanding> standings = new LinkedHashMap<>();
        for (Team t : teamById.values()) {
            String id = t.teamId();
            standings.put(id, new TeamStanding(id, t.conference(), t.division(), overall.get(id), division.get(id),
                    conference.get(id), streak(results.get(id)), 0, 0));
        }

        Map<Conference, Map<Division, List<String>>> divisions = new EnumMap<>(Conference.class);
        Map<Conference, List<String>> conferences = new EnumMap<>(Conference.class);
        for (Conference c : Conference.values()) {
            List<TeamStanding> confTeams = standings.values().stream()
                    .filter(s -> s.conference() == c)
                    .sorted(StandingsOrder.BEST_FIRST)
                    .toList();
            conferences.put(c, confTeams.stream().map(TeamStanding::teamId).toList());

            Map<Division, List<String>> byDivision = new EnumMap<>(Division.class);
            for (Division d : Division.values()) {
                List<String> ids = confTeams.stream().filter(s -> s.division() == d).map(TeamStanding::teamId).toList();
                if (!ids.isEmpty()) byDivision.put(d, ids);
            }
            divisions.put(c, Collections.unmodifiableMap(byDivision));
        }

        Map<String, TeamStanding> ranked = new LinkedHashMap<>();
        for (TeamStanding s : standings.values()) {
            int divRank = divisions.get(s.conference()).get(s.division()).indexOf(s.teamId()) + 1;
            int confRank = conferences.get(s.conference()).indexOf(s.teamId()) + 1;
            ranked.put(s.teamId(), s.withRanks(divRank, confRank));
        }

        return new LeagueStandings(year, Collections.unmodifiableMap(ranked),
                Collections.unmodifiableMap(divisions), Collections.unmodifiableMap(conferences));
    }

    private static String streak(List<Character> results) {
        if (results.isEmpty()) return "-";
        char last = results.get(results.size() - 1);
        int n = 0;
        for (int i = results.size() - 1; i >= 0 && results.get(i) == last; i--) n++;
        return String.valueOf(last) + n;
    }
}
