package com.gnovoa.gridiron.offseason;

import com.gnovoa.gridiron.model.Coach;
import com.gnovoa.gridiron.model.CoachRole;
import com.gnovoa.gridiron.model.CoachingStaff;
import com.gnovoa.gridiron.model.LeagueState;
import com.gnovoa.gridiron.model.Team;
import com.gnovoa.gridiron.sim.RandomSource;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Coaching turnover, driven by the record of the season just played.
 *
 * <p>Head coaches of losing teams may be fired, and a fired head coach's coordinators may follow.
 * Coach contracts count down; an expiring coach is kept after a decent season or on a coin flip.
 * Every team ends the stage with a full staff. Openings are filled from unemployed coaches of the
 * same role or with a new coach.
 */
public final class CoachingStage implements OffseasonStage {

    static final double COORDINATOR_FOLLOWS_CHANCE = 0.4;
    static final double RENEW_WIN_PERCENTAGE = 0.45;
    static final double RENEW_COIN_FLIP = 0.5;
    static final double HIRE_FROM_POOL_CHANCE = 0.5;
    static final int UNEMPLOYED_RETIREMENT_AGE = 68;

    @Override
    public String name() { return "coaching"; }

    @Override
    public OffseasonStep apply(OffseasonStep step, OffseasonContext ctx) {
        LeagueState state = step.state();
        RandomSource rnd = ctx.rnd();
        int hireYear = ctx.draftYear();

        Map<String, Coach> coaches = new LinkedHashMap<>();
        for (Coach c : state.coaches().values()) {
            if (!c.isEmployed() && c.age() >= UNEMPLOYED_RETIREMENT_AGE) continue;
            coaches.put(c.coachId(), c);
        }

        Map<String, Team> teams = new LinkedHashMap<>();
        List<CoachingChange> changes = new ArrayList<>();

        for (Team team : state.teams().values()) {
            double winPct = team.currentRecord().winPercentage();
            CoachingStaff staff = team.staff();
            List<CoachRole> replacedThisYear = new ArrayList<>();

            Coach head = coaches.get(staff.headCoachId());
            if (head != null && rnd.chance(firingChance(winPct))) {
                staff = replace(team.teamId(), staff, CoachRole.HEAD_COACH, CoachingChange.Reason.FIRED, coaches, changes, hireYear, ctx);
                replacedThisYear.add(CoachRole.HEAD_COACH);
                for (CoachRole role : List.of(CoachRole.OFFENSIVE_COORDINATOR, CoachRole.DEFENSIVE_COORDINATOR)) {
                    if (coaches.get(staff.coachFor(role)) != null && rnd.chance(COORDINATOR_FOLLOWS_CHANCE)) {
                        staff = replace(team.teamId(), staff, role, CoachingChange.Reason.FIRED, coaches, changes, hireYear, ctx);
                        replacedThisYear.add(role);
                    }
                }
            }

            for (CoachRole role : CoachRole.values()) {
                if (replacedThisYear.contains(role)) continue;
                Coach current = coaches.get(staff.coachFor(role));
                if (current == null) {
                    staff = replace(team.teamId(), staff, role, CoachingChange.Reason.VACANCY, coaches, changes, hireYear, ctx);
                    continue;
                }
                int left = current.contractYearsRemaining() - 1;
                if (left > 0) {
                    coaches.put(current.coachId(), current.withContractYearsRemaining(left));
                } else if (winPct > RENEW_WIN_PERCENTAGE || rnd.chance(RENEW_COIN_FLIP)) {
                    coaches.put(current.coachId(), current.withContractYearsRemaining(contractLength(role, rnd)));
                } else {
                    staff = replace(team.teamId(), staff, role, CoachingChange.Reason.CONTRACT_EXPIRED, coaches, changes, hireYear, ctx);
                }
            }

            teams.put(team.teamId(), staff.equals(team.staff()) ? team : team.withStaff(staff));
        }

        LeagueState next = state.withCoaches(coaches).withTeams(teams);
        return new OffseasonStep(next, step.report().withCoachingChanges(changes));
    }

    /** Firing odds for a head coach after a season at the given win percentage. */
    public static double firingChance(double winPct) {
        if (winPct < 0.25) return 0.8;
        if (winPct < 0.35) return 0.5;
        if (winPct < 0.45) return 0.2;
        if (winPct < 0.5) return 0.08;
        return 0.0;
    }

    private CoachingStaff replace(String teamId, CoachingStaff staff, CoachRole role, CoachingChange.Reason reason,
                                  Map<String, Coach> coaches, List<CoachingChange> changes, int year, OffseasonContext ctx) {
        String outgoingId = staff.coachFor(role);
        Coach outgoing = outgoingId == null ? null : coaches.get(outgoingId);
        if (outgoing != null) coaches.put(outgoingId, outgoing.released());

        Coach incoming = hire(teamId, role, outgoingId, coaches, year, ctx);
        coaches.put(incoming.coachId(), incoming);
        changes.add(new CoachingChange(teamId, role, outgoing == null ? null : outgoingId, incoming.coachId(), reason));
        return staff.with(role, incoming.coachId());
    }

    private Coach hire(String teamId, CoachRole role, String excludedId, Map<String, Coach> coaches, int year, OffseasonContext ctx) {
        RandomSource rnd = ctx.rnd();
        List<Coach> pool = coaches.values().stream()
                .filter(c -> !c.isEmployed() && c.role() == role && !c.coachId().equals(excludedId))
                .toList();
        if (!pool.isEmpty() && rnd.chance(HIRE_FROM_POOL_CHANCE)) {
            return rnd.pick(pool).hiredBy(teamId, year, contractLength(role, rnd));
        }
        return ctx.coaches().generateCoach(role, teamId, year);
    }

    private static int contractLength(CoachRole role, RandomSource rnd) {
        return role == CoachRole.HEAD_COACH ? rnd.nextIntInclusive(3, 5) : rnd.nextIntInclusive(2, 4);
    }
}
