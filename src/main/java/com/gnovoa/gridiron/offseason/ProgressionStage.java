package com.gnovoa.gridiron.offseason;

import com.gnovoa.gridiron.model.Coach;
import com.gnovoa.gridiron.model.Injury;
import com.gnovoa.gridiron.model.LeagueState;
import com.gnovoa.gridiron.model.Player;
import com.gnovoa.gridiron.model.Team;
import com.gnovoa.gridiron.sim.RandomSource;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Ages every player and coach by a year. Young players close part of the gap to their potential,
 * faster under a head coach with strong development; players past thirty decline. Injuries heal.
 */
public final class ProgressionStage implements OffseasonStage {

    static final int MIN_OVERALL = 30;
    static final int MAX_OVERALL = 99;
    static final double GROWTH_RATE = 0.25;

    @Override
    public String name() { return "progression"; }

    @Override
    public OffseasonStep apply(OffseasonStep step, OffseasonContext ctx) {
        LeagueState state = step.state();
        RandomSource rnd = ctx.rnd();

        Map<String, Coach> headCoachByPlayer = new HashMap<>();
        for (Team t : state.teams().values()) {
            Coach hc = state.coaches().get(t.staff().headCoachId());
            if (hc == null) continue;
            for (String id : t.rosterPlayerIds()) headCoachByPlayer.put(id, hc);
        }

        Map<String, Player> players = new LinkedHashMap<>();
        for (Player p : state.players().values()) {
            int age = p.age() + 1;
            int overall = nextOverall(p, age, headCoachByPlayer.get(p.playerId()), rnd);
            players.put(p.playerId(), p.developed(age, p.experience() + 1, overall).withInjury(Injury.NONE));
        }

        Map<String, Coach> coaches = new LinkedHashMap<>();
        for (Coach c : state.coaches().values()) coaches.put(c.coachId(), c.aged());

        return new OffseasonStep(state.withPlayers(players).withCoaches(coaches), step.report());
    }

    static double ageModifier(int age) {
        if (age <= 23) return 1.3;
        if (age <= 25) return 1.15;
        if (age <= 27) return 1.0;
        if (age <= 29) return 0.85;
        if (age <= 31) return 0.6;
        if (age <= 33) return 0.3;
        return 0.0;
    }

    private static int nextOverall(Player p, int age, Coach headCoach, RandomSource rnd) {
        double change = 0.0;
        int gap = p.potential() - p.overall();
        if (gap > 0) {
            double coachBonus = headCoach == null ? 0.0 : (headCoach.attributes().development() - 50) / 25.0;
            change += Math.max(0.0, gap * GROWTH_RATE * ageModifier(age) + coachBonus);
        }
        if (age > 30) {
            change -= (age - 30) * 0.8 + rnd.nextIntInclusive(0, 2);
        }
        change += rnd.nextIntInclusive(-1, 1);
        int next = (int) Math.round(p.overall() + change);
        return Math.max(MIN_OVERALL, Math.min(MAX_OVERALL, next));
    }
}
