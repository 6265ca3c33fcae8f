package com.gnovoa.gridiron.generators;

import com.gnovoa.gridiron.model.Coach;
import com.gnovoa.gridiron.model.CoachAttributes;
import com.gnovoa.gridiron.model.CoachRole;
import com.gnovoa.gridiron.sim.RandomSource;

public final class RandomCoachGenerator implements CoachGenerator {

    private final RandomSource rnd;
    private final IdSequence ids;

    public RandomCoachGenerator(RandomSource rnd, IdSequence ids) {
        this.rnd = rnd;
        this.ids = ids;
    }

    @Override
    public Coach generateCoach(CoachRole role, String teamId, int year) {
        boolean head = role == CoachRole.HEAD_COACH;
        CoachAttributes attributes = new CoachAttributes(
                rnd.nextIntInclusive(35, 90),
                rnd.nextIntInclusive(35, 90),
                rnd.nextIntInclusive(35, 90));
        int age = head ? rnd.nextIntInclusive(38, 64) : rnd.nextIntInclusive(33, 58);
        int contractYears = teamId == null ? 0 : (head ? rnd.nextIntInclusive(3, 5) : rnd.nextIntInclusive(2, 4));
        return new Coach(ids.next(), NamePool.firstName(rnd), NamePool.lastName(rnd), role, teamId, attributes,
                age, contractYears, year);
    }
}
