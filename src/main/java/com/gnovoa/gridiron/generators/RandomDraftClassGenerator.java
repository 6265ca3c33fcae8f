package com.gnovoa.gridiron.generators;

import com.gnovoa.gridiron.model.Position;
import com.gnovoa.gridiron.model.Prospect;
import com.gnovoa.gridiron.model.RoleCeiling;
import com.gnovoa.gridiron.model.RosterNeeds;
import com.gnovoa.gridiron.sim.RandomSource;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

public final class RandomDraftClassGenerator implements DraftClassGenerator {

    private final RandomSource rnd;
    private final IdSequence ids;
    private final int classSize;

    public RandomDraftClassGenerator(RandomSource rnd, IdSequence ids, int classSize) {
        if (classSize < 1) throw new IllegalArgumentException("Draft class size must be positive");
        this.rnd = rnd;
        this.ids = ids;
        this.classSize = classSize;
    }

    @Override
    public List<Prospect> generateDraftClass(int year) {
        List<Prospect> prospects = new ArrayList<>(classSize);
        for (int i = 0; i < classSize; i++) {
            Position pos = randomPosition();
            RoleCeiling ceiling = pos.isSpecialist() ? RoleCeiling.SPECIALIST : randomCeiling();
            int[] ratings = ratingsFor(ceiling);
            prospects.add(new Prospect(ids.next(), NamePool.firstName(rnd), NamePool.lastName(rnd), pos,
                    rnd.nextIntInclusive(21, 23), ratings[0], Math.max(ratings[0], ratings[1]), ceiling, year));
        }
        prospects.sort(Comparator.comparingInt((Prospect p) -> p.ceiling().draftGrade()).reversed()
                .thenComparing(Comparator.comparingInt(Prospect::potential).reversed())
                .thenComparing(Prospect::prospectId));
        return prospects;
    }

    private Position randomPosition() {
        int roll = rnd.nextIntInclusive(1, RosterNeeds.idealRosterSize());
        for (Position p : Position.values()) {
            roll -= p.idealCount();
            if (roll <= 0) return p;
        }
        return Position.WR;
    }

    private RoleCeiling randomCeiling() {
        double r = rnd.nextDouble();
        if (r < 0.03) return RoleCeiling.FRANCHISE_CORNERSTONE;
        if (r < 0.12) return RoleCeiling.HIGH_END_STARTER;
        if (r < 0.32) return RoleCeiling.SOLID_STARTER;
        if (r < 0.57) return RoleCeiling.QUALITY_ROTATIONAL;
        if (r < 0.85) return RoleCeiling.DEPTH;
        return RoleCeiling.PRACTICE_SQUAD;
    }

    /** {overall, potential} */
    private int[] ratingsFor(RoleCeiling ceiling) {
        switch (ceiling) {
            case FRANCHISE_CORNERSTONE:
                return new int[] {rnd.nextIntInclusive(62, 74), rnd.nextIntInclusive(85, 97)};
            case HIGH_END_STARTER:
                return new int[] {rnd.nextIntInclusive(58, 68), rnd.nextIntInclusive(78, 88)};
            case SOLID_STARTER:
                return new int[] {rnd.nextIntInclusive(52, 64), rnd.nextIntInclusive(68, 79)};
            case QUALITY_ROTATIONAL:
                return new int[] {rnd.nextIntInclusive(48, 58), rnd.nextIntInclusive(60, 70)};
            case SPECIALIST:
                return new int[] {rnd.nextIntInclusive(50, 70), rnd.nextIntInclusive(60, 80)};
            case DEPTH:
                return new int[] {rnd.nextIntInclusive(44, 54), rnd.nextIntInclusive(52, 62)};
            default:
                return new int[] {rnd.nextIntInclusive(40, 48), rnd.nextIntInclusive(45, 55)};
        }
    }
}
