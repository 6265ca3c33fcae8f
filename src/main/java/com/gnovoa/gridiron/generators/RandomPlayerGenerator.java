package com.gnovoa.gridiron.generators;

import com.gnovoa.gridiron.model.Injury;
import com.gnovoa.gridiron.model.Player;
import com.gnovoa.gridiron.model.Position;
import com.gnovoa.gridiron.model.RosterNeeds;
import com.gnovoa.gridiron.model.SkillTier;
import com.gnovoa.gridiron.sim.RandomSource;

import java.util.ArrayList;
import java.util.List;

public final class RandomPlayerGenerator implements PlayerGenerator {

    static final int ROSTER_SIZE = 53;

    private final RandomSource rnd;
    private final IdSequence ids;

    public RandomPlayerGenerator(RandomSource rnd, IdSequence ids) {
        this.rnd = rnd;
        this.ids = ids;
    }

    @Override
    public Player generatePlayer(PlayerConstraints constraints) {
        Position position = constraints.position() != null ? constraints.position() : randomPosition();
        SkillTier tier = constraints.tier() != null ? constraints.tier() : randomTier();
        int age = rnd.nextIntInclusive(constraints.minAge(), constraints.maxAge());
        int overall = overallFor(tier);
        int growthRoom = Math.max(2, (30 - age) * 3);
        int potential = Math.min(99, overall + rnd.nextIntInclusive(0, growthRoom));
        int experience = Math.max(0, age - 22 - rnd.nextIntInclusive(0, 1));

        return new Player(ids.next(), NamePool.firstName(rnd), NamePool.lastName(rnd), position, age, experience,
                overall, potential, null, Injury.NONE, null);
    }

    @Override
    public List<Player> generateRoster(String teamId) {
        List<Player> roster = new ArrayList<>(ROSTER_SIZE);
        for (Position pos : Position.values()) {
            for (int i = 0; i < pos.idealCount(); i++) {
                roster.add(generatePlayer(PlayerConstraints.of(pos, null, 22, 33)));
            }
        }
        int filler = 0;
        while (roster.size() < ROSTER_SIZE) {
            Position pos = RosterNeeds.FILLER_ROTATION.get(filler++ % RosterNeeds.FILLER_ROTATION.size());
            roster.add(generatePlayer(PlayerConstraints.of(pos, null, 22, 30)));
        }
        return roster;
    }

    private Position randomPosition() {
        int roll = rnd.nextIntInclusive(1, RosterNeeds.idealRosterSize());
        for (Position p : Position.values()) {
            roll -= p.idealCount();
            if (roll <= 0) return p;
        }
        return Position.WR;
    }

    private SkillTier randomTier() {
        double r = rnd.nextDouble();
        if (r < 0.08) return SkillTier.ELITE;
        if (r < 0.43) return SkillTier.STARTER;
        if (r < 0.80) return SkillTier.BACKUP;
        return SkillTier.FRINGE;
    }

    private int overallFor(SkillTier tier) {
        if (tier == SkillTier.ELITE) return rnd.nextIntInclusive(80, 92);
        if (tier == SkillTier.STARTER) return rnd.nextIntInclusive(68, 79);
        if (tier == SkillTier.BACKUP) return rnd.nextIntInclusive(55, 67);
        return rnd.nextIntInclusive(42, 54);
    }
}
