package com.gnovoa.gridiron.generators;

import com.gnovoa.gridiron.model.Position;
import com.gnovoa.gridiron.model.SkillTier;

/** Optional constraints for a generated player; null position or tier means "any". */
public record PlayerConstraints(Position position, SkillTier tier, int minAge, int maxAge) {

    public static final int ROOKIE_MIN_AGE = 21;

    public PlayerConstraints {
        if (minAge < ROOKIE_MIN_AGE) throw new IllegalArgumentException("Players must be at least " + ROOKIE_MIN_AGE);
        if (maxAge < minAge) throw new IllegalArgumentException("maxAge " + maxAge + " < minAge " + minAge);
    }

    public static PlayerConstraints any() {
        return new PlayerConstraints(null, null, 22, 33);
    }

    public static PlayerConstraints of(Position position, SkillTier tier, int minAge, int maxAge) {
        return new PlayerConstraints(position, tier, minAge, maxAge);
    }
}
