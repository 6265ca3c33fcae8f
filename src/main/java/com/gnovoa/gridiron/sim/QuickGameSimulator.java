package com.gnovoa.gridiron.sim;

/**
 * Non play-by-play game model.
 *
 * <p>Each side's score is drawn from a normal distribution whose mean moves with the gap between
 * its offense and the opposing defense. Long-run team averages land roughly between 10 and 40
 * points.
 */
public final class QuickGameSimulator {

    static final double BASE_POINTS = 22.0;
    static final double DIFFERENTIAL_WEIGHT = 14.0;
    static final double HOME_FIELD_POINTS = 3.0;
    static final double SCORE_STD_DEV = 10.0;
    static final double OVERTIME_DECIDED_CHANCE = 0.9;
    static final double HOME_OVERTIME_EDGE = 0.55;

    private final RandomSource rnd;

    public QuickGameSimulator(RandomSource rnd) {
        this.rnd = rnd;
    }

    /** Regular-season game; a tie survives overtime about one time in ten. */
    public GameResult simulate(TeamStrength home, TeamStrength away) {
        int homeScore = rollScore(home, away, true);
        int awayScore = rollScore(away, home, false);
        boolean overtime = false;

        if (homeScore == awayScore) {
            overtime = true;
            if (rnd.chance(OVERTIME_DECIDED_CHANCE)) {
                if (rnd.chance(HOME_OVERTIME_EDGE)) homeScore += 3;
                else awayScore += 3;
            }
        }
        return new GameResult(home.teamId(), away.teamId(), homeScore, awayScore, overtime,
                boxScore(home, away));
    }

    /** Postseason game; never returns a tie. */
    public GameResult simulatePlayoff(TeamStrength home, TeamStrength away) {
        int homeScore = rollScore(home, away, true);
        int awayScore = rollScore(away, home, false);
        boolean overtime = false;

        while (homeScore == awayScore) {
            overtime = true;
            int points = rnd.nextIntInclusive(3, 7);
            if (rnd.chance(HOME_OVERTIME_EDGE)) homeScore += points;
            else awayScore += points;
        }
        return new GameResult(home.teamId(), away.teamId(), homeScore, awayScore, overtime,
                boxScore(home, away));
    }

    private int rollScore(TeamStrength offense, TeamStrength defense, boolean home) {
        double mean = BASE_POINTS + (offense.offense() - defense.defense()) / 100.0 * DIFFERENTIAL_WEIGHT;
        if (home) mean += HOME_FIELD_POINTS;
        return (int) Math.max(0, Math.round(rnd.nextGaussian(mean, SCORE_STD_DEV)));
    }

    private BoxScore boxScore(TeamStrength home, TeamStrength away) {
        int homeYards = yards(home, away);
        int awayYards = yards(away, home);
        return new BoxScore(homeYards, awayYards, rnd.nextIntInclusive(0, 3), rnd.nextIntInclusive(0, 3));
    }

    private int yards(TeamStrength offense, TeamStrength defense) {
        double mean = 330 + (offense.offense() - defense.defense()) * 2.0;
        return (int) Math.max(80, Math.round(rnd.nextGaussian(mean, 55)));
    }
}
