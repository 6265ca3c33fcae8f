package com.gnovoa.gridiron.contracts;

/** League salary scales, in thousands. */
public final class SalaryScale {

    private static final long[] MINIMUM_BY_EXPERIENCE = {795, 915, 990, 1065, 1145, 1215};

    private SalaryScale() {}

    public static long minimumSalary(int experience) {
        int idx = Math.max(0, Math.min(experience, MINIMUM_BY_EXPERIENCE.length - 1));
        return MINIMUM_BY_EXPERIENCE[idx];
    }

    /** Rookie slot value per year for an overall pick. */
    public static long rookieSlotValue(int overallPick, int round) {
        long value;
        if (round == 1) value = 12_000 - (overallPick - 1) * 220L;
        else if (round == 2) value = 3_500 - (overallPick - 33) * 40L;
        else if (round == 3) value = 2_000 - (overallPick - 65) * 20L;
        else if (round <= 5) value = 1_200 - (overallPick - 97) * 5L;
        else value = 900 - (round - 5) * 30L;
        return Math.max(minimumSalary(0), value);
    }
}
