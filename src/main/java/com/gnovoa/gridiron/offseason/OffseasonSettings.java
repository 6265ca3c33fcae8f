package com.gnovoa.gridiron.offseason;

/**
 * League rules the offseason works with. Money is in thousands.
 *
 * @param salaryCap cap for the upcoming league year
 * @param rosterLimit active roster ceiling enforced by roster maintenance
 * @param draftRounds rounds in the draft
 * @param prospectsConsidered how deep into the remaining class each AI pick looks
 */
public record OffseasonSettings(long salaryCap, int rosterLimit, int draftRounds, int prospectsConsidered) {

    public static final OffseasonSettings DEFAULTS = new OffseasonSettings(255_000, 53, 7, 50);

    public OffseasonSettings {
        if (rosterLimit < 1) throw new IllegalArgumentException("rosterLimit must be positive");
        if (draftRounds < 1) throw new IllegalArgumentException("draftRounds must be positive");
        if (prospectsConsidered < 1) throw new IllegalArgumentException("prospectsConsidered must be positive");
    }
}
