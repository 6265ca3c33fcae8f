package com.gnovoa.gridiron.playoffs;

/** States of the postseason bracket, in order. */
public enum PlayoffRound {
    SEEDED,
    WILD_CARD,
    DIVISIONAL,
    CONFERENCE_CHAMPIONSHIP,
    SUPER_BOWL,
    COMPLETE;

    public PlayoffRound next() {
        if (this == COMPLETE) throw new IllegalStateException("Playoffs are already complete");
        return values()[ordinal() + 1];
    }

    public boolean hasGames() {
        return this != SEEDED && this != COMPLETE;
    }
}
