package com.gnovoa.gridiron.offseason;

/**
 * One transformation of the league between seasons.
 *
 * <p>Stages run against partially inconsistent intermediate state. A reference to an entity an
 * earlier stage removed is skipped, never thrown on.
 */
public interface OffseasonStage {

    String name();

    OffseasonStep apply(OffseasonStep step, OffseasonContext ctx);
}
