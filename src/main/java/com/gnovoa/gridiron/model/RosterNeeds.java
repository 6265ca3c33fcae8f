package com.gnovoa.gridiron.model;

import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/** Position depth targets and the shortfalls of a roster against them. */
public final class RosterNeeds {

  /** Positions used to fill a roster beyond the ideal depth chart, in order. */
  public static final List<Position> FILLER_ROTATION =
      List.of(
          Position.WR, Position.CB, Position.DE, Position.OLB, Position.RB, Position.TE,
          Position.DT, Position.ILB, Position.LG, Position.RG, Position.SS, Position.FS);

  private RosterNeeds() {}

  /** Positions below their ideal count, with the size of the gap. Only positive gaps are present. */
  public static Map<Position, Integer> deficits(Collection<Player> roster) {
    Map<Position, Integer> counts = new EnumMap<>(Position.class);
    for (Player p : roster) counts.merge(p.position(), 1, Integer::sum);

    Map<Position, Integer> needs = new EnumMap<>(Position.class);
    for (Position pos : Position.values()) {
      int gap = pos.idealCount() - counts.getOrDefault(pos, 0);
      if (gap > 0) needs.put(pos, gap);
    }
    return needs;
  }

  public static int idealRosterSize() {
    int sum = 0;
    for (Position p : Position.values()) sum += p.idealCount();
    return sum;
  }
}
