package com.gnovoa.gridiron.model;

/**
 * Cap picture of a team for one league year. Figures are in thousands.
 *
 * <p>{@code capSpace} may be negative: the engine reports overages, it does not enforce them.
 */
public record TeamFinances(
    int year,
    long salaryCap,
    long capUsage,
    long deadCap,
    long capSpace,
    long nextYearCommitted,
    long twoYearsOutCommitted,
    long threeYearsOutCommitted) {

  public static TeamFinances empty(int year, long salaryCap) {
    return new TeamFinances(year, salaryCap, 0, 0, salaryCap, 0, 0, 0);
  }
}
