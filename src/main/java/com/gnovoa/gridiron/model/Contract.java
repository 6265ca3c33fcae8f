package com.gnovoa.gridiron.model;

import java.util.List;

/**
 * Player contract. Money is expressed in thousands.
 *
 * <p>{@code yearsRemaining} counts league years still to be played, including the upcoming one. The
 * contract expiration stage decrements it once per offseason and voids the contract at zero.
 */
public record Contract(
    String contractId,
    String playerId,
    String teamId,
    ContractType type,
    int signedYear,
    int totalYears,
    int yearsRemaining,
    long totalValue,
    long guaranteedMoney,
    long signingBonus,
    List<ContractYear> yearlyBreakdown) {

  public Contract {
    yearlyBreakdown = yearlyBreakdown == null ? List.of() : List.copyOf(yearlyBreakdown);
  }

  public long capHitFor(int year) {
    for (ContractYear y : yearlyBreakdown) {
      if (y.year() == year) return y.capHit();
    }
    return 0;
  }

  /** Bonus proration not yet charged from {@code fromYear} on; it accelerates to dead cap on release. */
  public long remainingProration(int fromYear) {
    long sum = 0;
    for (ContractYear y : yearlyBreakdown) {
      if (y.year() >= fromYear) sum += y.proratedBonus();
    }
    return sum;
  }

  public long averageAnnualValue() {
    return totalYears == 0 ? 0 : Math.round((double) totalValue / totalYears);
  }

  public Contract withYearsRemaining(int years) {
    return new Contract(contractId, playerId, teamId, type, signedYear, totalYears, years,
        totalValue, guaranteedMoney, signingBonus, yearlyBreakdown);
  }
}
