package com.gnovoa.gridiron.model;

/** One league year of a contract. Cap hit is base salary plus that year's bonus proration. */
public record ContractYear(int year, long baseSalary, long proratedBonus) {

  public long capHit() {
    return baseSalary + proratedBonus;
  }
}
