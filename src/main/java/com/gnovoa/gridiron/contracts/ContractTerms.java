package com.gnovoa.gridiron.contracts;

/** Offer terms: base salary and signing-bonus proration per year, in thousands. */
public record ContractTerms(int years, long baseSalaryPerYear, long bonusPerYear) {

    public ContractTerms {
        if (years < 1) throw new IllegalArgumentException("Contract needs at least one year, got " + years);
        if (baseSalaryPerYear < 0 || bonusPerYear < 0) throw new IllegalArgumentException("Negative contract money");
    }

    public long totalValue() {
        return (baseSalaryPerYear + bonusPerYear) * years;
    }

    public long signingBonus() {
        return bonusPerYear * years;
    }
}
