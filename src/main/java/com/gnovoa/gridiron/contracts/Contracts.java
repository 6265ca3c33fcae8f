package com.gnovoa.gridiron.contracts;

import com.gnovoa.gridiron.model.Contract;
import com.gnovoa.gridiron.model.ContractType;
import com.gnovoa.gridiron.model.ContractYear;

import java.util.ArrayList;
import java.util.List;

/** Builds contracts from terms. Ids are derived from player and first year so they stay reproducible. */
public final class Contracts {

    private Contracts() {}

    public static Contract create(String playerId, String teamId, ContractType type, int firstYear, ContractTerms terms) {
        List<ContractYear> years = new ArrayList<>(terms.years());
        for (int i = 0; i < terms.years(); i++) {
            years.add(new ContractYear(firstYear + i, terms.baseSalaryPerYear(), terms.bonusPerYear()));
        }
        long guaranteed = terms.signingBonus() + terms.baseSalaryPerYear();
        return new Contract(contractId(playerId, firstYear), playerId, teamId, type, firstYear, terms.years(),
                terms.years(), terms.totalValue(), guaranteed, terms.signingBonus(), years);
    }

    public static String contractId(String playerId, int firstYear) {
        return "contract-" + playerId + "-" + firstYear;
    }
}
