package com.gnovoa.gridiron.generators;

import com.gnovoa.gridiron.contracts.ContractTerms;
import com.gnovoa.gridiron.contracts.Contracts;
import com.gnovoa.gridiron.contracts.SalaryScale;
import com.gnovoa.gridiron.model.Contract;
import com.gnovoa.gridiron.model.ContractType;
import com.gnovoa.gridiron.model.Player;
import com.gnovoa.gridiron.sim.RandomSource;

import java.util.ArrayList;
import java.util.List;

/**
 * Prices veterans on a curve of their overall rating; rookies on the slot scale, half of it as
 * prorated bonus over four years.
 */
public final class RandomContractGenerator implements ContractGenerator {

    static final int ROOKIE_YEARS = 4;
    static final long VALUE_PER_RATING_POINT_SQUARED = 12;

    private final RandomSource rnd;

    public RandomContractGenerator(RandomSource rnd) {
        this.rnd = rnd;
    }

    @Override
    public Contract generateContract(Player player, String teamId, int year) {
        long minimum = SalaryScale.minimumSalary(player.experience());
        long above = Math.max(0, player.overall() - 50);
        long annual = minimum + above * above * VALUE_PER_RATING_POINT_SQUARED;

        int years;
        if (player.age() <= 26) years = rnd.nextIntInclusive(3, 5);
        else if (player.age() <= 30) years = rnd.nextIntInclusive(2, 4);
        else years = rnd.nextIntInclusive(1, 2);

        double bonusShare = 0.2 + rnd.nextDouble() * 0.2;
        long bonusPerYear = Math.round(annual * bonusShare);
        ContractTerms terms = new ContractTerms(years, annual - bonusPerYear, bonusPerYear);
        return Contracts.create(player.playerId(), teamId, ContractType.VETERAN, year, terms);
    }

    @Override
    public RosterContracts generateRosterContracts(List<Player> roster, String teamId, int year) {
        List<Contract> contracts = new ArrayList<>(roster.size());
        List<Player> updated = new ArrayList<>(roster.size());
        for (Player p : roster) {
            Contract c = generateContract(p, teamId, year);
            contracts.add(c);
            updated.add(p.withContract(c.contractId()));
        }
        return new RosterContracts(contracts, updated);
    }

    @Override
    public Contract rookieContract(Player player, String teamId, int year, int overallPick, int round) {
        long slot = SalaryScale.rookieSlotValue(overallPick, round);
        long bonusPerYear = Math.round(slot * 0.5);
        ContractTerms terms = new ContractTerms(ROOKIE_YEARS, slot - bonusPerYear, bonusPerYear);
        return Contracts.create(player.playerId(), teamId, ContractType.ROOKIE, year, terms);
    }

    @Override
    public Contract minimumContract(Player player, String teamId, int year) {
        ContractTerms terms = new ContractTerms(1, SalaryScale.minimumSalary(player.experience()), 0);
        return Contracts.create(player.playerId(), teamId, ContractType.MINIMUM, year, terms);
    }
}
