package com.gnovoa.gridiron.generators;

import com.gnovoa.gridiron.model.Contract;
import com.gnovoa.gridiron.model.Player;

import java.util.List;

/**
 * Contract terms for players. {@code year} is always the first league year the contract covers.
 */
public interface ContractGenerator {

    /** Contracts for a roster plus the players carrying their new contract ids. */
    record RosterContracts(List<Contract> contracts, List<Player> updatedPlayers) {}

    Contract generateContract(Player player, String teamId, int year);

    RosterContracts generateRosterContracts(List<Player> roster, String teamId, int year);

    Contract rookieContract(Player player, String teamId, int year, int overallPick, int round);

    Contract minimumContract(Player player, String teamId, int year);
}
