package com.gnovoa.gridiron.offseason;

import com.gnovoa.gridiron.contracts.CapCalculator;
import com.gnovoa.gridiron.draft.DraftOrder;
import com.gnovoa.gridiron.generators.CoachGenerator;
import com.gnovoa.gridiron.generators.ContractGenerator;
import com.gnovoa.gridiron.generators.DraftClassGenerator;
import com.gnovoa.gridiron.generators.PlayerGenerator;
import com.gnovoa.gridiron.sim.RandomSource;

/**
 * Everything an offseason stage may consult besides the league state itself.
 *
 * @param completedYear the season that just finished; contracts, picks and finances target the
 *     following league year
 */
public record OffseasonContext(
        int completedYear,
        DraftOrder draftOrder,
        RandomSource rnd,
        PlayerGenerator players,
        DraftClassGenerator draftClasses,
        ContractGenerator contracts,
        CoachGenerator coaches,
        CapCalculator cap,
        OffseasonSettings settings
) {
    public int draftYear() { return completedYear + 1; }
}
