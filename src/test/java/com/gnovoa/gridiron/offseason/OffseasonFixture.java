package com.gnovoa.gridiron.offseason;

import com.gnovoa.gridiron.TestLeagues;
import com.gnovoa.gridiron.draft.DraftOrder;
import com.gnovoa.gridiron.draft.PartialDraftOrder;
import com.gnovoa.gridiron.history.HistoryConfig;
import com.gnovoa.gridiron.history.LeagueEngine;
import com.gnovoa.gridiron.history.LeagueFactory;
import com.gnovoa.gridiron.model.Contract;
import com.gnovoa.gridiron.model.LeagueState;
import com.gnovoa.gridiron.model.Player;
import com.gnovoa.gridiron.sim.SeededRandomSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/** A fresh 2025 league and the context of the offseason that follows it. */
final class OffseasonFixture {

    static final int SEASON = 2025;

    final LeagueEngine engine;
    final LeagueState state;
    final OffseasonContext ctx;

    OffseasonFixture(long seed) {
        engine = LeagueEngine.create(new SeededRandomSource(seed), HistoryConfig.ofYears(1));
        state = new LeagueFactory(engine).create(TestLeagues.definitions(), SEASON);
        DraftOrder order = engine.draftOrders().reconcile(new PartialDraftOrder(SEASON, List.of()), state.teams().values());
        ctx = engine.offseasonContext(SEASON, order);
    }

    OffseasonStep start() {
        return OffseasonStep.start(state);
    }

    static Contract movedTo(Contract c, String teamId) {
        return new Contract(c.contractId(), c.playerId(), teamId, c.type(), c.signedYear(), c.totalYears(),
                c.yearsRemaining(), c.totalValue(), c.guaranteedMoney(), c.signingBonus(), c.yearlyBreakdown());
    }

    /** Every roster entry resolves to a player signed to that team. */
    static void assertRostersConsistent(LeagueState s) {
        s.teams().values().forEach(t -> t.rosterPlayerIds().forEach(id -> {
            Player p = s.player(id);
            assertThat(p).as("player %s of %s", id, t.teamId()).isNotNull();
            assertThat(p.isSigned()).as("%s signed", id).isTrue();
            assertThat(s.contracts().get(p.contractId()).teamId()).isEqualTo(t.teamId());
        }));
    }
}
