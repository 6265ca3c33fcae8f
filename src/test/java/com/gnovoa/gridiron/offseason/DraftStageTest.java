package com.gnovoa.gridiron.offseason;

import com.gnovoa.gridiron.draft.DraftPickFactory;
import com.gnovoa.gridiron.model.Contract;
import com.gnovoa.gridiron.model.ContractType;
import com.gnovoa.gridiron.model.DraftPick;
import com.gnovoa.gridiron.model.Player;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DraftStageTest {

    @Test
    @DisplayName("Every pick selects a prospect who joins the roster on a rookie deal")
    void picksBecomeRookies() {
        OffseasonFixture f = new OffseasonFixture(61);

        OffseasonStep out = new DraftStage(new DraftPickFactory()).apply(f.start(), f.ctx);

        assertThat(out.report().executedPicks()).hasSize(7 * 32);
        assertThat(out.report().draftedCount()).isEqualTo(7 * 32);
        assertThat(out.state().draftPicks()).allMatch(DraftPick::isUsed);
        assertThat(out.state().draftClass()).isEmpty();

        for (DraftPick pick : out.report().executedPicks()) {
            Player rookie = out.state().player(pick.selectedPlayerId());
            Contract deal = out.state().contracts().get(rookie.contractId());
            assertThat(rookie.draft().round()).isEqualTo(pick.round());
            assertThat(rookie.draft().year()).isEqualTo(f.ctx.draftYear());
            assertThat(deal.type()).isEqualTo(ContractType.ROOKIE);
            assertThat(deal.teamId()).isEqualTo(pick.currentTeamId());
            assertThat(out.state().team(pick.currentTeamId()).rosterPlayerIds()).contains(rookie.playerId());
        }
        OffseasonFixture.assertRostersConsistent(out.state());
    }

    @Test
    @DisplayName("Prospects left on the board enter the league as unsigned free agents")
    void leftoversBecomeUndraftedFreeAgents() {
        OffseasonFixture f = new OffseasonFixture(62);

        OffseasonStep out = new DraftStage(new DraftPickFactory()).apply(f.start(), f.ctx);

        assertThat(out.report().udfaPlayerIds()).hasSize(256 - 7 * 32);
        for (String id : out.report().udfaPlayerIds()) {
            Player p = out.state().player(id);
            assertThat(p.isSigned()).isFalse();
            assertThat(p.draft()).isNull();
        }
    }

    @Test
    @DisplayName("The first pick goes to the first team in the draft order")
    void firstPickFollowsOrder() {
        OffseasonFixture f = new OffseasonFixture(63);

        OffseasonStep out = new DraftStage(new DraftPickFactory()).apply(f.start(), f.ctx);

        DraftPick first = out.report().executedPicks().get(0);
        assertThat(first.overallPick()).isEqualTo(1);
        assertThat(first.currentTeamId()).isEqualTo(f.ctx.draftOrder().teamIds().get(0));
    }
}
