package com.gnovoa.gridiron.offseason;

import com.gnovoa.gridiron.model.Contract;
import com.gnovoa.gridiron.model.ContractType;
import com.gnovoa.gridiron.model.Player;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class FreeAgencyStageTest {

    @Test
    @DisplayName("Signed free agents join the winning team under a contract with that team")
    void signingsAreConsistent() {
        OffseasonFixture f = new OffseasonFixture(71);
        OffseasonStep expired = new ContractExpirationStage().apply(f.start(), f.ctx);

        OffseasonStep out = new FreeAgencyStage().apply(expired, f.ctx);

        assertThat(out.report().signings()).isNotEmpty();
        assertThat(out.report().signings().stream().map(Signing::playerId).collect(Collectors.toList()))
                .doesNotHaveDuplicates();
        for (Signing s : out.report().signings()) {
            Player before = expired.state().player(s.playerId());
            Player after = out.state().player(s.playerId());
            Contract deal = out.state().contracts().get(s.contractId());

            assertThat(before.isSigned()).isFalse();
            assertThat(after.contractId()).isEqualTo(s.contractId());
            assertThat(deal.teamId()).isEqualTo(s.teamId());
            assertThat(deal.capHitFor(f.ctx.draftYear())).isEqualTo(s.capHit());
            assertThat(out.state().team(s.teamId()).rosterPlayerIds()).contains(s.playerId());
            if (s.minimumDeal()) assertThat(deal.type()).isEqualTo(ContractType.MINIMUM);
        }
        OffseasonFixture.assertRostersConsistent(out.state());
    }
}
