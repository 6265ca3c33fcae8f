package com.gnovoa.gridiron.offseason;

import com.gnovoa.gridiron.contracts.CapCalculator;
import com.gnovoa.gridiron.model.TeamFinances;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FinanceStageTest {

    @Test
    @DisplayName("Cap usage is the sum of contract cap hits and space accounts for dead money")
    void financesMatchContracts() {
        OffseasonFixture f = new OffseasonFixture(21);
        String teamId = f.state.teams().keySet().iterator().next();
        Release cut = new Release("gone", teamId, "contract-gone", 1_500);
        OffseasonStep withCut = new OffseasonStep(f.state, OffseasonReport.empty().withRosterMaintenance(List.of(cut), List.of()));

        OffseasonStep out = new FinanceStage().apply(withCut, f.ctx);

        CapCalculator cap = new CapCalculator();
        int year = f.ctx.draftYear();
        out.state().teams().values().forEach(t -> {
            TeamFinances fin = t.finances();
            long usage = cap.capUsage(t.teamId(), out.state().contracts().values(), year);
            assertThat(fin.year()).isEqualTo(year);
            assertThat(fin.salaryCap()).isEqualTo(f.ctx.settings().salaryCap());
            assertThat(fin.capUsage()).isEqualTo(usage);
            assertThat(fin.capSpace()).isEqualTo(fin.salaryCap() - fin.capUsage() - fin.deadCap());
            assertThat(fin.nextYearCommitted()).isEqualTo(cap.capUsage(t.teamId(), out.state().contracts().values(), year + 1));
        });
        assertThat(out.state().team(teamId).finances().deadCap()).isEqualTo(1_500);
    }
}
