package com.gnovoa.gridiron.offseason;

import com.gnovoa.gridiron.model.Contract;
import com.gnovoa.gridiron.model.ContractType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ContractExpirationStageTest {

    @Test
    @DisplayName("Final-year contracts are voided and their players become unrostered free agents")
    void expiringContractsAreVoided() {
        OffseasonFixture f = new OffseasonFixture(51);

        OffseasonStep out = new ContractExpirationStage().apply(f.start(), f.ctx);

        for (Contract before : f.state.contracts().values()) {
            if (before.yearsRemaining() == 1) {
                assertThat(out.state().contracts()).doesNotContainKey(before.contractId());
                assertThat(out.report().voidedContractIds()).contains(before.contractId());
                assertThat(out.report().newFreeAgentIds()).contains(before.playerId());
                assertThat(out.state().player(before.playerId()).isSigned()).isFalse();
                assertThat(out.state().teams().values()).noneMatch(t -> t.rosterPlayerIds().contains(before.playerId()));
            } else {
                assertThat(out.state().contracts().get(before.contractId()).yearsRemaining())
                        .isEqualTo(before.yearsRemaining() - 1);
            }
        }
        OffseasonFixture.assertRostersConsistent(out.state());
    }

    @Test
    @DisplayName("Contracts whose player is gone are voided without creating a free agent")
    void orphanContractsAreVoided() {
        OffseasonFixture f = new OffseasonFixture(52);
        OffseasonStep retired = new RetirementStage().apply(f.start(), f.ctx);
        String retiredId = retired.report().retiredPlayerIds().get(0);
        Contract orphan = new Contract("orphan", retiredId, "nobody", ContractType.VETERAN,
                2025, 3, 3, 0, 0, 0, null);
        Map<String, Contract> contracts = new LinkedHashMap<>(retired.state().contracts());
        contracts.put(orphan.contractId(), orphan);

        OffseasonStep out = new ContractExpirationStage()
                .apply(new OffseasonStep(retired.state().withContracts(contracts), retired.report()), f.ctx);

        assertThat(out.state().contracts()).doesNotContainKey("orphan");
        assertThat(out.report().voidedContractIds()).contains("orphan");
        assertThat(out.report().newFreeAgentIds()).doesNotContain(retiredId);
    }
}
