package com.gnovoa.gridiron.offseason;

import com.gnovoa.gridiron.draft.DraftPickFactory;
import com.gnovoa.gridiron.model.LeagueState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Runs the offseason stages in order, threading the league state and the report through them.
 * Stage order matters: coaching reads last season's record before it is reset, free agency
 * sees this year's UDFAs, and finance sees the final contract set.
 */
public final class OffseasonProcessor {

    private static final Logger log = LoggerFactory.getLogger(OffseasonProcessor.class);

    private final List<OffseasonStage> stages;

    public OffseasonProcessor(List<OffseasonStage> stages) {
        if (stages.isEmpty()) throw new IllegalArgumentException("At least one offseason stage is required");
        this.stages = List.copyOf(stages);
    }

    /** Progression, retirement, expiration, coaching, draft, free agency, roster maintenance, finance. */
    public static OffseasonProcessor standard(DraftPickFactory pickFactory) {
        return new OffseasonProcessor(List.of(
                new ProgressionStage(),
                new RetirementStage(),
                new ContractExpirationStage(),
                new CoachingStage(),
                new DraftStage(pickFactory),
                new FreeAgencyStage(),
                new RosterMaintenanceStage(),
                new FinanceStage()
        ));
    }

    public List<String> stageNames() {
        return stages.stream().map(OffseasonStage::name).toList();
    }

    public OffseasonStep process(LeagueState state, OffseasonContext ctx) {
        OffseasonStep step = OffseasonStep.start(state);
        for (OffseasonStage stage : stages) {
            step = stage.apply(step, ctx);
            log.debug("Offseason {} stage '{}' done: players={}, contracts={}, coaches={}",
                    ctx.completedYear(), stage.name(), step.state().players().size(),
                    step.state().contracts().size(), step.state().coaches().size());
        }

        OffseasonReport r = step.report();
        log.debug("Offseason {}: {} retired, {} expired, {} coaching changes, {} drafted, {} signed, {} cut",
                ctx.completedYear(), r.retiredPlayerIds().size(), r.voidedContractIds().size(),
                r.coachingChanges().size(), r.draftedCount(), r.signings().size(), r.releases().size());
        return step;
    }
}
