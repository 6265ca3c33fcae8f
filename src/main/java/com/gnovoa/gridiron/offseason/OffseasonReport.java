package com.gnovoa.gridiron.offseason;

import com.gnovoa.gridiron.model.DraftPick;

import java.util.ArrayList;
import java.util.List;

/** What the offseason did, accumulated stage by stage. */
public record OffseasonReport(
        List<String> retiredPlayerIds,
        List<String> voidedContractIds,
        List<String> newFreeAgentIds,
        List<CoachingChange> coachingChanges,
        List<DraftPick> executedPicks,
        List<String> udfaPlayerIds,
        List<Signing> signings,
        List<Release> releases,
        List<String> generatedPlayerIds
) {
    public OffseasonReport {
        retiredPlayerIds = List.copyOf(retiredPlayerIds);
        voidedContractIds = List.copyOf(voidedContractIds);
        newFreeAgentIds = List.copyOf(newFreeAgentIds);
        coachingChanges = List.copyOf(coachingChanges);
        executedPicks = List.copyOf(executedPicks);
        udfaPlayerIds = List.copyOf(udfaPlayerIds);
        signings = List.copyOf(signings);
        releases = List.copyOf(releases);
        generatedPlayerIds = List.copyOf(generatedPlayerIds);
    }

    public static OffseasonReport empty() {
        return new OffseasonReport(List.of(), List.of(), List.of(), List.of(), List.of(), List.of(), List.of(),
                List.of(), List.of());
    }

    public int draftedCount() {
        return (int) executedPicks.stream().filter(DraftPick::isUsed).count();
    }

    public OffseasonReport withRetirements(List<String> ids) {
        return new OffseasonReport(concat(retiredPlayerIds, ids), voidedContractIds, newFreeAgentIds, coachingChanges,
                executedPicks, udfaPlayerIds, signings, releases, generatedPlayerIds);
    }

    public OffseasonReport withExpirations(List<String> contractIds, List<String> freeAgentIds) {
        return new OffseasonReport(retiredPlayerIds, concat(voidedContractIds, contractIds),
                concat(newFreeAgentIds, freeAgentIds), coachingChanges, executedPicks, udfaPlayerIds, signings,
                releases, generatedPlayerIds);
    }

    public OffseasonReport withCoachingChanges(List<CoachingChange> changes) {
        return new OffseasonReport(retiredPlayerIds, voidedContractIds, newFreeAgentIds,
                concat(coachingChanges, changes), executedPicks, udfaPlayerIds, signings, releases, generatedPlayerIds);
    }

    public OffseasonReport withDraft(List<DraftPick> picks, List<String> udfaIds) {
        return new OffseasonReport(retiredPlayerIds, voidedContractIds, newFreeAgentIds, coachingChanges,
                concat(executedPicks, picks), concat(udfaPlayerIds, udfaIds), signings, releases, generatedPlayerIds);
    }

    public OffseasonReport withSignings(List<Signing> added) {
        return new OffseasonReport(retiredPlayerIds, voidedContractIds, newFreeAgentIds, coachingChanges,
                executedPicks, udfaPlayerIds, concat(signings, added), releases, generatedPlayerIds);
    }

    public OffseasonReport withRosterMaintenance(List<Release> cuts, List<String> generatedIds) {
        return new OffseasonReport(retiredPlayerIds, voidedContractIds, newFreeAgentIds, coachingChanges,
                executedPicks, udfaPlayerIds, signings, concat(releases, cuts), concat(generatedPlayerIds, generatedIds));
    }

    private static <T> List<T> concat(List<T> a, List<T> b) {
        if (b.isEmpty()) return a;
        List<T> out = new ArrayList<>(a.size() + b.size());
        out.addAll(a);
        out.addAll(b);
        return out;
    }
}
