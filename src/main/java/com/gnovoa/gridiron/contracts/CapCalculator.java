package com.gnovoa.gridiron.contracts;

import com.gnovoa.gridiron.model.Contract;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/** Cap usage is the sum of a team's contract cap hits for one year. */
public final class CapCalculator {

    public long capUsage(String teamId, Collection<Contract> contracts, int year) {
        long sum = 0;
        for (Contract c : contracts) {
            if (teamId.equals(c.teamId())) sum += c.capHitFor(year);
        }
        return sum;
    }

    /** Cap usage of every team in one pass. */
    public Map<String, Long> capUsageByTeam(Collection<String> teamIds, Collection<Contract> contracts, int year) {
        Map<String, Long> usage = new LinkedHashMap<>();
        for (String id : teamIds) usage.put(id, 0L);
        for (Contract c : contracts) {
            if (c.teamId() != null && usage.containsKey(c.teamId())) usage.merge(c.teamId(), c.capHitFor(year), Long::sum);
        }
        return usage;
    }

    /** Money already committed {@code yearsOut} years after {@code year}. */
    public long futureCommitment(String teamId, Collection<Contract> contracts, int year, int yearsOut) {
        return capUsage(teamId, contracts, year + yearsOut);
    }
}
