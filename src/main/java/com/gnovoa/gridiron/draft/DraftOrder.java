package com.gnovoa.gridiron.draft;

import java.util.HashSet;
import java.util.List;

/**
 * Complete draft order, worst team first. {@code toppedUp} lists the teams the fallback had to
 * append.
 */
public record DraftOrder(int year, List<String> teamIds, List<String> toppedUp) {

    public DraftOrder {
        teamIds = List.copyOf(teamIds);
        toppedUp = List.copyOf(toppedUp);
        if (new HashSet<>(teamIds).size() != teamIds.size()) {
            throw new IllegalArgumentException("Draft order " + year + " contains duplicates");
        }
    }

    public int size() { return teamIds.size(); }

    /** 1-based pick position of a team in every round. */
    public int positionOf(String teamId) {
        return teamIds.indexOf(teamId) + 1;
    }

    public boolean usedFallback() { return !toppedUp.isEmpty(); }
}
