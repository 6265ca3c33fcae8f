package com.gnovoa.gridiron.draft;

import java.util.List;

/** Draft order as far as standings and playoff results determine it; may be short or contain junk. */
public record PartialDraftOrder(int year, List<String> teamIds) {
    public PartialDraftOrder {
        teamIds = List.copyOf(teamIds);
    }
}
