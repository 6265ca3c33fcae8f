package com.gnovoa.gridiron.draft;

import com.gnovoa.gridiron.model.DraftPick;

import java.util.ArrayList;
import java.util.List;

public final class DraftPickFactory {

    /** Every round follows the same order; no trades are modelled, so original and current owner match. */
    public List<DraftPick> createPicks(DraftOrder order, int draftYear, int rounds) {
        List<DraftPick> picks = new ArrayList<>(rounds * order.size());
        int overall = 0;
        for (int round = 1; round <= rounds; round++) {
            for (int i = 0; i < order.size(); i++) {
                overall++;
                String teamId = order.teamIds().get(i);
                picks.add(new DraftPick("pick-" + draftYear + "-" + overall, draftYear, round, i + 1, overall,
                        teamId, teamId, null, List.of()));
            }
        }
        return picks;
    }
}
