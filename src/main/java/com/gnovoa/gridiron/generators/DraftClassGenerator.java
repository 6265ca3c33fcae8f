package com.gnovoa.gridiron.generators;

import com.gnovoa.gridiron.model.Prospect;

import java.util.List;

public interface DraftClassGenerator {

    /** Prospects for the given draft year, best-graded first. */
    List<Prospect> generateDraftClass(int year);
}
