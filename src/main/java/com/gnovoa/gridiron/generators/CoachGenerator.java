package com.gnovoa.gridiron.generators;

import com.gnovoa.gridiron.model.Coach;
import com.gnovoa.gridiron.model.CoachRole;

public interface CoachGenerator {

    /** A new coach; a null team id yields an unemployed coach. */
    Coach generateCoach(CoachRole role, String teamId, int year);
}
