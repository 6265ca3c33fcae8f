package com.gnovoa.gridiron.offseason;

import com.gnovoa.gridiron.model.CoachRole;

/** A staff change; {@code outgoingCoachId} is null when a vacancy was filled. */
public record CoachingChange(String teamId, CoachRole role, String outgoingCoachId, String incomingCoachId, Reason reason) {

    public enum Reason {
        FIRED,
        CONTRACT_EXPIRED,
        VACANCY
    }
}
