package com.gnovoa.gridiron.model;

/** Coach ids currently holding each role on a team. A null id is a vacancy. */
public record CoachingStaff(
    String headCoachId, String offensiveCoordinatorId, String defensiveCoordinatorId) {

  public static final CoachingStaff VACANT = new CoachingStaff(null, null, null);

  public String coachFor(CoachRole role) {
    if (role == CoachRole.HEAD_COACH) return headCoachId;
    if (role == CoachRole.OFFENSIVE_COORDINATOR) return offensiveCoordinatorId;
    return defensiveCoordinatorId;
  }

  public CoachingStaff with(CoachRole role, String coachId) {
    if (role == CoachRole.HEAD_COACH) {
      return new CoachingStaff(coachId, offensiveCoordinatorId, defensiveCoordinatorId);
    }
    if (role == CoachRole.OFFENSIVE_COORDINATOR) {
      return new CoachingStaff(headCoachId, coachId, defensiveCoordinatorId);
    }
    return new CoachingStaff(headCoachId, offensiveCoordinatorId, coachId);
  }
}
