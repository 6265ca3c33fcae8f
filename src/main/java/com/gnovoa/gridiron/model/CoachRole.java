package com.gnovoa.gridiron.model;

public enum CoachRole {
  HEAD_COACH,
  OFFENSIVE_COORDINATOR,
  DEFENSIVE_COORDINATOR
}
