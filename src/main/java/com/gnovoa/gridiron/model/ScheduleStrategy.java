package com.gnovoa.gridiron.model;

/** How a season schedule was built. */
public enum ScheduleStrategy {
  FORMULA,
  RANDOMIZED_FALLBACK
}
