package com.gnovoa.gridiron.sim;

/** Aggregate offense and defense ratings of a team, each bounded to [20, 95]. */
public record TeamStrength(String teamId, double offense, double defense) {}
