package com.gnovoa.gridiron.sim;

/** Team-level box score numbers, enough for injury and news consumers. */
public record BoxScore(int homeYards, int awayYards, int homeTurnovers, int awayTurnovers) {}
