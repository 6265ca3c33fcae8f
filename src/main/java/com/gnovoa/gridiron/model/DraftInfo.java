package com.gnovoa.gridiron.model;

/** Where a player was drafted. Undrafted players carry no draft info. */
public record DraftInfo(int year, int round, int overallPick, String teamId) {}
