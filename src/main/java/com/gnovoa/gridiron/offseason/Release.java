package com.gnovoa.gridiron.offseason;

/** A roster cut. Unamortised bonus becomes dead cap in the upcoming year. */
public record Release(String playerId, String teamId, String contractId, long deadCap) {}
