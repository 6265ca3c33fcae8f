package com.gnovoa.gridiron.offseason;

/** A free-agent signing and the cap hit it adds to the upcoming year. */
public record Signing(String playerId, String teamId, String contractId, long capHit, boolean minimumDeal) {}
