package com.gnovoa.gridiron.catalog;

import java.util.List;

/** Root of the team catalog JSON. */
public record LeagueDefinition(String league, List<TeamDefinition> teams) {}
