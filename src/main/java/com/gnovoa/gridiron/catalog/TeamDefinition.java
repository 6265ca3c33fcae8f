package com.gnovoa.gridiron.catalog;

import com.gnovoa.gridiron.model.Conference;
import com.gnovoa.gridiron.model.Division;

/** Static identity of a franchise as configured in the team catalog. */
public record TeamDefinition(
    String teamId,
    String city,
    String nickname,
    String abbreviation,
    Conference conference,
    Division division) {}
