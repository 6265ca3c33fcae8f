package com.gnovoa.gridiron.catalog;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gnovoa.gridiron.model.Conference;
import com.gnovoa.gridiron.model.Division;
import java.io.InputStream;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;

/**
 * Loads and validates the league's franchises.
 *
 * <p>The catalog location is configured via {@code sim.teams.resource} (any Spring resource
 * location, {@code classpath:} by default) and must be JSON matching {@link LeagueDefinition}.
 *
 * <p>Teams are kept in memory in file order. The catalog is constructed once at application startup
 * and fails fast if the file is missing or invalid.
 */
public final class TeamCatalog {

  public static final String DEFAULT_RESOURCE = "classpath:league/teams.json";
  public static final int TEAM_COUNT = 32;
  public static final int TEAMS_PER_DIVISION = 4;

  private final String leagueName;

  /** Teams by id, in file order. */
  private final Map<String, TeamDefinition> teams = new LinkedHashMap<>();

  /**
   * Loads the configured catalog.
   *
   * @param mapper Jackson mapper used to deserialize the JSON catalog
   * @param props simulation properties (includes the catalog location)
   * @throws IllegalStateException if the catalog cannot be read or parsed
   * @throws IllegalArgumentException if the catalog content is invalid (team count, division
   *     layout, duplicate ids)
   */
  public TeamCatalog(ObjectMapper mapper, SimProperties props) {
    this(mapper, props.teams().resource());
  }

  /**
   * @param location Spring resource location of the catalog JSON
   */
  public TeamCatalog(ObjectMapper mapper, String location) {
    Resource resource = new DefaultResourceLoader().getResource(location);
    LeagueDefinition league;
    try (InputStream in = resource.getInputStream()) {
      league = mapper.readValue(in, LeagueDefinition.class);
    } catch (Exception e) {
      throw new IllegalStateException("Failed to load team catalog from " + location, e);
    }
    validate(league, location);
    this.leagueName = league.league();
    league.teams().forEach(t -> teams.put(t.teamId(), t));
  }

  public String leagueName() {
    return leagueName;
  }

  /** All teams in catalog order. */
  public List<TeamDefinition> teams() {
    return List.copyOf(teams.values());
  }

  /**
   * @throws IllegalArgumentException if no team has this id
   */
  public TeamDefinition team(String teamId) {
    TeamDefinition t = teams.get(teamId);
    if (t == null) throw new IllegalArgumentException("Unknown team " + teamId);
    return t;
  }

  /**
   * Validates the catalog:
   *
   * <ul>
   *   <li>Exactly 32 teams with unique, non-blank ids
   *   <li>Every team names a conference and a division
   *   <li>Every conference has four divisions of exactly four teams
   * </ul>
   */
  private void validate(LeagueDefinition league, String location) {
    if (league.teams() == null || league.teams().size() != TEAM_COUNT) {
      throw new IllegalArgumentException(
          "Catalog must have exactly " + TEAM_COUNT + " teams (" + location + ")");
    }
    Set<String> ids = new HashSet<>();
    Map<String, Integer> perDivision = new LinkedHashMap<>();
    for (TeamDefinition t : league.teams()) {
      if (t.teamId() == null || t.teamId().isBlank()) {
        throw new IllegalArgumentException("Team without id in " + location);
      }
      if (!ids.add(t.teamId())) {
        throw new IllegalArgumentException("Duplicate team id " + t.teamId() + " in " + location);
      }
      if (t.conference() == null || t.division() == null) {
        throw new IllegalArgumentException(
            "Team " + t.teamId() + " needs a conference and a division (" + location + ")");
      }
      perDivision.merge(t.conference() + " " + t.division(), 1, Integer::sum);
    }
    for (Conference c : Conference.values()) {
      for (Division d : Division.values()) {
        int count = perDivision.getOrDefault(c + " " + d, 0);
        if (count != TEAMS_PER_DIVISION) {
          throw new IllegalArgumentException(
              c + " " + d + " has " + count + " teams, expected " + TEAMS_PER_DIVISION + " (" + location + ")");
        }
      }
    }
  }
}
