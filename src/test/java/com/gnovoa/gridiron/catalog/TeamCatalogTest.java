package com.gnovoa.gridiron.catalog;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gnovoa.gridiron.model.Conference;
import com.gnovoa.gridiron.model.Division;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TeamCatalogTest {

  private final ObjectMapper mapper = new ObjectMapper();

  @Test
  @DisplayName("Bundled catalog has 32 teams in eight divisions of four")
  void loadsBundledCatalog() {
    TeamCatalog catalog = new TeamCatalog(mapper, TeamCatalog.DEFAULT_RESOURCE);

    assertThat(catalog.teams()).hasSize(32);
    assertThat(catalog.leagueName()).isNotBlank();
    for (Conference c : Conference.values()) {
      for (Division d : Division.values()) {
        assertThat(catalog.teams())
            .filteredOn(t -> t.conference() == c && t.division() == d)
            .hasSize(4);
      }
    }
    String first = catalog.teams().get(0).teamId();
    assertThat(catalog.team(first).teamId()).isEqualTo(first);
  }

  @Test
  @DisplayName("Location comes from sim.teams.resource")
  void loadsFromProperties() {
    SimProperties props = new SimProperties(0, 0, 0, 0, 0, null, null);

    assertThat(new TeamCatalog(mapper, props).teams()).hasSize(32);
  }

  @Test
  @DisplayName("Unknown team ids are rejected")
  void unknownTeam() {
    TeamCatalog catalog = new TeamCatalog(mapper, TeamCatalog.DEFAULT_RESOURCE);

    assertThatThrownBy(() -> catalog.team("nope")).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisplayName("A missing catalog fails fast")
  void missingResource() {
    assertThatThrownBy(() -> new TeamCatalog(mapper, "classpath:league/missing.json"))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("missing.json");
  }

  @Test
  @DisplayName("A catalog without 32 teams is invalid")
  void wrongTeamCount() {
    assertThatThrownBy(() -> new TeamCatalog(mapper, "classpath:league/too-few-teams.json"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("exactly 32");
  }
}
