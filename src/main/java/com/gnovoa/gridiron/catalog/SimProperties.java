package com.gnovoa.gridiron.catalog;

import com.gnovoa.gridiron.history.HistoryConfig;
import com.gnovoa.gridiron.offseason.OffseasonSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * League rules and data locations under {@code sim.*}. Money is in thousands.
 *
 * @param prospectsConsidered how many of the best remaining prospects an AI pick weighs
 */
@ConfigurationProperties(prefix = "sim")
public record SimProperties(
    long salaryCap,
    int activeRosterLimit,
    int draftRounds,
    int draftClassSize,
    int prospectsConsidered,
    Schedule schedule,
    Teams teams) {

  public SimProperties {
    OffseasonSettings d = OffseasonSettings.DEFAULTS;
    if (salaryCap <= 0) salaryCap = d.salaryCap();
    if (activeRosterLimit <= 0) activeRosterLimit = d.rosterLimit();
    if (draftRounds <= 0) draftRounds = d.draftRounds();
    if (draftClassSize <= 0) draftClassSize = HistoryConfig.DEFAULT_DRAFT_CLASS_SIZE;
    if (prospectsConsidered <= 0) prospectsConsidered = d.prospectsConsidered();
    if (schedule == null) schedule = new Schedule(HistoryConfig.DEFAULT_MAX_TEAMS_PER_BYE_WEEK);
    if (teams == null) teams = new Teams(TeamCatalog.DEFAULT_RESOURCE);
  }

  public record Schedule(int maxTeamsPerByeWeek) {}

  public record Teams(String resource) {}

  public OffseasonSettings offseasonSettings() {
    return new OffseasonSettings(salaryCap, activeRosterLimit, draftRounds, prospectsConsidered);
  }

  public HistoryConfig historyConfig(int years) {
    return new HistoryConfig(
        years, offseasonSettings(), draftClassSize, schedule.maxTeamsPerByeWeek());
  }
}
