package com.gnovoa.gridiron.history;

import com.gnovoa.gridiron.contracts.CapCalculator;
import com.gnovoa.gridiron.draft.DraftOrder;
import com.gnovoa.gridiron.draft.DraftOrderCalculator;
import com.gnovoa.gridiron.draft.DraftPickFactory;
import com.gnovoa.gridiron.generators.CoachGenerator;
import com.gnovoa.gridiron.generators.ContractGenerator;
import com.gnovoa.gridiron.generators.DraftClassGenerator;
import com.gnovoa.gridiron.generators.IdSequence;
import com.gnovoa.gridiron.generators.PlayerGenerator;
import com.gnovoa.gridiron.generators.RandomCoachGenerator;
import com.gnovoa.gridiron.generators.RandomContractGenerator;
import com.gnovoa.gridiron.generators.RandomDraftClassGenerator;
import com.gnovoa.gridiron.generators.RandomPlayerGenerator;
import com.gnovoa.gridiron.model.LeagueState;
import com.gnovoa.gridiron.model.Prospect;
import com.gnovoa.gridiron.offseason.OffseasonContext;
import com.gnovoa.gridiron.offseason.OffseasonProcessor;
import com.gnovoa.gridiron.offseason.OffseasonSettings;
import com.gnovoa.gridiron.playoffs.PlayoffGenerator;
import com.gnovoa.gridiron.playoffs.PlayoffSimulator;
import com.gnovoa.gridiron.schedule.RoundRobinScheduler;
import com.gnovoa.gridiron.schedule.ScheduleGenerator;
import com.gnovoa.gridiron.schedule.ScheduleValidator;
import com.gnovoa.gridiron.sim.QuickGameSimulator;
import com.gnovoa.gridiron.sim.RandomSource;
import com.gnovoa.gridiron.sim.SeasonSimulator;
import com.gnovoa.gridiron.sim.TeamStrengthCalculator;
import com.gnovoa.gridiron.standings.StandingsCalculator;

import java.util.ArrayList;
import java.util.List;

/**
 * Every season and offseason component of one simulation, all drawing from the same random source.
 *
 * <p>One engine belongs to one run. Id sequences continue after the ids already present in the
 * league they are created for, so a league can be simulated further without id clashes.
 */
public final class LeagueEngine {

    private final RandomSource rnd;
    private final OffseasonSettings settings;

    private final TeamStrengthCalculator strengths = new TeamStrengthCalculator();
    private final StandingsCalculator standings = new StandingsCalculator();
    private final PlayoffGenerator playoffs = new PlayoffGenerator();
    private final DraftOrderCalculator draftOrders = new DraftOrderCalculator();
    private final DraftPickFactory pickFactory = new DraftPickFactory();
    private final CapCalculator cap = new CapCalculator();

    private final QuickGameSimulator games;
    private final SeasonSimulator seasons;
    private final PlayoffSimulator playoffSimulator;
    private final ScheduleGenerator schedules;
    private final OffseasonProcessor offseason;

    private final PlayerGenerator players;
    private final DraftClassGenerator draftClasses;
    private final ContractGenerator contracts;
    private final CoachGenerator coaches;

    private LeagueEngine(RandomSource rnd, HistoryConfig config, LeagueState existing) {
        this.rnd = rnd;
        this.settings = config.settings();

        this.games = new QuickGameSimulator(rnd);
        this.seasons = new SeasonSimulator(rnd, games, strengths);
        this.playoffSimulator = new PlayoffSimulator(playoffs, games);
        this.schedules = new ScheduleGenerator(rnd, new RoundRobinScheduler(), new ScheduleValidator(), config.maxTeamsPerByeWeek());
        this.offseason = OffseasonProcessor.standard(pickFactory);

        List<String> prospectIds = new ArrayList<>(existing.players().keySet());
        for (Prospect p : existing.draftClass()) prospectIds.add(p.prospectId());

        this.players = new RandomPlayerGenerator(rnd, IdSequence.continuing("player", existing.players().keySet()));
        this.draftClasses = new RandomDraftClassGenerator(rnd, IdSequence.continuing("prospect", prospectIds), config.draftClassSize());
        this.contracts = new RandomContractGenerator(rnd);
        this.coaches = new RandomCoachGenerator(rnd, IdSequence.continuing("coach", existing.coaches().keySet()));
    }

    public static LeagueEngine create(RandomSource rnd, HistoryConfig config, LeagueState existing) {
        return new LeagueEngine(rnd, config, existing);
    }

    /** An engine for building a league from nothing. */
    public static LeagueEngine create(RandomSource rnd, HistoryConfig config) {
        return new LeagueEngine(rnd, config, new LeagueState(0, null, null, null, null, null, null, null, null));
    }

    public OffseasonContext offseasonContext(int completedYear, DraftOrder draftOrder) {
        return new OffseasonContext(completedYear, draftOrder, rnd, players, draftClasses, contracts, coaches, cap, settings);
    }

    public RandomSource rnd() { return rnd; }
    public OffseasonSettings settings() { return settings; }
    public TeamStrengthCalculator strengths() { return strengths; }
    public StandingsCalculator standings() { return standings; }
    public PlayoffGenerator playoffs() { return playoffs; }
    public PlayoffSimulator playoffSimulator() { return playoffSimulator; }
    public DraftOrderCalculator draftOrders() { return draftOrders; }
    public DraftPickFactory pickFactory() { return pickFactory; }
    public CapCalculator cap() { return cap; }
    public QuickGameSimulator games() { return games; }
    public SeasonSimulator seasons() { return seasons; }
    public ScheduleGenerator schedules() { return schedules; }
    public OffseasonProcessor offseason() { return offseason; }
    public PlayerGenerator players() { return players; }
    public DraftClassGenerator draftClasses() { return draftClasses; }
    public ContractGenerator contracts() { return contracts; }
    public CoachGenerator coaches() { return coaches; }
}
