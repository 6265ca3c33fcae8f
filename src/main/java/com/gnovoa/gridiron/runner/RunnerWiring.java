package com.gnovoa.gridiron.runner;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gnovoa.gridiron.catalog.SimProperties;
import com.gnovoa.gridiron.catalog.TeamCatalog;
import com.gnovoa.gridiron.history.LeagueHistorySimulator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RunnerWiring {

    @Bean
    public TeamCatalog teamCatalog(ObjectMapper mapper, SimProperties simProps) {
        return new TeamCatalog(mapper, simProps);
    }

    @Bean
    public LeagueHistorySimulator leagueHistorySimulator() {
        return new LeagueHistorySimulator();
    }
}
