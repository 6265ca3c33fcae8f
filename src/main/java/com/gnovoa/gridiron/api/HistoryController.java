package com.gnovoa.gridiron.api;

import com.gnovoa.gridiron.api.dto.LeagueScheduleResponse;
import com.gnovoa.gridiron.api.dto.RunStatusResponse;
import com.gnovoa.gridiron.api.dto.SeasonSummaryResponse;
import com.gnovoa.gridiron.api.dto.StartRunRequest;
import com.gnovoa.gridiron.api.dto.TeamTableResponse;
import com.gnovoa.gridiron.runner.RunnerFacade;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.function.Supplier;

@RestController
@RequestMapping("/api/history/runs")
public class HistoryController {

    private final RunnerFacade facade;

    public HistoryController(RunnerFacade facade) {
        this.facade = facade;
    }

    @PostMapping
    public ResponseEntity<RunStatusResponse> start(@Valid @RequestBody(required = false) StartRunRequest request) {
        Integer years = request == null ? null : request.years();
        Long seed = request == null ? null : request.seed();
        try {
            return ResponseEntity.accepted().body(facade.start(years, seed));
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }
    }

    @GetMapping("/{runId}")
    public RunStatusResponse status(@PathVariable String runId) {
        return lookup(() -> facade.status(runId));
    }

    @PostMapping("/{runId}/cancel")
    public ResponseEntity<RunStatusResponse> cancel(@PathVariable String runId) {
        return ResponseEntity.accepted().body(lookup(() -> facade.cancel(runId)));
    }

    @GetMapping("/{runId}/seasons")
    public List<SeasonSummaryResponse> seasons(@PathVariable String runId) {
        return lookup(() -> facade.seasons(runId));
    }

    @GetMapping("/{runId}/schedule")
    public LeagueScheduleResponse schedule(@PathVariable String runId) {
        return lookup(() -> facade.schedule(runId));
    }

    @GetMapping("/{runId}/teams")
    public TeamTableResponse teams(@PathVariable String runId) {
        return lookup(() -> facade.teams(runId));
    }

    /** Unknown runs are 404, runs without a finished history 409. */
    private static <T> T lookup(Supplier<T> call) {
        try {
            return call.get();
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage(), e);
        } catch (IllegalStateException e) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, e.getMessage(), e);
        }
    }
}
