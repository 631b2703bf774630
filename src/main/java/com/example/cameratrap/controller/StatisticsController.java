package com.example.cameratrap.controller;

import com.example.cameratrap.domain.LocationStatistics;
import com.example.cameratrap.domain.SpeciesStatistics;
import com.example.cameratrap.model.ConservationStatus;
import com.example.cameratrap.model.OverviewStatistics;
import com.example.cameratrap.model.RefreshSummary;
import com.example.cameratrap.service.statistics.StatisticsQueryService;
import com.example.cameratrap.service.statistics.StatisticsRefresher;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/statistics")
@Tag(name = "Statistics", description = "Aggregates per species and per camera location")
public class StatisticsController {

    private final StatisticsRefresher refresher;
    private final StatisticsQueryService queryService;

    public StatisticsController(StatisticsRefresher refresher, StatisticsQueryService queryService) {
        this.refresher = refresher;
        this.queryService = queryService;
    }

    @PostMapping("/refresh")
    @Operation(summary = "Recompute the aggregate tables now")
    public ResponseEntity<RefreshSummary> refresh() {
        return ResponseEntity.ok(refresher.refresh());
    }

    @GetMapping("/species")
    @Operation(summary = "Species ordered by number of detections", description = "Reflects the last refresh.")
    public ResponseEntity<List<SpeciesStatistics>> species(
            @RequestParam(value = "conservation_status", required = false) ConservationStatus conservationStatus,
            @RequestParam(value = "limit", defaultValue = "50") int limit,
            @RequestParam(value = "offset", defaultValue = "0") int offset) {
        return ResponseEntity.ok(queryService.species(conservationStatus, limit, offset));
    }

    @GetMapping("/locations")
    @Operation(summary = "Camera locations ordered by number of detections", description = "Reflects the last refresh.")
    public ResponseEntity<List<LocationStatistics>> locations() {
        return ResponseEntity.ok(queryService.locations());
    }

    @GetMapping("/overview")
    @Operation(summary = "Live totals over images, detections, species and locations")
    public ResponseEntity<OverviewStatistics> overview() {
        return ResponseEntity.ok(queryService.overview());
    }
}
