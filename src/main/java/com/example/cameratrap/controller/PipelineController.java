package com.example.cameratrap.controller;

import com.example.cameratrap.model.IngestResponse;
import com.example.cameratrap.model.PipelineOutcome;
import com.example.cameratrap.model.StorageEvent;
import com.example.cameratrap.service.pipeline.PipelineDispatcher;
import com.example.cameratrap.service.pipeline.PipelineOrchestrator;
import com.example.cameratrap.service.pipeline.StorageNotificationParser;
import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/pipeline")
@Tag(name = "Pipeline", description = "Image ingestion and processing")
public class PipelineController {

    private static final Logger log = LoggerFactory.getLogger(PipelineController.class);

    private final StorageNotificationParser notificationParser;
    private final PipelineDispatcher dispatcher;
    private final PipelineOrchestrator orchestrator;

    public PipelineController(StorageNotificationParser notificationParser,
                              PipelineDispatcher dispatcher,
                              PipelineOrchestrator orchestrator) {
        this.notificationParser = notificationParser;
        this.dispatcher = dispatcher;
        this.orchestrator = orchestrator;
    }

    @PostMapping(value = "/events", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Accept an object storage notification",
            description = "Queues one pipeline invocation per record. Duplicate deliveries are detected by storage key.")
    public ResponseEntity<IngestResponse> ingest(@RequestBody JsonNode notification) {
        List<StorageEvent> events = notificationParser.parse(notification);
        dispatcher.dispatchAll(events);
        log.info("Accepted {} storage events", events.size());
        return ResponseEntity.accepted().body(new IngestResponse(events.stream().map(StorageEvent::key).toList()));
    }

    @PostMapping(value = "/process", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Process a single image synchronously")
    public ResponseEntity<PipelineOutcome> process(@Valid @RequestBody StorageEvent event) {
        return ResponseEntity.ok(orchestrator.process(event));
    }
}
