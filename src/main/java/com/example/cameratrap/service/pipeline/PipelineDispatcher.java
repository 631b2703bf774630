package com.example.cameratrap.service.pipeline;

import com.example.cameratrap.model.PipelineOutcome;
import com.example.cameratrap.model.StorageEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Runs each notification as an independent invocation on the pipeline worker pool.
 */
@Component
public class PipelineDispatcher {

    private static final Logger log = LoggerFactory.getLogger(PipelineDispatcher.class);

    private final PipelineOrchestrator orchestrator;
    private final TaskExecutor executor;

    public PipelineDispatcher(PipelineOrchestrator orchestrator, @Qualifier("pipelineExecutor") TaskExecutor executor) {
        this.orchestrator = orchestrator;
        this.executor = executor;
    }

    public List<CompletableFuture<PipelineOutcome>> dispatchAll(List<StorageEvent> events) {
        return events.stream().map(this::dispatch).toList();
    }

    public CompletableFuture<PipelineOutcome> dispatch(StorageEvent event) {
        return CompletableFuture.supplyAsync(() -> orchestrator.process(event), executor)
                .exceptionally(ex -> {
                    log.error("Invocation for {} ended before a claim was recorded", event.key(), ex);
                    return PipelineOutcome.abandoned(event.key(), null, ex.getMessage());
                });
    }
}
