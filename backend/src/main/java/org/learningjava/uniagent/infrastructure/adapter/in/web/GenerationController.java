package org.learningjava.uniagent.infrastructure.adapter.in.web;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.learningjava.uniagent.application.usecase.GenerateGameUseCase;
import org.learningjava.uniagent.application.usecase.GenerateGameUseCase.GenerationPlan;
import org.learningjava.uniagent.domain.model.generation.GenerationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

@RestController
@RequestMapping("/generations")
public class GenerationController {

    private static final Logger log = LoggerFactory.getLogger(GenerationController.class);

    private final GenerateGameUseCase useCase;
    private final GenerationJobRegistry jobs;
    private final Executor executor;

    public GenerationController(GenerateGameUseCase useCase,
                                GenerationJobRegistry jobs,
                                @Qualifier("applicationTaskExecutor") Executor executor) {
        this.useCase = useCase;
        this.jobs = jobs;
        this.executor = executor;
    }

    public record GenerationRequest(@NotBlank String topic, String provider, String model, Integer maxRounds) {}

    @PostMapping
    public Map<String, Object> start(@Valid @RequestBody GenerationRequest req) {
        GenerationPlan plan;
        try {
            plan = useCase.plan(req.topic(), req.provider(), req.model(), req.maxRounds());
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }

        String jobId = jobs.start(plan.maxRounds());
        try {
            submit(jobId, plan);
        } catch (RejectedExecutionException e) {
            jobs.fail(jobId, "Rejected: generation queue is full");
            log.warn("[{}] Generation rejected: {}", jobId, e.toString());
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "Generation queue is full, retry later", e);
        }

        return Map.of("jobId", jobId);
    }

    private void submit(String jobId, GenerationPlan plan) {
        executor.execute(() -> {
            try {
                log.info("[{}] Generation start: provider={}, model={}, topic='{}'",
                        jobId, plan.provider(), plan.model(), plan.topic());
                GenerationResult result = useCase.generate(plan,
                        (round, maxRounds) -> jobs.roundStarted(jobId, round, maxRounds));
                jobs.done(jobId, result);
                log.info("[{}] Generation done: {} after {} round(s)", jobId, result.outcome(), result.roundsUsed());
            } catch (Exception e) {
                jobs.fail(jobId, e.getMessage());
                log.error("[{}] Generation failed: {}", jobId, e.toString(), e);
            }
        });
    }

    @GetMapping("/{id}")
    public GenerationJobRegistry.JobStatus status(@PathVariable("id") String id) {
        GenerationJobRegistry.JobStatus status = jobs.get(id);
        if (status == null) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown job: " + id);
        }
        return status;
    }

    @GetMapping("/providers")
    public Set<String> providers() {
        return useCase.providers();
    }
}
