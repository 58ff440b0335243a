package org.learningjava.uniagent.infrastructure.adapter.in.web;

import org.learningjava.uniagent.domain.model.generation.GenerationResult;
import org.learningjava.uniagent.domain.model.generation.Outcome;
import org.learningjava.uniagent.domain.model.generation.TokenUsage;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/** In-memory status of background generation runs, keyed by job id. */
@Component
public class GenerationJobRegistry {

    public enum JobState { RUNNING, DONE, FAILED }

    public record JobStatus(
            String id,
            JobState state,
            String message,
            int round,
            int maxRounds,
            Outcome outcome,
            String document,
            TokenUsage usage
    ) {}

    private final Map<String, JobStatus> jobs = new ConcurrentHashMap<>();

    public String start(int maxRounds) {
        String id = UUID.randomUUID().toString();
        jobs.put(id, initial(id, Math.max(maxRounds, 0)));
        return id;
    }

    public void roundStarted(String id, int round, int maxRounds) {
        jobs.compute(id, (k, j) -> {
            JobStatus cur = j != null ? j : initial(id, maxRounds);
            return new JobStatus(id, JobState.RUNNING, "Round " + round + "/" + maxRounds,
                    round, maxRounds, null, null, cur.usage());
        });
    }

    /** A run that ended (finalized or exhausted) is DONE; the outcome tells which. */
    public void done(String id, GenerationResult result) {
        jobs.compute(id, (k, j) -> {
            JobStatus cur = j != null ? j : initial(id, result.roundsUsed());
            return new JobStatus(id, JobState.DONE, "Finished: " + result.outcome(),
                    result.roundsUsed(), cur.maxRounds(), result.outcome(), result.document(), result.usage());
        });
    }

    public void fail(String id, String message) {
        jobs.compute(id, (k, j) -> {
            JobStatus cur = j != null ? j : initial(id, 0);
            return new JobStatus(id, JobState.FAILED, message != null ? message : "Failed",
                    cur.round(), cur.maxRounds(), null, null, cur.usage());
        });
    }

    public JobStatus get(String id) {
        return jobs.get(id);
    }

    private static JobStatus initial(String id, int maxRounds) {
        return new JobStatus(id, JobState.RUNNING, "Started", 0, maxRounds, null, null, TokenUsage.ZERO);
    }
}
