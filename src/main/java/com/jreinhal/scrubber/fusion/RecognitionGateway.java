package com.jreinhal.scrubber.fusion;

import com.jreinhal.scrubber.model.ExternalCandidate;
import com.jreinhal.scrubber.model.ExternalModelStatus;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the optional recognition model on a dedicated executor with a deadline.
 * Never throws: any failure yields {@link ExternalModelStatus#DEGRADED} and no candidates.
 */
public class RecognitionGateway {
    private static final Logger log = LoggerFactory.getLogger(RecognitionGateway.class);

    private final RecognitionModel model;
    private final ExecutorService executor;
    private final long timeoutMs;
    private final RecognitionCircuitBreaker circuitBreaker;

    public RecognitionGateway(RecognitionModel model, ExecutorService executor, long timeoutMs, RecognitionCircuitBreaker circuitBreaker) {
        this.model = model == null ? NoOpRecognitionModel.INSTANCE : model;
        this.executor = executor;
        this.timeoutMs = timeoutMs;
        this.circuitBreaker = circuitBreaker;
    }

    /**
     * Gateway for deployments without a recognition model.
     */
    public static RecognitionGateway disabled() {
        return new RecognitionGateway(NoOpRecognitionModel.INSTANCE, null, 0L, null);
    }

    /**
     * Recognizes entities in one unit. The no-op model reports {@link ExternalModelStatus#DISABLED}
     * without touching the executor.
     */
    public Outcome recognize(String content) {
        if (this.model instanceof NoOpRecognitionModel) {
            return Outcome.DISABLED;
        }
        if (!this.circuitBreaker.tryAcquire()) {
            log.debug("Recognition model {} short-circuited", this.model.name());
            return Outcome.DEGRADED;
        }
        Future<List<ExternalCandidate>> future;
        try {
            future = this.executor.submit(() -> this.model.recognize(content));
        } catch (RejectedExecutionException e) {
            this.circuitBreaker.onFailure();
            log.warn("Recognition model {} rejected: executor saturated", this.model.name());
            return Outcome.DEGRADED;
        }
        try {
            List<ExternalCandidate> candidates = future.get(this.timeoutMs, TimeUnit.MILLISECONDS);
            this.circuitBreaker.onSuccess();
            return new Outcome(usable(candidates), ExternalModelStatus.CONTRIBUTED);
        } catch (TimeoutException e) {
            future.cancel(true);
            this.circuitBreaker.onFailure();
            log.warn("Recognition model {} timed out after {}ms; continuing rule-only", this.model.name(), this.timeoutMs);
            return Outcome.DEGRADED;
        } catch (ExecutionException e) {
            this.circuitBreaker.onFailure();
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Recognition model {} failed; continuing rule-only: {}", this.model.name(), cause.getMessage());
            return Outcome.DEGRADED;
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return Outcome.DEGRADED;
        }
    }

    private List<ExternalCandidate> usable(List<ExternalCandidate> candidates) {
        if (candidates == null) {
            return List.of();
        }
        List<ExternalCandidate> usable = new ArrayList<ExternalCandidate>(candidates.size());
        for (ExternalCandidate candidate : candidates) {
            if (candidate != null && candidate.span() != null && FusionEngine.isUsableScore(candidate.score())) {
                usable.add(candidate);
            } else {
                log.debug("Recognition model {} returned an unusable candidate; dropped", this.model.name());
            }
        }
        return List.copyOf(usable);
    }

    public record Outcome(List<ExternalCandidate> candidates, ExternalModelStatus status) {
        static final Outcome DISABLED = new Outcome(List.of(), ExternalModelStatus.DISABLED);
        static final Outcome DEGRADED = new Outcome(List.of(), ExternalModelStatus.DEGRADED);

        /**
         * Status of an operation spanning several units: any degraded unit degrades the whole.
         */
        public static ExternalModelStatus combine(ExternalModelStatus a, ExternalModelStatus b) {
            if (a == ExternalModelStatus.DEGRADED || b == ExternalModelStatus.DEGRADED) {
                return ExternalModelStatus.DEGRADED;
            }
            if (a == ExternalModelStatus.CONTRIBUTED || b == ExternalModelStatus.CONTRIBUTED) {
                return ExternalModelStatus.CONTRIBUTED;
            }
            return ExternalModelStatus.DISABLED;
        }
    }
}
