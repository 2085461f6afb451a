package com.jreinhal.scrubber.fusion;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.jreinhal.scrubber.model.ExternalCandidate;
import com.jreinhal.scrubber.model.ExternalModelStatus;
import com.jreinhal.scrubber.model.Span;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class RecognitionGatewayTest {
    private final ExecutorService executor = Executors.newSingleThreadExecutor();

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void disabledGatewayReportsDisabled() {
        RecognitionGateway gateway = RecognitionGateway.disabled();

        RecognitionGateway.Outcome outcome = gateway.recognize("text");

        assertEquals(ExternalModelStatus.DISABLED, outcome.status());
        assertTrue(outcome.candidates().isEmpty());
    }

    @Test
    void noOpModelNeverReachesTheExecutor() {
        ExecutorService unused = mock(ExecutorService.class);
        RecognitionGateway gateway = new RecognitionGateway(NoOpRecognitionModel.INSTANCE, unused, 1000,
                new RecognitionCircuitBreaker(3, Duration.ofSeconds(30)));

        assertEquals(ExternalModelStatus.DISABLED, gateway.recognize("Jan Peeters").status());
        verifyNoInteractions(unused);
    }

    @Test
    void candidatesWithScoresOutsideUnitRangeAreDropped() {
        RecognitionModel model = mock(RecognitionModel.class);
        when(model.name()).thenReturn("stub");
        when(model.recognize("Jan Peeters")).thenReturn(List.of(
                new ExternalCandidate("PER", new Span(0, 3), 1.5),
                new ExternalCandidate("PER", new Span(0, 3), Double.NaN),
                new ExternalCandidate("PER", new Span(0, 3), -0.2),
                new ExternalCandidate("PER", new Span(4, 11), 0.88)));
        RecognitionGateway gateway = new RecognitionGateway(model, executor, 1000, new RecognitionCircuitBreaker(3, Duration.ofSeconds(30)));

        RecognitionGateway.Outcome outcome = gateway.recognize("Jan Peeters");

        assertEquals(ExternalModelStatus.CONTRIBUTED, outcome.status());
        assertEquals(1, outcome.candidates().size());
        assertEquals(0.88, outcome.candidates().get(0).score(), 1e-9);
    }

    @Test
    void successfulCallContributes() {
        RecognitionModel model = mock(RecognitionModel.class);
        when(model.name()).thenReturn("stub");
        when(model.recognize("Jan Peeters")).thenReturn(List.of(new ExternalCandidate("PER", new Span(0, 11), 0.93)));
        RecognitionGateway gateway = new RecognitionGateway(model, executor, 1000, new RecognitionCircuitBreaker(3, Duration.ofSeconds(30)));

        RecognitionGateway.Outcome outcome = gateway.recognize("Jan Peeters");

        assertEquals(ExternalModelStatus.CONTRIBUTED, outcome.status());
        assertEquals(1, outcome.candidates().size());
    }

    @Test
    void failureDegradesWithoutThrowing() {
        RecognitionModel model = mock(RecognitionModel.class);
        when(model.name()).thenReturn("stub");
        when(model.recognize(anyString())).thenThrow(new IllegalStateException("connection refused"));
        RecognitionGateway gateway = new RecognitionGateway(model, executor, 1000, new RecognitionCircuitBreaker(3, Duration.ofSeconds(30)));

        RecognitionGateway.Outcome outcome = gateway.recognize("text");

        assertEquals(ExternalModelStatus.DEGRADED, outcome.status());
        assertTrue(outcome.candidates().isEmpty());
    }

    @Test
    void timeoutDegrades() throws InterruptedException {
        CountDownLatch release = new CountDownLatch(1);
        RecognitionModel slow = new RecognitionModel() {
            @Override
            public String name() {
                return "slow";
            }

            @Override
            public List<ExternalCandidate> recognize(String content) {
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return List.of(new ExternalCandidate("PER", new Span(0, 1), 0.9));
            }
        };
        RecognitionGateway gateway = new RecognitionGateway(slow, executor, 50, new RecognitionCircuitBreaker(3, Duration.ofSeconds(30)));

        RecognitionGateway.Outcome outcome = gateway.recognize("x");
        release.countDown();

        assertEquals(ExternalModelStatus.DEGRADED, outcome.status());
    }

    @Test
    void openCircuitSkipsTheModel() {
        RecognitionModel model = mock(RecognitionModel.class);
        when(model.name()).thenReturn("stub");
        RecognitionCircuitBreaker breaker = new RecognitionCircuitBreaker(1, Duration.ofMinutes(5));
        breaker.onFailure();
        RecognitionGateway gateway = new RecognitionGateway(model, executor, 1000, breaker);

        assertEquals(ExternalModelStatus.DEGRADED, gateway.recognize("text").status());
        verify(model, never()).recognize(anyString());
    }

    @Test
    void combinedStatus() {
        assertEquals(ExternalModelStatus.DEGRADED,
                RecognitionGateway.Outcome.combine(ExternalModelStatus.CONTRIBUTED, ExternalModelStatus.DEGRADED));
        assertEquals(ExternalModelStatus.CONTRIBUTED,
                RecognitionGateway.Outcome.combine(ExternalModelStatus.DISABLED, ExternalModelStatus.CONTRIBUTED));
        assertEquals(ExternalModelStatus.DISABLED,
                RecognitionGateway.Outcome.combine(ExternalModelStatus.DISABLED, ExternalModelStatus.DISABLED));
    }
}
