package com.jreinhal.scrubber.config;

import com.jreinhal.scrubber.fusion.HttpRecognitionModel;
import com.jreinhal.scrubber.fusion.RecognitionCircuitBreaker;
import com.jreinhal.scrubber.fusion.RecognitionGateway;
import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Optional external recognition model. Disabled by default; with it off the pipeline is
 * rule-only and the executor is never used.
 */
@Configuration
public class RecognitionConfig {
    private static final Logger log = LoggerFactory.getLogger(RecognitionConfig.class);

    @Bean(name = {"recognitionExecutor"}, destroyMethod = "shutdownNow")
    public ThreadPoolExecutor recognitionExecutor(@Value("${scrubber.external-model.threads:4}") int threads,
                                                  @Value("${scrubber.external-model.queue-capacity:100}") int queueCapacity) {
        int size = Math.max(1, threads);
        ThreadPoolExecutor executor = new ThreadPoolExecutor(size, size, 30L, TimeUnit.SECONDS,
                new ArrayBlockingQueue<Runnable>(Math.max(1, queueCapacity)), new NamedThreadFactory("recognition-"),
                new ThreadPoolExecutor.AbortPolicy());
        executor.allowCoreThreadTimeOut(true);
        return executor;
    }

    @Bean
    public RecognitionGateway recognitionGateway(ThreadPoolExecutor recognitionExecutor,
                                                 @Value("${scrubber.external-model.enabled:false}") boolean enabled,
                                                 @Value("${scrubber.external-model.name:ner}") String name,
                                                 @Value("${scrubber.external-model.service-url:http://localhost:8091}") String serviceUrl,
                                                 @Value("${scrubber.external-model.timeout-ms:2000}") int timeoutMs,
                                                 @Value("${scrubber.external-model.failure-threshold:5}") int failureThreshold,
                                                 @Value("${scrubber.external-model.open-seconds:30}") int openSeconds) {
        if (!enabled) {
            log.info("External recognition model disabled; detection is rule-only");
            return RecognitionGateway.disabled();
        }
        log.info("External recognition model '{}' enabled at {} (timeout {}ms)", name, serviceUrl, timeoutMs);
        return new RecognitionGateway(new HttpRecognitionModel(name, serviceUrl, timeoutMs), recognitionExecutor, timeoutMs,
                new RecognitionCircuitBreaker(failureThreshold, Duration.ofSeconds(openSeconds)));
    }

    static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger(1);

        NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, this.prefix + this.counter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }
    }
}
