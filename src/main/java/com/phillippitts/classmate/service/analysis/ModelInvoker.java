package com.phillippitts.classmate.service.analysis;

import com.phillippitts.classmate.config.properties.AnalysisProperties;
import com.phillippitts.classmate.exception.AnalysisException;
import com.phillippitts.classmate.service.metrics.PipelineMetrics;
import com.phillippitts.classmate.util.Backoff;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs model calls with a per-call timeout and bounded retries with exponential backoff.
 */
@Component
public class ModelInvoker {

    private static final Logger LOG = LogManager.getLogger(ModelInvoker.class);

    private final AnalyzerBackend backend;
    private final Executor executor;
    private final PipelineMetrics metrics;
    private final long callTimeoutMs;
    private final long retryBaseMs;
    private final long retryMaxMs;

    public ModelInvoker(AnalyzerBackend backend,
                        @Qualifier("modelExecutor") Executor executor,
                        AnalysisProperties properties,
                        PipelineMetrics metrics) {
        this.backend = backend;
        this.executor = executor;
        this.metrics = metrics;
        this.callTimeoutMs = properties.getCallTimeoutMs();
        this.retryBaseMs = properties.getRetryBaseMs();
        this.retryMaxMs = Math.max(properties.getRetryBaseMs(), properties.getRetryMaxMs());
    }

    /**
     * Calls the model up to {@code maxAttempts} times.
     *
     * @return reply text of the first successful attempt
     * @throws AnalysisException carrying the last failure once attempts are exhausted
     */
    public String invoke(CompletionRequest request, int maxAttempts) {
        Backoff backoff = Backoff.ofMillis(retryBaseMs, retryMaxMs, Math.max(1, maxAttempts));
        AnalysisException last = null;
        for (int attempt = 0; backoff.allowsAnother(attempt); attempt++) {
            if (attempt > 0 && !backoff.sleep(attempt - 1)) {
                throw new AnalysisException("Interrupted between retries", request.kind().label(), last);
            }
            try {
                return invokeOnce(request);
            } catch (AnalysisException e) {
                last = e;
                LOG.warn("{} model call attempt {}/{} failed: {}", request.kind().label(), attempt + 1,
                        backoff.maxAttempts(), e.getMessage());
            }
        }
        throw last;
    }

    /**
     * Single call bounded by the configured timeout.
     */
    public String invokeOnce(CompletionRequest request) {
        String analyzer = request.kind().label();
        long start = System.nanoTime();
        CompletableFuture<String> call = CompletableFuture.supplyAsync(() -> backend.complete(request), executor);
        try {
            String reply = call.get(callTimeoutMs, TimeUnit.MILLISECONDS);
            metrics.recordModelLatency(analyzer, System.nanoTime() - start);
            return reply;
        } catch (TimeoutException e) {
            call.cancel(true);
            metrics.incrementAnalysisFailure(analyzer, "timeout");
            throw new AnalysisException("Model call timed out after " + callTimeoutMs + "ms", analyzer, e);
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            throw new AnalysisException("Interrupted waiting for model", analyzer, e);
        } catch (ExecutionException e) {
            metrics.incrementAnalysisFailure(analyzer, "error");
            Throwable cause = e.getCause();
            if (cause instanceof AnalysisException analysisException) {
                throw analysisException;
            }
            throw new AnalysisException("Model call failed: " + cause, analyzer, cause);
        }
    }

    public String backendName() {
        return backend.name();
    }
}
