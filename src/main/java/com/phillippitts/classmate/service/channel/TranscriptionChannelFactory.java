package com.phillippitts.classmate.service.channel;

import com.phillippitts.classmate.config.properties.TranscriptionProperties;
import com.phillippitts.classmate.exception.ConnectionException;
import com.phillippitts.classmate.service.bus.EventBus;
import com.phillippitts.classmate.service.metrics.PipelineMetrics;
import com.phillippitts.classmate.util.Backoff;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Opens {@link TranscriptionChannel}s against the backend selected by
 * {@code classmate.transcription.backend}.
 */
@Component
public class TranscriptionChannelFactory {

    private final TranscriptionBackend backend;
    private final TranscriptionProperties properties;
    private final EventBus bus;
    private final PipelineMetrics metrics;
    private final TaskScheduler scheduler;

    public TranscriptionChannelFactory(List<TranscriptionBackend> backends,
                                       TranscriptionProperties properties,
                                       EventBus bus,
                                       PipelineMetrics metrics,
                                       @Qualifier("pipelineScheduler") TaskScheduler scheduler) {
        this.properties = properties;
        this.bus = bus;
        this.metrics = metrics;
        this.scheduler = scheduler;
        String wanted = properties.getBackend().name().toLowerCase(Locale.ROOT);
        this.backend = backends.stream()
                .filter(b -> b.name().equalsIgnoreCase(wanted))
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("No transcription backend named " + wanted));
    }

    /** Builds the connection parameters for a session from configuration. */
    public ChannelConfig configFor(UUID sessionId) {
        return new ChannelConfig(sessionId, properties.getUrl(), properties.getAppKey(), properties.getApiKey(),
                properties.getLanguage(), properties.getSampleRate(),
                Duration.ofMillis(properties.getConnectTimeoutMs()));
    }

    /**
     * Opens a channel and starts its receiver thread.
     *
     * @throws ConnectionException if the backend is unreachable or rejects the credentials
     */
    public TranscriptionChannel open(ChannelConfig config) {
        TranscriptionProperties.Reconnect reconnect = properties.getReconnect();
        TranscriptionChannel channel = new TranscriptionChannel(config, backend, bus, metrics, scheduler,
                Backoff.ofMillis(reconnect.getBaseDelayMs(), reconnect.getMaxDelayMs(), reconnect.getMaxAttempts()),
                Duration.ofMillis(properties.getDrainTimeoutMs()),
                properties.getBufferFrames(),
                properties.getInboxCapacity());
        channel.open();
        return channel;
    }

    public String backendName() {
        return backend.name();
    }
}
