package com.phillippitts.classmate.service.orchestration;

import com.phillippitts.classmate.domain.AudioFrame;
import com.phillippitts.classmate.exception.ChannelClosedException;
import com.phillippitts.classmate.service.audio.AudioSource;
import com.phillippitts.classmate.service.bus.EventBus;
import com.phillippitts.classmate.service.bus.Topic;
import com.phillippitts.classmate.service.channel.TranscriptionChannel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Dedicated thread moving frames from the audio source to the bus and the transcription
 * channel. While paused, frames are read and discarded so the device does not overrun.
 */
final class AudioPump {

    private static final Logger LOG = LogManager.getLogger(AudioPump.class);

    private final UUID sessionId;
    private final AudioSource source;
    private final TranscriptionChannel channel;
    private final EventBus bus;
    private final Thread thread;

    private volatile boolean paused;
    private volatile boolean stopping;
    private volatile long forwarded;
    private volatile long discarded;

    AudioPump(UUID sessionId, AudioSource source, TranscriptionChannel channel, EventBus bus) {
        this.sessionId = sessionId;
        this.source = source;
        this.channel = channel;
        this.bus = bus;
        this.thread = new Thread(this::run, "audio-pump");
        this.thread.setDaemon(true);
    }

    void start() {
        thread.start();
    }

    void setPaused(boolean paused) {
        this.paused = paused;
    }

    boolean isPaused() {
        return paused;
    }

    /** Releases the source and waits for the pump thread to exit. */
    void stop(Duration timeout) {
        stopping = true;
        source.close();
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (thread.isAlive()) {
            LOG.warn("Audio pump did not stop within {} ms; interrupting", timeout.toMillis());
            thread.interrupt();
        }
    }

    long forwarded() {
        return forwarded;
    }

    long discarded() {
        return discarded;
    }

    private void run() {
        ThreadContext.put("sessionId", sessionId.toString());
        try {
            while (!stopping) {
                Optional<AudioFrame> next = source.nextFrame();
                if (next.isEmpty()) {
                    if (!stopping) {
                        LOG.warn("Audio source reached end of stream");
                    }
                    break;
                }
                if (paused) {
                    discarded++;
                    continue;
                }
                AudioFrame frame = next.get();
                bus.publish(Topic.AUDIO_FRAME, frame);
                try {
                    channel.sendAudio(frame);
                    forwarded++;
                } catch (ChannelClosedException e) {
                    LOG.debug("Channel closed; audio pump exiting");
                    break;
                }
            }
        } catch (RuntimeException e) {
            LOG.error("Audio pump failed", e);
        } finally {
            LOG.info("Audio pump stopped (forwarded={}, discarded={})", forwarded, discarded);
            ThreadContext.remove("sessionId");
        }
    }
}
