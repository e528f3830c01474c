package com.phillippitts.classmate.service.audio;

import com.phillippitts.classmate.domain.AudioFrame;
import com.phillippitts.classmate.exception.AudioCaptureException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.DataLine;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.Mixer;
import javax.sound.sampled.TargetDataLine;
import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * Java Sound microphone source producing PCM16LE mono @16kHz frames of
 * {@code audio.capture.chunk-millis} each. One instance per session.
 */
public class JavaSoundAudioSource implements AudioSource {

    private static final Logger LOG = LogManager.getLogger(JavaSoundAudioSource.class);

    /** Abstraction to open a TargetDataLine (for testing). */
    public interface DataLineProvider {
        TargetDataLine open(javax.sound.sampled.AudioFormat format, Optional<String> deviceName)
                throws LineUnavailableException;
    }

    private final int bytesPerChunk;
    private final String deviceName;
    private final DataLineProvider provider;

    private volatile TargetDataLine line;
    private volatile boolean closed;
    private long sequence = 0;

    public JavaSoundAudioSource(int chunkMillis, String deviceName) {
        this(chunkMillis, deviceName, defaultProvider());
    }

    // Package-private for tests
    JavaSoundAudioSource(int chunkMillis, String deviceName, DataLineProvider provider) {
        this.bytesPerChunk = PcmFormat.bytesPerChunk(chunkMillis);
        this.deviceName = deviceName;
        this.provider = Objects.requireNonNull(provider);
    }

    static DataLineProvider defaultProvider() {
        return (format, device) -> {
            TargetDataLine line = null;
            if (device.isPresent()) {
                for (Mixer.Info info : AudioSystem.getMixerInfo()) {
                    if (info.getName().equalsIgnoreCase(device.get())) {
                        Mixer m = AudioSystem.getMixer(info);
                        line = (TargetDataLine) m.getLine(new DataLine.Info(TargetDataLine.class, format));
                        break;
                    }
                }
            }
            if (line == null) {
                line = (TargetDataLine) AudioSystem.getLine(new DataLine.Info(TargetDataLine.class, format));
            }
            line.open(format);
            return line;
        };
    }

    @Override
    public void open() {
        try {
            TargetDataLine opened = provider.open(PcmFormat.javaSoundFormat(), Optional.ofNullable(deviceName));
            opened.start();
            line = opened;
            LOG.info("Microphone open: device='{}', frame={} bytes",
                    deviceName != null ? deviceName : "default", bytesPerChunk);
        } catch (LineUnavailableException e) {
            throw new AudioCaptureException("MIC_UNAVAILABLE", e);
        } catch (SecurityException e) {
            throw new AudioCaptureException("MIC_PERMISSION_DENIED", e);
        } catch (IllegalArgumentException e) {
            throw new AudioCaptureException("FORMAT_UNSUPPORTED", e);
        }
    }

    @Override
    public Optional<AudioFrame> nextFrame() {
        TargetDataLine current = line;
        if (current == null || closed) {
            return Optional.empty();
        }
        byte[] buf = new byte[bytesPerChunk];
        int filled = 0;
        while (filled < buf.length && !closed) {
            int n = current.read(buf, filled, buf.length - filled);
            if (n <= 0) {
                if (!current.isOpen()) {
                    break;
                }
                continue;
            }
            filled += n;
        }
        if (filled == 0) {
            return Optional.empty();
        }
        byte[] pcm = filled == buf.length ? buf : Arrays.copyOf(buf, filled);
        return Optional.of(new AudioFrame(pcm, sequence++, Instant.now()));
    }

    @Override
    public void close() {
        closed = true;
        TargetDataLine current = line;
        line = null;
        if (current == null) {
            return;
        }
        try {
            current.stop();
            current.close();
        } catch (RuntimeException e) {
            LOG.debug("Error releasing microphone: {}", e.getMessage());
        }
    }
}
