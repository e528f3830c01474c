package com.phillippitts.classmate.service.audio;

import com.phillippitts.classmate.config.properties.AudioCaptureProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import javax.sound.sampled.AudioSystem;

/**
 * Default {@link AudioSourceFactory}: one Java Sound microphone source per session.
 */
@Component
public class JavaSoundAudioSourceFactory implements AudioSourceFactory {

    private static final Logger LOG = LogManager.getLogger(JavaSoundAudioSourceFactory.class);

    private final AudioCaptureProperties props;

    public JavaSoundAudioSourceFactory(AudioCaptureProperties props) {
        this.props = props;
    }

    @PostConstruct
    public void logSystemInfo() {
        String device = props.getDeviceName() != null ? props.getDeviceName() : "default";
        LOG.info("Audio capture initialized: OS={}, arch={}, device='{}', available-mixers={}, chunk={}ms",
                System.getProperty("os.name"), System.getProperty("os.arch"), device,
                AudioSystem.getMixerInfo().length, props.getChunkMillis());
    }

    @Override
    public AudioSource create() {
        return new JavaSoundAudioSource(props.getChunkMillis(), props.getDeviceName());
    }
}
