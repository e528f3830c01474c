package com.phillippitts.classmate.service.audio;

/**
 * Creates the audio source for a new session.
 */
@FunctionalInterface
public interface AudioSourceFactory {

    AudioSource create();
}
