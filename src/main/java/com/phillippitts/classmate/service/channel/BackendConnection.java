package com.phillippitts.classmate.service.channel;

import com.phillippitts.classmate.exception.ConnectionException;

/**
 * One live connection to a transcription backend. Calls are made from a single thread at a time.
 */
public interface BackendConnection extends AutoCloseable {

    /**
     * Sends one block of PCM audio.
     *
     * @throws ConnectionException if the connection is broken
     */
    void sendAudio(byte[] pcm);

    /**
     * Asks the backend to finish recognition. The backend answers with a
     * {@link BackendMessage.Type#COMPLETED} message once every pending result was pushed.
     */
    void requestStop();

    boolean isOpen();

    /** Releases the connection. Never throws. */
    @Override
    void close();
}
