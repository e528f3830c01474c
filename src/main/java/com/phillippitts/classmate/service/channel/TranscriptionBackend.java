package com.phillippitts.classmate.service.channel;

import com.phillippitts.classmate.exception.ConnectionException;

import java.util.function.Consumer;

/**
 * Streaming speech-recognition backend.
 *
 * <p>Implementations push every message they receive into {@code inbox}; they never call
 * into pipeline code directly. The inbox consumer must not block for long.
 */
public interface TranscriptionBackend {

    /** Configuration key selecting this backend. */
    String name();

    /**
     * Opens a streaming connection.
     *
     * @param config connection parameters
     * @param inbox receives normalized backend messages, called on a backend thread
     * @return live connection
     * @throws ConnectionException if the backend is unreachable or rejects the credentials
     */
    BackendConnection connect(ChannelConfig config, Consumer<BackendMessage> inbox);
}
