package com.phillippitts.classmate.service.channel;

import com.phillippitts.classmate.exception.ConnectionException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * Transcription backend speaking the header/payload JSON dialect over a WebSocket.
 * Audio is sent as binary frames; results arrive as text frames.
 */
@Component
public class WebSocketTranscriptionBackend implements TranscriptionBackend {

    private static final Logger LOG = LogManager.getLogger(WebSocketTranscriptionBackend.class);
    private static final String NAME = "websocket";
    private static final long SEND_TIMEOUT_MS = 5_000;

    private final HttpClient httpClient;

    public WebSocketTranscriptionBackend() {
        this(HttpClient.newHttpClient());
    }

    WebSocketTranscriptionBackend(HttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public BackendConnection connect(ChannelConfig config, Consumer<BackendMessage> inbox) {
        if (config.url().isBlank()) {
            throw new ConnectionException("No transcription endpoint configured", NAME);
        }
        URI uri;
        try {
            uri = URI.create(config.url());
        } catch (IllegalArgumentException e) {
            throw new ConnectionException("Invalid transcription endpoint " + config.url(), NAME, e);
        }
        Listener listener = new Listener(inbox);
        WebSocket.Builder builder = httpClient.newWebSocketBuilder().connectTimeout(config.connectTimeout());
        if (!config.apiKey().isBlank()) {
            builder.header("Authorization", "Bearer " + config.apiKey());
        }
        WebSocket socket;
        try {
            socket = builder.buildAsync(uri, listener)
                    .get(config.connectTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConnectionException("Interrupted while connecting", NAME, e);
        } catch (ExecutionException | TimeoutException e) {
            throw new ConnectionException("Cannot connect to " + uri.getHost(), NAME, e);
        }
        Connection connection = new Connection(socket, config.appKey());
        connection.sendText(TranscriptMessageParser.command("StartTranscription", config.appKey(),
                System.currentTimeMillis()));
        LOG.info("Transcription stream connected to {}", uri.getHost());
        return connection;
    }

    private static final class Connection implements BackendConnection {
        private final WebSocket socket;
        private final String appKey;

        Connection(WebSocket socket, String appKey) {
            this.socket = socket;
            this.appKey = appKey;
        }

        @Override
        public void sendAudio(byte[] pcm) {
            await(socket.sendBinary(ByteBuffer.wrap(pcm), true));
        }

        @Override
        public void requestStop() {
            sendText(TranscriptMessageParser.command("StopTranscription", appKey, System.currentTimeMillis()));
        }

        void sendText(String text) {
            await(socket.sendText(text, true));
        }

        private void await(CompletionStage<WebSocket> stage) {
            try {
                stage.toCompletableFuture().get(SEND_TIMEOUT_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ConnectionException("Interrupted while sending", NAME, e);
            } catch (ExecutionException | TimeoutException e) {
                throw new ConnectionException("Send failed", NAME, e);
            }
        }

        @Override
        public boolean isOpen() {
            return !socket.isOutputClosed() && !socket.isInputClosed();
        }

        @Override
        public void close() {
            if (!socket.isOutputClosed()) {
                socket.sendClose(WebSocket.NORMAL_CLOSURE, "done")
                        .exceptionally(t -> {
                            LOG.debug("Close handshake failed: {}", t.getMessage());
                            return null;
                        });
            }
            socket.abort();
        }
    }

    private static final class Listener implements WebSocket.Listener {
        private final Consumer<BackendMessage> inbox;
        private final TranscriptMessageParser parser = new TranscriptMessageParser();
        private final StringBuilder partial = new StringBuilder();

        Listener(Consumer<BackendMessage> inbox) {
            this.inbox = inbox;
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            partial.append(data);
            if (last) {
                String message = partial.toString();
                partial.setLength(0);
                parser.parse(message).ifPresent(inbox);
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            inbox.accept(BackendMessage.disconnected("closed " + statusCode + " " + reason));
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            inbox.accept(BackendMessage.disconnected(String.valueOf(error.getMessage())));
        }
    }
}
