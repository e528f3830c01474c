package com.phillippitts.classmate.exception;

import com.phillippitts.classmate.domain.SessionState;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionHierarchyTest {

    @Test
    void classmateExceptionShouldIncludeCause() {
        IOException cause = new IOException("IO failure");
        ClassmateException ex = new ClassmateException("wrapper error", cause);

        assertThat(ex.getMessage()).isEqualTo("wrapper error");
        assertThat(ex.getCause()).isEqualTo(cause);
    }

    @Test
    void connectionExceptionShouldIncludeBackendName() {
        ConnectionException ex = new ConnectionException("handshake refused", "websocket");

        assertThat(ex.getMessage()).contains("handshake refused");
        assertThat(ex.getBackendName()).isEqualTo("websocket");
        assertThat(ex).isInstanceOf(ClassmateException.class);
    }

    @Test
    void protocolExceptionShouldIncludeSegmentId() {
        TranscriptProtocolException ex = new TranscriptProtocolException("out of order", "s-7");

        assertThat(ex.getSegmentId()).isEqualTo("s-7");
    }

    @Test
    void analysisExceptionShouldIncludeAnalyzer() {
        AnalysisException ex = new AnalysisException("timeout", "answer");

        assertThat(ex.getAnalyzer()).isEqualTo("answer");
        assertThat(ex).isInstanceOf(ClassmateException.class);
    }

    @Test
    void unknownQuestionExceptionShouldIncludeQuestionId() {
        UnknownQuestionException ex = new UnknownQuestionException("q-9");

        assertThat(ex.getQuestionId()).isEqualTo("q-9");
        assertThat(ex.getMessage()).contains("q-9");
        assertThat(ex).isInstanceOf(ClassmateException.class);
    }

    @Test
    void nothingToAnalyzeExceptionShouldIncludeAnalyzer() {
        NothingToAnalyzeException ex = new NothingToAnalyzeException("Summaries are disabled", "summary");

        assertThat(ex.getAnalyzer()).isEqualTo("summary");
        assertThat(ex).isInstanceOf(ClassmateException.class);
    }

    @Test
    void persistenceExceptionShouldIncludeTarget() {
        Path target = Path.of("data", "meta.json");
        PersistenceException ex = new PersistenceException("disk full", target, new IOException("ENOSPC"));

        assertThat(ex.getTarget()).isEqualTo(target);
        assertThat(ex.getCause()).isInstanceOf(IOException.class);
    }

    @Test
    void invalidTransitionShouldDescribeStateAndAction() {
        InvalidStateTransitionException ex = new InvalidStateTransitionException(SessionState.CREATED, "end");

        assertThat(ex.getMessage()).isEqualTo("Cannot end a session in state CREATED");
        assertThat(ex.getFrom()).isEqualTo(SessionState.CREATED);
        assertThat(ex.getAction()).isEqualTo("end");
    }

    @Test
    void invalidTransitionWithoutSessionShouldHaveNoState() {
        InvalidStateTransitionException ex = new InvalidStateTransitionException("start");

        assertThat(ex.getMessage()).isEqualTo("No session to start");
        assertThat(ex.getFrom()).isNull();
    }

    @Test
    void audioCaptureExceptionShouldIncludeReason() {
        AudioCaptureException ex = new AudioCaptureException("MIC_UNAVAILABLE", new IllegalStateException());

        assertThat(ex.getReason()).isEqualTo("MIC_UNAVAILABLE");
        assertThat(ex.getMessage()).contains("MIC_UNAVAILABLE");
    }

    @Test
    void channelClosedShouldBeApplicationException() {
        assertThat(new ChannelClosedException("closed")).isInstanceOf(ClassmateException.class);
    }
}
