package com.phillippitts.classmate.service.channel;

import com.phillippitts.classmate.domain.AudioFrame;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FrameBufferTest {

    private static AudioFrame frame(long sequence) {
        return new AudioFrame(new byte[]{(byte) sequence}, sequence, Instant.now());
    }

    @Test
    void shouldDropOldestWhenFull() {
        FrameBuffer buffer = new FrameBuffer(3);

        for (long i = 0; i < 5; i++) {
            buffer.add(frame(i));
        }

        assertThat(buffer.drain()).extracting(AudioFrame::sequence).containsExactly(2L, 3L, 4L);
        assertThat(buffer.dropped()).isEqualTo(2);
        assertThat(buffer.size()).isZero();
    }

    @Test
    void shouldRequeueUnsentFramesAtHead() {
        FrameBuffer buffer = new FrameBuffer(4);
        List<AudioFrame> unsent = List.of(frame(1), frame(2));
        buffer.add(frame(3));

        buffer.requeue(unsent);

        assertThat(buffer.drain()).extracting(AudioFrame::sequence).containsExactly(1L, 2L, 3L);
    }

    @Test
    void shouldTrimOldestAfterRequeueOverflow() {
        FrameBuffer buffer = new FrameBuffer(2);
        buffer.add(frame(3));

        buffer.requeue(List.of(frame(1), frame(2)));

        assertThat(buffer.drain()).extracting(AudioFrame::sequence).containsExactly(2L, 3L);
        assertThat(buffer.dropped()).isEqualTo(1);
    }

    @Test
    void shouldRejectNonPositiveCapacity() {
        assertThatThrownBy(() -> new FrameBuffer(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
