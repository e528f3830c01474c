package com.phillippitts.classmate.service.audio;

/**
 * Single source of truth for the streamed audio format.
 * Required: 16 kHz, 16-bit signed PCM, mono, little-endian.
 */
public final class PcmFormat {

    /** Required sample rate in Hz. */
    public static final int SAMPLE_RATE = 16_000;
    /** Required bits per sample. */
    public static final int BITS_PER_SAMPLE = 16;
    /** Required number of channels (mono). */
    public static final int CHANNELS = 1;

    /** Signed PCM flag for Java Sound. */
    public static final boolean SIGNED = true;
    /** Endian flag for Java Sound (false = little-endian). */
    public static final boolean BIG_ENDIAN = false;

    /** Bytes per PCM frame (sample for all channels). */
    public static final int BLOCK_ALIGN = (BITS_PER_SAMPLE / 8) * CHANNELS;   // 2 bytes
    /** Bytes per second. */
    public static final int BYTE_RATE = SAMPLE_RATE * BLOCK_ALIGN;            // 32,000

    private PcmFormat() {}

    /** Size in bytes of one frame covering {@code chunkMillis} of audio. */
    public static int bytesPerChunk(int chunkMillis) {
        return (chunkMillis * BYTE_RATE) / 1000;
    }

    public static javax.sound.sampled.AudioFormat javaSoundFormat() {
        return new javax.sound.sampled.AudioFormat(SAMPLE_RATE, BITS_PER_SAMPLE, CHANNELS, SIGNED, BIG_ENDIAN);
    }
}
