package com.coursegen.orchestrator.media;

import javax.sound.sampled.AudioFileFormat;
import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Synthetic speech stand-in: a quiet sine tone as 16-bit mono WAV.
 */
public class WaveformSynthesizer {

    public static final float  SAMPLE_RATE  = 16_000f;
    public static final double MIN_SECONDS  = 1.0;
    public static final double MAX_SECONDS  = 120.0;

    private static final double FREQUENCY_HZ = 220.0;
    private static final double AMPLITUDE    = 0.2;

    /** @param seconds clamped to [{@value #MIN_SECONDS}, {@value #MAX_SECONDS}] */
    public byte[] tone(double seconds) {
        double length = Math.max(MIN_SECONDS, Math.min(MAX_SECONDS, seconds));
        int frames = (int) (length * SAMPLE_RATE);
        byte[] pcm = new byte[frames * 2];
        for (int i = 0; i < frames; i++) {
            // short fade in/out so the clip does not click
            double envelope = Math.min(1.0, Math.min(i, frames - i) / (SAMPLE_RATE * 0.05));
            short sample = (short) (Math.sin(2 * Math.PI * FREQUENCY_HZ * i / SAMPLE_RATE)
                    * AMPLITUDE * envelope * Short.MAX_VALUE);
            pcm[2 * i]     = (byte) (sample & 0xff);
            pcm[2 * i + 1] = (byte) ((sample >> 8) & 0xff);
        }

        AudioFormat format = new AudioFormat(SAMPLE_RATE, 16, 1, true, false);
        try (AudioInputStream in = new AudioInputStream(new ByteArrayInputStream(pcm), format, frames);
             ByteArrayOutputStream out = new ByteArrayOutputStream(pcm.length + 64)) {
            AudioSystem.write(in, AudioFileFormat.Type.WAVE, out);
            return out.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException("WAV encoding failed", e);
        }
    }
}
