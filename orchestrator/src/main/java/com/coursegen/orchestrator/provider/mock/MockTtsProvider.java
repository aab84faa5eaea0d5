package com.coursegen.orchestrator.provider.mock;

import com.coursegen.orchestrator.media.WaveformSynthesizer;
import com.coursegen.orchestrator.provider.TtsProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Returns a short synthetic tone instead of speech.
 */
@Component
@ConditionalOnProperty(name = "coursegen.mode", havingValue = "mock", matchIfMissing = true)
public class MockTtsProvider implements TtsProvider {

    private static final double SECONDS = 2.0;

    private final WaveformSynthesizer synthesizer;

    public MockTtsProvider(WaveformSynthesizer synthesizer) {
        this.synthesizer = synthesizer;
    }

    @Override
    public String name() {
        return "mock-tts";
    }

    @Override
    public String audioFormat() {
        return "wav";
    }

    @Override
    public byte[] synthesize(String text) {
        return synthesizer.tone(SECONDS);
    }
}
