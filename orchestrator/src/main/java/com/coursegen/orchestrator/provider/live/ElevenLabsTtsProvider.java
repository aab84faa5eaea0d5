package com.coursegen.orchestrator.provider.live;

import com.coursegen.orchestrator.config.CourseGenProperties;
import com.coursegen.orchestrator.provider.ProviderException;
import com.coursegen.orchestrator.provider.TtsProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.Map;

/**
 * ElevenLabs neural text-to-speech; answers with MP3 audio.
 */
@Component
@ConditionalOnProperty(name = "coursegen.mode", havingValue = "live")
public class ElevenLabsTtsProvider implements TtsProvider {

    private static final String BASE_URL = "https://api.elevenlabs.io/v1/text-to-speech/";
    private static final String MODEL    = "eleven_monolingual_v1";

    private final ProviderHttp        http;
    private final CourseGenProperties props;

    public ElevenLabsTtsProvider(ProviderHttp http, CourseGenProperties props) {
        this.http  = http;
        this.props = props;
    }

    @Override
    public String name() {
        return "elevenlabs";
    }

    @Override
    public String audioFormat() {
        return "mp3";
    }

    @Override
    public byte[] synthesize(String text) {
        String apiKey = props.apiKeys().elevenlabs();
        if (apiKey.isEmpty()) throw ProviderException.missingCredential(name());

        return http.postForBytes(name(), URI.create(BASE_URL + props.speech().voice()),
                Map.of("xi-api-key", apiKey, "Accept", "audio/mpeg"),
                Map.of("text",     text,
                       "model_id", MODEL,
                       "voice_settings", Map.of("stability", 0.5, "similarity_boost", 0.5)),
                props.timeouts().speech());
    }
}
