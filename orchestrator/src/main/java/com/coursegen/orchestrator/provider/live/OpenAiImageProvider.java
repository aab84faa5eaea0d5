package com.coursegen.orchestrator.provider.live;

import com.coursegen.orchestrator.config.CourseGenProperties;
import com.coursegen.orchestrator.fallback.FailureKind;
import com.coursegen.orchestrator.provider.ImageProvider;
import com.coursegen.orchestrator.provider.Prompt;
import com.coursegen.orchestrator.provider.ProviderException;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.Map;

/**
 * OpenAI image generation. The API answers with a short-lived URL, which is
 * downloaded straight away.
 */
@Component
@ConditionalOnProperty(name = "coursegen.mode", havingValue = "live")
public class OpenAiImageProvider implements ImageProvider {

    private static final URI    API_URL = URI.create("https://api.openai.com/v1/images/generations");
    private static final String MODEL   = "dall-e-3";

    private final ProviderHttp        http;
    private final CourseGenProperties props;

    public OpenAiImageProvider(ProviderHttp http, CourseGenProperties props) {
        this.http  = http;
        this.props = props;
    }

    @Override
    public String name() {
        return "openai-images";
    }

    @Override
    public byte[] generate(Prompt prompt, String size) {
        String apiKey = props.apiKeys().openai();
        if (apiKey.isEmpty()) throw ProviderException.missingCredential(name());

        JsonNode resp = http.postJson(name(), API_URL,
                Map.of("Authorization", "Bearer " + apiKey),
                Map.of("model",   MODEL,
                       "prompt",  prompt.text(),
                       "size",    size,
                       "quality", "standard",
                       "n",       1),
                props.timeouts().image());

        String url = resp.path("data").path(0).path("url").asText("");
        if (url.isBlank()) {
            throw new ProviderException(FailureKind.VALIDATION, "Image response carried no URL");
        }
        return http.getBytes(name(), URI.create(url), props.timeouts().image());
    }
}
