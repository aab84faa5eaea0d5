package com.coursegen.orchestrator.provider.live;

import com.coursegen.orchestrator.config.CourseGenProperties;
import com.coursegen.orchestrator.fallback.FailureKind;
import com.coursegen.orchestrator.provider.Prompt;
import com.coursegen.orchestrator.provider.ProviderException;
import com.coursegen.orchestrator.provider.TextProvider;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.List;
import java.util.Map;

/**
 * OpenAI chat completions.
 */
@Component
@ConditionalOnProperty(name = "coursegen.mode", havingValue = "live")
public class OpenAiTextProvider implements TextProvider {

    private static final Logger log = LoggerFactory.getLogger(OpenAiTextProvider.class);

    private static final URI    API_URL     = URI.create("https://api.openai.com/v1/chat/completions");
    private static final String MODEL       = "gpt-4";
    private static final double TEMPERATURE = 0.7;

    private final ProviderHttp        http;
    private final CourseGenProperties props;

    public OpenAiTextProvider(ProviderHttp http, CourseGenProperties props) {
        this.http  = http;
        this.props = props;
    }

    @Override
    public String name() {
        return "openai-chat";
    }

    @Override
    public String generate(Prompt prompt) {
        String apiKey = props.apiKeys().openai();
        if (apiKey.isEmpty()) throw ProviderException.missingCredential(name());

        log.debug("Requesting {} for '{}'", prompt.kind(), prompt.subject());
        JsonNode resp = http.postJson(name(), API_URL,
                Map.of("Authorization", "Bearer " + apiKey),
                Map.of("model",       MODEL,
                       "temperature", TEMPERATURE,
                       "messages",    List.of(Map.of("role", "user", "content", prompt.text()))),
                props.timeouts().text());

        JsonNode content = resp.path("choices").path(0).path("message").path("content");
        if (!content.isTextual() || content.asText().isBlank()) {
            throw new ProviderException(FailureKind.VALIDATION, "No message content in chat completion");
        }
        return content.asText();
    }
}
