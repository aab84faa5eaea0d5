package com.coursegen.orchestrator.provider.live;

import com.coursegen.orchestrator.config.CourseGenProperties;
import com.coursegen.orchestrator.fallback.FailureKind;
import com.coursegen.orchestrator.provider.ProviderException;
import com.coursegen.orchestrator.provider.VideoProvider;
import com.coursegen.orchestrator.provider.VideoStatus;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.time.Duration;
import java.util.Map;

/**
 * D-ID talking-presenter API: {@code POST /talks}, then {@code GET /talks/{id}}
 * until the talk is done or errored. The API key is sent as Basic credentials.
 */
@Component
@ConditionalOnProperty(name = "coursegen.mode", havingValue = "live")
public class DidVideoProvider implements VideoProvider {

    private static final Logger log = LoggerFactory.getLogger(DidVideoProvider.class);

    private static final String BASE_URL = "https://api.d-id.com";

    private final ProviderHttp        http;
    private final CourseGenProperties props;

    public DidVideoProvider(ProviderHttp http, CourseGenProperties props) {
        this.http  = http;
        this.props = props;
    }

    @Override
    public String name() {
        return "d-id";
    }

    @Override
    public String submit(String script, String avatarRef) {
        String apiKey = props.apiKeys().did();
        if (apiKey.isEmpty()) throw ProviderException.missingCredential(name());
        if (avatarRef == null || avatarRef.isBlank()) {
            throw new ProviderException(FailureKind.CONFIGURATION, "No presenter image configured for " + name());
        }

        JsonNode resp = http.postJson(name(), URI.create(BASE_URL + "/talks"), auth(apiKey),
                Map.of("source_url", avatarRef,
                       "script",     Map.of("type", "text", "input", script)),
                props.timeouts().videoSubmit());

        String id = resp.path("id").asText("");
        if (id.isBlank()) {
            throw new ProviderException(FailureKind.VALIDATION, "No talk id in D-ID response");
        }
        log.info("D-ID talk {} submitted", id);
        return id;
    }

    @Override
    public VideoStatus poll(String jobId) {
        JsonNode resp = http.getJson(name(), URI.create(BASE_URL + "/talks/" + jobId),
                auth(props.apiKeys().did()), Duration.ofSeconds(30));
        String status = resp.path("status").asText("");
        return switch (status) {
            case "done"  -> {
                String url = resp.path("result_url").asText("");
                yield url.isBlank() ? VideoStatus.error("Talk done without result_url") : VideoStatus.done(url);
            }
            case "error", "rejected" -> VideoStatus.error(resp.path("error").path("description")
                    .asText(resp.path("error").path("message").asText("Unknown error")));
            default -> VideoStatus.pending();
        };
    }

    private static Map<String, String> auth(String apiKey) {
        return Map.of("Authorization", "Basic " + apiKey);
    }
}
