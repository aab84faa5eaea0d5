package com.coursegen.orchestrator.provider.mock;

import com.coursegen.orchestrator.fallback.FailureKind;
import com.coursegen.orchestrator.provider.ProviderException;
import com.coursegen.orchestrator.provider.VideoProvider;
import com.coursegen.orchestrator.provider.VideoStatus;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Video service stand-in: every talk is done on first poll and points at a
 * small local file.
 */
@Component
@ConditionalOnProperty(name = "coursegen.mode", havingValue = "mock", matchIfMissing = true)
public class MockVideoProvider implements VideoProvider {

    private final Map<String, String> scripts = new ConcurrentHashMap<>();

    @Override
    public String name() {
        return "mock-video";
    }

    @Override
    public String submit(String script, String avatarRef) {
        String id = "mock-talk-" + UUID.randomUUID();
        scripts.put(id, script);
        return id;
    }

    @Override
    public VideoStatus poll(String jobId) {
        String script = scripts.remove(jobId);
        if (script == null) {
            return VideoStatus.error("Unknown talk " + jobId);
        }
        try {
            Path file = Files.createTempFile("coursegen-mock-talk-", ".mp4");
            file.toFile().deleteOnExit();
            Files.writeString(file, "MOCK PRESENTER VIDEO\n" + script, StandardCharsets.UTF_8);
            return VideoStatus.done(file.toUri().toString());
        } catch (IOException e) {
            throw new ProviderException(FailureKind.PROVIDER, "Mock video write failed", e);
        }
    }
}
