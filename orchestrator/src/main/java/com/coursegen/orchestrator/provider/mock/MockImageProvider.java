package com.coursegen.orchestrator.provider.mock;

import com.coursegen.orchestrator.media.ImageRenderer;
import com.coursegen.orchestrator.provider.ImageProvider;
import com.coursegen.orchestrator.provider.Prompt;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Renders images locally instead of calling an image API.
 */
@Component
@ConditionalOnProperty(name = "coursegen.mode", havingValue = "mock", matchIfMissing = true)
public class MockImageProvider implements ImageProvider {

    private final ImageRenderer renderer;

    public MockImageProvider(ImageRenderer renderer) {
        this.renderer = renderer;
    }

    @Override
    public String name() {
        return "mock-images";
    }

    @Override
    public byte[] generate(Prompt prompt, String size) {
        return renderer.background(prompt.subject(), prompt.subject().hashCode());
    }
}
