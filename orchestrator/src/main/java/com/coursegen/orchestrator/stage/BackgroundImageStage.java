package com.coursegen.orchestrator.stage;

import com.coursegen.orchestrator.config.CourseGenProperties;
import com.coursegen.orchestrator.content.Prompts;
import com.coursegen.orchestrator.fallback.ChainResult;
import com.coursegen.orchestrator.fallback.FallbackChain;
import com.coursegen.orchestrator.fallback.Producer;
import com.coursegen.orchestrator.fallback.ProducerInvoker;
import com.coursegen.orchestrator.fallback.TierPolicy;
import com.coursegen.orchestrator.media.ImageRenderer;
import com.coursegen.orchestrator.model.LessonSpec;
import com.coursegen.orchestrator.model.StageArtifact;
import com.coursegen.orchestrator.model.StageName;
import com.coursegen.orchestrator.pipeline.CourseData;
import com.coursegen.orchestrator.pipeline.JobWorkspace;
import com.coursegen.orchestrator.provider.ImageProvider;
import com.coursegen.orchestrator.provider.ProviderCalls;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Stage 6: video background per lesson. Generated image, else a flat-colour
 * slide with the lesson title.
 */
@Component
public class BackgroundImageStage implements StageExecutor<Path> {

    static final String SIZE = "1792x1024";

    private final FallbackChain<LessonContext, byte[]> chain;

    public BackgroundImageStage(ImageProvider images, ImageRenderer renderer,
                                ProducerInvoker invoker, CourseGenProperties props) {
        this.chain = FallbackChain.<LessonContext, byte[]>builder("background-image", invoker)
                .tier(Producer.of(images.name(), ctx -> ProviderCalls.attempt(() -> images.generate(
                              Prompts.backgroundImage(ctx.lesson(), ctx.course().courseTitle()), SIZE))),
                      TierPolicy.of(props.timeouts().image(), props.retry().maxAttempts()))
                .terminal("rendered-background",
                          ctx -> renderer.background(ctx.lesson().title(), ctx.lesson().number()))
                .build();
    }

    @Override
    public StageName stage() {
        return StageName.BACKGROUND_IMAGES;
    }

    @Override
    public StageArtifact<Path> execute(LessonSpec lesson, CourseData course) {
        ChainResult<byte[]> result = chain.execute(new LessonContext(lesson, course));
        Path file = ArtifactFiles.write(course.workspace().dir(JobWorkspace.BACKGROUNDS)
                .resolve(ArtifactFiles.name(lesson, "background.png")), result.value());
        return result.toArtifact(lesson.id(), stage(), file);
    }

    @Override
    public boolean pacesAfter(StageArtifact<Path> artifact) {
        return artifact.tier() == 1;
    }
}
