package com.coursegen.orchestrator.stage;

import com.coursegen.orchestrator.config.CourseGenProperties;
import com.coursegen.orchestrator.content.Prompts;
import com.coursegen.orchestrator.fallback.ChainResult;
import com.coursegen.orchestrator.fallback.FallbackChain;
import com.coursegen.orchestrator.fallback.Producer;
import com.coursegen.orchestrator.fallback.ProducerInvoker;
import com.coursegen.orchestrator.fallback.TierPolicy;
import com.coursegen.orchestrator.media.ImageRenderer;
import com.coursegen.orchestrator.model.LessonId;
import com.coursegen.orchestrator.model.StageArtifact;
import com.coursegen.orchestrator.model.StageName;
import com.coursegen.orchestrator.pipeline.CourseData;
import com.coursegen.orchestrator.pipeline.JobWorkspace;
import com.coursegen.orchestrator.provider.ImageProvider;
import com.coursegen.orchestrator.provider.ProviderCalls;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Stage 7: course thumbnail under {@code marketing/}.
 */
@Component
public class ThumbnailStage implements CourseStageExecutor<Path> {

    public static final String FILE_NAME = "thumbnail.png";

    private final FallbackChain<CourseData, byte[]> chain;

    public ThumbnailStage(ImageProvider images, ImageRenderer renderer,
                          ProducerInvoker invoker, CourseGenProperties props) {
        this.chain = FallbackChain.<CourseData, byte[]>builder("course-thumbnail", invoker)
                .tier(Producer.of(images.name(), course -> ProviderCalls.attempt(() -> images.generate(
                              Prompts.thumbnail(course.curriculum(), course.description().orElse("")), "1024x1024"))),
                      TierPolicy.of(props.timeouts().image(), props.retry().maxAttempts()))
                .terminal("rendered-thumbnail", course -> renderer.thumbnail(
                        course.courseTitle(), course.curriculum().difficulty() + " course"))
                .build();
    }

    @Override
    public StageName stage() {
        return StageName.COURSE_THUMBNAIL;
    }

    @Override
    public StageArtifact<Path> execute(CourseData course) {
        ChainResult<byte[]> result = chain.execute(course);
        Path file = ArtifactFiles.write(course.workspace().dir(JobWorkspace.MARKETING).resolve(FILE_NAME), result.value());
        return result.toArtifact(LessonId.COURSE, stage(), file);
    }
}
