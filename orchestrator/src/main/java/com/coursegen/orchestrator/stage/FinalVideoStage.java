package com.coursegen.orchestrator.stage;

import com.coursegen.orchestrator.config.CourseGenProperties;
import com.coursegen.orchestrator.fallback.FallbackChain;
import com.coursegen.orchestrator.fallback.Producer;
import com.coursegen.orchestrator.fallback.ProducerInvoker;
import com.coursegen.orchestrator.fallback.ProducerResult;
import com.coursegen.orchestrator.fallback.TierPolicy;
import com.coursegen.orchestrator.media.MediaComposer;
import com.coursegen.orchestrator.media.MediaException;
import com.coursegen.orchestrator.model.LessonSpec;
import com.coursegen.orchestrator.model.StageArtifact;
import com.coursegen.orchestrator.model.StageName;
import com.coursegen.orchestrator.pipeline.CourseData;
import com.coursegen.orchestrator.pipeline.JobWorkspace;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Stage 9: final lesson video in {@code videos/}. The presenter video over
 * the lesson background; without a background (or if composition fails) the
 * presenter video is passed through unmodified.
 */
@Component
public class FinalVideoStage implements StageExecutor<Path> {

    private final FallbackChain<LessonContext, Path> chain;

    public FinalVideoStage(MediaComposer composer, ProducerInvoker invoker, CourseGenProperties props) {
        this.chain = FallbackChain.<LessonContext, Path>builder("final-video", invoker)
                .tier(Producer.of("overlay-" + composer.name(), ctx -> overlay(composer, ctx)),
                      TierPolicy.of(props.timeouts().compose()))
                .terminal("passthrough", ctx -> {
                    Path presenter = presenter(ctx);
                    return ArtifactFiles.copy(presenter, target(ctx, ArtifactFiles.extension(presenter, "mp4")));
                })
                .build();
    }

    @Override
    public StageName stage() {
        return StageName.FINAL_VIDEOS;
    }

    /** Lessons whose presenter video is missing have nothing to finish. */
    @Override
    public boolean appliesTo(LessonSpec lesson, CourseData course) {
        return course.presenterVideos().contains(lesson.id());
    }

    @Override
    public StageArtifact<Path> execute(LessonSpec lesson, CourseData course) {
        return chain.execute(new LessonContext(lesson, course)).toArtifact(lesson.id(), stage());
    }

    private static ProducerResult<Path> overlay(MediaComposer composer, LessonContext ctx) {
        Optional<Path> background = ctx.course().backgrounds().value(ctx.lesson().id());
        if (background.isEmpty()) {
            return ProducerResult.invalid("No background image for lesson " + ctx.lesson().number());
        }
        try {
            return ProducerResult.ok(composer.overlay(background.get(), presenter(ctx), target(ctx, "mp4")));
        } catch (MediaException e) {
            return ProducerResult.providerError(e.getMessage());
        }
    }

    private static Path presenter(LessonContext ctx) {
        return ctx.course().presenterVideos().value(ctx.lesson().id())
                .orElseThrow(() -> new IllegalStateException("No presenter video for lesson " + ctx.lesson().number()));
    }

    private static Path target(LessonContext ctx, String extension) {
        return ctx.course().workspace().dir(JobWorkspace.VIDEOS)
                .resolve(ArtifactFiles.name(ctx.lesson(), "final." + extension));
    }
}
