package com.coursegen.orchestrator.stage;

import com.coursegen.orchestrator.content.NotebookWriter;
import com.coursegen.orchestrator.fallback.FallbackChain;
import com.coursegen.orchestrator.fallback.Producer;
import com.coursegen.orchestrator.fallback.ProducerInvoker;
import com.coursegen.orchestrator.fallback.ProducerResult;
import com.coursegen.orchestrator.fallback.TierPolicy;
import com.coursegen.orchestrator.model.LessonSpec;
import com.coursegen.orchestrator.model.StageArtifact;
import com.coursegen.orchestrator.model.StageName;
import com.coursegen.orchestrator.pipeline.CourseData;
import com.coursegen.orchestrator.pipeline.JobWorkspace;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;

/**
 * Stage 5: Jupyter notebooks, for coding lessons only.
 */
@Component
public class NotebookStage implements StageExecutor<Path> {

    private final NotebookWriter                     writer;
    private final FallbackChain<LessonContext, Path> chain;

    public NotebookStage(NotebookWriter writer, ProducerInvoker invoker) {
        this.writer = writer;
        this.chain = FallbackChain.<LessonContext, Path>builder("notebook", invoker)
                .tier(Producer.of("full-notebook", this::fullNotebook), TierPolicy.inline())
                .terminal("minimal-notebook", ctx -> {
                    try {
                        return writer.write(writer.minimal(ctx.lesson()), target(ctx));
                    } catch (IOException e) {
                        throw new UncheckedIOException(e);
                    }
                })
                .build();
    }

    @Override
    public StageName stage() {
        return StageName.NOTEBOOKS;
    }

    @Override
    public boolean appliesTo(LessonSpec lesson, CourseData course) {
        return lesson.hasCoding();
    }

    @Override
    public StageArtifact<Path> execute(LessonSpec lesson, CourseData course) {
        return chain.execute(new LessonContext(lesson, course)).toArtifact(lesson.id(), stage());
    }

    private ProducerResult<Path> fullNotebook(LessonContext ctx) {
        ObjectNode content = ctx.course().content().value(ctx.lesson().id()).orElse(null);
        if (content == null) {
            return ProducerResult.invalid("No lesson content to build a notebook from");
        }
        ObjectNode notebook = writer.full(ctx.lesson(), content);
        if (notebook == null) {
            return ProducerResult.invalid("Lesson content has no code examples or exercises");
        }
        try {
            return ProducerResult.ok(writer.write(notebook, target(ctx)));
        } catch (IOException e) {
            return ProducerResult.providerError("Cannot write notebook: " + e.getMessage());
        }
    }

    private static Path target(LessonContext ctx) {
        return ctx.course().workspace().dir(JobWorkspace.NOTEBOOKS).resolve(NotebookWriter.fileName(ctx.lesson()));
    }
}
