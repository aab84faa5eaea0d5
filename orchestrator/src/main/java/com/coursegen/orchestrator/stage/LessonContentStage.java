package com.coursegen.orchestrator.stage;

import com.coursegen.orchestrator.config.CourseGenProperties;
import com.coursegen.orchestrator.content.ContentRepairer;
import com.coursegen.orchestrator.content.LessonTemplates;
import com.coursegen.orchestrator.content.Prompts;
import com.coursegen.orchestrator.fallback.ChainResult;
import com.coursegen.orchestrator.fallback.FallbackChain;
import com.coursegen.orchestrator.fallback.Producer;
import com.coursegen.orchestrator.fallback.ProducerInvoker;
import com.coursegen.orchestrator.fallback.ProducerResult;
import com.coursegen.orchestrator.fallback.TierPolicy;
import com.coursegen.orchestrator.model.LessonSpec;
import com.coursegen.orchestrator.model.StageArtifact;
import com.coursegen.orchestrator.model.StageName;
import com.coursegen.orchestrator.pipeline.CourseData;
import com.coursegen.orchestrator.provider.ProviderCalls;
import com.coursegen.orchestrator.provider.TextProvider;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Stage 2: lesson content JSON. LLM answer through {@link ContentRepairer},
 * then the templated lesson.
 */
@Component
public class LessonContentStage implements StageExecutor<ObjectNode> {

    private static final Logger log = LoggerFactory.getLogger(LessonContentStage.class);

    private final ContentRepairer                          repairer;
    private final FallbackChain<LessonContext, ObjectNode> chain;

    public LessonContentStage(TextProvider text, ContentRepairer repairer, ObjectMapper objectMapper,
                              ProducerInvoker invoker, CourseGenProperties props) {
        this.repairer = repairer;
        this.chain = FallbackChain.<LessonContext, ObjectNode>builder("lesson-content", invoker)
                .tier(Producer.of(text.name(), ctx -> generate(text, ctx)),
                      TierPolicy.of(props.timeouts().text(), props.retry().maxAttempts()))
                .terminal("lesson-template", ctx -> LessonTemplates.withLessonMetadata(
                        LessonTemplates.lessonContent(objectMapper, ctx.lesson().title()), ctx.lesson()))
                .build();
    }

    @Override
    public StageName stage() {
        return StageName.LESSON_CONTENT;
    }

    @Override
    public StageArtifact<ObjectNode> execute(LessonSpec lesson, CourseData course) {
        ChainResult<ObjectNode> result = chain.execute(new LessonContext(lesson, course));
        return result.toArtifact(lesson.id(), stage());
    }

    @Override
    public boolean pacesAfter(StageArtifact<ObjectNode> artifact) {
        return artifact.tier() == 1;
    }

    private ProducerResult<ObjectNode> generate(TextProvider text, LessonContext ctx) {
        LessonSpec lesson = ctx.lesson();
        ProducerResult<String> raw = ProviderCalls.attempt(
                () -> text.generate(Prompts.lessonContent(lesson, ctx.course().courseTitle())));
        if (!raw.isOk()) return ProducerResult.failure(raw.failureKind(), raw.reason());

        ContentRepairer.Repaired repaired = repairer.repair(raw.value(), lesson.title());
        return switch (repaired.method()) {
            case PARSED, REPAIRED -> {
                ObjectNode json = repaired.value();
                if (!json.has("introduction")) {
                    yield ProducerResult.invalid("Lesson JSON has no introduction");
                }
                if (repaired.method() == ContentRepairer.Method.REPAIRED) {
                    log.info("Lesson {} content needed JSON repair", lesson.number());
                }
                yield ProducerResult.ok(LessonTemplates.withLessonMetadata(json, lesson));
            }
            case TEMPLATE -> ProducerResult.invalid("Lesson JSON could not be parsed or repaired");
        };
    }
}
