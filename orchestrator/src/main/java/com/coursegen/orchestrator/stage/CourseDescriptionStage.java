package com.coursegen.orchestrator.stage;

import com.coursegen.orchestrator.config.CourseGenProperties;
import com.coursegen.orchestrator.content.Prompts;
import com.coursegen.orchestrator.fallback.FallbackChain;
import com.coursegen.orchestrator.fallback.Producer;
import com.coursegen.orchestrator.fallback.ProducerInvoker;
import com.coursegen.orchestrator.fallback.ProducerResult;
import com.coursegen.orchestrator.fallback.TierPolicy;
import com.coursegen.orchestrator.model.Curriculum;
import com.coursegen.orchestrator.model.LessonId;
import com.coursegen.orchestrator.model.StageArtifact;
import com.coursegen.orchestrator.model.StageName;
import com.coursegen.orchestrator.pipeline.CourseData;
import com.coursegen.orchestrator.provider.ProviderCalls;
import com.coursegen.orchestrator.provider.TextProvider;
import org.springframework.stereotype.Component;

/**
 * Stage 3: marketing description of the course.
 */
@Component
public class CourseDescriptionStage implements CourseStageExecutor<String> {

    private final FallbackChain<CourseData, String> chain;

    public CourseDescriptionStage(TextProvider text, ProducerInvoker invoker, CourseGenProperties props) {
        this.chain = FallbackChain.<CourseData, String>builder("course-description", invoker)
                .tier(Producer.of(text.name(), course -> describe(text, course.curriculum())),
                      TierPolicy.of(props.timeouts().text(), props.retry().maxAttempts()))
                .terminal("description-template", course -> template(course.curriculum()))
                .build();
    }

    @Override
    public StageName stage() {
        return StageName.COURSE_DESCRIPTION;
    }

    @Override
    public StageArtifact<String> execute(CourseData course) {
        return chain.execute(course).toArtifact(LessonId.COURSE, stage());
    }

    static String template(Curriculum c) {
        return "Comprehensive course on " + c.courseTitle() + " designed for " + c.difficulty() + " learners.";
    }

    private static ProducerResult<String> describe(TextProvider text, Curriculum curriculum) {
        ProducerResult<String> raw = ProviderCalls.attempt(() -> text.generate(Prompts.courseDescription(curriculum)));
        if (!raw.isOk()) return raw;
        String description = raw.value().strip();
        return description.isEmpty() ? ProducerResult.invalid("Empty description") : ProducerResult.ok(description);
    }
}
