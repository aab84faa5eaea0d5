package com.coursegen.orchestrator.stage;

import com.coursegen.orchestrator.config.CourseGenProperties;
import com.coursegen.orchestrator.content.ContentRepairer;
import com.coursegen.orchestrator.content.CurriculumTemplates;
import com.coursegen.orchestrator.content.Prompts;
import com.coursegen.orchestrator.fallback.ChainResult;
import com.coursegen.orchestrator.fallback.FallbackChain;
import com.coursegen.orchestrator.fallback.Producer;
import com.coursegen.orchestrator.fallback.ProducerInvoker;
import com.coursegen.orchestrator.fallback.ProducerResult;
import com.coursegen.orchestrator.fallback.TierPolicy;
import com.coursegen.orchestrator.model.Curriculum;
import com.coursegen.orchestrator.model.LessonId;
import com.coursegen.orchestrator.model.LessonSpec;
import com.coursegen.orchestrator.model.LessonType;
import com.coursegen.orchestrator.model.StageArtifact;
import com.coursegen.orchestrator.model.StageName;
import com.coursegen.orchestrator.pipeline.CourseData;
import com.coursegen.orchestrator.provider.ProviderCalls;
import com.coursegen.orchestrator.provider.TextProvider;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Stage 1: plans the curriculum through the text provider, falling back to
 * the deterministic template curriculum.
 *
 * Lessons are renumbered 1..n in answer order and cut to the configured
 * lesson count, so lesson ids are always dense and unique.
 */
@Component
public class CurriculumPlanner implements CourseStageExecutor<Curriculum> {

    private static final Logger log = LoggerFactory.getLogger(CurriculumPlanner.class);

    private final ContentRepairer                     repairer;
    private final CourseGenProperties                 props;
    private final FallbackChain<CourseData, Curriculum> chain;

    public CurriculumPlanner(TextProvider text, ContentRepairer repairer,
                             ProducerInvoker invoker, CourseGenProperties props) {
        this.repairer = repairer;
        this.props    = props;
        this.chain = FallbackChain.<CourseData, Curriculum>builder("curriculum", invoker)
                .tier(Producer.of(text.name(), course -> plan(text, course)),
                      TierPolicy.of(props.timeouts().text(), props.retry().maxAttempts()))
                .terminal("curriculum-template",
                          course -> CurriculumTemplates.fallback(course.topic(), props.lessonCount()))
                .build();
    }

    @Override
    public StageName stage() {
        return StageName.PLAN_CURRICULUM;
    }

    @Override
    public StageArtifact<Curriculum> execute(CourseData course) {
        ChainResult<Curriculum> result = chain.execute(course);
        Curriculum c = result.value();
        log.info("Planned '{}': {} lessons, {} h ({})", c.courseTitle(), c.lessons().size(),
                "%.1f".formatted(c.totalDurationHours()), result.producer());
        return result.toArtifact(LessonId.COURSE, stage());
    }

    private ProducerResult<Curriculum> plan(TextProvider text, CourseData course) {
        ProducerResult<String> raw = ProviderCalls.attempt(() -> text.generate(
                Prompts.curriculum(course.topic(), props.lessonCount(), course.documentIds())));
        if (!raw.isOk()) return ProducerResult.failure(raw.failureKind(), raw.reason());

        return repairer.tryRepair(raw.value(), List.of("lessons"))
                .map(json -> parse(json, course.topic()))
                .orElseGet(() -> ProducerResult.invalid("Curriculum answer is not a JSON object"));
    }

    ProducerResult<Curriculum> parse(ObjectNode json, String topic) {
        JsonNode lessonsNode = json.path("lessons");
        if (!lessonsNode.isArray() || lessonsNode.isEmpty()) {
            return ProducerResult.invalid("Curriculum has no lessons");
        }

        List<LessonSpec> lessons = new ArrayList<>();
        for (JsonNode l : lessonsNode) {
            if (lessons.size() == props.lessonCount()) break;
            String title = l.path("title").asText("").strip();
            if (title.isEmpty()) continue;
            List<String> objectives = new ArrayList<>();
            l.path("learning_objectives").forEach(o -> objectives.add(o.asText()));
            int minutes = l.path("duration_minutes").asInt(CurriculumTemplates.LESSON_MINUTES);
            lessons.add(new LessonSpec(LessonId.of(lessons.size() + 1), title,
                    LessonType.fromLabel(l.path("type").asText(null)),
                    minutes > 0 ? minutes : CurriculumTemplates.LESSON_MINUTES,
                    objectives));
        }
        if (lessons.isEmpty()) {
            return ProducerResult.invalid("No curriculum lesson has a title");
        }

        List<String> objectives = new ArrayList<>();
        json.path("learning_objectives").forEach(o -> objectives.add(o.asText()));
        return ProducerResult.ok(new Curriculum(
                json.path("course_title").asText("Complete " + topic + " Course"),
                json.path("difficulty").asText("intermediate"),
                json.path("target_audience").asText("Developers and learners"),
                objectives,
                lessons));
    }
}
