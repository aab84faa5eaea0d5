package com.coursegen.orchestrator.stage;

import com.coursegen.orchestrator.config.CourseGenProperties;
import com.coursegen.orchestrator.content.Prompts;
import com.coursegen.orchestrator.content.ScriptTemplates;
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
import com.coursegen.orchestrator.pipeline.JobWorkspace;
import com.coursegen.orchestrator.provider.ProviderCalls;
import com.coursegen.orchestrator.provider.TextProvider;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Stage 4: narration script per lesson, written to {@code scripts/}.
 */
@Component
public class SpeechScriptStage implements StageExecutor<SpeechScript> {

    private static final Logger log = LoggerFactory.getLogger(SpeechScriptStage.class);

    private final FallbackChain<LessonContext, String> chain;

    public SpeechScriptStage(TextProvider text, ProducerInvoker invoker, CourseGenProperties props) {
        this.chain = FallbackChain.<LessonContext, String>builder("speech-script", invoker)
                .tier(Producer.of(text.name(), ctx -> write(text, ctx)),
                      TierPolicy.of(props.timeouts().text(), props.retry().maxAttempts()))
                .terminal("script-template",
                          ctx -> ScriptTemplates.fallbackScript(ctx.lesson(), content(ctx)))
                .build();
    }

    @Override
    public StageName stage() {
        return StageName.SPEECH_SCRIPTS;
    }

    @Override
    public StageArtifact<SpeechScript> execute(LessonSpec lesson, CourseData course) {
        ChainResult<String> result = chain.execute(new LessonContext(lesson, course));
        String text = result.value();
        Path file = ArtifactFiles.writeString(
                course.workspace().dir(JobWorkspace.SCRIPTS).resolve(ArtifactFiles.name(lesson, "script.txt")),
                text);
        double minutes = ScriptTemplates.estimateDurationMinutes(text);
        log.info("Script for lesson {}: ~{} min ({})", lesson.number(), "%.1f".formatted(minutes), result.producer());
        return result.toArtifact(lesson.id(), stage(), new SpeechScript(text, file, minutes));
    }

    @Override
    public boolean pacesAfter(StageArtifact<SpeechScript> artifact) {
        return artifact.tier() == 1;
    }

    private static ProducerResult<String> write(TextProvider text, LessonContext ctx) {
        ProducerResult<String> raw = ProviderCalls.attempt(
                () -> text.generate(Prompts.speechScript(ctx.lesson(), content(ctx))));
        if (!raw.isOk()) return raw;
        String script = raw.value().strip();
        return script.isEmpty() ? ProducerResult.invalid("Empty script") : ProducerResult.ok(script);
    }

    private static JsonNode content(LessonContext ctx) {
        return ctx.course().content().value(ctx.lesson().id()).orElse(null);
    }
}
