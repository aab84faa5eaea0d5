package com.coursegen.orchestrator.stage;

import com.coursegen.orchestrator.config.CourseGenProperties;
import com.coursegen.orchestrator.content.ScriptTemplates;
import com.coursegen.orchestrator.fallback.ChainResult;
import com.coursegen.orchestrator.fallback.FallbackChain;
import com.coursegen.orchestrator.fallback.Producer;
import com.coursegen.orchestrator.fallback.ProducerInvoker;
import com.coursegen.orchestrator.fallback.ProducerResult;
import com.coursegen.orchestrator.fallback.TierPolicy;
import com.coursegen.orchestrator.media.ImageRenderer;
import com.coursegen.orchestrator.media.MediaComposer;
import com.coursegen.orchestrator.media.MediaDownloader;
import com.coursegen.orchestrator.media.MediaException;
import com.coursegen.orchestrator.model.LessonSpec;
import com.coursegen.orchestrator.model.StageArtifact;
import com.coursegen.orchestrator.model.StageName;
import com.coursegen.orchestrator.pipeline.CourseData;
import com.coursegen.orchestrator.pipeline.JobWorkspace;
import com.coursegen.orchestrator.provider.ProviderCalls;
import com.coursegen.orchestrator.provider.VideoProvider;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Stage 8: presenter video per lesson, the deepest chain in the pipeline.
 * <ol>
 *   <li>talking-presenter service: submit the script, poll with a bounded wait, download;</li>
 *   <li>local composite: the lesson background shown over synthesized narration;</li>
 *   <li>placeholder clip: a rendered poster frame.</li>
 * </ol>
 * Intermediate files go to the workspace's work directory.
 */
@Component
public class PresenterVideoStage implements StageExecutor<Path> {

    // headroom for the download after the poll budget is spent
    private static final Duration DOWNLOAD_ALLOWANCE = Duration.ofMinutes(2);

    private final FallbackChain<LessonContext, Path> chain;

    public PresenterVideoStage(VideoProvider video, VideoPoller poller, MediaDownloader downloader,
                               SpeechAudioSynthesizer speech, MediaComposer composer, ImageRenderer renderer,
                               ProducerInvoker invoker, CourseGenProperties props) {
        Duration avatarBudget = props.timeouts().videoSubmit()
                .plus(poller.maxWait()).plus(poller.interval()).plus(DOWNLOAD_ALLOWANCE);

        this.chain = FallbackChain.<LessonContext, Path>builder("presenter-video", invoker)
                .tier(Producer.of(video.name(), ctx -> avatar(video, poller, downloader, props, ctx)),
                      TierPolicy.of(avatarBudget, props.retry().maxAttempts()))
                .tier(Producer.of("composited-" + composer.name(), ctx -> composite(speech, composer, renderer, ctx)),
                      TierPolicy.of(props.timeouts().compose().plus(props.timeouts().speech())))
                .terminal("placeholder-clip", ctx -> ArtifactFiles.write(
                        work(ctx).resolve(ArtifactFiles.name(ctx.lesson(), "placeholder.png")),
                        renderer.placeholderFrame(ctx.lesson().title())))
                .build();
    }

    @Override
    public StageName stage() {
        return StageName.PRESENTER_VIDEOS;
    }

    @Override
    public StageArtifact<Path> execute(LessonSpec lesson, CourseData course) {
        ChainResult<Path> result = chain.execute(new LessonContext(lesson, course));
        return result.toArtifact(lesson.id(), stage());
    }

    @Override
    public boolean pacesAfter(StageArtifact<Path> artifact) {
        return artifact.tier() == 1;
    }

    private static ProducerResult<Path> avatar(VideoProvider video, VideoPoller poller, MediaDownloader downloader,
                                               CourseGenProperties props, LessonContext ctx) {
        String spoken = ScriptTemplates.spokenText(script(ctx).text());
        ProducerResult<String> submitted = ProviderCalls.attempt(
                () -> video.submit(spoken, props.presenter().avatarUrl()));
        if (!submitted.isOk()) return ProducerResult.failure(submitted.failureKind(), submitted.reason());

        ProducerResult<String> url = poller.await(submitted.value());
        if (!url.isOk()) return ProducerResult.failure(url.failureKind(), url.reason());

        try {
            return ProducerResult.ok(downloader.download(url.value(),
                    work(ctx).resolve(ArtifactFiles.name(ctx.lesson(), "presenter.mp4"))));
        } catch (MediaException e) {
            return ProducerResult.providerError(e.getMessage());
        }
    }

    private static ProducerResult<Path> composite(SpeechAudioSynthesizer speech, MediaComposer composer,
                                                  ImageRenderer renderer, LessonContext ctx) {
        LessonSpec lesson = ctx.lesson();
        try {
            Path audio = speech.synthesize(lesson, script(ctx), work(ctx));
            Path still = ctx.course().backgrounds().value(lesson.id())
                    .orElseGet(() -> ArtifactFiles.write(work(ctx).resolve(ArtifactFiles.name(lesson, "still.png")),
                            renderer.background(lesson.title(), lesson.number())));
            return ProducerResult.ok(composer.stillWithAudio(still, audio,
                    work(ctx).resolve(ArtifactFiles.name(lesson, "composited.mp4"))));
        } catch (MediaException | UncheckedIOException e) {
            return ProducerResult.providerError(e.getMessage());
        }
    }

    /** The lesson's script, or a templated one if the script stage lost this lesson. */
    private static SpeechScript script(LessonContext ctx) {
        return ctx.course().scripts().value(ctx.lesson().id()).orElseGet(() -> {
            String text = ScriptTemplates.fallbackScript(ctx.lesson(),
                    ctx.course().content().value(ctx.lesson().id()).orElse(null));
            return new SpeechScript(text, null, ScriptTemplates.estimateDurationMinutes(text));
        });
    }

    private static Path work(LessonContext ctx) {
        return ctx.course().workspace().dir(JobWorkspace.WORK);
    }
}
