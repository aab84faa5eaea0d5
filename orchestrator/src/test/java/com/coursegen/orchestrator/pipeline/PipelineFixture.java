package com.coursegen.orchestrator.pipeline;

import com.coursegen.orchestrator.config.CourseGenProperties;
import com.coursegen.orchestrator.content.ContentRepairer;
import com.coursegen.orchestrator.content.NotebookWriter;
import com.coursegen.orchestrator.fallback.ProducerInvoker;
import com.coursegen.orchestrator.media.ImageRenderer;
import com.coursegen.orchestrator.media.MediaComposer;
import com.coursegen.orchestrator.media.MediaDownloader;
import com.coursegen.orchestrator.media.MockMediaComposer;
import com.coursegen.orchestrator.media.OsSpeechSynthesizer;
import com.coursegen.orchestrator.media.WaveformSynthesizer;
import com.coursegen.orchestrator.model.ArtifactRecord;
import com.coursegen.orchestrator.model.GenerationJob;
import com.coursegen.orchestrator.model.StageName;
import com.coursegen.orchestrator.packaging.ArchiveWriter;
import com.coursegen.orchestrator.packaging.CoursePackager;
import com.coursegen.orchestrator.packaging.PackageValidator;
import com.coursegen.orchestrator.provider.ImageProvider;
import com.coursegen.orchestrator.provider.TextProvider;
import com.coursegen.orchestrator.provider.TtsProvider;
import com.coursegen.orchestrator.provider.VideoProvider;
import com.coursegen.orchestrator.provider.mock.MockImageProvider;
import com.coursegen.orchestrator.provider.mock.MockTextProvider;
import com.coursegen.orchestrator.provider.mock.MockTtsProvider;
import com.coursegen.orchestrator.provider.mock.MockVideoProvider;
import com.coursegen.orchestrator.repository.ArtifactRecordRepository;
import com.coursegen.orchestrator.repository.GenerationJobRepository;
import com.coursegen.orchestrator.service.JobStateMachine;
import com.coursegen.orchestrator.stage.BackgroundImageStage;
import com.coursegen.orchestrator.stage.CourseDescriptionStage;
import com.coursegen.orchestrator.stage.CurriculumPlanner;
import com.coursegen.orchestrator.stage.FinalVideoStage;
import com.coursegen.orchestrator.stage.LessonContentStage;
import com.coursegen.orchestrator.stage.NotebookStage;
import com.coursegen.orchestrator.stage.PresenterVideoStage;
import com.coursegen.orchestrator.stage.SpeechAudioSynthesizer;
import com.coursegen.orchestrator.stage.SpeechScriptStage;
import com.coursegen.orchestrator.stage.ThumbnailStage;
import com.coursegen.orchestrator.stage.VideoPoller;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.mockito.AdditionalAnswers.returnsFirstArg;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyIterable;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * The real pipeline wired by hand with mock providers, writing under a temp
 * directory. Repositories are Mockito mocks that keep what they are given.
 *
 * Any collaborator can be swapped before {@link #orchestrator()} is called.
 */
class PipelineFixture implements AutoCloseable {

    final ObjectMapper        mapper     = new ObjectMapper();
    final SimpleMeterRegistry meters     = new SimpleMeterRegistry();
    final ExecutorService     calls      = Executors.newCachedThreadPool();
    final ProducerInvoker     invoker    = new ProducerInvoker(calls, meters);
    final ImageRenderer       renderer   = new ImageRenderer();
    final WaveformSynthesizer waveform   = new WaveformSynthesizer();
    final Clock               clock      = Clock.systemUTC();

    final GenerationJobRepository  jobRepo      = mock(GenerationJobRepository.class);
    final ArtifactRecordRepository artifactRepo = mock(ArtifactRecordRepository.class);
    final List<ArtifactRecord>     records      = Collections.synchronizedList(new ArrayList<>());

    CourseGenProperties props;
    TextProvider        text     = new MockTextProvider(mapper);
    ImageProvider       images   = new MockImageProvider(renderer);
    TtsProvider         tts      = new MockTtsProvider(waveform);
    VideoProvider       video    = new MockVideoProvider();
    MediaComposer       composer = new MockMediaComposer();
    CoursePackager      packager;

    PipelineFixture(Path outputDir, int lessonCount) {
        this.props    = CourseGenProperties.defaults().withOutputDir(outputDir).withLessonCount(lessonCount);
        this.packager = new CoursePackager(mapper, new PackageValidator(clock), new ArchiveWriter(), clock);
        when(jobRepo.save(any())).then(returnsFirstArg());
        when(artifactRepo.saveAll(anyIterable())).thenAnswer(inv -> {
            Iterable<ArtifactRecord> batch = inv.getArgument(0);
            List<ArtifactRecord> saved = new ArrayList<>();
            batch.forEach(saved::add);
            records.addAll(saved);
            return saved;
        });
    }

    PipelineStages stages() {
        ContentRepairer repairer = new ContentRepairer(mapper);
        VideoPoller poller = new VideoPoller(video, Duration.ofMillis(10), Duration.ofSeconds(2), clock, d -> { });
        SpeechAudioSynthesizer speech = new SpeechAudioSynthesizer(tts,
                new OsSpeechSynthesizer("", Duration.ofSeconds(5)), waveform, invoker, props);
        return new PipelineStages(
                new CurriculumPlanner(text, repairer, invoker, props),
                new LessonContentStage(text, repairer, mapper, invoker, props),
                new CourseDescriptionStage(text, invoker, props),
                new SpeechScriptStage(text, invoker, props),
                new NotebookStage(new NotebookWriter(mapper), invoker),
                new BackgroundImageStage(images, renderer, invoker, props),
                new ThumbnailStage(images, renderer, invoker, props),
                new PresenterVideoStage(video, poller, new MediaDownloader(HttpClient.newHttpClient()),
                        speech, composer, renderer, invoker, props),
                new FinalVideoStage(composer, invoker, props));
    }

    PipelineOrchestrator orchestrator() {
        return new PipelineOrchestrator(stages(), new BatchRunner(RatePacer.disabled()),
                packager, artifactRepo, props, clock);
    }

    JobStateMachine machine(GenerationJob job) {
        return new JobStateMachine(job, jobRepo, clock);
    }

    List<ArtifactRecord> records(StageName stage) {
        synchronized (records) {
            return records.stream().filter(r -> r.getStage() == stage).toList();
        }
    }

    @Override
    public void close() {
        calls.shutdownNow();
    }
}
