package com.coursegen.orchestrator.config;

import com.coursegen.orchestrator.content.ContentRepairer;
import com.coursegen.orchestrator.content.NotebookWriter;
import com.coursegen.orchestrator.fallback.ProducerInvoker;
import com.coursegen.orchestrator.media.ImageRenderer;
import com.coursegen.orchestrator.media.MediaDownloader;
import com.coursegen.orchestrator.media.OsSpeechSynthesizer;
import com.coursegen.orchestrator.media.WaveformSynthesizer;
import com.coursegen.orchestrator.packaging.ArchiveWriter;
import com.coursegen.orchestrator.packaging.CoursePackager;
import com.coursegen.orchestrator.packaging.PackageValidator;
import com.coursegen.orchestrator.pipeline.BatchRunner;
import com.coursegen.orchestrator.pipeline.PipelineStages;
import com.coursegen.orchestrator.pipeline.RatePacer;
import com.coursegen.orchestrator.provider.live.ProviderHttp;
import com.coursegen.orchestrator.stage.BackgroundImageStage;
import com.coursegen.orchestrator.stage.CourseDescriptionStage;
import com.coursegen.orchestrator.stage.CurriculumPlanner;
import com.coursegen.orchestrator.stage.FinalVideoStage;
import com.coursegen.orchestrator.stage.LessonContentStage;
import com.coursegen.orchestrator.stage.NotebookStage;
import com.coursegen.orchestrator.stage.PresenterVideoStage;
import com.coursegen.orchestrator.stage.SpeechScriptStage;
import com.coursegen.orchestrator.stage.ThumbnailStage;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wiring for everything that is not a stage or a provider.
 *
 * Two thread pools live here besides the job workers in JobLauncher:
 * "calls" runs individual producer attempts under a deadline, "lessons"
 * fans a stage out when lesson-parallelism is above 1. The calls pool is
 * unbounded because chains nest (speech audio runs inside a presenter tier)
 * and a bounded pool could fill with outer attempts waiting on inner ones.
 */
@Configuration
@EnableConfigurationProperties(CourseGenProperties.class)
public class PipelineConfig {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfig.class);

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    HttpClient httpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(15))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Bean
    ProviderHttp providerHttp(HttpClient httpClient, ObjectMapper objectMapper) {
        return new ProviderHttp(httpClient, objectMapper);
    }

    // ------------------------------------------------------------------
    // Execution
    // ------------------------------------------------------------------

    @Bean(destroyMethod = "shutdownNow")
    @Qualifier("calls")
    ExecutorService callsPool() {
        return Executors.newCachedThreadPool(named("producer-call"));
    }

    @Bean(destroyMethod = "shutdownNow")
    @Qualifier("lessons")
    ExecutorService lessonPool(CourseGenProperties props) {
        return Executors.newFixedThreadPool(props.lessonParallelism(), named("lesson"));
    }

    @Bean
    ProducerInvoker producerInvoker(@Qualifier("calls") ExecutorService callsPool, MeterRegistry meterRegistry) {
        return new ProducerInvoker(callsPool, meterRegistry);
    }

    @Bean
    RatePacer ratePacer(CourseGenProperties props) {
        Duration delay = props.effectiveInterCallDelay();
        log.info("Mode {}: inter-call delay {}", props.mode(), delay);
        return new RatePacer(delay);
    }

    @Bean
    BatchRunner batchRunner(RatePacer ratePacer, CourseGenProperties props,
                            @Qualifier("lessons") ExecutorService lessonPool) {
        return new BatchRunner(ratePacer, props.lessonParallelism(), lessonPool);
    }

    @Bean
    PipelineStages pipelineStages(CurriculumPlanner curriculum,
                                  LessonContentStage content,
                                  CourseDescriptionStage description,
                                  SpeechScriptStage scripts,
                                  NotebookStage notebooks,
                                  BackgroundImageStage backgrounds,
                                  ThumbnailStage thumbnail,
                                  PresenterVideoStage presenterVideos,
                                  FinalVideoStage finalVideos) {
        return new PipelineStages(curriculum, content, description, scripts, notebooks,
                backgrounds, thumbnail, presenterVideos, finalVideos);
    }

    // ------------------------------------------------------------------
    // Content and media
    // ------------------------------------------------------------------

    @Bean
    ContentRepairer contentRepairer(ObjectMapper objectMapper) {
        return new ContentRepairer(objectMapper);
    }

    @Bean
    NotebookWriter notebookWriter(ObjectMapper objectMapper) {
        return new NotebookWriter(objectMapper);
    }

    @Bean
    ImageRenderer imageRenderer() {
        return new ImageRenderer();
    }

    @Bean
    WaveformSynthesizer waveformSynthesizer() {
        return new WaveformSynthesizer();
    }

    @Bean
    MediaDownloader mediaDownloader(HttpClient httpClient) {
        return new MediaDownloader(httpClient);
    }

    @Bean
    OsSpeechSynthesizer osSpeechSynthesizer(CourseGenProperties props) {
        return new OsSpeechSynthesizer(props.speech().osCommand(), props.timeouts().speech());
    }

    // ------------------------------------------------------------------
    // Packaging
    // ------------------------------------------------------------------

    @Bean
    PackageValidator packageValidator(Clock clock) {
        return new PackageValidator(clock);
    }

    @Bean
    ArchiveWriter archiveWriter() {
        return new ArchiveWriter();
    }

    @Bean
    CoursePackager coursePackager(ObjectMapper objectMapper, PackageValidator validator,
                                  ArchiveWriter archiveWriter, Clock clock) {
        return new CoursePackager(objectMapper, validator, archiveWriter, clock);
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
