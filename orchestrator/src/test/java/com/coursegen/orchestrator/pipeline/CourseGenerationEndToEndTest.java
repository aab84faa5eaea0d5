package com.coursegen.orchestrator.pipeline;

import com.coursegen.orchestrator.fallback.FailureKind;
import com.coursegen.orchestrator.media.MediaException;
import com.coursegen.orchestrator.media.MockMediaComposer;
import com.coursegen.orchestrator.model.ArtifactRecord;
import com.coursegen.orchestrator.model.GenerationJob;
import com.coursegen.orchestrator.model.JobStatus;
import com.coursegen.orchestrator.model.StageName;
import com.coursegen.orchestrator.model.TestJobs;
import com.coursegen.orchestrator.provider.ProviderException;
import com.coursegen.orchestrator.provider.VideoProvider;
import com.coursegen.orchestrator.provider.VideoStatus;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.List;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Whole pipeline with mock providers, from PENDING job to zipped package.
 */
class CourseGenerationEndToEndTest {

    @TempDir Path output;

    PipelineFixture fixture;

    @AfterEach
    void tearDown() {
        if (fixture != null) fixture.close();
    }

    /** Scenario A: every provider succeeds on its first attempt. */
    @Test
    void allProvidersSucceed_producesCompletePackage() throws Exception {
        fixture = new PipelineFixture(output, 2);
        GenerationJob job = TestJobs.job("Test");

        fixture.orchestrator().run(fixture.machine(job), new CancellationToken());

        assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(job.getProgress()).isEqualTo(100);
        Path pkg = packageDir();

        assertThat(files(pkg.resolve(JobWorkspace.SCRIPTS)))
                .containsExactly("lesson_01_script.txt", "lesson_02_script.txt");
        // lesson 1 is theory, lesson 2 hands-on
        assertThat(files(pkg.resolve(JobWorkspace.NOTEBOOKS))).containsExactly("lesson_02.ipynb");
        assertThat(files(pkg.resolve(JobWorkspace.VIDEOS))).hasSize(2)
                .allSatisfy(name -> assertThat(name).matches("lesson_0[12]_final\\..+"));

        JsonNode metadata = fixture.mapper.readTree(pkg.resolve("course_metadata.json").toFile());
        assertThat(metadata.get("lessons").asInt()).isEqualTo(2);

        JsonNode report = fixture.mapper.readTree(pkg.resolve("validation_report.json").toFile());
        assertThat(report.get("is_valid").asBoolean()).isTrue();

        assertThat(pkg.resolve(JobWorkspace.WORK)).doesNotExist();
        assertThat(fixture.records(StageName.PRESENTER_VIDEOS))
                .hasSize(2)
                .allSatisfy(r -> {
                    assertThat(r.getTier()).isEqualTo(1);
                    assertThat(r.isDegraded()).isFalse();
                });

        List<String> entries = zipEntries(Path.of(job.getResultReference()));
        String root = pkg.getFileName().toString();
        assertThat(entries).contains(root + "/course_metadata.json", root + "/scripts/lesson_01_script.txt");
        assertThat(entries).noneMatch(e -> e.startsWith(root + "/work/"));
    }

    /** Scenario B: avatar video and composited video both fail; the placeholder tier answers. */
    @Test
    void videoTiersFail_placeholderKeepsJobCompleting() throws Exception {
        fixture = new PipelineFixture(output, 2);
        fixture.video = new RejectingVideo();
        fixture.composer = new MockMediaComposer() {
            @Override
            public Path stillWithAudio(Path image, Path audio, Path out) {
                throw new MediaException("encoder crashed");
            }
        };
        GenerationJob job = TestJobs.job("Test");

        fixture.orchestrator().run(fixture.machine(job), new CancellationToken());

        assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
        List<ArtifactRecord> presenter = fixture.records(StageName.PRESENTER_VIDEOS);
        assertThat(presenter).hasSize(2).allSatisfy(r -> {
            assertThat(r.getTier()).isEqualTo(3);
            assertThat(r.isDegraded()).isTrue();
            assertThat(r.getProviderUsed()).isEqualTo("placeholder-clip");
        });
        assertThat(fixture.records(StageName.FINAL_VIDEOS)).hasSize(2);
        assertThat(files(packageDir().resolve(JobWorkspace.VIDEOS))).hasSize(2);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Path packageDir() throws IOException {
        try (Stream<Path> s = Files.list(output)) {
            return s.filter(Files::isDirectory).findFirst().orElseThrow();
        }
    }

    private static List<String> files(Path dir) throws IOException {
        try (Stream<Path> s = Files.list(dir)) {
            return s.map(p -> p.getFileName().toString()).sorted().toList();
        }
    }

    private static List<String> zipEntries(Path archive) throws IOException {
        List<String> names = new ArrayList<>();
        try (ZipFile zip = new ZipFile(archive.toFile())) {
            Enumeration<? extends ZipEntry> entries = zip.entries();
            while (entries.hasMoreElements()) names.add(entries.nextElement().getName());
        }
        return names;
    }

    static final class RejectingVideo implements VideoProvider {
        @Override public String name() { return "rejecting-video"; }

        @Override
        public String submit(String script, String avatarRef) {
            throw new ProviderException(FailureKind.PROVIDER, "HTTP 500 from video service");
        }

        @Override
        public VideoStatus poll(String jobId) {
            throw new ProviderException(FailureKind.PROVIDER, "no such talk");
        }
    }
}
