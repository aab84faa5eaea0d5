package com.coursegen.orchestrator.pipeline;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class JobWorkspaceTest {

    @TempDir Path output;

    final Clock clock = Clock.fixed(Instant.parse("2026-03-01T08:09:10Z"), ZoneOffset.UTC);

    @Test
    void sanitize_keepsLowercaseWordsOnly() {
        assertThat(JobWorkspace.sanitize("Machine Learning / AI!")).isEqualTo("machine_learning_ai");
        assertThat(JobWorkspace.sanitize("../../etc/passwd")).isEqualTo("etc_passwd");
        assertThat(JobWorkspace.sanitize("日本語")).isEqualTo("course");
        assertThat(JobWorkspace.sanitize(null)).isEqualTo("course");
        assertThat(JobWorkspace.sanitize("x".repeat(80))).hasSize(50);
    }

    @Test
    void create_namesDirectoryAfterTopicTimeAndJob() {
        UUID jobId = UUID.fromString("1b2c3d4e-0000-0000-0000-000000000000");

        JobWorkspace ws = JobWorkspace.create(output, "Go Basics", jobId, clock);

        assertThat(ws.root()).isDirectory()
                .hasFileName("course_package_go_basics_20260301_080910_1b2c3d4e");
    }

    @Test
    void sameTopicSameSecond_getsSeparateDirectories() {
        JobWorkspace a = JobWorkspace.create(output, "Go", UUID.randomUUID(), clock);
        JobWorkspace b = JobWorkspace.create(output, "Go", UUID.randomUUID(), clock);

        assertThat(a.root()).isNotEqualTo(b.root());
    }

    @Test
    void dir_createsOnFirstUse() {
        JobWorkspace ws = JobWorkspace.create(output, "Go", UUID.randomUUID(), clock);

        assertThat(ws.dir(JobWorkspace.NOTEBOOKS)).isDirectory().hasParent(ws.root());
    }
}
