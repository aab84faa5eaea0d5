package com.coursegen.orchestrator.pipeline;

import com.coursegen.orchestrator.model.LessonId;
import com.coursegen.orchestrator.model.LessonSpec;
import com.coursegen.orchestrator.model.LessonType;
import com.coursegen.orchestrator.model.StageArtifact;
import com.coursegen.orchestrator.model.StageName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BatchRunnerTest {

    final List<Duration> sleeps = new ArrayList<>();
    final RatePacer      pacer  = new RatePacer(Duration.ofSeconds(30),
            Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC), sleeps::add);

    // ------------------------------------------------------------------
    // Isolation
    // ------------------------------------------------------------------

    @Test
    void failingLesson_isLeftOutAndOthersStillRun() {
        BatchRunner runner = new BatchRunner(pacer);
        List<LessonSpec> lessons = lessons(5);

        LessonArtifacts<String> result = runner.run(StageName.LESSON_CONTENT, lessons,
                lesson -> {
                    if (lesson.number() == 3) throw new IllegalStateException("provider exploded");
                    return artifact(lesson, "content " + lesson.number(), 1);
                },
                a -> false, new CancellationToken());

        assertThat(result.size()).isEqualTo(4);
        assertThat(result.lessons()).containsExactly(LessonId.of(1), LessonId.of(2), LessonId.of(4), LessonId.of(5));
        assertThat(result.contains(LessonId.of(3))).isFalse();
        assertThat(result.value(LessonId.of(5))).contains("content 5");
    }

    @Test
    void nullArtifact_isTreatedAsAbsent() {
        BatchRunner runner = new BatchRunner(pacer);

        LessonArtifacts<String> result = runner.run(StageName.NOTEBOOKS, lessons(2),
                lesson -> lesson.number() == 1 ? null : artifact(lesson, "nb", 1),
                a -> false, new CancellationToken());

        assertThat(result.lessons()).containsExactly(LessonId.of(2));
    }

    // ------------------------------------------------------------------
    // Pacing
    // ------------------------------------------------------------------

    @Test
    void pacesAfterExternalArtifacts_butNotAfterTheLastLesson() {
        BatchRunner runner = new BatchRunner(pacer);

        runner.run(StageName.LESSON_CONTENT, lessons(5),
                lesson -> {
                    if (lesson.number() == 3) throw new IllegalStateException("boom");
                    return artifact(lesson, "x", 1);
                },
                a -> a.tier() == 1, new CancellationToken());

        // after lessons 1, 2 and 4; lesson 3 failed and lesson 5 is last
        assertThat(sleeps).hasSize(3);
    }

    @Test
    void doesNotPaceAfterTemplateArtifacts() {
        BatchRunner runner = new BatchRunner(pacer);

        runner.run(StageName.LESSON_CONTENT, lessons(3),
                lesson -> artifact(lesson, "template", 2),
                a -> a.tier() == 1, new CancellationToken());

        assertThat(sleeps).isEmpty();
    }

    // ------------------------------------------------------------------
    // Cancellation
    // ------------------------------------------------------------------

    @Test
    void cancellation_stopsLaunchingLessonsAndThrows() {
        BatchRunner runner = new BatchRunner(pacer);
        CancellationToken token = new CancellationToken();
        AtomicInteger started = new AtomicInteger();

        assertThatThrownBy(() -> runner.run(StageName.SPEECH_SCRIPTS, lessons(5),
                lesson -> {
                    if (started.incrementAndGet() == 2) token.cancel("stop");
                    return artifact(lesson, "s", 1);
                },
                a -> false, token))
                .isInstanceOf(JobCancelledException.class)
                .hasMessageContaining("stop");

        assertThat(started).hasValue(2);
    }

    // ------------------------------------------------------------------
    // Parallel mode
    // ------------------------------------------------------------------

    @Test
    void parallelRun_keepsIsolationAndOrdering() {
        ExecutorService pool = Executors.newFixedThreadPool(3);
        try {
            BatchRunner runner = new BatchRunner(RatePacer.disabled(), 3, pool);
            Function<LessonSpec, StageArtifact<String>> fn = lesson -> {
                if (lesson.number() == 3) throw new IllegalStateException("boom");
                return artifact(lesson, "v" + lesson.number(), 1);
            };

            LessonArtifacts<String> result = runner.run(StageName.BACKGROUND_IMAGES, lessons(6),
                    fn, a -> true, new CancellationToken());

            assertThat(result.lessons()).containsExactly(
                    LessonId.of(1), LessonId.of(2), LessonId.of(4), LessonId.of(5), LessonId.of(6));
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void parallelRun_reservesStartSlotsBeforeEachCall() {
        List<Duration> parallelSleeps = Collections.synchronizedList(new ArrayList<>());
        RatePacer shared = new RatePacer(Duration.ofSeconds(30),
                Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC), parallelSleeps::add);
        ExecutorService pool = Executors.newFixedThreadPool(3);
        try {
            BatchRunner runner = new BatchRunner(shared, 3, pool);

            runner.run(StageName.BACKGROUND_IMAGES, lessons(4),
                    lesson -> artifact(lesson, "img", 1), a -> true, new CancellationToken());

            // first call goes at once, the others wait for successive slots
            assertThat(parallelSleeps).containsExactlyInAnyOrder(
                    Duration.ofSeconds(30), Duration.ofSeconds(60), Duration.ofSeconds(90));
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void parallelRun_spacesCallStartsByTheInterval() {
        List<Long> starts = Collections.synchronizedList(new ArrayList<>());
        ExecutorService pool = Executors.newFixedThreadPool(3);
        try {
            BatchRunner runner = new BatchRunner(new RatePacer(Duration.ofMillis(300)), 3, pool);

            LessonArtifacts<String> result = runner.run(StageName.BACKGROUND_IMAGES, lessons(4),
                    lesson -> {
                        starts.add(System.nanoTime());
                        return artifact(lesson, "img", 1);
                    },
                    a -> true, new CancellationToken());

            assertThat(result.size()).isEqualTo(4);
            List<Long> sorted = new ArrayList<>(starts);
            Collections.sort(sorted);
            for (int i = 1; i < sorted.size(); i++) {
                long gapMillis = TimeUnit.NANOSECONDS.toMillis(sorted.get(i) - sorted.get(i - 1));
                assertThat(gapMillis).as("gap before call %d", i + 1).isGreaterThanOrEqualTo(250);
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void parallelismAboveOne_requiresAPool() {
        assertThatThrownBy(() -> new BatchRunner(pacer, 2, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    static List<LessonSpec> lessons(int count) {
        return IntStream.rangeClosed(1, count)
                .mapToObj(n -> new LessonSpec(LessonId.of(n), "Lesson " + n, LessonType.HANDS_ON, 30, List.of()))
                .toList();
    }

    static StageArtifact<String> artifact(LessonSpec lesson, String value, int tier) {
        return new StageArtifact<>(lesson.id(), StageName.LESSON_CONTENT, value, "test", tier, tier,
                tier > 1, List.of(), null);
    }
}
