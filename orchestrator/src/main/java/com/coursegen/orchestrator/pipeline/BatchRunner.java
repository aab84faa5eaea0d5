package com.coursegen.orchestrator.pipeline;

import com.coursegen.orchestrator.model.LessonId;
import com.coursegen.orchestrator.model.LessonSpec;
import com.coursegen.orchestrator.model.StageArtifact;
import com.coursegen.orchestrator.model.StageName;
import com.coursegen.orchestrator.stage.StageExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Runs one stage over every lesson of a course.
 *
 * <ul>
 *   <li>Isolation: an exception from one lesson is logged and that lesson is
 *       left out of the result; the remaining lessons still run.</li>
 *   <li>Pacing: run one after another, a lesson whose artifact came from an
 *       external provider is followed by the shared {@link RatePacer} wait, unless
 *       it was the last lesson. Run concurrently, every lesson acquires a start
 *       slot from the pacer before its call, so starts stay one interval apart.</li>
 *   <li>Cancellation: the token is checked before each lesson starts; once it
 *       is set no further lessons are launched and {@link JobCancelledException}
 *       is thrown after in-flight lessons finish.</li>
 * </ul>
 * With {@code parallelism > 1} lessons run on the supplied pool.
 */
public class BatchRunner {

    private static final Logger log = LoggerFactory.getLogger(BatchRunner.class);

    private final RatePacer       pacer;
    private final int             parallelism;
    private final ExecutorService lessonPool;

    /** Sequential runner. */
    public BatchRunner(RatePacer pacer) {
        this(pacer, 1, null);
    }

    public BatchRunner(RatePacer pacer, int parallelism, ExecutorService lessonPool) {
        if (parallelism > 1 && lessonPool == null) {
            throw new IllegalArgumentException("A lesson pool is required for parallelism " + parallelism);
        }
        this.pacer       = pacer;
        this.parallelism = Math.max(1, parallelism);
        this.lessonPool  = lessonPool;
    }

    /** Runs {@code executor} for every lesson it applies to. */
    public <T> LessonArtifacts<T> run(StageExecutor<T> executor, CourseData course, CancellationToken token) {
        List<LessonSpec> applicable = course.lessons().stream()
                .filter(l -> executor.appliesTo(l, course))
                .toList();
        if (applicable.size() < course.lessons().size()) {
            log.info("{}: {} of {} lessons apply", executor.stage(), applicable.size(), course.lessons().size());
        }
        return run(executor.stage(), applicable, l -> executor.execute(l, course), executor::pacesAfter, token);
    }

    /**
     * @param paceAfter true for artifacts that cost an external call
     * @return artifacts of the lessons that succeeded, keyed by lesson
     * @throws JobCancelledException if the token was set during the run
     */
    public <T> LessonArtifacts<T> run(StageName stage,
                                      List<LessonSpec> lessons,
                                      Function<LessonSpec, StageArtifact<T>> fn,
                                      Predicate<StageArtifact<T>> paceAfter,
                                      CancellationToken token) {
        Map<LessonId, StageArtifact<T>> results = new ConcurrentHashMap<>();
        AtomicInteger remaining = new AtomicInteger(lessons.size());

        if (parallelism == 1 || lessons.size() <= 1) {
            for (LessonSpec lesson : lessons) {
                if (token.isCancelled()) break;
                runOne(stage, lesson, fn, paceAfter, results, remaining);
            }
        } else {
            runParallel(stage, lessons, fn, token, results, remaining);
        }

        token.throwIfCancelled();
        int failed = lessons.size() - results.size();
        if (failed > 0) {
            log.warn("{}: {} of {} lessons failed and were skipped", stage, failed, lessons.size());
        }
        return LessonArtifacts.of(results);
    }

    private <T> void runParallel(StageName stage,
                                 List<LessonSpec> lessons,
                                 Function<LessonSpec, StageArtifact<T>> fn,
                                 CancellationToken token,
                                 Map<LessonId, StageArtifact<T>> results,
                                 AtomicInteger remaining) {
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        List<Future<?>> futures = new ArrayList<>(lessons.size());
        for (LessonSpec lesson : lessons) {
            futures.add(lessonPool.submit(() -> {
                if (mdc != null) MDC.setContextMap(mdc);
                try {
                    if (token.isCancelled()) return;
                    pacer.acquire();
                    if (!token.isCancelled() && !Thread.currentThread().isInterrupted()) {
                        runOne(stage, lesson, fn, null, results, remaining);
                    }
                } finally {
                    MDC.clear();
                }
            }));
        }
        for (Future<?> f : futures) {
            try {
                f.get();
            } catch (ExecutionException e) {
                // runOne isolates lesson failures; anything here escaped it
                log.error("{}: lesson task failed unexpectedly", stage, e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.forEach(x -> x.cancel(true));
                token.cancel("Interrupted");
                return;
            }
        }
    }

    /** {@code paceAfter} is null when pacing was done before the call. */
    private <T> void runOne(StageName stage,
                            LessonSpec lesson,
                            Function<LessonSpec, StageArtifact<T>> fn,
                            Predicate<StageArtifact<T>> paceAfter,
                            Map<LessonId, StageArtifact<T>> results,
                            AtomicInteger remaining) {
        MDC.put("lesson", String.valueOf(lesson.number()));
        StageArtifact<T> artifact = null;
        try {
            artifact = fn.apply(lesson);
            if (artifact == null) {
                log.warn("{}: lesson {} produced no artifact", stage, lesson.number());
            } else {
                results.put(lesson.id(), artifact);
            }
        } catch (RuntimeException e) {
            log.warn("{}: lesson {} '{}' failed: {}", stage, lesson.number(), lesson.title(), e.toString(), e);
        } finally {
            MDC.remove("lesson");
        }
        boolean moreToCome = remaining.decrementAndGet() > 0;
        if (paceAfter != null && moreToCome && artifact != null && paceAfter.test(artifact)) {
            pacer.pace();
        }
    }
}
