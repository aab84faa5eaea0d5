package com.coursegen.orchestrator.packaging;

import com.coursegen.orchestrator.model.Curriculum;
import com.coursegen.orchestrator.model.LessonSpec;
import com.coursegen.orchestrator.model.StageArtifact;
import com.coursegen.orchestrator.pipeline.CourseData;
import com.coursegen.orchestrator.pipeline.JobWorkspace;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Comparator;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * Stage 10: writes the course package and its zip archive.
 *
 * <pre>
 * course_package_.../
 *   videos/ notebooks/ scripts/ backgrounds/     (written by earlier stages)
 *   resources/ assessments/ marketing/
 *   course_metadata.json  curriculum.json  README.md  setup_instructions.md
 *   validation_report.json
 * course_package_....zip
 * </pre>
 * The work directory of intermediate files is left out of the archive and
 * removed afterwards.
 */
public class CoursePackager {

    private static final Logger log = LoggerFactory.getLogger(CoursePackager.class);

    public static final String METADATA_FILE   = "course_metadata.json";
    public static final String CURRICULUM_FILE = "curriculum.json";
    public static final String README_FILE     = "README.md";
    public static final String SETUP_FILE      = "setup_instructions.md";
    public static final String REPORT_FILE     = "validation_report.json";

    private final ObjectMapper     objectMapper;
    private final PackageValidator validator;
    private final ArchiveWriter    archiveWriter;
    private final Clock            clock;

    public CoursePackager(ObjectMapper objectMapper, PackageValidator validator,
                          ArchiveWriter archiveWriter, Clock clock) {
        this.objectMapper  = objectMapper;
        this.validator     = validator;
        this.archiveWriter = archiveWriter;
        this.clock         = clock;
    }

    /** @throws PackagingException if any part of the package cannot be written */
    public PackageResult build(CourseData course) throws PackagingException {
        JobWorkspace ws = course.workspace();
        Path root = ws.root();
        try {
            PackageValidator.REQUIRED_DIRECTORIES.forEach(ws::dir);

            writeResources(course);
            writeAssessments(course);
            writeMarketing(course);
            writeJson(root.resolve(CURRICULUM_FILE), curriculumJson(course.curriculum()));
            writeJson(root.resolve(METADATA_FILE), metadataJson(course));
            Files.writeString(root.resolve(README_FILE), readme(course));
            Files.writeString(root.resolve(SETUP_FILE), setupInstructions(course));

            ValidationReport report = validator.validate(root);
            writeJson(root.resolve(REPORT_FILE), objectMapper.valueToTree(report));
            if (!report.isValid()) {
                log.warn("Package {} failed checks {}", root.getFileName(), report.failedChecks());
            }

            Path work = root.resolve(JobWorkspace.WORK);
            Path archive = archiveWriter.zip(root, root.resolveSibling(root.getFileName() + ".zip"),
                    p -> !p.startsWith(work));
            deleteQuietly(work);

            log.info("Packaged {} ({} of {} checks passed)", archive.getFileName(),
                    report.passedChecks(), report.totalChecks());
            return new PackageResult(root, archive, report);
        } catch (IOException | UncheckedIOException e) {
            throw new PackagingException("Cannot write course package " + root + ": " + e.getMessage(), e);
        }
    }

    // ------------------------------------------------------------------
    // Package parts
    // ------------------------------------------------------------------

    private void writeResources(CourseData course) throws IOException {
        Path dir = course.workspace().dir(JobWorkspace.RESOURCES);
        Path root = course.workspace().root();
        for (LessonSpec lesson : course.lessons()) {
            ObjectNode res = objectMapper.createObjectNode();
            res.put("lesson_number", lesson.number());
            res.put("title", lesson.title());
            res.put("type", lesson.type().label());
            ArrayNode objectives = res.putArray("learning_objectives");
            lesson.learningObjectives().forEach(objectives::add);

            Optional<ObjectNode> content = course.content().value(lesson.id());
            content.map(c -> c.get("key_takeaways")).ifPresent(k -> res.set("key_takeaways", k));
            content.map(c -> c.get("examples")).ifPresent(e -> res.set("examples", e));

            ObjectNode files = res.putObject("files");
            course.scripts().value(lesson.id()).ifPresent(s -> files.put("script", relative(root, s.file())));
            course.notebooks().value(lesson.id()).ifPresent(p -> files.put("notebook", relative(root, p)));
            course.backgrounds().value(lesson.id()).ifPresent(p -> files.put("background", relative(root, p)));
            course.finalVideos().value(lesson.id()).ifPresent(p -> files.put("video", relative(root, p)));

            writeJson(dir.resolve("lesson_" + lesson.id().padded() + "_resources.json"), res);
        }
    }

    private void writeAssessments(CourseData course) throws IOException {
        Path dir = course.workspace().dir(JobWorkspace.ASSESSMENTS);
        ArrayNode all = objectMapper.createArrayNode();
        for (LessonSpec lesson : course.lessons()) {
            JsonNode exercises = course.content().value(lesson.id())
                    .map(c -> c.get("exercises")).orElse(null);
            if (exercises == null || !exercises.isArray() || exercises.isEmpty()) continue;

            ObjectNode assessment = objectMapper.createObjectNode();
            assessment.put("lesson_number", lesson.number());
            assessment.put("title", lesson.title());
            assessment.set("exercises", exercises);
            writeJson(dir.resolve("lesson_" + lesson.id().padded() + "_assessment.json"), assessment);
            all.add(assessment);
        }
        ObjectNode summary = objectMapper.createObjectNode();
        summary.put("course_title", course.courseTitle());
        summary.put("assessed_lessons", all.size());
        writeJson(dir.resolve("assessment_index.json"), summary);
    }

    private void writeMarketing(CourseData course) throws IOException {
        Path dir = course.workspace().dir(JobWorkspace.MARKETING);
        String description = course.description().orElse("");
        Files.writeString(dir.resolve("description.md"),
                "# " + course.courseTitle() + "\n\n" + description + "\n");
    }

    ObjectNode curriculumJson(Curriculum c) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("course_title", c.courseTitle());
        root.put("difficulty", c.difficulty());
        root.put("target_audience", c.targetAudience());
        ArrayNode objectives = root.putArray("learning_objectives");
        c.learningObjectives().forEach(objectives::add);
        root.put("total_duration_minutes", c.totalDurationMinutes());
        ArrayNode lessons = root.putArray("lessons");
        for (LessonSpec l : c.lessons()) {
            ObjectNode n = lessons.addObject();
            n.put("lesson_number", l.number());
            n.put("title", l.title());
            n.put("type", l.type().label());
            n.put("duration_minutes", l.durationMinutes());
            n.put("has_coding", l.hasCoding());
            ArrayNode lo = n.putArray("learning_objectives");
            l.learningObjectives().forEach(lo::add);
        }
        return root;
    }

    ObjectNode metadataJson(CourseData course) {
        Curriculum c = course.curriculum();
        ObjectNode root = objectMapper.createObjectNode();

        ObjectNode info = root.putObject("course_info");
        info.put("title", c.courseTitle());
        info.put("topic", course.topic());
        info.put("difficulty", c.difficulty());
        info.put("target_audience", c.targetAudience());
        info.put("description", course.description().orElse(""));
        info.put("total_duration_hours", c.totalDurationHours());

        root.put("lessons", c.lessons().size());

        ObjectNode tech = root.putObject("technical_info");
        tech.put("scripts", course.scripts().size());
        tech.put("notebooks", course.notebooks().size());
        tech.put("backgrounds", course.backgrounds().size());
        tech.put("videos", course.finalVideos().size());
        tech.put("has_thumbnail", course.thumbnail().isPresent());

        ObjectNode gen = root.putObject("generation_info");
        gen.put("job_id", course.jobId().toString());
        gen.put("generated_at", clock.instant().toString());
        ArrayNode docs = gen.putArray("document_ids");
        course.documentIds().forEach(d -> docs.add(d.toString()));
        Map<String, Integer> providers = new TreeMap<>();
        int degraded = 0;
        for (StageArtifact<?> a : course.allArtifacts()) {
            providers.merge(a.providerUsed(), 1, Integer::sum);
            if (a.degraded()) degraded++;
        }
        gen.put("degraded_artifacts", degraded);
        ObjectNode used = gen.putObject("providers_used");
        providers.forEach(used::put);
        return root;
    }

    private String readme(CourseData course) {
        Curriculum c = course.curriculum();
        StringBuilder sb = new StringBuilder();
        sb.append("# ").append(c.courseTitle()).append("\n\n");
        course.description().ifPresent(d -> sb.append(d).append("\n\n"));
        sb.append("- Difficulty: ").append(c.difficulty()).append('\n');
        sb.append("- Audience: ").append(c.targetAudience()).append('\n');
        sb.append("- Duration: ").append("%.1f".formatted(c.totalDurationHours())).append(" hours\n\n");
        sb.append("## Lessons\n\n");
        for (LessonSpec l : c.lessons()) {
            sb.append(l.number()).append(". ").append(l.title())
              .append(" (").append(l.type().label()).append(", ").append(l.durationMinutes()).append(" min)");
            if (course.notebooks().contains(l.id())) sb.append(" [notebook]");
            sb.append('\n');
        }
        sb.append("\n## Contents\n\n")
          .append("- `videos/` final lesson videos\n")
          .append("- `scripts/` narration scripts\n")
          .append("- `notebooks/` Jupyter notebooks for coding lessons\n")
          .append("- `backgrounds/` video backgrounds\n")
          .append("- `resources/` per-lesson reference material\n")
          .append("- `assessments/` exercises per lesson\n")
          .append("- `marketing/` description and thumbnail\n\n")
          .append("See `").append(SETUP_FILE).append("` to get started.\n");
        return sb.toString();
    }

    private static String setupInstructions(CourseData course) {
        return """
                # Setup

                1. Unpack the archive and open `README.md` for the lesson overview.
                2. Watch the lesson videos in `videos/` in order.
                3. For coding lessons, install Python 3.10+ and Jupyter:

                       pip install notebook
                       jupyter notebook notebooks/

                4. Work through the exercises in `assessments/` after each lesson.

                Course: %s
                """.formatted(course.courseTitle());
    }

    // ------------------------------------------------------------------

    private void writeJson(Path file, JsonNode node) throws IOException {
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), node);
    }

    private static String relative(Path root, Path file) {
        if (file == null) return null;
        return file.startsWith(root) ? root.relativize(file).toString().replace('\\', '/') : file.toString();
    }

    private static void deleteQuietly(Path dir) {
        if (!Files.exists(dir)) return;
        try (Stream<Path> walk = Files.walk(dir)) {
            walk.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.delete(p);
                } catch (IOException e) {
                    log.debug("Could not delete {}: {}", p, e.getMessage());
                }
            });
        } catch (IOException e) {
            log.warn("Could not clean up {}: {}", dir, e.getMessage());
        }
    }
}
