package com.coursegen.orchestrator.packaging;

import com.coursegen.orchestrator.pipeline.JobWorkspace;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Checks a package directory for the required layout.
 */
public class PackageValidator {

    public static final List<String> REQUIRED_DIRECTORIES = List.of(
            JobWorkspace.VIDEOS, JobWorkspace.NOTEBOOKS, JobWorkspace.RESOURCES, JobWorkspace.MARKETING,
            JobWorkspace.SCRIPTS, JobWorkspace.BACKGROUNDS, JobWorkspace.ASSESSMENTS);

    public static final List<String> REQUIRED_FILES = List.of(
            CoursePackager.METADATA_FILE, CoursePackager.CURRICULUM_FILE, CoursePackager.README_FILE);

    private final Clock clock;

    public PackageValidator(Clock clock) {
        this.clock = clock;
    }

    public ValidationReport validate(Path packageDir) {
        List<ValidationReport.Check> checks = new ArrayList<>();
        for (String dir : REQUIRED_DIRECTORIES) {
            checks.add(new ValidationReport.Check("directory " + dir, Files.isDirectory(packageDir.resolve(dir))));
        }
        for (String file : REQUIRED_FILES) {
            checks.add(new ValidationReport.Check("file " + file, Files.isRegularFile(packageDir.resolve(file))));
        }
        return new ValidationReport(checks, clock.instant().toString());
    }
}
