package com.coursegen.orchestrator.packaging;

import java.nio.file.Path;

/**
 * A finished course package: the directory and its zip archive.
 */
public record PackageResult(Path directory, Path archive, ValidationReport validation) {}
