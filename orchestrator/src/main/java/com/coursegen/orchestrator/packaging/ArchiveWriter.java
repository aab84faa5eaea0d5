package com.coursegen.orchestrator.packaging;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Zips a directory tree. Entry names are relative to the directory's parent,
 * so unpacking recreates the package directory itself.
 */
public class ArchiveWriter {

    public Path zip(Path directory, Path archive, Predicate<Path> include) throws IOException {
        List<Path> files;
        try (Stream<Path> walk = Files.walk(directory)) {
            files = walk.filter(Files::isRegularFile).filter(include).sorted().toList();
        }
        Path base = directory.getParent() != null ? directory.getParent() : directory;
        Path partial = archive.resolveSibling(archive.getFileName() + ".part");
        try (OutputStream out = Files.newOutputStream(partial);
             ZipOutputStream zip = new ZipOutputStream(out)) {
            for (Path file : files) {
                zip.putNextEntry(new ZipEntry(base.relativize(file).toString().replace('\\', '/')));
                Files.copy(file, zip);
                zip.closeEntry();
            }
        }
        return Files.move(partial, archive, StandardCopyOption.REPLACE_EXISTING);
    }
}
