package com.libragraph.drivereport.formats.archive;

import com.libragraph.drivereport.formats.api.DriveReportException;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Temporary directory owned by one batch run. Everything under it is deleted on close.
 */
public final class WorkArea implements AutoCloseable {

    private static final Logger log = Logger.getLogger(WorkArea.class);

    private final Path root;
    private boolean closed;

    private WorkArea(Path root) {
        this.root = root;
    }

    public static WorkArea create() {
        try {
            return new WorkArea(Files.createTempDirectory("drivereport-"));
        } catch (IOException e) {
            throw new DriveReportException("Failed to create work area", e);
        }
    }

    public static WorkArea under(Path parent) {
        try {
            return new WorkArea(Files.createTempDirectory(parent, "drivereport-"));
        } catch (IOException e) {
            throw new DriveReportException("Failed to create work area under " + parent, e);
        }
    }

    public Path root() {
        return root;
    }

    public Path newFile(String prefix, String suffix) throws IOException {
        if (closed) {
            throw new IllegalStateException("Work area already closed: " + root);
        }
        return Files.createTempFile(root, prefix, suffix);
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (!Files.exists(root)) {
            return;
        }
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(root)) {
            paths = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
        } catch (IOException e) {
            log.warnf(e, "Failed to list work area %s for cleanup", root);
            return;
        }
        for (Path path : paths) {
            try {
                Files.deleteIfExists(path);
            } catch (IOException e) {
                log.warnf(e, "Failed to delete %s", path);
            }
        }
    }
}
