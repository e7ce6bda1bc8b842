package io.github.cogscore.scan;

import java.nio.file.Path;

/** A file that could not be scored, with the reason. */
public record ScanFailure(Path file, String message) {}
