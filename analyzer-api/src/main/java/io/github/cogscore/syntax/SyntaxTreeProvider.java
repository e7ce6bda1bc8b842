package io.github.cogscore.syntax;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

/** Turns source text into a {@link SyntaxNode} tree rooted at a {@link NodeKind#SOURCE_FILE} node. */
public interface SyntaxTreeProvider {

    /**
     * Parses {@code source}.
     *
     * @param source the full text of one source file
     * @param sourceName a name for the source used in log and error messages, typically its path
     */
    SyntaxNode parse(String source, String sourceName) throws SyntaxTreeException;

    /** Reads and parses a file as UTF-8. */
    default SyntaxNode parse(Path file) throws IOException, SyntaxTreeException {
        return parse(Files.readString(file, StandardCharsets.UTF_8), file.toString());
    }

    /** Lowercase file extensions, without the dot, this provider can parse. */
    Set<String> supportedExtensions();
}
