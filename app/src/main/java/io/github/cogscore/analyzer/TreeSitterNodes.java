package io.github.cogscore.analyzer;

import java.nio.charset.StandardCharsets;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.treesitter.TSNode;

/**
 * Helpers for reading tree-sitter nodes against the UTF-8 bytes they were parsed from. Tree-sitter reports byte
 * offsets and byte columns, while Java strings index characters, so every conversion goes through the byte array.
 */
public final class TreeSitterNodes {
    private static final Logger log = LogManager.getLogger(TreeSitterNodes.class);

    private TreeSitterNodes() {}

    /** The source text of {@code node}, decoded from {@code sourceBytes}. */
    public static String text(TSNode node, byte[] sourceBytes) {
        int startByte = node.getStartByte();
        int endByte = node.getEndByte();

        if (startByte < 0 || endByte < startByte) {
            log.warn(
                    "Requested bytes outside valid range for source text (length: {} bytes): startByte={}, endByte={}",
                    sourceBytes.length,
                    startByte,
                    endByte);
            return "";
        }
        // zero-width nodes, e.g. tokens inserted by error recovery
        if (startByte == endByte) {
            return "";
        }
        if (startByte >= sourceBytes.length) {
            log.warn("Start byte offset {} exceeds source byte length {}", startByte, sourceBytes.length);
            return "";
        }
        if (endByte > sourceBytes.length) {
            log.warn("End byte offset {} exceeds source byte length {}, truncating", endByte, sourceBytes.length);
            endByte = sourceBytes.length;
        }
        return new String(sourceBytes, startByte, endByte - startByte, StandardCharsets.UTF_8);
    }

    /** Zero-based character column of the start of {@code node}. */
    public static int charColumn(TSNode node, byte[] sourceBytes) {
        int startByte = Math.min(node.getStartByte(), sourceBytes.length);
        int byteColumn = node.getStartPoint().getColumn();
        int lineStartByte = startByte - byteColumn;
        if (byteColumn <= 0 || lineStartByte < 0) {
            return Math.max(byteColumn, 0);
        }
        return new String(sourceBytes, lineStartByte, byteColumn, StandardCharsets.UTF_8).length();
    }
}
