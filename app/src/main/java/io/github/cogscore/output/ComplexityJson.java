package io.github.cogscore.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.cogscore.complexity.FileOrFolderCost;
import java.util.Map;

/**
 * JSON form of scan results: {@code {"<name>": <file-or-folder>}}. A file is {@code {"score", "inner"}}, a folder maps
 * entry names to files or folders, and inner elements carry {@code name, score, line, column, inner}. Empty
 * {@code inner} arrays are left out.
 */
public final class ComplexityJson {
    private static final ObjectMapper objectMapper = new ObjectMapper();

    private ComplexityJson() {}

    public static String toJson(String name, FileOrFolderCost result, boolean pretty)
            throws JsonProcessingException {
        var writer = pretty ? objectMapper.writerWithDefaultPrettyPrinter() : objectMapper.writer();
        return writer.writeValueAsString(Map.of(name, result));
    }
}
