package com.phillippitts.classmate.service.materials;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.MalformedInputException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Reads {@code .txt}, {@code .md} and {@code .csv} materials as UTF-8. Other formats need
 * an external extractor and are skipped with a warning.
 */
@Component
public class PlainTextMaterialsProvider implements MaterialsProvider {

    private static final Logger LOG = LogManager.getLogger(PlainTextMaterialsProvider.class);

    static final Set<String> SUPPORTED_EXTENSIONS = Set.of("txt", "md", "csv");

    @Override
    public String load(List<String> refs) {
        if (refs == null || refs.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (String ref : refs) {
            Path path = Paths.get(ref);
            String ext = extension(path);
            if (!SUPPORTED_EXTENSIONS.contains(ext)) {
                LOG.warn("Unsupported material format '{}', skipped: {}", ext, path.getFileName());
                continue;
            }
            if (!Files.isRegularFile(path)) {
                LOG.warn("Material not found: {}", ref);
                continue;
            }
            try {
                String text = Files.readString(path, StandardCharsets.UTF_8).strip();
                if (text.isEmpty()) {
                    continue;
                }
                if (sb.length() > 0) {
                    sb.append("\n\n");
                }
                sb.append("## ").append(path.getFileName()).append('\n').append(text);
                LOG.debug("Loaded material {} ({} chars)", path.getFileName(), text.length());
            } catch (MalformedInputException e) {
                LOG.warn("Material {} is not valid UTF-8, skipped", path.getFileName());
            } catch (IOException e) {
                LOG.warn("Cannot read material {}: {}", ref, e.getMessage());
            }
        }
        return sb.toString();
    }

    static String extension(Path path) {
        String name = path.getFileName() == null ? "" : path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
