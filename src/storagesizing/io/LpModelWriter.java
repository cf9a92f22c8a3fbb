package storagesizing.io;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Запись собранной модели в LP-формате. Старый файл перезаписывается.
 */
public final class LpModelWriter {

    private LpModelWriter() {}

    public static void write(String path, String lpText) throws IOException {
        if (lpText == null || lpText.isEmpty()) {
            throw new IllegalArgumentException("Empty LP model");
        }
        Path target = Path.of(path);
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (BufferedWriter w = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            w.write(lpText);
        }
    }
}
