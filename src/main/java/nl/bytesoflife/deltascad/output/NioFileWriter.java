package nl.bytesoflife.deltascad.output;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes UTF-8 text with {@code \n} line endings on every platform.
 */
public class NioFileWriter implements FileWriter {

    @Override
    public void writeAllLines(Path path, List<String> lines) throws IOException {
        StringBuilder sb = new StringBuilder();
        for (String line : lines) {
            sb.append(line);
            if (!line.endsWith("\n")) {
                sb.append('\n');
            }
        }
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(path, sb.toString(), StandardCharsets.UTF_8);
    }
}
