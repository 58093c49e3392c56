package nl.bytesoflife.deltascad.output;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes lines of text to storage.
 */
public interface FileWriter {

    void writeAllLines(Path path, List<String> lines) throws IOException;
}
