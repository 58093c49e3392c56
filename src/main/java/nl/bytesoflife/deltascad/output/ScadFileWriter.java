package nl.bytesoflife.deltascad.output;

import nl.bytesoflife.deltascad.model.ScadObject;
import nl.bytesoflife.deltascad.renderer.scad.ModuleFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Function;

/**
 * Writes a rendered object to a {@code .scad} file: the header line, then the
 * object wrapped in a named module, optionally followed by a call to it.
 */
public class ScadFileWriter {

    private static final Logger log = LoggerFactory.getLogger(ScadFileWriter.class);

    public static final String EXTENSION = ".scad";

    private final OutputSettings settings;
    private final FileWriter fileWriter;
    private final Function<Path, FileInvoker> invokerFactory;

    public ScadFileWriter() {
        this(OutputSettings.defaults());
    }

    public ScadFileWriter(OutputSettings settings) {
        this(settings, new NioFileWriter(), path -> new OpenScadInvoker(path, settings.getExecutable()));
    }

    public ScadFileWriter(OutputSettings settings, FileWriter fileWriter,
                          Function<Path, FileInvoker> invokerFactory) {
        this.settings = settings;
        this.fileWriter = fileWriter;
        this.invokerFactory = invokerFactory;
    }

    /**
     * @param filePath target file; {@code .scad} is appended when missing
     * @return a handle for launching OpenSCAD on the written file
     */
    public FileInvoker write(ScadObject object, String filePath) throws IOException {
        Path path = Path.of(withExtension(filePath));
        List<String> lines = compose(object);
        fileWriter.writeAllLines(path, lines);
        log.info("Wrote {} (object {}, module {})", path, object.getId(), settings.getModuleName());
        return invokerFactory.apply(path);
    }

    List<String> compose(ScadObject object) {
        ModuleFormatter module = new ModuleFormatter(
                settings.getModuleName(), object.toString(), settings.isCallRenderFunction());
        return List.of(settings.getHeader(), module.toString());
    }

    static String withExtension(String filePath) {
        return filePath.endsWith(EXTENSION) ? filePath : filePath + EXTENSION;
    }
}
