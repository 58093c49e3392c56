package nl.bytesoflife.deltascad.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Launches the {@code openscad} executable on a written script.
 */
public class OpenScadInvoker implements FileInvoker {

    private static final Logger log = LoggerFactory.getLogger(OpenScadInvoker.class);

    private final Path path;
    private final String executable;

    public OpenScadInvoker(Path path) {
        this(path, OutputSettings.DEFAULT_EXECUTABLE);
    }

    public OpenScadInvoker(Path path, String executable) {
        this.path = path;
        this.executable = executable;
    }

    @Override
    public Path getPath() {
        return path;
    }

    @Override
    public Process open() {
        return start(command(null));
    }

    @Override
    public Process render(Path output) {
        return start(command(output));
    }

    List<String> command(Path output) {
        List<String> command = new ArrayList<>();
        command.add(executable);
        if (output != null) {
            command.add("-o");
            command.add(output.toString());
        }
        command.add(path.toString());
        return command;
    }

    private Process start(List<String> command) {
        log.info("Starting {}", String.join(" ", command));
        try {
            return new ProcessBuilder(command).inheritIO().start();
        } catch (IOException e) {
            throw new ScadInvocationException("Failed to start " + executable + " for " + path, e);
        }
    }
}
