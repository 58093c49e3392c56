package nl.bytesoflife.deltascad.output;

import java.nio.file.Path;

/**
 * Handle on a written script that can be passed to an external OpenSCAD process.
 */
public interface FileInvoker {

    Path getPath();

    /**
     * Open the script in the OpenSCAD viewer.
     */
    Process open();

    /**
     * Export the script to {@code output}; the format follows its extension
     * (e.g. {@code .stl}).
     */
    Process render(Path output);
}
