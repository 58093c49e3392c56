package nl.bytesoflife.deltascad.output;

/**
 * Thrown when the external OpenSCAD process cannot be started.
 */
public class ScadInvocationException extends RuntimeException {

    public ScadInvocationException(String message, Throwable cause) {
        super(message, cause);
    }
}
