package nl.bytesoflife.deltascad.output;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OpenScadInvokerTest {

    private final Path script = Path.of("models", "part.scad");

    @Test
    void openCommandPassesScript() {
        OpenScadInvoker invoker = new OpenScadInvoker(script);
        assertEquals(List.of("openscad", script.toString()), invoker.command(null));
    }

    @Test
    void renderCommandAddsOutput() {
        OpenScadInvoker invoker = new OpenScadInvoker(script, "/usr/local/bin/openscad");
        Path stl = Path.of("part.stl");
        assertEquals(List.of("/usr/local/bin/openscad", "-o", stl.toString(), script.toString()),
                invoker.command(stl));
    }

    @Test
    void missingExecutableFailsWithCause() {
        OpenScadInvoker invoker = new OpenScadInvoker(script, "delta-scad-no-such-executable");
        ScadInvocationException e = assertThrows(ScadInvocationException.class, invoker::open);
        assertNotNull(e.getCause());
        assertEquals(script, invoker.getPath());
    }
}
