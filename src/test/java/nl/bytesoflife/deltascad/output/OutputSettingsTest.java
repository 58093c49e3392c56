package nl.bytesoflife.deltascad.output;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class OutputSettingsTest {

    @Test
    void defaultsComeFromClasspathResource() {
        OutputSettings settings = OutputSettings.defaults();
        assertEquals("// Generated by delta-scad", settings.getHeader());
        assertEquals("delta_scad_render", settings.getModuleName());
        assertTrue(settings.isCallRenderFunction());
        assertEquals("openscad", settings.getExecutable());
        assertSame(settings, OutputSettings.defaults());
    }

    @Test
    void emptyPropertiesUseBuiltInDefaults() {
        OutputSettings settings = OutputSettings.load(new Properties());
        assertEquals(OutputSettings.DEFAULT_HEADER, settings.getHeader());
        assertEquals(OutputSettings.DEFAULT_MODULE_NAME, settings.getModuleName());
        assertTrue(settings.isCallRenderFunction());
        assertEquals(OutputSettings.DEFAULT_EXECUTABLE, settings.getExecutable());
    }

    @Test
    void loadFromStream() throws IOException {
        String content = """
                output.header=// custom
                output.moduleName = bracket
                output.callRenderFunction=false
                output.openscadExecutable=/opt/openscad/bin/openscad
                """;
        OutputSettings settings = OutputSettings.load(
                new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8)));

        assertEquals("// custom", settings.getHeader());
        assertEquals("bracket", settings.getModuleName());
        assertFalse(settings.isCallRenderFunction());
        assertEquals("/opt/openscad/bin/openscad", settings.getExecutable());
    }

    @Test
    void withersReturnModifiedCopies() {
        OutputSettings base = OutputSettings.load(new Properties());
        OutputSettings changed = base.withCallRenderFunction(false).withModuleName("other");
        assertTrue(base.isCallRenderFunction());
        assertFalse(changed.isCallRenderFunction());
        assertEquals("other", changed.getModuleName());
        assertEquals(base.getHeader(), changed.getHeader());
    }
}
