package nl.bytesoflife.deltascad.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * Settings applied when writing a script to a file: the header line, the name
 * of the module wrapping the rendered object and whether that module is called.
 *
 * Defaults are read from the {@code deltascad.properties} classpath resource.
 */
public final class OutputSettings {

    private static final Logger log = LoggerFactory.getLogger(OutputSettings.class);

    public static final String RESOURCE = "/deltascad.properties";

    public static final String KEY_HEADER = "output.header";
    public static final String KEY_MODULE_NAME = "output.moduleName";
    public static final String KEY_CALL_RENDER_FUNCTION = "output.callRenderFunction";
    public static final String KEY_EXECUTABLE = "output.openscadExecutable";

    public static final String DEFAULT_HEADER = "// Generated by delta-scad";
    public static final String DEFAULT_MODULE_NAME = "delta_scad_render";
    public static final String DEFAULT_EXECUTABLE = "openscad";

    private static volatile OutputSettings cachedDefaults;

    private final String header;
    private final String moduleName;
    private final boolean callRenderFunction;
    private final String executable;

    public OutputSettings(String header, String moduleName, boolean callRenderFunction, String executable) {
        this.header = header;
        this.moduleName = moduleName;
        this.callRenderFunction = callRenderFunction;
        this.executable = executable;
    }

    /**
     * Settings from the classpath resource, falling back to the built-in
     * defaults for anything it does not define.
     */
    public static OutputSettings defaults() {
        if (cachedDefaults == null) {
            synchronized (OutputSettings.class) {
                if (cachedDefaults == null) {
                    cachedDefaults = loadDefaults();
                }
            }
        }
        return cachedDefaults;
    }

    private static OutputSettings loadDefaults() {
        try (InputStream is = OutputSettings.class.getResourceAsStream(RESOURCE)) {
            if (is == null) {
                log.debug("No {} on classpath, using built-in output settings", RESOURCE);
                return load(new Properties());
            }
            return load(is);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
    }

    public static OutputSettings load(InputStream is) throws IOException {
        Properties props = new Properties();
        props.load(is);
        return load(props);
    }

    public static OutputSettings load(Properties props) {
        OutputSettings settings = new OutputSettings(
                props.getProperty(KEY_HEADER, DEFAULT_HEADER),
                props.getProperty(KEY_MODULE_NAME, DEFAULT_MODULE_NAME).trim(),
                Boolean.parseBoolean(props.getProperty(KEY_CALL_RENDER_FUNCTION, "true").trim()),
                props.getProperty(KEY_EXECUTABLE, DEFAULT_EXECUTABLE).trim());
        log.debug("Loaded output settings: {}", settings);
        return settings;
    }

    public String getHeader() {
        return header;
    }

    public String getModuleName() {
        return moduleName;
    }

    public boolean isCallRenderFunction() {
        return callRenderFunction;
    }

    public String getExecutable() {
        return executable;
    }

    public OutputSettings withCallRenderFunction(boolean call) {
        return new OutputSettings(header, moduleName, call, executable);
    }

    public OutputSettings withModuleName(String name) {
        return new OutputSettings(header, name, callRenderFunction, executable);
    }

    @Override
    public String toString() {
        return "OutputSettings{module=" + moduleName + ", call=" + callRenderFunction
                + ", executable=" + executable + "}";
    }
}
