package co.fanki.lifecyclelint.analysis.domain.python;

import co.fanki.lifecyclelint.analysis.domain.UnparsableSourceException;
import co.fanki.lifecyclelint.shared.Preconditions;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.PolyglotException;
import org.graalvm.polyglot.Source;
import org.graalvm.polyglot.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Parses Python source with the standard {@code ast} module running inside
 * a GraalPy polyglot context.
 *
 * <p>Loads the ast_export.py script from the classpath, creates a context
 * with no host access, and exposes the exported syntax tree as a Jackson
 * {@link JsonNode}. The context is created once and reused for every file
 * of a run, then closed via {@link #close()}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class PythonAstEngine implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(
            PythonAstEngine.class);

    private static final String SCRIPT_RESOURCE = "python/ast_export.py";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Context context;
    private final Value exportFunction;

    /**
     * Creates a new engine, evaluating the export script in a fresh
     * GraalPy context.
     *
     * @throws IOException if the script resource cannot be loaded
     */
    public PythonAstEngine() throws IOException {
        final String script = loadScriptFromClasspath();

        this.context = createContext();

        try {
            context.eval(Source.newBuilder("python", script,
                    "ast_export.py").build());

            this.exportFunction = context.getBindings("python")
                    .getMember("export_module");

            if (exportFunction == null || !exportFunction.canExecute()) {
                throw new IllegalStateException(
                        "export_module function not found in script");
            }
        } catch (final Exception e) {
            context.close();
            throw e;
        }
        LOG.info("GraalPy syntax tree exporter ready");
    }

    /**
     * Opens an engine, turning any startup failure into a
     * {@link PythonAstException}.
     *
     * @return the engine, never null
     */
    public static PythonAstEngine open() {
        try {
            return new PythonAstEngine();
        } catch (final IOException | RuntimeException e) {
            throw new PythonAstException(
                    "Could not start the Python parser: " + e.getMessage(), e);
        }
    }

    /**
     * Parses one module.
     *
     * @param source the module source
     * @param filename the name reported in syntax errors
     * @return the root {@code Module} node
     * @throws UnparsableSourceException if the source has a syntax error
     */
    public JsonNode parse(final String source, final String filename) {
        Preconditions.requireNonNull(source, "Source is required");
        Preconditions.requireNonNull(filename, "File name is required");

        final String json;
        try {
            json = exportFunction.execute(source, filename).asString();
        } catch (final PolyglotException e) {
            if (e.isGuestException()) {
                throw new UnparsableSourceException(e.getMessage());
            }
            throw new PythonAstException("Python parser failed on "
                    + filename, e);
        }

        final JsonNode tree;
        try {
            tree = MAPPER.readTree(json);
        } catch (final JsonProcessingException e) {
            throw new PythonAstException("Malformed syntax tree export for "
                    + filename, e);
        }

        if (tree.has("_error")) {
            throw new UnparsableSourceException(tree.get("_error").asText());
        }
        return tree;
    }

    /** {@inheritDoc} */
    @Override
    public void close() {
        context.close();
    }

    /**
     * Creates a GraalPy context without host access.
     *
     * <p>The posix module is emulated in Java so the guest never reaches
     * native code; only the ast and json modules are used.</p>
     */
    private static Context createContext() {
        return Context.newBuilder("python")
                .allowExperimentalOptions(true)
                .option("python.PosixModuleBackend", "java")
                .option("engine.WarnInterpreterOnly", "false")
                .build();
    }

    /**
     * Loads the export script from the classpath.
     */
    private static String loadScriptFromClasspath() throws IOException {
        try (InputStream is = PythonAstEngine.class.getClassLoader()
                .getResourceAsStream(SCRIPT_RESOURCE)) {
            if (is == null) {
                throw new IOException(
                        "Export script not found on classpath: "
                                + SCRIPT_RESOURCE);
            }
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
