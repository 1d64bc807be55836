package co.fanki.lifecyclelint.analysis.domain.rust;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * One line of a structural-match feed, as produced by an external AST
 * pattern matcher.
 *
 * <p>Only the fields the detector uses are mapped; everything else in the
 * line is ignored.</p>
 *
 * @param file the matched file
 * @param range the matched range
 * @param metaVariables the captured meta variables
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StructuralMatch(
        String file,
        Range range,
        MetaVariables metaVariables
) {

    private static final Pattern IDENTIFIER = Pattern.compile(
            "^[A-Za-z_][A-Za-z0-9_]*$");

    /**
     * Returns the guarded identifier, when the entry is usable.
     *
     * <p>An entry is usable when it names a file, carries both byte
     * offsets and captures a bare identifier as {@code SOURCE} (or
     * {@code S}).</p>
     *
     * @return the identifier, or empty
     */
    public Optional<String> guardedName() {
        if (file == null || file.isBlank() || range == null
                || range.byteOffset() == null
                || range.byteOffset().start() == null
                || range.byteOffset().end() == null
                || metaVariables == null || metaVariables.single() == null) {
            return Optional.empty();
        }
        final Single single = metaVariables.single();
        final Capture capture = single.source() != null
                ? single.source() : single.s();
        if (capture == null || capture.text() == null) {
            return Optional.empty();
        }
        final String name = capture.text().trim();
        return IDENTIFIER.matcher(name).matches()
                ? Optional.of(name) : Optional.empty();
    }

    /** The matched range. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Range(ByteOffset byteOffset) {}

    /** UTF-8 byte offsets of the match, end exclusive. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ByteOffset(Long start, Long end) {}

    /** The meta variable captures. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MetaVariables(Single single) {}

    /** Single-node captures by meta variable name. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Single(
            @JsonProperty("SOURCE") Capture source,
            @JsonProperty("S") Capture s) {}

    /** A captured node. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Capture(String text) {}

}
