package co.fanki.lifecyclelint.analysis.domain.rust;

import co.fanki.lifecyclelint.shared.Preconditions;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a line-delimited JSON structural-match feed.
 *
 * <p>Each line is parsed on its own. Blank lines, lines that are not
 * valid JSON (including lines with malformed UTF-8) and entries without a usable identifier are skipped.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class StructuralMatchFeed {

    private static final Logger LOG = LoggerFactory.getLogger(
            StructuralMatchFeed.class);

    private final ObjectMapper objectMapper;

    /**
     * Creates a feed reader.
     *
     * @param theObjectMapper the JSON mapper
     */
    public StructuralMatchFeed(final ObjectMapper theObjectMapper) {
        this.objectMapper = Preconditions.requireNonNull(theObjectMapper,
                "Object mapper is required");
    }

    /**
     * Reads the usable entries of a feed file.
     *
     * @param feed the feed file
     * @return the usable entries in feed order
     * @throws IOException if the feed cannot be read
     */
    public List<StructuralMatch> read(final Path feed) throws IOException {
        Preconditions.requireNonNull(feed, "Feed path is required");

        final List<StructuralMatch> matches = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(
                Files.newInputStream(feed), lenientUtf8()))) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                try {
                    final StructuralMatch match = objectMapper.readValue(line,
                            StructuralMatch.class);
                    if (match != null && match.guardedName().isPresent()) {
                        matches.add(match);
                    }
                } catch (final JsonProcessingException e) {
                    LOG.debug("Skipping malformed feed line {}: {}",
                            lineNumber, e.getOriginalMessage());
                }
            }
        }
        return matches;
    }

    /**
     * Decodes UTF-8 replacing malformed sequences, so that a line with bad
     * bytes fails as JSON and is skipped on its own.
     */
    private static CharsetDecoder lenientUtf8() {
        return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
    }

}
