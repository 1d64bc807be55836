package co.fanki.lifecyclelint.analysis.domain.rust;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for {@link StructuralMatchFeed}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class StructuralMatchFeedTest {

    @TempDir
    Path root;

    private final StructuralMatchFeed reader = new StructuralMatchFeed(
            new ObjectMapper());

    @Test
    void whenReading_givenMixedLines_shouldKeepOnlyUsableEntries()
            throws IOException {
        final Path feed = root.resolve("feed.jsonl");
        Files.write(feed, List.of(
                "{\"file\": \"a.rs\", \"range\": {\"byteOffset\": {\"start\": 1,"
                        + " \"end\": 9}}, \"metaVariables\": {\"single\":"
                        + " {\"SOURCE\": {\"text\": \"opt\"}}}}",
                "   ",
                "{ broken",
                "{\"file\": \"b.rs\", \"range\": {\"byteOffset\": {\"start\": 1,"
                        + " \"end\": 9}}, \"metaVariables\": {\"single\":"
                        + " {\"SOURCE\": {\"text\": \"self.opt\"}}}}",
                "{\"file\": \"c.rs\", \"range\": {\"byteOffset\": {\"start\": 3,"
                        + " \"end\": 4}}, \"metaVariables\": {\"single\":"
                        + " {\"S\": {\"text\": \"res\"}}, \"multi\": {}}}"));

        final List<StructuralMatch> matches = reader.read(feed);

        assertEquals(2, matches.size());
        assertEquals("a.rs", matches.get(0).file());
        assertEquals(Optional.of("opt"), matches.get(0).guardedName());
        assertEquals(9L, matches.get(0).range().byteOffset().end());
        assertEquals("c.rs", matches.get(1).file());
        assertEquals(Optional.of("res"), matches.get(1).guardedName());
    }

    @Test
    void whenReading_givenLineWithMalformedUtf8_shouldSkipOnlyThatLine()
            throws IOException {
        final Path feed = root.resolve("feed.jsonl");
        final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        bytes.write(entry("a.rs", "first"));
        bytes.write(new byte[] {'{', '"', (byte) 0xff, (byte) 0xfe, '"', '}',
            '\n'});
        bytes.write(entry("b.rs", "second"));
        Files.write(feed, bytes.toByteArray());

        final List<StructuralMatch> matches = reader.read(feed);

        assertEquals(2, matches.size());
        assertEquals(Optional.of("first"), matches.get(0).guardedName());
        assertEquals(Optional.of("second"), matches.get(1).guardedName());
    }

    @Test
    void whenReading_givenEntryWithoutRange_shouldHaveNoGuardedName() {
        final StructuralMatch match = new StructuralMatch("a.rs", null,
                new StructuralMatch.MetaVariables(new StructuralMatch.Single(
                        new StructuralMatch.Capture("opt"), null)));

        assertEquals(Optional.empty(), match.guardedName());
    }

    @Test
    void whenReading_givenMissingFile_shouldThrowIoException() {
        assertThrows(IOException.class,
                () -> reader.read(root.resolve("missing.jsonl")));
    }

    private static byte[] entry(final String file, final String name) {
        return ("{\"file\": \"" + file + "\", \"range\": {\"byteOffset\":"
                + " {\"start\": 0, \"end\": 4}}, \"metaVariables\":"
                + " {\"single\": {\"SOURCE\": {\"text\": \"" + name
                + "\"}}}}\n").getBytes(StandardCharsets.UTF_8);
    }

}
