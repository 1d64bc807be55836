package co.fanki.lifecyclelint.analysis.domain;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Unit tests for {@link SourceLocator}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class SourceLocatorTest {

    @Test
    void whenLocating_givenFirstCharacter_shouldReturnLineOneColumnOne() {
        final SourceLocator locator = new SourceLocator("abc\ndef");

        assertEquals(new SourceLocator.Position(1, 1), locator.locate(0));
    }

    @Test
    void whenLocating_givenOffsetOnSecondLine_shouldCountFromLineStart() {
        final SourceLocator locator = new SourceLocator("abc\ndef\n");

        assertEquals(new SourceLocator.Position(2, 3), locator.locate(6));
        assertEquals(2, locator.line(4));
    }

}
