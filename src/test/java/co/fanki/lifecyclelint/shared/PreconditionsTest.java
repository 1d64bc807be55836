package co.fanki.lifecyclelint.shared;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for Preconditions utility.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class PreconditionsTest {

    @Test
    void whenRequireNonNull_givenNonNullValue_shouldReturnValue() {
        final String value = "test";

        final String result = Preconditions.requireNonNull(value, "message");

        assertEquals(value, result);
    }

    @Test
    void whenRequireNonNull_givenNullValue_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> Preconditions.requireNonNull(null, "Value is null"));
    }

    @Test
    void whenRequireNonBlank_givenBlankString_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> Preconditions.requireNonBlank("  ", "String is blank"));
    }

    @Test
    void whenRequire_givenFalseCondition_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> Preconditions.require(false, "Condition is false"));
    }

    @Test
    void whenRequirePosition_givenOne_shouldReturnIt() {
        assertEquals(1, Preconditions.requirePosition(1, "message"));
    }

    @Test
    void whenRequirePosition_givenZero_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> Preconditions.requirePosition(0, "Line must be >= 1"));
    }

    @Test
    void whenRequireOffset_givenTextLength_shouldReturnIt() {
        assertEquals(3, Preconditions.requireOffset(3, "abc", "message"));
    }

    @Test
    void whenRequireOffset_givenOffsetPastEnd_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> Preconditions.requireOffset(4, "abc", "Out of range"));
    }

    @Test
    void whenRequireOffset_givenNegativeOffset_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> Preconditions.requireOffset(-1, "abc", "Out of range"));
    }

}
