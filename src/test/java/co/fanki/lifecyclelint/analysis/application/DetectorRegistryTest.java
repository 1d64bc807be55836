package co.fanki.lifecyclelint.analysis.application;

import co.fanki.lifecyclelint.analysis.domain.Detector;
import co.fanki.lifecyclelint.analysis.domain.java.JdbcHandleDetector;
import co.fanki.lifecyclelint.analysis.domain.kotlin.KotlinNullGuardDetector;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link DetectorRegistry}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class DetectorRegistryTest {

    @Test
    void whenFinding_givenRegisteredName_shouldReturnDetector() {
        final Detector kotlin = new KotlinNullGuardDetector();
        final DetectorRegistry registry = new DetectorRegistry(List.of(
                new JdbcHandleDetector(), kotlin));

        assertEquals(kotlin, registry.find("kotlin-narrowing").orElseThrow());
        assertTrue(registry.find("cobol-resources").isEmpty());
    }

    @Test
    void whenListingNames_shouldReturnThemSorted() {
        final DetectorRegistry registry = new DetectorRegistry(List.of(
                new KotlinNullGuardDetector(), new JdbcHandleDetector()));

        assertEquals(List.of("java-resources", "kotlin-narrowing"),
                registry.names());
    }

    @Test
    void whenCreating_givenDuplicateNames_shouldFail() {
        final Detector impostor = mock(Detector.class);
        when(impostor.name()).thenReturn("java-resources");

        assertThrows(IllegalArgumentException.class,
                () -> new DetectorRegistry(List.of(new JdbcHandleDetector(),
                        impostor)));
    }

}
