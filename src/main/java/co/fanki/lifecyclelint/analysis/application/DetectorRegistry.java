package co.fanki.lifecyclelint.analysis.application;

import co.fanki.lifecyclelint.analysis.domain.Detector;
import co.fanki.lifecyclelint.shared.Preconditions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Looks detectors up by the name used on the command line.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class DetectorRegistry {

    private final Map<String, Detector> detectors = new LinkedHashMap<>();

    /**
     * Creates a registry.
     *
     * @param theDetectors the available detectors, names must be unique
     */
    public DetectorRegistry(final List<Detector> theDetectors) {
        Preconditions.requireNonNull(theDetectors, "Detectors are required");
        for (final Detector detector : theDetectors) {
            final Detector previous = detectors.put(detector.name(), detector);
            Preconditions.require(previous == null,
                    "Duplicate detector name: " + detector.name());
        }
    }

    /**
     * Finds a detector by name.
     *
     * @param name the detector name
     * @return the detector, or empty if unknown
     */
    public Optional<Detector> find(final String name) {
        return Optional.ofNullable(detectors.get(name));
    }

    /**
     * Returns the registered names, sorted.
     *
     * @return the detector names
     */
    public List<String> names() {
        final List<String> names = new ArrayList<>(detectors.keySet());
        Collections.sort(names);
        return names;
    }

}
