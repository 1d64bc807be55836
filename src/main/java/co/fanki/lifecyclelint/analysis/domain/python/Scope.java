package co.fanki.lifecyclelint.analysis.domain.python;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A module or function scope: the names it imported and the resources it
 * bound to names.
 *
 * <p>Records are kept by their index in the analyzer's record list, in
 * acquisition order, so that a release always finds the earliest open
 * record for a name first.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
final class Scope {

    private final Map<String, ImportAlias> aliases = new HashMap<>();

    private final Map<String, List<Integer>> recordsByName = new HashMap<>();

    void bind(final String name, final ImportAlias alias) {
        aliases.put(name, alias);
    }

    Optional<ImportAlias> alias(final String name) {
        return Optional.ofNullable(aliases.get(name));
    }

    void track(final String name, final int recordIndex) {
        recordsByName.computeIfAbsent(name, key -> new ArrayList<>())
                .add(recordIndex);
    }

    List<Integer> recordsNamed(final String name) {
        return recordsByName.getOrDefault(name, List.of());
    }

}
