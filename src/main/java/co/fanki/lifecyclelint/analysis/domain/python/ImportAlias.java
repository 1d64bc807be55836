package co.fanki.lifecyclelint.analysis.domain.python;

import co.fanki.lifecyclelint.shared.ValueObject;

/**
 * What a local name was bound to by an import statement.
 *
 * <p>{@code import subprocess as sp} binds {@code sp} to
 * {@code ("subprocess", null)}; {@code from io import open as o} binds
 * {@code o} to {@code ("io", "open")}.</p>
 *
 * @param module the imported module, empty for a relative import without
 *        module, null when the name is not an import
 * @param symbol the imported symbol, null for a plain module import
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ImportAlias(String module, String symbol) implements ValueObject {

    /** The binding of a name that no import introduced. */
    public static final ImportAlias UNBOUND = new ImportAlias(null, null);

}
