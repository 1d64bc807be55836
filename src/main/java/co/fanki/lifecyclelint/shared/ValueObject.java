package co.fanki.lifecyclelint.shared;

import java.io.Serializable;

/**
 * Marker for the immutable values that flow between the analyzers and the
 * reporter (findings, call signatures, import aliases, resource
 * records).
 *
 * <p>Implementations are records or final classes that validate their
 * state on construction and compare by value.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface ValueObject extends Serializable {

}
