package co.fanki.lifecyclelint.analysis.domain.python;

import co.fanki.lifecyclelint.analysis.domain.ResourceKind;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The known Python APIs that acquire or release resources.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class PythonResourceApi {

    private static final Map<CallSignature, ResourceKind> ACQUISITIONS =
            Map.ofEntries(
                    Map.entry(CallSignature.bare("open"),
                            ResourceKind.FILE_HANDLE),
                    Map.entry(new CallSignature("builtins", "open"),
                            ResourceKind.FILE_HANDLE),
                    Map.entry(new CallSignature("io", "open"),
                            ResourceKind.FILE_HANDLE),
                    Map.entry(new CallSignature("pathlib", "open"),
                            ResourceKind.FILE_HANDLE),
                    Map.entry(new CallSignature("pathlib.Path", "open"),
                            ResourceKind.FILE_HANDLE),
                    Map.entry(new CallSignature("tempfile",
                            "NamedTemporaryFile"), ResourceKind.FILE_HANDLE),
                    Map.entry(new CallSignature("tempfile", "TemporaryFile"),
                            ResourceKind.FILE_HANDLE),
                    Map.entry(new CallSignature("tempfile",
                            "SpooledTemporaryFile"), ResourceKind.FILE_HANDLE),
                    Map.entry(new CallSignature("socket", "socket"),
                            ResourceKind.SOCKET_HANDLE),
                    Map.entry(new CallSignature("socket", "create_connection"),
                            ResourceKind.SOCKET_HANDLE),
                    Map.entry(new CallSignature("socket", "socketpair"),
                            ResourceKind.SOCKET_HANDLE),
                    Map.entry(new CallSignature("subprocess", "Popen"),
                            ResourceKind.POPEN_HANDLE),
                    Map.entry(new CallSignature("asyncio", "create_task"),
                            ResourceKind.ASYNCIO_TASK));

    private static final Map<ResourceKind, Set<String>> RELEASE_METHODS =
            new EnumMap<>(Map.of(
                    ResourceKind.FILE_HANDLE, Set.of("close"),
                    ResourceKind.SOCKET_HANDLE, Set.of("close", "shutdown"),
                    ResourceKind.POPEN_HANDLE,
                            Set.of("wait", "communicate", "terminate", "kill"),
                    ResourceKind.ASYNCIO_TASK, Set.of("cancel")));

    private static final Set<CallSignature> TASK_JOINS = Set.of(
            new CallSignature("asyncio", "gather"),
            new CallSignature("asyncio", "wait"),
            new CallSignature("asyncio", "wait_for"));

    private PythonResourceApi() {
    }

    /**
     * Returns the kind of resource a call acquires.
     *
     * @param signature the resolved call signature, may be null
     * @return the acquired kind, or empty if the call acquires nothing
     */
    public static Optional<ResourceKind> acquisition(
            final CallSignature signature) {
        if (signature == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(ACQUISITIONS.get(signature));
    }

    /**
     * Checks whether calling a method releases a resource of a kind.
     *
     * @param kind the resource kind
     * @param method the called method name
     * @return true if the method releases the resource
     */
    public static boolean releases(final ResourceKind kind,
            final String method) {
        return RELEASE_METHODS.getOrDefault(kind, Set.of()).contains(method);
    }

    /**
     * Checks whether a method name releases any tracked kind.
     *
     * @param method the called method name
     * @return true if some kind is released by it
     */
    public static boolean isReleaseMethod(final String method) {
        return RELEASE_METHODS.values().stream()
                .anyMatch(methods -> methods.contains(method));
    }

    /**
     * Checks whether a call joins the tasks passed to it.
     *
     * @param signature the resolved call signature, may be null
     * @return true for asyncio.gather, asyncio.wait and asyncio.wait_for
     */
    public static boolean joinsTasks(final CallSignature signature) {
        return signature != null && TASK_JOINS.contains(signature);
    }

}
