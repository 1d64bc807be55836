package co.fanki.lifecyclelint.analysis.domain.python;

import co.fanki.lifecyclelint.analysis.domain.Finding;
import co.fanki.lifecyclelint.analysis.domain.ResourceKind;
import co.fanki.lifecyclelint.shared.Preconditions;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Tracks resource acquisitions and releases over the syntax tree of one
 * Python module.
 *
 * <p>The tree is the JSON export produced by {@link PythonAstEngine}. The
 * walk keeps a stack of {@link Scope}s, the module scope at the bottom and
 * one more per function. Imports bind aliases in the current scope; calls
 * are resolved to a {@link CallSignature} through those aliases and
 * classified with {@link PythonResourceApi}.</p>
 *
 * <p>Release rules:</p>
 * <ul>
 *   <li>a release method called on a name releases the earliest open
 *   record of that name in the innermost scope only;</li>
 *   <li>returning or yielding a name releases the earliest open record of
 *   that name in any scope, innermost first, whatever its kind;</li>
 *   <li>awaiting a name, or passing it to asyncio.gather/wait/wait_for,
 *   releases a task in the innermost scope.</li>
 * </ul>
 *
 * <p>Resources created as the context expression of a {@code with} block
 * are never recorded.</p>
 *
 * <p>Instances are single use: create one per module.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ResourceLifecycleAnalyzer {

    private static final Set<String> POSITION_KEYS = Set.of(
            "_type", "lineno", "col");

    private final List<ResourceRecord> records = new ArrayList<>();

    private final Set<JsonNode> safeCalls = identitySet();

    private final Set<JsonNode> assignedCalls = identitySet();

    private final Deque<Scope> scopes = new ArrayDeque<>();

    private ResourceLifecycleAnalyzer() {
        scopes.push(new Scope());
    }

    /**
     * Analyzes a module and reports its unreleased resources.
     *
     * @param displayPath the path printed in findings
     * @param module the exported {@code Module} node
     * @return the findings sorted by line, kind and name
     */
    public static List<Finding> analyze(final String displayPath,
            final JsonNode module) {
        Preconditions.requireNonBlank(displayPath, "Display path is required");
        Preconditions.requireNonNull(module, "Syntax tree is required");

        final ResourceLifecycleAnalyzer analyzer =
                new ResourceLifecycleAnalyzer();
        analyzer.visit(module);
        return analyzer.report(displayPath);
    }

    private List<Finding> report(final String displayPath) {
        final List<ResourceRecord> sorted = new ArrayList<>(records);
        sorted.sort(Comparator.comparingInt(ResourceRecord::line)
                .thenComparing(record -> record.kind().tag())
                .thenComparing(record -> record.name() == null
                        ? "" : record.name()));

        final List<Finding> findings = new ArrayList<>();
        for (final ResourceRecord record : sorted) {
            if (!record.released()) {
                findings.add(Finding.atLine(displayPath, record.line(),
                        record.kind().tag(),
                        record.kind().describe(record.name())));
            }
        }
        return findings;
    }

    // Dispatch.

    private void visit(final JsonNode node) {
        if (node == null) {
            return;
        }
        if (node.isArray()) {
            for (final JsonNode child : node) {
                visit(child);
            }
            return;
        }
        if (!node.isObject()) {
            return;
        }
        switch (type(node)) {
            case "FunctionDef", "AsyncFunctionDef" -> visitFunction(node);
            case "Import" -> visitImport(node);
            case "ImportFrom" -> visitImportFrom(node);
            case "Return", "Yield", "YieldFrom" -> visitOwnershipTransfer(node);
            case "With", "AsyncWith" -> visitWith(node);
            case "Assign" -> visitAssign(node);
            case "AnnAssign" -> visitAnnAssign(node);
            case "Call" -> visitCall(node);
            case "Await" -> visitAwait(node);
            default -> visitChildren(node);
        }
    }

    private void visitChildren(final JsonNode node) {
        final Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            final Map.Entry<String, JsonNode> field = fields.next();
            if (!POSITION_KEYS.contains(field.getKey())) {
                visit(field.getValue());
            }
        }
    }

    // Scopes.

    private void visitFunction(final JsonNode node) {
        scopes.push(new Scope());
        visitChildren(node);
        scopes.pop();
    }

    // Imports.

    private void visitImport(final JsonNode node) {
        for (final JsonNode alias : node.path("names")) {
            final String name = text(alias, "name");
            final String asName = text(alias, "asname");
            scopes.peek().bind(asName != null ? asName : name,
                    new ImportAlias(name, null));
        }
    }

    private void visitImportFrom(final JsonNode node) {
        final String module = text(node, "module");
        for (final JsonNode alias : node.path("names")) {
            final String name = text(alias, "name");
            if ("*".equals(name)) {
                continue;
            }
            final String asName = text(alias, "asname");
            scopes.peek().bind(asName != null ? asName : name,
                    new ImportAlias(module != null ? module : "", name));
        }
    }

    // Ownership transfer.

    private void visitOwnershipTransfer(final JsonNode node) {
        final JsonNode value = child(node, "value");
        if (value != null) {
            for (final String name : collectNames(value)) {
                markReleased(name, kind -> true, true);
            }
        }
        visitChildren(node);
    }

    // Scoped acquisition.

    private void visitWith(final JsonNode node) {
        for (final JsonNode item : node.path("items")) {
            markSafeCalls(child(item, "context_expr"));
        }
        visitChildren(node);
    }

    private void markSafeCalls(final JsonNode expr) {
        if (expr == null) {
            return;
        }
        if (is(expr, "Call")) {
            if (PythonResourceApi.acquisition(signature(expr)).isPresent()) {
                safeCalls.add(expr);
            }
            for (final JsonNode argument : expr.path("args")) {
                markSafeCalls(argument);
            }
            for (final JsonNode keyword : expr.path("keywords")) {
                markSafeCalls(child(keyword, "value"));
            }
        } else if (is(expr, "Attribute")) {
            markSafeCalls(child(expr, "value"));
        }
    }

    // Assignments.

    private void visitAssign(final JsonNode node) {
        final List<JsonNode> targets = new ArrayList<>();
        node.path("targets").forEach(targets::add);
        recordAssignment(targets, child(node, "value"));
        visitChildren(node);
    }

    private void visitAnnAssign(final JsonNode node) {
        final JsonNode value = child(node, "value");
        if (value != null) {
            recordAssignment(List.of(node.path("target")), value);
        }
        visitChildren(node);
    }

    private void recordAssignment(final List<JsonNode> targets,
            final JsonNode value) {
        if (value == null || !is(value, "Call")) {
            return;
        }
        final Optional<ResourceKind> kind = PythonResourceApi.acquisition(
                signature(value));
        if (kind.isEmpty()) {
            return;
        }
        assignedCalls.add(value);

        final List<String> names = new ArrayList<>();
        for (final JsonNode target : targets) {
            names.addAll(collectNames(target));
        }
        if (names.isEmpty()) {
            addRecord(null, kind.get(), line(value));
            return;
        }
        for (final String name : names) {
            addRecord(name, kind.get(), line(value));
        }
    }

    // Calls and releases.

    private void visitCall(final JsonNode node) {
        if (!assignedCalls.contains(node) && !safeCalls.contains(node)) {
            PythonResourceApi.acquisition(signature(node)).ifPresent(kind ->
                    addRecord(null, kind, line(node)));
        }
        handleRelease(node);
        visitChildren(node);
    }

    private void visitAwait(final JsonNode node) {
        final JsonNode value = child(node, "value");
        if (value != null && is(value, "Name")) {
            markReleased(text(value, "id"),
                    kind -> kind == ResourceKind.ASYNCIO_TASK, false);
        }
        visitChildren(node);
    }

    private void handleRelease(final JsonNode call) {
        final JsonNode func = child(call, "func");
        if (func != null && is(func, "Attribute")) {
            final String method = text(func, "attr");
            if (method != null && PythonResourceApi.isReleaseMethod(method)) {
                markReleased(dottedName(child(func, "value")),
                        kind -> PythonResourceApi.releases(kind, method),
                        false);
            }
        }

        if (PythonResourceApi.joinsTasks(signature(call))) {
            final List<String> tasks = new ArrayList<>();
            call.path("args").forEach(argument ->
                    collectTaskNames(argument, tasks));
            for (final JsonNode keyword : call.path("keywords")) {
                collectTaskNames(child(keyword, "value"), tasks);
            }
            for (final String task : tasks) {
                markReleased(task,
                        kind -> kind == ResourceKind.ASYNCIO_TASK, false);
            }
        }
    }

    private static void collectTaskNames(final JsonNode argument,
            final List<String> names) {
        if (argument == null) {
            return;
        }
        if (is(argument, "Name")) {
            names.add(text(argument, "id"));
        } else if (is(argument, "Tuple") || is(argument, "List")
                || is(argument, "Set")) {
            for (final JsonNode element : argument.path("elts")) {
                collectTaskNames(element, names);
            }
        }
    }

    // Records.

    private void addRecord(final String name, final ResourceKind kind,
            final int line) {
        records.add(ResourceRecord.acquired(name, kind, line));
        if (name != null && !name.isEmpty()) {
            scopes.peek().track(name, records.size() - 1);
        }
    }

    /**
     * Releases the earliest open record of a name whose kind matches.
     *
     * <p>Only the innermost scope is searched unless {@code allScopes} is
     * set, in which case scopes are searched innermost first and the
     * search stops at the first release.</p>
     */
    private void markReleased(final String name,
            final Predicate<ResourceKind> kind, final boolean allScopes) {
        if (name == null || name.isEmpty()) {
            return;
        }
        final Iterable<Scope> searched = allScopes
                ? scopes : List.of(scopes.peek());
        for (final Scope scope : searched) {
            for (final int index : scope.recordsNamed(name)) {
                final ResourceRecord record = records.get(index);
                if (!record.released() && kind.test(record.kind())) {
                    records.set(index, record.release());
                    return;
                }
            }
        }
    }

    // Call signatures.

    /**
     * Resolves the API a call invokes.
     *
     * <p>A receiver that is a plain name but no import is taken as a module
     * name; dotted receivers are used verbatim without alias resolution.</p>
     *
     * @return the signature, or null when the callee has no static shape
     */
    private CallSignature signature(final JsonNode call) {
        final JsonNode func = child(call, "func");
        if (func == null) {
            return null;
        }

        if (is(func, "Name")) {
            final String id = text(func, "id");
            final ImportAlias alias = lookupAlias(id);
            if (present(alias.symbol())) {
                return new CallSignature(alias.module(), alias.symbol());
            }
            return new CallSignature(alias.module(), id);
        }

        if (!is(func, "Attribute")) {
            return null;
        }
        final String attribute = text(func, "attr");
        final JsonNode base = child(func, "value");
        if (attribute == null || base == null) {
            return null;
        }

        if (is(base, "Name")) {
            final String id = text(base, "id");
            final ImportAlias alias = lookupAlias(id);
            final String owner;
            if (present(alias.module())) {
                owner = alias.module();
            } else if (present(alias.symbol())) {
                owner = alias.symbol();
            } else {
                owner = id;
            }
            return new CallSignature(owner, attribute);
        }
        if (is(base, "Attribute")) {
            final String dotted = dottedName(base);
            return dotted == null ? null
                    : new CallSignature(dotted, attribute);
        }
        if (is(base, "Call")) {
            final CallSignature inner = signature(base);
            if (inner == null) {
                return null;
            }
            final String owner = present(inner.owner())
                    ? inner.owner() + "." + inner.attribute()
                    : inner.attribute();
            return new CallSignature(owner, attribute);
        }
        return null;
    }

    private ImportAlias lookupAlias(final String name) {
        if (name == null) {
            return ImportAlias.UNBOUND;
        }
        for (final Scope scope : scopes) {
            final Optional<ImportAlias> alias = scope.alias(name);
            if (alias.isPresent()) {
                return alias.get();
            }
        }
        return ImportAlias.UNBOUND;
    }

    // Tree helpers.

    private static List<String> collectNames(final JsonNode node) {
        if (is(node, "Tuple") || is(node, "List")) {
            final List<String> names = new ArrayList<>();
            for (final JsonNode element : node.path("elts")) {
                names.addAll(collectNames(element));
            }
            return names;
        }
        if (is(node, "Name")) {
            final String id = text(node, "id");
            return id == null ? List.of() : List.of(id);
        }
        if (is(node, "Attribute")) {
            final String dotted = dottedName(node);
            return dotted == null ? List.of() : List.of(dotted);
        }
        return List.of();
    }

    private static String dottedName(final JsonNode expr) {
        if (expr == null) {
            return null;
        }
        if (is(expr, "Name")) {
            return text(expr, "id");
        }
        if (is(expr, "Attribute")) {
            final String base = dottedName(child(expr, "value"));
            final String attribute = text(expr, "attr");
            if (base != null && attribute != null) {
                return base + "." + attribute;
            }
        }
        return null;
    }

    private static String type(final JsonNode node) {
        return node.path("_type").asText("");
    }

    private static boolean is(final JsonNode node, final String type) {
        return node != null && type.equals(type(node));
    }

    private static int line(final JsonNode node) {
        return Math.max(1, node.path("lineno").asInt(1));
    }

    private static JsonNode child(final JsonNode node, final String field) {
        if (node == null) {
            return null;
        }
        final JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value;
    }

    private static String text(final JsonNode node, final String field) {
        final JsonNode value = child(node, field);
        return value != null && value.isTextual() ? value.asText() : null;
    }

    private static boolean present(final String value) {
        return value != null && !value.isEmpty();
    }

    private static Set<JsonNode> identitySet() {
        return Collections.newSetFromMap(new IdentityHashMap<>());
    }

}
