package co.fanki.sourcescan.extraction.domain;

import co.fanki.sourcescan.extraction.domain.python.Fields;
import co.fanki.sourcescan.extraction.domain.python.NodeKind;
import co.fanki.sourcescan.extraction.domain.python.SourceLines;
import co.fanki.sourcescan.extraction.domain.python.SyntaxNode;
import co.fanki.sourcescan.extraction.domain.python.SyntaxTree;
import co.fanki.sourcescan.shared.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects the call expressions of a tree in document order.
 *
 * <h3>Callee resolution</h3>
 * <ul>
 *   <li>{@code f(...)}: function {@code f}, no module.</li>
 *   <li>{@code a.b.f(...)}: function {@code f}, module {@code a.b}.</li>
 *   <li>{@code x().f(...)} or {@code x[0].f(...)}: function {@code f},
 *       no module, as the chain is not rooted in an identifier.</li>
 *   <li>Any other callee: neither function nor module.</li>
 * </ul>
 *
 * <p>Nested calls yield one record each. Stateless and thread-safe.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class CallExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(
            CallExtractor.class);

    private final ValueNormalizer normalizer;

    /**
     * Creates a new call extractor.
     *
     * @param theNormalizer the normalizer for argument values
     */
    public CallExtractor(final ValueNormalizer theNormalizer) {
        this.normalizer = Preconditions.requireNonNull(theNormalizer,
                "Value normalizer is required");
    }

    /**
     * Extracts every call expression.
     *
     * @param tree the parsed document, never null
     * @param lines the document lines, used to echo each call's line
     * @return the records in document order
     * @throws IllegalStateException if a call node has no callee
     */
    public List<CallRecord> extract(final SyntaxTree tree,
            final SourceLines lines) {
        Preconditions.requireNonNull(tree, "Syntax tree is required");
        Preconditions.requireNonNull(lines, "Source lines are required");

        final List<CallRecord> records = new ArrayList<>();
        for (final SyntaxNode node : tree.enumerate()) {
            if (node.is(NodeKind.CALL)) {
                records.add(toRecord(node, lines));
            }
        }
        return records;
    }

    private CallRecord toRecord(final SyntaxNode call,
            final SourceLines lines) {
        final SyntaxNode callee = call.requireChild(Fields.FUNC);

        String function = null;
        String module = null;
        if (callee.is(NodeKind.NAME)) {
            function = callee.payload(String.class);
        } else if (callee.is(NodeKind.ATTRIBUTE)) {
            function = callee.payload(String.class);
            module = qualifier(callee.child(Fields.VALUE));
        }

        final List<TypedValue> positional = new ArrayList<>();
        for (final SyntaxNode argument : call.children(Fields.ARGS)) {
            positional.add(normalizer.normalize(argument));
        }

        final Map<String, TypedValue> keywords = new LinkedHashMap<>();
        int unpackings = 0;
        for (final SyntaxNode keyword : call.children(Fields.KEYWORDS)) {
            String name = keyword.payload(String.class);
            if (name == null) {
                name = "**" + unpackings++;
            }
            keywords.put(name, normalizer.normalize(
                    keyword.child(Fields.VALUE)));
        }

        final Map<String, TypedValue> arguments = new LinkedHashMap<>();
        for (int i = 0; i < positional.size(); i++) {
            arguments.put("arg_" + i, positional.get(i));
        }
        for (final Map.Entry<String, TypedValue> entry : keywords.entrySet()) {
            if (arguments.containsKey(entry.getKey())) {
                LOG.warn("Keyword '{}' at line {} shadows a positional"
                        + " argument in the combined view", entry.getKey(),
                        call.line());
            }
            arguments.put(entry.getKey(), entry.getValue());
        }

        final String text = lines.line(call.line());

        return new CallRecord(call.line(), call.column(), function, module,
                arguments, positional, keywords,
                text == null ? null : text.strip());
    }

    /**
     * Resolves the dotted prefix of an attribute callee.
     *
     * @return the prefix, or null if the chain is not rooted in a name
     */
    private static String qualifier(final SyntaxNode value) {
        final Deque<String> parts = new ArrayDeque<>();
        SyntaxNode current = value;
        while (current != null && current.is(NodeKind.ATTRIBUTE)) {
            parts.addFirst(current.payload(String.class));
            current = current.child(Fields.VALUE);
        }
        if (current == null || !current.is(NodeKind.NAME)) {
            return null;
        }
        parts.addFirst(current.payload(String.class));
        return String.join(".", parts);
    }
}
