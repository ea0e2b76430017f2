package co.fanki.sourcescan.extraction.domain.python;

import co.fanki.sourcescan.shared.Preconditions;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Queue;

/**
 * A parsed Python module as produced by a {@link PythonFrontEnd}.
 *
 * <p>Document order is breadth-first from the module node, children taken
 * in field order. This is the order CPython's {@code ast.walk} yields, so
 * results stay comparable whichever front-end built the tree.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class SyntaxTree {

    private final SyntaxNode root;

    /**
     * Creates a new tree.
     *
     * @param theRoot the {@link NodeKind#MODULE} node
     */
    public SyntaxTree(final SyntaxNode theRoot) {
        Preconditions.requireNonNull(theRoot, "Root node is required");
        Preconditions.require(theRoot.is(NodeKind.MODULE),
                "Root node must be a module, got " + theRoot.kind());
        this.root = theRoot;
    }

    /** @return the module node */
    public SyntaxNode root() {
        return root;
    }

    /**
     * Enumerates every node of the tree in document order.
     *
     * @return all nodes, the module first
     */
    public List<SyntaxNode> enumerate() {
        final List<SyntaxNode> result = new ArrayList<>();
        final Queue<SyntaxNode> pending = new ArrayDeque<>();
        pending.add(root);

        while (!pending.isEmpty()) {
            final SyntaxNode node = pending.poll();
            result.add(node);
            pending.addAll(node.children());
        }
        return Collections.unmodifiableList(result);
    }
}
