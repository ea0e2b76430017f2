package co.fanki.sourcescan.extraction.domain.python;

import co.fanki.sourcescan.shared.Preconditions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One node of a generic Python syntax tree.
 *
 * <p>A node has a {@link NodeKind}, a source position, an optional scalar
 * payload (identifier, attribute name, literal, ...) and named child
 * fields kept in declaration order. A field holds either a single child or
 * a list; list fields may contain null entries where CPython keeps them
 * ({@code Dict.keys} for {@code **mapping} entries and
 * {@code arguments.kw_defaults}).</p>
 *
 * <p>Nodes are immutable once built.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class SyntaxNode {

    private final NodeKind kind;
    private final int line;
    private final int column;
    private final Object payload;
    private final Map<String, List<SyntaxNode>> fields;

    private SyntaxNode(final Builder builder) {
        this.kind = builder.kind;
        this.line = builder.line;
        this.column = builder.column;
        this.payload = builder.payload;
        this.fields = Collections.unmodifiableMap(builder.fields);
    }

    /**
     * Starts building a node.
     *
     * @param kind the node kind, never null
     * @param line the 1-based line, or 0 for nodes without a position
     * @param column the 0-based column
     * @return a new builder
     */
    public static Builder builder(final NodeKind kind, final int line,
            final int column) {
        return new Builder(kind, line, column);
    }

    /** @return the node kind */
    public NodeKind kind() {
        return kind;
    }

    /** @return the 1-based line, 0 when the node carries no position */
    public int line() {
        return line;
    }

    /** @return the 0-based column */
    public int column() {
        return column;
    }

    /** @return the raw payload, may be null */
    public Object payload() {
        return payload;
    }

    /**
     * Returns the payload cast to the expected type.
     *
     * @param type the expected payload type
     * @param <T> the payload type
     * @return the payload, null if the node has none
     * @throws IllegalStateException if the payload has another type
     */
    public <T> T payload(final Class<T> type) {
        if (payload == null) {
            return null;
        }
        if (!type.isInstance(payload)) {
            throw new IllegalStateException(kind + " node at line " + line
                    + " carries a " + payload.getClass().getSimpleName()
                    + " payload, expected " + type.getSimpleName());
        }
        return type.cast(payload);
    }

    /**
     * Returns the single child stored under a field.
     *
     * @param field the field name
     * @return the child, or null if the field is absent or empty
     */
    public SyntaxNode child(final String field) {
        final List<SyntaxNode> values = fields.get(field);
        if (values == null || values.isEmpty()) {
            return null;
        }
        return values.get(0);
    }

    /**
     * Returns the single child stored under a field that must be present.
     *
     * @param field the field name
     * @return the child, never null
     * @throws IllegalStateException if the field is absent or empty
     */
    public SyntaxNode requireChild(final String field) {
        final SyntaxNode child = child(field);
        if (child == null) {
            throw new IllegalStateException(kind + " node at line " + line
                    + " has no '" + field + "' child");
        }
        return child;
    }

    /**
     * Returns the children stored under a field.
     *
     * @param field the field name
     * @return the children in source order, may contain nulls; empty if
     *         the field is absent
     */
    public List<SyntaxNode> children(final String field) {
        return fields.getOrDefault(field, List.of());
    }

    /**
     * Returns every non-null child across all fields, in field order.
     *
     * @return the direct children of this node
     */
    public List<SyntaxNode> children() {
        final List<SyntaxNode> result = new ArrayList<>();
        for (final List<SyntaxNode> values : fields.values()) {
            for (final SyntaxNode value : values) {
                if (value != null) {
                    result.add(value);
                }
            }
        }
        return result;
    }

    /**
     * Checks the node kind.
     *
     * @param expected the kind to compare against
     * @return true if this node is of the expected kind
     */
    public boolean is(final NodeKind expected) {
        return kind == expected;
    }

    /** {@inheritDoc} */
    @Override
    public String toString() {
        return kind + "@" + line + ":" + column
                + (payload != null ? "(" + payload + ")" : "");
    }

    /**
     * Builder for {@link SyntaxNode}.
     */
    public static final class Builder {

        private final NodeKind kind;
        private final int line;
        private final int column;
        private Object payload;
        private final Map<String, List<SyntaxNode>> fields =
                new LinkedHashMap<>();

        private Builder(final NodeKind theKind, final int theLine,
                final int theColumn) {
            this.kind = Preconditions.requireNonNull(theKind,
                    "Node kind is required");
            this.line = Preconditions.requireNonNegative(theLine,
                    "Line must not be negative");
            this.column = Preconditions.requireNonNegative(theColumn,
                    "Column must not be negative");
        }

        /**
         * Sets the payload.
         *
         * @param value the payload
         * @return this builder
         */
        public Builder payload(final Object value) {
            this.payload = value;
            return this;
        }

        /**
         * Adds a single-child field; a null child records an empty field.
         *
         * @param field the field name
         * @param child the child, may be null
         * @return this builder
         */
        public Builder child(final String field, final SyntaxNode child) {
            if (child == null) {
                fields.put(field, List.of());
            } else {
                fields.put(field, List.of(child));
            }
            return this;
        }

        /**
         * Adds a list field.
         *
         * @param field the field name
         * @param children the children, null entries allowed
         * @return this builder
         */
        public Builder children(final String field,
                final List<SyntaxNode> children) {
            Preconditions.requireNonNull(children,
                    "Children list is required");
            fields.put(field,
                    Collections.unmodifiableList(new ArrayList<>(children)));
            return this;
        }

        /** @return the built node */
        public SyntaxNode build() {
            return new SyntaxNode(this);
        }
    }
}
