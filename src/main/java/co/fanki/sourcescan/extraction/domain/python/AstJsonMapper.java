package co.fanki.sourcescan.extraction.domain.python;

import co.fanki.sourcescan.shared.Preconditions;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Maps the JSON document written by the bundled {@code ast_dump.py} script
 * onto a {@link SyntaxTree}.
 *
 * <p>The document holds exactly one of {@code tree}, {@code error} (a
 * CPython {@code SyntaxError}) or {@code failure} (any other exception the
 * interpreter raised).</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
final class AstJsonMapper {

    private final SourceLines lines;

    /**
     * Creates a mapper for one document.
     *
     * @param theLines the line index of the parsed source
     */
    AstJsonMapper(final SourceLines theLines) {
        this.lines = Preconditions.requireNonNull(theLines,
                "Source lines are required");
    }

    /**
     * Converts the dumper output.
     *
     * @param document the parsed JSON document
     * @return the syntax tree
     * @throws PythonSyntaxException if the interpreter reported a
     *         syntax error
     * @throws FrontEndException if the interpreter failed otherwise or the
     *         document is malformed
     */
    SyntaxTree toTree(final JsonNode document) {
        Preconditions.requireNonNull(document, "Document is required");

        final JsonNode error = document.get("error");
        if (error != null && !error.isNull()) {
            throw syntaxError(error);
        }

        final JsonNode failure = document.get("failure");
        if (failure != null && !failure.isNull()) {
            throw new FrontEndException("Python interpreter raised "
                    + failure.path("type").asText("Exception") + ": "
                    + failure.path("message").asText(""));
        }

        final JsonNode tree = document.get("tree");
        if (tree == null || !tree.isObject()) {
            throw new FrontEndException("Python front-end output has no tree");
        }

        final SyntaxNode root = toNode(tree);
        if (root == null || !root.is(NodeKind.MODULE)) {
            throw new FrontEndException("Python front-end output root is not"
                    + " a Module");
        }
        return new SyntaxTree(root);
    }

    private PythonSyntaxException syntaxError(final JsonNode error) {
        final int line = error.path("lineno").asInt(0);
        final int offset = error.path("offset").asInt(0);
        final JsonNode text = error.get("text");
        return new PythonSyntaxException(
                error.path("msg").asText("invalid syntax"),
                line,
                offset,
                text == null || text.isNull() ? lines.line(line)
                        : text.asText());
    }

    private SyntaxNode toNode(final JsonNode json) {
        if (json == null || json.isNull()) {
            return null;
        }
        if (!json.isObject()) {
            throw new FrontEndException("Expected a syntax node, found "
                    + json.getNodeType());
        }

        final NodeKind kind = NodeKind.fromAstName(json.path("_type").asText());
        final SyntaxNode.Builder builder = SyntaxNode.builder(kind,
                Math.max(0, json.path("lineno").asInt(0)),
                Math.max(0, json.path("col_offset").asInt(0)));

        final JsonNode payload = json.get("payload");
        if (payload != null && !payload.isNull()) {
            builder.payload(toPayload(kind, payload));
        }

        final Iterator<Map.Entry<String, JsonNode>> fields =
                json.path("fields").fields();
        while (fields.hasNext()) {
            final Map.Entry<String, JsonNode> field = fields.next();
            final JsonNode value = field.getValue();
            if (value.isArray()) {
                final List<SyntaxNode> children = new ArrayList<>();
                for (final JsonNode item : value) {
                    children.add(toNode(item));
                }
                builder.children(field.getKey(), children);
            } else {
                builder.child(field.getKey(), toNode(value));
            }
        }
        return builder.build();
    }

    private Object toPayload(final NodeKind kind, final JsonNode payload) {
        switch (kind) {
            case CONSTANT:
            case MATCH_SINGLETON:
                return toLiteral(payload);
            case ALIAS:
                final JsonNode asName = payload.get("asname");
                return new ImportAlias(payload.path("name").asText(),
                        asName == null || asName.isNull()
                                ? null : asName.asText());
            case GLOBAL:
            case NONLOCAL:
            case COMPARE:
            case MATCH_CLASS:
                final List<String> values = new ArrayList<>();
                for (final JsonNode item : payload) {
                    values.add(item.asText());
                }
                return List.copyOf(values);
            case FORMATTED_VALUE:
                return payload.asInt(-1);
            case COMPREHENSION:
                return payload.asBoolean(false);
            default:
                return payload.asText();
        }
    }

    private LiteralValue toLiteral(final JsonNode payload) {
        final String kind = payload.path("kind").asText();
        final JsonNode value = payload.get("value");
        switch (kind) {
            case "none":
                return LiteralValue.none();
            case "ellipsis":
                return LiteralValue.ellipsis();
            case "boolean":
                return LiteralValue.ofBoolean(value.asBoolean());
            case "string":
                return LiteralValue.ofString(value.asText());
            case "bytes":
                return LiteralValue.ofBytes(value.asText());
            case "integer":
            case "float":
            case "imaginary":
                try {
                    return LiteralValue.ofNumber(value.asText());
                } catch (final NumberFormatException e) {
                    throw new FrontEndException("Unreadable number literal '"
                            + value.asText() + "'", e);
                }
            default:
                throw new FrontEndException("Unknown constant kind '" + kind
                        + "'");
        }
    }
}
