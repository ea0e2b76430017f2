package co.fanki.sourcescan.extraction.domain;

import co.fanki.sourcescan.extraction.domain.python.Fields;
import co.fanki.sourcescan.extraction.domain.python.ImportAlias;
import co.fanki.sourcescan.extraction.domain.python.NodeKind;
import co.fanki.sourcescan.extraction.domain.python.SyntaxNode;
import co.fanki.sourcescan.extraction.domain.python.SyntaxTree;
import co.fanki.sourcescan.shared.Preconditions;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects the import declarations of a tree in document order.
 *
 * <p>Stateless and thread-safe.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ImportExtractor {

    /**
     * Extracts every import declaration, nested ones included.
     *
     * @param tree the parsed document, never null
     * @return the records in document order
     */
    public List<ImportRecord> extract(final SyntaxTree tree) {
        Preconditions.requireNonNull(tree, "Syntax tree is required");

        final List<ImportRecord> records = new ArrayList<>();
        for (final SyntaxNode node : tree.enumerate()) {
            if (node.is(NodeKind.IMPORT)) {
                for (final SyntaxNode alias : node.children(Fields.NAMES)) {
                    final ImportAlias target = alias.payload(ImportAlias.class);
                    records.add(ImportRecord.plain(target.name(),
                            target.asName(), node.line()));
                }
            } else if (node.is(NodeKind.IMPORT_FROM)) {
                records.add(fromImport(node));
            }
        }
        return records;
    }

    private static ImportRecord fromImport(final SyntaxNode node) {
        final String module = node.payload(String.class);

        final List<String> names = new ArrayList<>();
        final List<ImportedName> aliases = new ArrayList<>();
        for (final SyntaxNode alias : node.children(Fields.NAMES)) {
            final ImportAlias imported = alias.payload(ImportAlias.class);
            names.add(imported.name());
            if (imported.asName() != null) {
                aliases.add(new ImportedName(imported.name(),
                        imported.asName()));
            }
        }

        return new ImportRecord(module == null ? "" : module, names, "",
                node.line(), aliases);
    }
}
