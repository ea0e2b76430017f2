package co.fanki.sourcescan.extraction.domain;

import co.fanki.sourcescan.shared.Preconditions;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * One import declaration found in a document.
 *
 * <p>A plain {@code import a.b as c} yields one record per target with
 * {@code module} and the single name both set to the dotted target, and
 * {@code alias} set to its alias or empty. A {@code from m import x, y}
 * yields one record for the whole statement with an empty {@code alias};
 * per-name aliases are kept apart in {@code aliases}, one entry per aliased
 * name in source order, so {@code from m import a as x, a as y} keeps
 * both bindings.</p>
 *
 * @param module the imported module, empty for {@code from . import x}
 * @param names the imported names in source order
 * @param alias the alias of a plain import, otherwise empty
 * @param line the 1-based line of the statement
 * @param aliases the aliased names of a from-import, in source order
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ImportRecord(
        String module,
        List<String> names,
        String alias,
        int line,
        @JsonInclude(JsonInclude.Include.NON_EMPTY) List<ImportedName> aliases
) {

    /**
     * Creates a new import record.
     *
     * @param module the module, never null
     * @param names the names, never null
     * @param alias the alias, never null
     * @param line the line, positive
     * @param aliases the per-name aliases, never null
     */
    public ImportRecord {
        Preconditions.requireNonNull(module, "Module is required");
        Preconditions.requireNonNull(names, "Names are required");
        Preconditions.requireNonNull(alias, "Alias is required");
        Preconditions.requirePositive(line, "Line must be positive");
        Preconditions.requireNonNull(aliases, "Aliases are required");
        names = List.copyOf(names);
        aliases = List.copyOf(aliases);
    }

    /**
     * Creates the record of one plain import target.
     *
     * @param target the dotted module name
     * @param asName the alias, may be null
     * @param line the statement line
     * @return the record
     */
    public static ImportRecord plain(final String target, final String asName,
            final int line) {
        return new ImportRecord(target, List.of(target),
                asName == null ? "" : asName, line, List.of());
    }
}
