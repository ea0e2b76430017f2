package co.fanki.sourcescan.extraction.domain;

import co.fanki.sourcescan.shared.Preconditions;

/**
 * A name bound by a from-import under an alias, as in
 * {@code from m import name as alias}.
 *
 * @param name the imported name
 * @param alias the local name it is bound to
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ImportedName(String name, String alias) {

    /**
     * Creates a new aliased name.
     *
     * @param name the name, never blank
     * @param alias the alias, never blank
     */
    public ImportedName {
        Preconditions.requireNonBlank(name, "Imported name is required");
        Preconditions.requireNonBlank(alias, "Alias is required");
    }
}
