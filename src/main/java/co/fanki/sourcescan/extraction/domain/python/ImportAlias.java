package co.fanki.sourcescan.extraction.domain.python;

import co.fanki.sourcescan.shared.Preconditions;

/**
 * Payload of a {@link NodeKind#ALIAS} node: one imported name and the
 * local name it is bound to.
 *
 * @param name the imported name, dotted for plain imports
 * @param asName the alias after {@code as}, or null
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ImportAlias(String name, String asName) {

    /**
     * Creates a new import alias.
     *
     * @param name the imported name, never blank
     * @param asName the alias, may be null
     */
    public ImportAlias {
        Preconditions.requireNonBlank(name, "Imported name is required");
    }
}
