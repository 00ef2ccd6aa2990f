package info.isaksson.erland.uagraph.parser;

import java.util.List;

/** Parser options. */
public final class ParseOptions {
    /**
     * Desired namespace order; index 0 must be the OPC UA namespace. Empty means first-seen order.
     * Unused indices may hold {@link info.isaksson.erland.uagraph.model.NamespaceTable#PLACEHOLDER}.
     */
    public List<String> desiredNamespaces = List.of();

    /** When a desired order is given, skip files that declare none of its namespaces. */
    public boolean excludeFilesNotInNamespaces = true;

    public static ParseOptions withNamespaces(List<String> desiredNamespaces) {
        ParseOptions o = new ParseOptions();
        o.desiredNamespaces = desiredNamespaces == null ? List.of() : List.copyOf(desiredNamespaces);
        return o;
    }
}
