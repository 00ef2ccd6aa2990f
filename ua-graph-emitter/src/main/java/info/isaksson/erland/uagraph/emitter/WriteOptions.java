package info.isaksson.erland.uagraph.emitter;

import java.time.OffsetDateTime;

/**
 * Options for writing one namespace of a graph as a NodeSet2 file.
 *
 * <p>Timestamps left null default to the time of writing.</p>
 */
public final class WriteOptions {

    /**
     * Keep references from instances in the namespace to nodes outside it. When false only
     * HasModellingRule and HasTypeDefinition references may leave the namespace.
     */
    public boolean includeOutgoingInstanceLevelReferences = true;

    public OffsetDateTime lastModified;

    /** {@code PublicationDate} of the written model; falls back to the parsed model's date. */
    public OffsetDateTime publicationDate;

    /** {@code Version} of the written model; falls back to the parsed model's version, then 1.0.0. */
    public String newModelVersion;

    /** Check stored values against their DataType before anything is written. */
    public boolean validateValues = true;

    public static WriteOptions defaults() {
        return new WriteOptions();
    }
}
