package info.isaksson.erland.uagraph.core;

/** Side of a node whose references are listed by the neighbor queries. */
public enum Relation {
    /** References whose source is the node. */
    OUTGOING,
    /** References whose target is the node. */
    INCOMING
}
