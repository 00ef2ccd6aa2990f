package info.isaksson.erland.uagraph.navigation;

/** Variable families told apart by their type definition. */
public enum VariableKind {
    /** {@code BaseDataVariableType} and its subtypes. */
    SIGNAL,
    /** {@code PropertyType} and its subtypes. */
    PROPERTY
}
