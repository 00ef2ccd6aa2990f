package info.isaksson.erland.uagraph.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/** The eight node classes of a NodeSet2 address space, keyed by their XML element name. */
public enum NodeClass {
    OBJECT("UAObject"),
    OBJECT_TYPE("UAObjectType"),
    VARIABLE("UAVariable"),
    VARIABLE_TYPE("UAVariableType"),
    DATA_TYPE("UADataType"),
    REFERENCE_TYPE("UAReferenceType"),
    VIEW("UAView"),
    METHOD("UAMethod");

    private final String xmlTag;

    NodeClass(String xmlTag) {
        this.xmlTag = xmlTag;
    }

    @JsonValue
    public String xmlTag() {
        return xmlTag;
    }

    /** Type-defining classes, i.e. the ones whose tag ends with "Type". */
    public boolean isType() {
        return this == OBJECT_TYPE || this == VARIABLE_TYPE || this == DATA_TYPE || this == REFERENCE_TYPE;
    }

    public static Optional<NodeClass> fromXmlTag(String tag) {
        for (NodeClass c : values()) {
            if (c.xmlTag.equals(tag)) return Optional.of(c);
        }
        return Optional.empty();
    }
}
