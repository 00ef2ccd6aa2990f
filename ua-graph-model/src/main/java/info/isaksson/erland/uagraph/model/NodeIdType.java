package info.isaksson.erland.uagraph.model;

import info.isaksson.erland.uagraph.model.error.MalformedNodeIdException;

/** Identifier kinds with their one-letter code in the textual form. */
public enum NodeIdType {
    NUMERIC("i"),
    STRING("s"),
    GUID("g"),
    OPAQUE("b");

    private final String code;

    NodeIdType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static NodeIdType fromCode(String code) {
        for (NodeIdType t : values()) {
            if (t.code.equals(code)) return t;
        }
        throw new MalformedNodeIdException("Unknown identifier kind '" + code + "'");
    }
}
