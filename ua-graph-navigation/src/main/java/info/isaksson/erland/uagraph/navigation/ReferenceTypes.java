package info.isaksson.erland.uagraph.navigation;

import info.isaksson.erland.uagraph.model.Node;
import info.isaksson.erland.uagraph.model.NodeClass;
import info.isaksson.erland.uagraph.model.error.AmbiguousOrMissingReferenceTypeException;

import java.util.Collection;

/** Browse names of the reference types the navigation relies on, and their resolution. */
public final class ReferenceTypes {

    public static final String HAS_SUBTYPE = "HasSubtype";
    public static final String HAS_TYPE_DEFINITION = "HasTypeDefinition";
    public static final String HAS_PROPERTY = "HasProperty";
    public static final String HAS_COMPONENT = "HasComponent";
    public static final String HAS_MODELLING_RULE = "HasModellingRule";
    public static final String ORGANIZES = "Organizes";
    public static final String HIERARCHICAL_REFERENCES = "HierarchicalReferences";
    public static final String NON_HIERARCHICAL_REFERENCES = "NonHierarchicalReferences";

    private ReferenceTypes() {}

    /**
     * @return surrogate of the single ReferenceType node called {@code browseName}
     * @throws AmbiguousOrMissingReferenceTypeException when there is no such node or more than one
     */
    public static int resolve(Collection<Node> nodes, String browseName) {
        Integer found = null;
        for (Node n : nodes) {
            if (n.nodeClass != NodeClass.REFERENCE_TYPE || !n.browseName.equals(browseName)) continue;
            if (found != null) {
                throw new AmbiguousOrMissingReferenceTypeException(
                        "More than one reference type has BrowseName " + browseName);
            }
            found = n.id;
        }
        if (found == null) {
            throw new AmbiguousOrMissingReferenceTypeException("No reference type has BrowseName " + browseName);
        }
        return found;
    }
}
