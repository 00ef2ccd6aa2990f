package info.isaksson.erland.uagraph.emitter;

import info.isaksson.erland.uagraph.model.Node;
import info.isaksson.erland.uagraph.model.NodeClass;
import info.isaksson.erland.uagraph.model.NodeSetTables;
import info.isaksson.erland.uagraph.model.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Checks that stored variable values agree with their declared DataType.
 *
 * <p>Only the built-in scalar types are checked: a value is invalid when both its own type and the display
 * name of its DataType are built-ins and the two differ. Anything else passes.</p>
 */
public final class ValueValidator {

    private static final Logger log = LoggerFactory.getLogger(ValueValidator.class);

    static final Set<String> BUILT_IN_TYPES = Set.of(
            "Boolean", "SByte", "Byte", "Int16", "UInt16", "Int32", "UInt32", "Int64", "UInt64",
            "Float", "Double", "String", "DateTime", "Guid", "ByteString", "LocalizedText", "NodeId");

    private ValueValidator() {}

    /**
     * @throws ValidationException listing the display names of every invalid row, or naming the first
     *         variable that has a value but no DataType
     */
    public static void validate(NodeSetTables tables, Collection<Node> nodes) {
        if (tables == null) throw new IllegalArgumentException("tables must not be null");
        List<String> invalid = new ArrayList<>();
        for (Node n : nodes) {
            if (n.nodeClass != NodeClass.VARIABLE || n.value == null) continue;
            if (n.dataType == null) {
                throw new ValidationException("UAVariable has no DataType! Value: " + n.value);
            }
            Node dataType = tables.node(n.dataType);
            if (dataType == null) {
                log.debug("DataType {} of {} is not part of the graph, value not checked",
                        tables.lookup.nodeId(n.dataType), n.nodeId);
                continue;
            }
            String expected = dataType.displayName;
            String actual = n.value.typeName();
            if (BUILT_IN_TYPES.contains(expected) && BUILT_IN_TYPES.contains(actual) && !expected.equals(actual)) {
                invalid.add(n.displayName);
            }
        }
        if (!invalid.isEmpty()) throw new ValidationException(invalid);
    }
}
