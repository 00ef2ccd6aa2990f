package info.isaksson.erland.uagraph.core;

import info.isaksson.erland.uagraph.model.Node;
import info.isaksson.erland.uagraph.model.NodeClass;
import info.isaksson.erland.uagraph.model.NodeSetTables;
import info.isaksson.erland.uagraph.model.Reference;
import info.isaksson.erland.uagraph.model.error.SchemaException;
import info.isaksson.erland.uagraph.model.value.UaEnumValueType;
import info.isaksson.erland.uagraph.model.value.UaEnumeration;
import info.isaksson.erland.uagraph.model.value.UaExtensionObject;
import info.isaksson.erland.uagraph.model.value.UaInteger;
import info.isaksson.erland.uagraph.model.value.UaListOf;
import info.isaksson.erland.uagraph.model.value.UaLocalizedText;
import info.isaksson.erland.uagraph.model.value.UaValue;
import info.isaksson.erland.uagraph.navigation.ReferenceTypes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Turns the Int32 values of enumeration-typed variables into {@link UaEnumeration} values.
 *
 * <p>Enumeration DataTypes are the direct {@code HasSubtype} children of {@code Enumeration}. Their labels
 * come from the {@code EnumStrings} or {@code EnumValues} property reached over {@code HasProperty}.</p>
 */
final class EnumTransformer {

    private static final Logger log = LoggerFactory.getLogger(EnumTransformer.class);

    static final String ENUMERATION = "Enumeration";
    static final String ENUM_STRINGS = "EnumStrings";
    static final String ENUM_VALUES = "EnumValues";

    private EnumTransformer() {}

    /** @return id of the {@code Enumeration} DataType, or null when the graph does not declare it */
    static Integer enumerationDataType(List<Node> nodes) {
        for (Node n : nodes) {
            if (n.nodeClass == NodeClass.DATA_TYPE && n.browseName.equals(ENUMERATION)) return n.id;
        }
        return null;
    }

    static NodeSetTables transform(NodeSetTables tables) {
        Integer enumeration = enumerationDataType(tables.nodes);
        if (enumeration == null) {
            log.debug("No Enumeration DataType, enum transformation skipped");
            return tables;
        }
        int hasSubtype = ReferenceTypes.resolve(tables.nodes, ReferenceTypes.HAS_SUBTYPE);
        Set<Integer> enumTypes = new HashSet<>();
        for (Reference r : tables.references) {
            if (r.src == enumeration && r.referenceType == hasSubtype) enumTypes.add(r.trg);
        }

        Map<Integer, Map<Integer, String>> labelsByType = new HashMap<>();
        List<Node> out = new ArrayList<>(tables.nodes.size());
        int transformed = 0;
        for (Node n : tables.nodes) {
            if (n.nodeClass != NodeClass.VARIABLE || n.value == null || n.dataType == null
                    || !enumTypes.contains(n.dataType)) {
                out.add(n);
                continue;
            }
            Map<Integer, String> labels = labelsByType.get(n.dataType);
            if (labels == null) {
                labels = labels(tables, n.dataType);
                labelsByType.put(n.dataType, labels);
            }
            if (labels.isEmpty()) {
                out.add(n);
                continue;
            }
            UaValue converted = convert(n, labels, tables.node(n.dataType).browseName);
            if (converted != n.value) transformed++;
            out.add(converted == n.value ? n : n.withValue(converted));
        }
        log.debug("Transformed {} enumeration values across {} enumeration types", transformed, enumTypes.size());
        return tables.withNodes(out);
    }

    /**
     * Labels of the enumeration DataType {@code enumType}, keyed by their integer value.
     *
     * @return empty when the type carries neither {@code EnumStrings} nor {@code EnumValues}
     */
    static Map<Integer, String> labels(NodeSetTables tables, int enumType) {
        Node definition = enumDefinition(tables, enumType);
        if (definition == null) {
            log.warn("Enumeration {} has no EnumStrings or EnumValues property", tables.node(enumType));
            return Map.of();
        }
        Map<Integer, String> labels = new TreeMap<>();
        if (definition.value instanceof UaListOf) {
            List<UaValue> entries = ((UaListOf) definition.value).values;
            for (int i = 0; i < entries.size(); i++) {
                UaValue entry = entries.get(i);
                if (entry instanceof UaExtensionObject) entry = ((UaExtensionObject) entry).body;
                if (entry instanceof UaLocalizedText) {
                    labels.put(i, ((UaLocalizedText) entry).text);
                } else if (entry instanceof UaEnumValueType) {
                    UaEnumValueType ev = (UaEnumValueType) entry;
                    labels.put((int) ev.value, ev.displayName.text);
                } else {
                    throw new SchemaException("Unexpected " + definition.browseName + " entry "
                            + (entry == null ? "null" : entry.typeName()) + " on " + tables.node(enumType));
                }
            }
        }
        return Collections.unmodifiableMap(labels);
    }

    /** The first {@code HasProperty} target of {@code enumType} named EnumStrings or EnumValues. */
    static Node enumDefinition(NodeSetTables tables, int enumType) {
        int hasProperty = ReferenceTypes.resolve(tables.nodes, ReferenceTypes.HAS_PROPERTY);
        for (Reference r : tables.references) {
            if (r.src != enumType || r.referenceType != hasProperty) continue;
            Node target = tables.node(r.trg);
            if (target != null && (target.browseName.equals(ENUM_STRINGS) || target.browseName.equals(ENUM_VALUES))) {
                return target;
            }
        }
        return null;
    }

    private static UaValue convert(Node variable, Map<Integer, String> labels, String enumName) {
        UaValue value = variable.value;
        if (isInt32(value)) {
            return enumeration(variable, (UaInteger) value, labels, enumName);
        }
        if (value instanceof UaListOf && ((UaListOf) value).elementTypeName.equals("Int32")) {
            List<UaValue> converted = new ArrayList<>();
            for (UaValue element : ((UaListOf) value).values) {
                converted.add(isInt32(element) ? enumeration(variable, (UaInteger) element, labels, enumName) : element);
            }
            return new UaListOf("Int32", converted);
        }
        log.debug("Value {} of {} is not an Int32, left as is", value.typeName(), variable);
        return value;
    }

    private static boolean isInt32(UaValue value) {
        return value instanceof UaInteger
                && !(value instanceof UaEnumeration)
                && value.typeName().equals("Int32")
                && ((UaInteger) value).value != null;
    }

    private static UaEnumeration enumeration(Node variable, UaInteger value, Map<Integer, String> labels, String enumName) {
        int v = value.value.intValue();
        String label = labels.get(v);
        if (label == null) {
            throw new SchemaException("Value " + v + " of " + variable.displayName + " (" + variable.nodeId
                    + ") has no label in enumeration " + enumName);
        }
        return new UaEnumeration(v, label, enumName);
    }
}
