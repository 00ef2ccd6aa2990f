package info.isaksson.erland.uagraph.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Attributes that only some node classes carry.
 *
 * <p>Values are kept as the attribute text read from the file so that they can be written back unchanged.
 * Each node class has its own variant; {@link #forClass} picks it.</p>
 */
public abstract class NodeAttributes {

    public final String symbolicName;
    public final String writeMask;
    public final String userWriteMask;

    protected NodeAttributes(String symbolicName, String writeMask, String userWriteMask) {
        this.symbolicName = symbolicName;
        this.writeMask = writeMask;
        this.userWriteMask = userWriteMask;
    }

    public abstract NodeClass nodeClass();

    /** Class-specific XML attributes in write order, absent ones left out. */
    public final Map<String, String> xmlAttributes() {
        Map<String, String> out = new LinkedHashMap<>();
        put(out, "WriteMask", writeMask);
        put(out, "UserWriteMask", userWriteMask);
        collect(out);
        return out;
    }

    protected abstract void collect(Map<String, String> out);

    /** Snapshot form: symbolic name plus the XML attributes plus any element content. */
    @JsonValue
    public Map<String, String> snapshot() {
        Map<String, String> out = new LinkedHashMap<>();
        put(out, "SymbolicName", symbolicName);
        out.putAll(xmlAttributes());
        return out;
    }

    protected static void put(Map<String, String> out, String name, String value) {
        if (value != null && !value.isEmpty()) out.put(name, value);
    }

    /**
     * Build the variant for a node class from raw attribute text.
     *
     * @param attribute lookup of raw attribute text by name, null when absent
     */
    public static NodeAttributes forClass(NodeClass nodeClass,
                                          UnaryOperator<String> attribute,
                                          String inverseName,
                                          DataTypeDefinition definition) {
        Objects.requireNonNull(nodeClass, "nodeClass");
        String sym = attribute.apply("SymbolicName");
        String wm = attribute.apply("WriteMask");
        String uwm = attribute.apply("UserWriteMask");
        return switch (nodeClass) {
            case OBJECT -> new ObjectAttributes(sym, wm, uwm, attribute.apply("EventNotifier"));
            case OBJECT_TYPE -> new ObjectTypeAttributes(sym, wm, uwm, attribute.apply("IsAbstract"));
            case VARIABLE -> new VariableAttributes(sym, wm, uwm,
                    attribute.apply("ValueRank"),
                    attribute.apply("ArrayDimensions"),
                    attribute.apply("AccessLevel"),
                    attribute.apply("UserAccessLevel"),
                    attribute.apply("MinimumSamplingInterval"),
                    attribute.apply("Historizing"));
            case VARIABLE_TYPE -> new VariableTypeAttributes(sym, wm, uwm,
                    attribute.apply("IsAbstract"),
                    attribute.apply("ValueRank"),
                    attribute.apply("ArrayDimensions"));
            case DATA_TYPE -> new DataTypeAttributes(sym, wm, uwm, attribute.apply("IsAbstract"), definition);
            case REFERENCE_TYPE -> new ReferenceTypeAttributes(sym, wm, uwm,
                    attribute.apply("IsAbstract"),
                    attribute.apply("Symmetric"),
                    inverseName);
            case VIEW -> new ViewAttributes(sym, wm, uwm, attribute.apply("ContainsNoLoops"), attribute.apply("EventNotifier"));
            case METHOD -> new MethodAttributes(sym, wm, uwm, attribute.apply("Executable"), attribute.apply("UserExecutable"));
        };
    }

    /** Variant with no class-specific attribute set. */
    public static NodeAttributes empty(NodeClass nodeClass) {
        return forClass(nodeClass, name -> null, null, null);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || o.getClass() != getClass()) return false;
        NodeAttributes that = (NodeAttributes) o;
        return Objects.equals(symbolicName, that.symbolicName)
                && xmlAttributes().equals(that.xmlAttributes())
                && sameElementContent(that);
    }

    protected boolean sameElementContent(NodeAttributes other) {
        return true;
    }

    @Override public int hashCode() {
        return Objects.hash(getClass(), symbolicName, xmlAttributes());
    }

    @Override public String toString() {
        return nodeClass().xmlTag() + snapshot();
    }

    public static final class ObjectAttributes extends NodeAttributes {
        public final String eventNotifier;

        public ObjectAttributes(String symbolicName, String writeMask, String userWriteMask, String eventNotifier) {
            super(symbolicName, writeMask, userWriteMask);
            this.eventNotifier = eventNotifier;
        }

        @Override public NodeClass nodeClass() {
            return NodeClass.OBJECT;
        }

        @Override protected void collect(Map<String, String> out) {
            put(out, "EventNotifier", eventNotifier);
        }
    }

    public static final class ObjectTypeAttributes extends NodeAttributes {
        public final String isAbstract;

        public ObjectTypeAttributes(String symbolicName, String writeMask, String userWriteMask, String isAbstract) {
            super(symbolicName, writeMask, userWriteMask);
            this.isAbstract = isAbstract;
        }

        @Override public NodeClass nodeClass() {
            return NodeClass.OBJECT_TYPE;
        }

        @Override protected void collect(Map<String, String> out) {
            put(out, "IsAbstract", isAbstract);
        }
    }

    public static final class VariableAttributes extends NodeAttributes {
        public final String valueRank;
        public final String arrayDimensions;
        public final String accessLevel;
        public final String userAccessLevel;
        public final String minimumSamplingInterval;
        public final String historizing;

        public VariableAttributes(String symbolicName, String writeMask, String userWriteMask,
                                  String valueRank, String arrayDimensions, String accessLevel,
                                  String userAccessLevel, String minimumSamplingInterval, String historizing) {
            super(symbolicName, writeMask, userWriteMask);
            this.valueRank = valueRank;
            this.arrayDimensions = arrayDimensions;
            this.accessLevel = accessLevel;
            this.userAccessLevel = userAccessLevel;
            this.minimumSamplingInterval = minimumSamplingInterval;
            this.historizing = historizing;
        }

        @Override public NodeClass nodeClass() {
            return NodeClass.VARIABLE;
        }

        @Override protected void collect(Map<String, String> out) {
            put(out, "ValueRank", valueRank);
            put(out, "AccessLevel", accessLevel);
            put(out, "UserAccessLevel", userAccessLevel);
            put(out, "ArrayDimensions", arrayDimensions);
            put(out, "MinimumSamplingInterval", minimumSamplingInterval);
            put(out, "Historizing", historizing);
        }
    }

    public static final class VariableTypeAttributes extends NodeAttributes {
        public final String isAbstract;
        public final String valueRank;
        public final String arrayDimensions;

        public VariableTypeAttributes(String symbolicName, String writeMask, String userWriteMask,
                                      String isAbstract, String valueRank, String arrayDimensions) {
            super(symbolicName, writeMask, userWriteMask);
            this.isAbstract = isAbstract;
            this.valueRank = valueRank;
            this.arrayDimensions = arrayDimensions;
        }

        @Override public NodeClass nodeClass() {
            return NodeClass.VARIABLE_TYPE;
        }

        @Override protected void collect(Map<String, String> out) {
            put(out, "ValueRank", valueRank);
            put(out, "IsAbstract", isAbstract);
            put(out, "ArrayDimensions", arrayDimensions);
        }
    }

    public static final class DataTypeAttributes extends NodeAttributes {
        public final String isAbstract;
        public final DataTypeDefinition definition;

        public DataTypeAttributes(String symbolicName, String writeMask, String userWriteMask,
                                  String isAbstract, DataTypeDefinition definition) {
            super(symbolicName, writeMask, userWriteMask);
            this.isAbstract = isAbstract;
            this.definition = definition;
        }

        @Override public NodeClass nodeClass() {
            return NodeClass.DATA_TYPE;
        }

        @Override protected void collect(Map<String, String> out) {
            put(out, "IsAbstract", isAbstract);
        }

        @Override public Map<String, String> snapshot() {
            Map<String, String> out = super.snapshot();
            if (definition != null) out.put("Definition", definition.encodeXml());
            return out;
        }

        public DataTypeAttributes withDefinition(DataTypeDefinition newDefinition) {
            return new DataTypeAttributes(symbolicName, writeMask, userWriteMask, isAbstract, newDefinition);
        }

        @Override protected boolean sameElementContent(NodeAttributes other) {
            return Objects.equals(definition, ((DataTypeAttributes) other).definition);
        }
    }

    public static final class ReferenceTypeAttributes extends NodeAttributes {
        public final String isAbstract;
        public final String symmetric;
        public final String inverseName;

        public ReferenceTypeAttributes(String symbolicName, String writeMask, String userWriteMask,
                                       String isAbstract, String symmetric, String inverseName) {
            super(symbolicName, writeMask, userWriteMask);
            this.isAbstract = isAbstract;
            this.symmetric = symmetric;
            this.inverseName = inverseName;
        }

        @Override public NodeClass nodeClass() {
            return NodeClass.REFERENCE_TYPE;
        }

        @Override protected void collect(Map<String, String> out) {
            put(out, "IsAbstract", isAbstract);
            put(out, "Symmetric", symmetric);
        }

        @Override public Map<String, String> snapshot() {
            Map<String, String> out = super.snapshot();
            put(out, "InverseName", inverseName);
            return out;
        }

        @Override protected boolean sameElementContent(NodeAttributes other) {
            return Objects.equals(inverseName, ((ReferenceTypeAttributes) other).inverseName);
        }
    }

    public static final class ViewAttributes extends NodeAttributes {
        public final String containsNoLoops;
        public final String eventNotifier;

        public ViewAttributes(String symbolicName, String writeMask, String userWriteMask,
                              String containsNoLoops, String eventNotifier) {
            super(symbolicName, writeMask, userWriteMask);
            this.containsNoLoops = containsNoLoops;
            this.eventNotifier = eventNotifier;
        }

        @Override public NodeClass nodeClass() {
            return NodeClass.VIEW;
        }

        @Override protected void collect(Map<String, String> out) {
            put(out, "ContainsNoLoops", containsNoLoops);
            put(out, "EventNotifier", eventNotifier);
        }
    }

    public static final class MethodAttributes extends NodeAttributes {
        public final String executable;
        public final String userExecutable;

        public MethodAttributes(String symbolicName, String writeMask, String userWriteMask,
                                String executable, String userExecutable) {
            super(symbolicName, writeMask, userWriteMask);
            this.executable = executable;
            this.userExecutable = userExecutable;
        }

        @Override public NodeClass nodeClass() {
            return NodeClass.METHOD;
        }

        @Override protected void collect(Map<String, String> out) {
            put(out, "Executable", executable);
            put(out, "UserExecutable", userExecutable);
        }
    }
}
