package info.isaksson.erland.uagraph.model.value;

import java.util.Objects;

/** Float or Double. */
public final class UaFloatingPoint extends UaValue {
    private final String typeName;
    public final Double value;

    public UaFloatingPoint(String typeName, Double value) {
        if (!"Float".equals(typeName) && !"Double".equals(typeName)) {
            throw new IllegalArgumentException("Not a floating point type: " + typeName);
        }
        this.typeName = typeName;
        this.value = value;
    }

    public static UaFloatingPoint parse(String typeName, String text) {
        if (text == null || text.isEmpty()) return new UaFloatingPoint(typeName, null);
        return new UaFloatingPoint(typeName, parseLexical(text));
    }

    /** Reads the xs:double lexical form, where infinities are {@code INF} and {@code -INF}. */
    public static double parseLexical(String text) {
        return switch (text) {
            case "INF", "+INF" -> Double.POSITIVE_INFINITY;
            case "-INF" -> Double.NEGATIVE_INFINITY;
            default -> Double.parseDouble(text);
        };
    }

    public static String lexical(double value) {
        if (value == Double.POSITIVE_INFINITY) return "INF";
        if (value == Double.NEGATIVE_INFINITY) return "-INF";
        return Double.toString(value);
    }

    @Override public String typeName() {
        return typeName;
    }

    @Override public String encodeXml(boolean includeNamespaceDecl) {
        return element(typeName, value == null ? "" : lexical(value), includeNamespaceDecl);
    }

    @Override public boolean equals(Object o) {
        if (!(o instanceof UaFloatingPoint)) return false;
        UaFloatingPoint that = (UaFloatingPoint) o;
        return typeName.equals(that.typeName) && Objects.equals(value, that.value);
    }

    @Override public int hashCode() {
        return Objects.hash(typeName, value);
    }
}
