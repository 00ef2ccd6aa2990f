package info.isaksson.erland.uagraph.model.value;

import info.isaksson.erland.uagraph.model.NodeId;

/** Low/high range, encoding id {@code i=885}. */
public final class UaRange extends UaExtensionObject {
    public static final NodeId ENCODING_ID = NodeId.numeric(0, 885);

    public final double low;
    public final double high;

    public UaRange(double low, double high) {
        super(ENCODING_ID, null);
        this.low = low;
        this.high = high;
    }

    @Override protected String encodedBody() {
        return "<Range><Low>" + UaFloatingPoint.lexical(low) + "</Low><High>" + UaFloatingPoint.lexical(high) + "</High></Range>";
    }

    @Override public boolean equals(Object o) {
        if (!(o instanceof UaRange)) return false;
        UaRange that = (UaRange) o;
        return Double.compare(low, that.low) == 0 && Double.compare(high, that.high) == 0;
    }

    @Override public int hashCode() {
        return Double.hashCode(low) * 31 + Double.hashCode(high);
    }
}
