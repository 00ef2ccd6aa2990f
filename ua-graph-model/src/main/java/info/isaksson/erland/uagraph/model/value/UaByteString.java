package info.isaksson.erland.uagraph.model.value;

import java.util.Arrays;
import java.util.Base64;

public final class UaByteString extends UaValue {
    private final byte[] value;

    public UaByteString(byte[] value) {
        this.value = value == null ? null : value.clone();
    }

    public static UaByteString parse(String base64) {
        if (base64 == null) return new UaByteString(null);
        return new UaByteString(Base64.getMimeDecoder().decode(base64));
    }

    public byte[] value() {
        return value == null ? null : value.clone();
    }

    @Override public String typeName() {
        return "ByteString";
    }

    @Override public String encodeXml(boolean includeNamespaceDecl) {
        return element("ByteString", value == null ? "" : Base64.getEncoder().encodeToString(value), includeNamespaceDecl);
    }

    @Override public boolean equals(Object o) {
        return o instanceof UaByteString && Arrays.equals(value, ((UaByteString) o).value);
    }

    @Override public int hashCode() {
        return Arrays.hashCode(value);
    }
}
