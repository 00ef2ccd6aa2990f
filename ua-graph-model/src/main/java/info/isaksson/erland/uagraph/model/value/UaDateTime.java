package info.isaksson.erland.uagraph.model.value;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Objects;

public final class UaDateTime extends UaValue {
    public final OffsetDateTime value;

    public UaDateTime(OffsetDateTime value) {
        this.value = value;
    }

    /** Timestamps without an offset are read as UTC. */
    public static UaDateTime parse(String text) {
        if (text == null || text.isEmpty()) return new UaDateTime(null);
        try {
            return new UaDateTime(OffsetDateTime.parse(text));
        } catch (DateTimeParseException e) {
            return new UaDateTime(LocalDateTime.parse(text).atOffset(ZoneOffset.UTC));
        }
    }

    @Override public String typeName() {
        return "DateTime";
    }

    @Override public String encodeXml(boolean includeNamespaceDecl) {
        return element("DateTime", value == null ? "" : value.format(DateTimeFormatter.ISO_OFFSET_DATE_TIME), includeNamespaceDecl);
    }

    @Override public boolean equals(Object o) {
        return o instanceof UaDateTime && Objects.equals(value, ((UaDateTime) o).value);
    }

    @Override public int hashCode() {
        return Objects.hashCode(value);
    }
}
