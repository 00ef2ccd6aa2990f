package info.isaksson.erland.uagraph.model.value;

import info.isaksson.erland.uagraph.model.NodeId;
import info.isaksson.erland.uagraph.model.XmlText;

import java.util.Objects;

/** Engineering unit, encoding id {@code i=888}. */
public final class UaEuInformation extends UaExtensionObject {
    public static final NodeId ENCODING_ID = NodeId.numeric(0, 888);

    public final String namespaceUri;
    public final int unitId;
    public final UaLocalizedText displayName;
    public final UaLocalizedText description;

    public UaEuInformation(String namespaceUri, int unitId, UaLocalizedText displayName, UaLocalizedText description) {
        super(ENCODING_ID, null);
        this.namespaceUri = namespaceUri;
        this.unitId = unitId;
        this.displayName = displayName == null ? new UaLocalizedText(null, null) : displayName;
        this.description = description == null ? new UaLocalizedText(null, null) : description;
    }

    @Override protected String encodedBody() {
        return "<EUInformation>"
                + "<NamespaceUri>" + XmlText.escape(namespaceUri) + "</NamespaceUri>"
                + "<UnitId>" + unitId + "</UnitId>"
                + "<DisplayName>" + displayName.body() + "</DisplayName>"
                + "<Description>" + description.body() + "</Description>"
                + "</EUInformation>";
    }

    @Override public boolean equals(Object o) {
        if (!(o instanceof UaEuInformation)) return false;
        UaEuInformation that = (UaEuInformation) o;
        return unitId == that.unitId
                && Objects.equals(namespaceUri, that.namespaceUri)
                && displayName.equals(that.displayName)
                && description.equals(that.description);
    }

    @Override public int hashCode() {
        return Objects.hash(namespaceUri, unitId, displayName, description);
    }
}
