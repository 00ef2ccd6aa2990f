package info.isaksson.erland.uagraph.model;

import java.time.OffsetDateTime;
import java.util.Objects;

public final class UaRequiredModel {
    public final String modelUri;
    public final String version;
    public final OffsetDateTime publicationDate;

    public UaRequiredModel(String modelUri, String version, OffsetDateTime publicationDate) {
        this.modelUri = Objects.requireNonNull(modelUri, "modelUri");
        this.version = version;
        this.publicationDate = publicationDate;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UaRequiredModel)) return false;
        UaRequiredModel that = (UaRequiredModel) o;
        return modelUri.equals(that.modelUri)
                && Objects.equals(version, that.version)
                && Objects.equals(publicationDate, that.publicationDate);
    }

    @Override public int hashCode() {
        return Objects.hash(modelUri, version, publicationDate);
    }
}
