package info.isaksson.erland.uagraph.model;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Objects;

/** The {@code <Model>} declaration of one parsed file. */
public final class UaModel {
    public final String modelUri;
    public final OffsetDateTime publicationDate;
    public final String version;
    public final List<UaRequiredModel> requiredModels;

    public UaModel(String modelUri, OffsetDateTime publicationDate, String version, List<UaRequiredModel> requiredModels) {
        this.modelUri = Objects.requireNonNull(modelUri, "modelUri");
        this.publicationDate = publicationDate;
        this.version = version;
        this.requiredModels = requiredModels == null ? List.of() : List.copyOf(requiredModels);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UaModel)) return false;
        UaModel that = (UaModel) o;
        return modelUri.equals(that.modelUri)
                && Objects.equals(publicationDate, that.publicationDate)
                && Objects.equals(version, that.version)
                && requiredModels.equals(that.requiredModels);
    }

    @Override public int hashCode() {
        return Objects.hash(modelUri, publicationDate, version, requiredModels);
    }

    @Override public String toString() {
        return "UaModel[" + modelUri + " " + version + "]";
    }
}
