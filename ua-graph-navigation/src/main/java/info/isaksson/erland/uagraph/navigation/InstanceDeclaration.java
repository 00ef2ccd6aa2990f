package info.isaksson.erland.uagraph.navigation;

import java.util.List;
import java.util.Objects;

/**
 * A member that instances of {@code typeId} get from the type itself or one of its supertypes.
 *
 * <p>{@code browsePath} is the '/'-joined BrowseNames from the declaring type down to the member and is
 * empty for the type's own row. {@code modellingRulePath} holds the modelling rule names along that path.</p>
 */
public final class InstanceDeclaration {
    public final int instanceId;
    public final String browsePath;
    public final int typeId;
    public final int superTypeId;
    public final List<String> modellingRulePath;

    public InstanceDeclaration(int instanceId, String browsePath, int typeId, int superTypeId, List<String> modellingRulePath) {
        this.instanceId = instanceId;
        this.browsePath = Objects.requireNonNull(browsePath, "browsePath");
        this.typeId = typeId;
        this.superTypeId = superTypeId;
        this.modellingRulePath = modellingRulePath == null ? List.of() : List.copyOf(modellingRulePath);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof InstanceDeclaration)) return false;
        InstanceDeclaration that = (InstanceDeclaration) o;
        return instanceId == that.instanceId
                && typeId == that.typeId
                && superTypeId == that.superTypeId
                && browsePath.equals(that.browsePath)
                && modellingRulePath.equals(that.modellingRulePath);
    }

    @Override public int hashCode() {
        return Objects.hash(instanceId, browsePath, typeId, superTypeId, modellingRulePath);
    }

    @Override public String toString() {
        return typeId + ":" + browsePath + " -> " + instanceId + " (from " + superTypeId + ") " + modellingRulePath;
    }
}
