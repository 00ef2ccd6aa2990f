package info.isaksson.erland.uagraph.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Bijection between dense surrogate ids and node identifiers.
 *
 * <p>Ids are handed out in first-seen order starting at 0.</p>
 */
public final class NodeIdLookup {

    private final List<NodeId> byId;
    private final Map<NodeId, Integer> ids;

    private NodeIdLookup(List<NodeId> byId, Map<NodeId, Integer> ids) {
        this.byId = byId;
        this.ids = ids;
    }

    public static Builder builder() {
        return new Builder();
    }

    public int size() {
        return byId.size();
    }

    public NodeId nodeId(int id) {
        if (id < 0 || id >= byId.size()) {
            throw new IllegalArgumentException("Unknown surrogate id " + id);
        }
        return byId.get(id);
    }

    /** Null-tolerant variant for optional columns. */
    public NodeId nodeIdOrNull(Integer id) {
        return id == null ? null : nodeId(id);
    }

    /** @return the surrogate, or null when the identifier was never seen */
    public Integer idOf(NodeId nodeId) {
        return ids.get(nodeId);
    }

    public List<NodeId> nodeIds() {
        return byId;
    }

    public static final class Builder {
        private final List<NodeId> byId = new ArrayList<>();
        private final Map<NodeId, Integer> ids = new HashMap<>();

        private Builder() {}

        public int intern(NodeId nodeId) {
            Objects.requireNonNull(nodeId, "nodeId");
            Integer existing = ids.get(nodeId);
            if (existing != null) return existing;
            int id = byId.size();
            byId.add(nodeId);
            ids.put(nodeId, id);
            return id;
        }

        /** Interns a nullable identifier, passing null through. */
        public Integer internOrNull(NodeId nodeId) {
            return nodeId == null ? null : intern(nodeId);
        }

        public NodeIdLookup build() {
            return new NodeIdLookup(Collections.unmodifiableList(new ArrayList<>(byId)), Map.copyOf(ids));
        }
    }
}
