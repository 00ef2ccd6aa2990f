package info.isaksson.erland.uagraph.parser;

import info.isaksson.erland.uagraph.model.NamespaceTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Accumulates the global namespace table while files are read.
 *
 * <p>Starts from the caller's desired order. URIs a file declares that are not yet known are appended
 * with a warning. Index 0 is always the OPC Foundation namespace.</p>
 */
public final class NamespaceTableBuilder {

    private static final Logger log = LoggerFactory.getLogger(NamespaceTableBuilder.class);

    private final List<String> uris = new ArrayList<>();
    private final boolean desiredOrderGiven;

    public NamespaceTableBuilder(List<String> desiredOrder) {
        desiredOrderGiven = desiredOrder != null && !desiredOrder.isEmpty();
        if (desiredOrderGiven) {
            if (!NamespaceTable.OPC_UA_URI.equals(desiredOrder.get(0))) {
                throw new IllegalArgumentException("Desired namespace 0 must be " + NamespaceTable.OPC_UA_URI
                        + ", got " + desiredOrder.get(0));
            }
            uris.addAll(desiredOrder);
        } else {
            uris.add(NamespaceTable.OPC_UA_URI);
        }
    }

    /**
     * Convert an index-keyed namespace map into a list, filling gaps with {@link NamespaceTable#PLACEHOLDER}.
     */
    public static List<String> fromIndexMap(Map<Integer, String> byIndex) {
        if (byIndex == null || byIndex.isEmpty()) return List.of();
        int max = byIndex.keySet().stream().mapToInt(Integer::intValue).max().orElse(-1);
        List<String> out = new ArrayList<>();
        for (int i = 0; i <= max; i++) {
            out.add(byIndex.getOrDefault(i, NamespaceTable.PLACEHOLDER));
        }
        return out;
    }

    /**
     * Register the {@code <NamespaceUris>} of one file.
     *
     * @return file-local index to global index; local 0 always maps to 0
     */
    public Map<Integer, Integer> register(List<String> fileUris) {
        Map<Integer, Integer> map = new HashMap<>();
        map.put(0, 0);
        for (int i = 0; i < fileUris.size(); i++) {
            String uri = fileUris.get(i);
            int global = uris.indexOf(uri);
            if (global < 0) {
                global = uris.size();
                if (desiredOrderGiven) {
                    log.warn("Namespace {} not found in namespace list, adding with index {}", uri, global);
                } else {
                    log.debug("Namespace {} added with index {}", uri, global);
                }
                uris.add(uri);
            }
            map.put(i + 1, global);
        }
        return map;
    }

    public NamespaceTable build() {
        return new NamespaceTable(uris);
    }
}
