package info.isaksson.erland.uagraph.emitter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects diagnostics during writing or schema validation.
 *
 * <p>Diagnostics keep the order in which they were reported, which for schema validation is document order.</p>
 */
public final class NodeSetDiagnostics {

    private final List<NodeSetDiagnostic> diagnostics = new ArrayList<>();

    public void report(String code, String message) {
        report(code, message, null);
    }

    public void report(String code, String message, Map<String, String> context) {
        diagnostics.add(new NodeSetDiagnostic(code, message, context));
    }

    public void report(String code, String message, String k1, String v1) {
        Map<String, String> ctx = new LinkedHashMap<>();
        ctx.put(k1, v1);
        report(code, message, ctx);
    }

    public void report(String code, String message, String k1, String v1, String k2, String v2) {
        Map<String, String> ctx = new LinkedHashMap<>();
        ctx.put(k1, v1);
        ctx.put(k2, v2);
        report(code, message, ctx);
    }

    public boolean has(String codePrefix) {
        for (NodeSetDiagnostic d : diagnostics) {
            if (d.code.startsWith(codePrefix)) return true;
        }
        return false;
    }

    public List<NodeSetDiagnostic> toList() {
        return Collections.unmodifiableList(new ArrayList<>(diagnostics));
    }
}
