package info.isaksson.erland.uagraph.emitter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** A deterministic finding produced while writing or validating a NodeSet2 document. */
public final class NodeSetDiagnostic {

    /** Diagnostic code stable across versions, e.g. {@code xsd.error}. */
    public final String code;

    /** Human-readable message. */
    public final String message;

    /** Optional structured context (line, column, namespace uri). */
    public final Map<String, String> context;

    public NodeSetDiagnostic(String code, String message, Map<String, String> context) {
        this.code = Objects.requireNonNull(code, "code must not be null");
        this.message = Objects.requireNonNull(message, "message must not be null");
        if (context == null || context.isEmpty()) {
            this.context = Collections.emptyMap();
        } else {
            this.context = Collections.unmodifiableMap(new LinkedHashMap<>(context));
        }
    }

    @Override public String toString() {
        return code + ": " + message + (context.isEmpty() ? "" : " " + context);
    }
}
