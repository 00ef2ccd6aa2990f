package info.isaksson.erland.uagraph.emitter;

import java.util.List;
import java.util.stream.Collectors;

/** Outcome of validating a document against the NodeSet2 schema. */
public final class SchemaValidationResult {
    public final boolean valid;
    public final List<NodeSetDiagnostic> diagnostics;

    SchemaValidationResult(boolean valid, List<NodeSetDiagnostic> diagnostics) {
        this.valid = valid;
        this.diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    /** One line per diagnostic, suitable for logs. */
    public String describe() {
        if (diagnostics.isEmpty()) return valid ? "valid" : "invalid";
        return diagnostics.stream().map(NodeSetDiagnostic::toString).collect(Collectors.joining("\n"));
    }

    @Override public String toString() {
        return "SchemaValidationResult[valid=" + valid + ", diagnostics=" + diagnostics.size() + "]";
    }
}
