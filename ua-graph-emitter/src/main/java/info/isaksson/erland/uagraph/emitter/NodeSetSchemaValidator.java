package info.isaksson.erland.uagraph.emitter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xml.sax.ErrorHandler;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.transform.Source;
import javax.xml.transform.stream.StreamSource;
import javax.xml.validation.Schema;
import javax.xml.validation.SchemaFactory;
import javax.xml.validation.Validator;
import java.io.IOException;
import java.io.StringReader;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Validates NodeSet2 documents against the bundled {@code UANodeSet.xsd}.
 *
 * <p>Validation never blocks writing; callers decide what to do with an invalid result.</p>
 */
public final class NodeSetSchemaValidator {

    private static final Logger log = LoggerFactory.getLogger(NodeSetSchemaValidator.class);

    static final String SCHEMA_RESOURCE = "/xsd/UANodeSet.xsd";

    private static Schema schema;

    private NodeSetSchemaValidator() {}

    public static SchemaValidationResult validate(Path file) throws IOException {
        if (file == null) throw new IllegalArgumentException("file must not be null");
        if (!Files.isRegularFile(file)) throw new NoSuchFileException(file.toString());
        long start = System.nanoTime();
        SchemaValidationResult result = validate(new StreamSource(file.toFile()));
        log.info("Validated {} against NodeSet2 schema in {} ms: {}",
                file, (System.nanoTime() - start) / 1_000_000, result.valid ? "valid" : "invalid");
        return result;
    }

    public static SchemaValidationResult validateString(String xml) throws IOException {
        if (xml == null) throw new IllegalArgumentException("xml must not be null");
        return validate(new StreamSource(new StringReader(xml)));
    }

    private static SchemaValidationResult validate(Source source) throws IOException {
        NodeSetDiagnostics diagnostics = new NodeSetDiagnostics();
        Validator validator = schema().newValidator();
        try {
            validator.setProperty(XMLConstants.ACCESS_EXTERNAL_DTD, "");
            validator.setProperty(XMLConstants.ACCESS_EXTERNAL_SCHEMA, "");
        } catch (SAXException e) {
            log.debug("Validator does not support external access restrictions: {}", e.getMessage());
        }
        validator.setErrorHandler(new ErrorHandler() {
            @Override public void warning(SAXParseException e) {
                report(diagnostics, "xsd.warning", e);
            }

            @Override public void error(SAXParseException e) {
                report(diagnostics, "xsd.error", e);
            }

            @Override public void fatalError(SAXParseException e) throws SAXException {
                throw e;
            }
        });
        try {
            validator.validate(source);
        } catch (SAXParseException e) {
            report(diagnostics, "xsd.fatal", e);
        } catch (SAXException e) {
            diagnostics.report("xsd.fatal", String.valueOf(e.getMessage()));
        }
        boolean valid = !diagnostics.has("xsd.error") && !diagnostics.has("xsd.fatal");
        return new SchemaValidationResult(valid, diagnostics.toList());
    }

    private static void report(NodeSetDiagnostics diagnostics, String code, SAXParseException e) {
        diagnostics.report(code, String.valueOf(e.getMessage()),
                "line", Integer.toString(e.getLineNumber()),
                "column", Integer.toString(e.getColumnNumber()));
    }

    static synchronized Schema schema() {
        if (schema == null) {
            URL xsd = NodeSetSchemaValidator.class.getResource(SCHEMA_RESOURCE);
            if (xsd == null) throw new IllegalStateException("Missing schema resource " + SCHEMA_RESOURCE);
            try {
                SchemaFactory factory = SchemaFactory.newInstance(XMLConstants.W3C_XML_SCHEMA_NS_URI);
                schema = factory.newSchema(xsd);
            } catch (SAXException e) {
                throw new IllegalStateException("Bundled NodeSet2 schema does not load", e);
            }
        }
        return schema;
    }
}
