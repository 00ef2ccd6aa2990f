package info.isaksson.erland.uagraph.parser;

import org.w3c.dom.Element;
import org.w3c.dom.Node;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;

/** Namespaces and small DOM helpers for reading NodeSet2 documents. */
public final class NodeSetXml {

    public static final String UA_NODESET_NS = "http://opcfoundation.org/UA/2011/03/UANodeSet.xsd";
    public static final String UA_TYPES_NS = "http://opcfoundation.org/UA/2008/02/Types.xsd";

    private NodeSetXml() {}

    /** Namespace-aware builder with DOCTYPEs and external entities disabled. */
    public static DocumentBuilder newDocumentBuilder() {
        DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
        dbf.setNamespaceAware(true);
        dbf.setExpandEntityReferences(false);
        try {
            dbf.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            dbf.setFeature("http://xml.org/sax/features/external-general-entities", false);
            dbf.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            dbf.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            return dbf.newDocumentBuilder();
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser does not support secure processing", e);
        }
    }

    public static List<Element> children(Element parent, String localName) {
        List<Element> out = new ArrayList<>();
        for (Node n = parent.getFirstChild(); n != null; n = n.getNextSibling()) {
            if (n instanceof Element && (localName == null || localName.equals(n.getLocalName()))) {
                out.add((Element) n);
            }
        }
        return out;
    }

    public static List<Element> children(Element parent) {
        return children(parent, null);
    }

    /** @return first child element with the given local name, or null */
    public static Element child(Element parent, String localName) {
        for (Node n = parent.getFirstChild(); n != null; n = n.getNextSibling()) {
            if (n instanceof Element && localName.equals(n.getLocalName())) return (Element) n;
        }
        return null;
    }

    /** @return text of the named child, or null when the child is absent */
    public static String childText(Element parent, String localName) {
        Element c = child(parent, localName);
        return c == null ? null : c.getTextContent();
    }

    /** @return attribute text, or null when absent */
    public static String attribute(Element e, String name) {
        return e.hasAttribute(name) ? e.getAttribute(name) : null;
    }

    /** Serialize an element subtree without XML declaration. */
    public static String serialize(Element e) {
        try {
            TransformerFactory tf = TransformerFactory.newInstance();
            tf.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            Transformer t = tf.newTransformer();
            t.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "yes");
            t.setOutputProperty(OutputKeys.INDENT, "no");
            StringWriter sw = new StringWriter();
            t.transform(new DOMSource(e), new StreamResult(sw));
            return sw.toString();
        } catch (TransformerException ex) {
            throw new IllegalStateException("Could not serialize element " + e.getLocalName(), ex);
        }
    }
}
