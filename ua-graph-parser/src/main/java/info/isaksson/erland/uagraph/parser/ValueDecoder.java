package info.isaksson.erland.uagraph.parser;

import info.isaksson.erland.uagraph.model.NodeId;
import info.isaksson.erland.uagraph.model.value.UaBoolean;
import info.isaksson.erland.uagraph.model.value.UaByteString;
import info.isaksson.erland.uagraph.model.value.UaDateTime;
import info.isaksson.erland.uagraph.model.value.UaEnumValueType;
import info.isaksson.erland.uagraph.model.value.UaEuInformation;
import info.isaksson.erland.uagraph.model.value.UaExtensionObject;
import info.isaksson.erland.uagraph.model.value.UaFloatingPoint;
import info.isaksson.erland.uagraph.model.value.UaInteger;
import info.isaksson.erland.uagraph.model.value.UaListOf;
import info.isaksson.erland.uagraph.model.value.UaLocalizedText;
import info.isaksson.erland.uagraph.model.value.UaNodeIdValue;
import info.isaksson.erland.uagraph.model.value.UaRange;
import info.isaksson.erland.uagraph.model.value.UaString;
import info.isaksson.erland.uagraph.model.value.UaValue;
import info.isaksson.erland.uagraph.model.value.UaXmlElement;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;

import static info.isaksson.erland.uagraph.parser.NodeSetXml.child;
import static info.isaksson.erland.uagraph.parser.NodeSetXml.childText;
import static info.isaksson.erland.uagraph.parser.NodeSetXml.children;

/**
 * Decodes the {@code Types.xsd} content of a {@code <Value>} element.
 *
 * <p>NodeIds inside values are kept exactly as written; they are not remapped to the global namespace table.
 * Elements without a dedicated value class are kept as raw markup.</p>
 */
public final class ValueDecoder {

    public UaValue decode(Element e) {
        String tag = e.getLocalName();
        if (tag.startsWith("ListOf")) {
            List<UaValue> items = new ArrayList<>();
            for (Element c : children(e)) {
                items.add(decode(c));
            }
            return new UaListOf(tag.substring("ListOf".length()), items);
        }
        String text = e.getTextContent() == null ? "" : e.getTextContent().strip();
        if (UaInteger.TYPE_NAMES.contains(tag)) {
            return UaInteger.parse(tag, text);
        }
        return switch (tag) {
            case "Boolean" -> UaBoolean.parse(text);
            case "Float", "Double" -> UaFloatingPoint.parse(tag, text);
            case "String" -> UaString.of(text);
            case "Guid" -> new UaString("Guid", guidText(e, text));
            case "DateTime" -> UaDateTime.parse(text);
            case "ByteString" -> UaByteString.parse(text);
            case "NodeId" -> new UaNodeIdValue(NodeId.parse(identifierText(e)));
            case "LocalizedText" -> localizedText(e);
            case "ExtensionObject" -> extensionObject(e);
            case "EnumValueType" -> enumValueType(e);
            default -> new UaXmlElement(tag, NodeSetXml.serialize(e));
        };
    }

    private static String guidText(Element e, String text) {
        String inner = childText(e, "String");
        return inner == null ? text : inner.strip();
    }

    private static String identifierText(Element e) {
        String inner = childText(e, "Identifier");
        return (inner == null ? e.getTextContent() : inner).strip();
    }

    /** Missing parts stay null; a blank locale counts as missing. */
    static UaLocalizedText localizedText(Element e) {
        if (e == null) return new UaLocalizedText(null, null);
        String locale = childText(e, "Locale");
        if (locale != null && locale.isBlank()) locale = null;
        return new UaLocalizedText(locale, childText(e, "Text"));
    }

    private UaValue extensionObject(Element e) {
        Element typeIdEl = child(e, "TypeId");
        NodeId typeId = typeIdEl == null ? null : NodeId.parse(identifierText(typeIdEl));
        Element bodyEl = child(e, "Body");
        Element content = null;
        if (bodyEl != null) {
            List<Element> c = children(bodyEl);
            content = c.isEmpty() ? null : c.get(0);
        }
        if (content != null && UaEuInformation.ENCODING_ID.equals(typeId) && "EUInformation".equals(content.getLocalName())) {
            return new UaEuInformation(
                    stripTrailing(childText(content, "NamespaceUri")),
                    Integer.parseInt(childText(content, "UnitId").strip()),
                    localizedText(child(content, "DisplayName")),
                    localizedText(child(content, "Description")));
        }
        if (content != null && UaRange.ENCODING_ID.equals(typeId) && "Range".equals(content.getLocalName())) {
            return new UaRange(
                    UaFloatingPoint.parseLexical(childText(content, "Low").strip()),
                    UaFloatingPoint.parseLexical(childText(content, "High").strip()));
        }
        return new UaExtensionObject(typeId, content == null ? null : decode(content));
    }

    private static UaValue enumValueType(Element e) {
        String value = childText(e, "Value");
        Element description = child(e, "Description");
        return new UaEnumValueType(
                value == null ? 0L : Long.parseLong(value.strip()),
                localizedText(child(e, "DisplayName")),
                description == null ? null : localizedText(description));
    }

    private static String stripTrailing(String s) {
        return s == null ? null : s.stripTrailing();
    }
}
