package info.isaksson.erland.uagraph.model.value;

import info.isaksson.erland.uagraph.model.XmlText;

import java.util.Objects;

/** Text with an optional locale. Absent parts are omitted when encoding. */
public final class UaLocalizedText extends UaValue {
    public final String locale;
    public final String text;

    public UaLocalizedText(String locale, String text) {
        this.locale = locale;
        this.text = text;
    }

    @Override public String typeName() {
        return "LocalizedText";
    }

    @Override public String encodeXml(boolean includeNamespaceDecl) {
        return open("LocalizedText", includeNamespaceDecl) + body() + close("LocalizedText");
    }

    /** Child elements only, for embedding under another element name. */
    public String body() {
        StringBuilder sb = new StringBuilder();
        if (locale != null) sb.append("<Locale>").append(XmlText.escape(locale)).append("</Locale>");
        if (text != null) sb.append("<Text>").append(XmlText.escape(text)).append("</Text>");
        return sb.toString();
    }

    @Override public boolean equals(Object o) {
        if (!(o instanceof UaLocalizedText)) return false;
        UaLocalizedText that = (UaLocalizedText) o;
        return Objects.equals(locale, that.locale) && Objects.equals(text, that.text);
    }

    @Override public int hashCode() {
        return Objects.hash(locale, text);
    }
}
