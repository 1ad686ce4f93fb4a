package eu.virtualparadox.ewexport.export;

import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Produces the four text payloads ProPresenter 6 stores for every text element.
 *
 * <ul>
 *   <li><strong>PlainText</strong> - the text with CRLF line endings.</li>
 *   <li><strong>RTFData</strong> - ProPresenter flavoured RTF: four-slot font table, colour table,
 *       one centred paragraph per line, non-ASCII characters as {@code \}{@code uN?} escapes.</li>
 *   <li><strong>WinFlowData</strong> - a WPF {@code FlowDocument} with one centred paragraph per line,
 *       used by the Windows version.</li>
 *   <li><strong>WinFontData</strong> - a fixed {@code RVFont} description.</li>
 * </ul>
 * Every payload is base64 encoded; the XML writer stores them as element text.
 */
@Component
public class Pro6TextEncoder {

    private static final String CRLF = "\r\n";

    private static final String RTF_LINE_SUFFIX = "\\li0\\sa0\\sb0\\fi0\\qc\\par";

    private static final String FLOW_DOCUMENT_START =
            "<FlowDocument TextAlignment=\"Center\" PagePadding=\"5,0,5,0\" AllowDrop=\"True\" "
                    + "xmlns=\"http://schemas.microsoft.com/winfx/2006/xaml/presentation\">";
    private static final String FLOW_DOCUMENT_END = "</FlowDocument>";

    static final String FONT_DATA = "<?xml version=\"1.0\" encoding=\"utf-16\"?>"
            + "<RVFont xmlns:i=\"http://www.w3.org/2001/XMLSchema-instance\" "
            + "xmlns=\"http://schemas.datacontract.org/2004/07/ProPresenter.Common\">"
            + "<Kerning>0</Kerning>"
            + "<LineSpacing>0</LineSpacing>"
            + "<OutlineColor xmlns:d2p1=\"http://schemas.datacontract.org/2004/07/System.Windows.Media\">"
            + "<d2p1:A>255</d2p1:A><d2p1:B>0</d2p1:B><d2p1:G>0</d2p1:G><d2p1:R>0</d2p1:R>"
            + "<d2p1:ScA>1</d2p1:ScA><d2p1:ScB>0</d2p1:ScB><d2p1:ScG>0</d2p1:ScG><d2p1:ScR>0</d2p1:ScR>"
            + "</OutlineColor>"
            + "<OutlineWidth>0</OutlineWidth>"
            + "<Variants>Normal</Variants>"
            + "</RVFont>";

    private static final String FONT_DATA_BASE64 = base64(FONT_DATA);

    public String plainText(final String content) {
        return base64(toCrlf(content));
    }

    public String rtfData(final String content, final ExportOptions options) {
        return base64(buildRtf(content, options.effectiveFontFamily(), options.effectiveFontSize()));
    }

    public String winFlowData(final String content, final ExportOptions options) {
        return base64(buildFlowDocument(content, options.effectiveFontFamily(), options.effectiveFontSize()));
    }

    public String winFontData() {
        return FONT_DATA_BASE64;
    }

    String buildRtf(final String content, final String fontFamily, final int fontSize) {
        final int halfPoints = fontSize * 2;

        final StringBuilder lines = new StringBuilder();
        for (final String line : lines(content)) {
            if (line.isBlank()) {
                continue;
            }
            if (lines.length() > 0) {
                lines.append(CRLF);
            }
            lines.append("{\\cf2\\ltrch ").append(escapeRtf(line)).append('}').append(RTF_LINE_SUFFIX);
        }

        return "{\\rtf1\\prortf1\\ansi\\ansicpg1252\\uc1\\htmautsp\\deff2"
                + "{\\fonttbl"
                + "{\\f0\\fcharset0 Times New Roman;}"
                + "{\\f2\\fcharset0 Georgia;}"
                + "{\\f3\\fcharset0 Arial;}"
                + "{\\f4\\fcharset0 " + escapeRtf(fontFamily) + ";}"
                + "}"
                + "{\\colortbl;\\red0\\green0\\blue0;\\red255\\green255\\blue255;}"
                + "\\loch\\hich\\dbch\\pard\\slleading0\\plain\\ltrpar\\itap0"
                + "{\\lang1033\\fs" + halfPoints + "\\f3\\cf1 \\cf1\\qc"
                + "{\\fs" + halfPoints + "\\f4 " + lines + "}" + CRLF
                + "}}";
    }

    String buildFlowDocument(final String content, final String fontFamily, final int fontSize) {
        final String family = escapeXml(fontFamily);
        final StringBuilder sb = new StringBuilder(FLOW_DOCUMENT_START);
        for (final String line : lines(content)) {
            if (line.isBlank()) {
                continue;
            }
            sb.append("<Paragraph Margin=\"0,0,0,0\" TextAlignment=\"Center\" FontFamily=\"").append(family)
                    .append("\" FontSize=\"").append(fontSize).append("\">")
                    .append("<Run FontFamily=\"").append(family).append("\" FontSize=\"").append(fontSize)
                    .append("\" Foreground=\"#FFFFFFFF\" Block.TextAlignment=\"Center\">")
                    .append(escapeXml(line))
                    .append("</Run></Paragraph>");
        }
        return sb.append(FLOW_DOCUMENT_END).toString();
    }

    /**
     * Escapes RTF syntax characters and writes everything outside ASCII as a signed 16-bit
     * Unicode escape followed by a {@code ?} placeholder.
     */
    static String escapeRtf(final String text) {
        final StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            final char c = text.charAt(i);
            if (c == '\\' || c == '{' || c == '}') {
                sb.append('\\').append(c);
            } else if (c > 127) {
                final int code = c > Short.MAX_VALUE ? c - 65536 : c;
                sb.append("\\u").append(code).append('?');
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    static String escapeXml(final String text) {
        final StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            final char c = text.charAt(i);
            switch (c) {
                case '&' -> sb.append("&amp;");
                case '<' -> sb.append("&lt;");
                case '>' -> sb.append("&gt;");
                case '"' -> sb.append("&quot;");
                case '\'' -> sb.append("&apos;");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    private static String[] lines(final String content) {
        return content.replace("\r\n", "\n").replace('\r', '\n').split("\n");
    }

    private static String toCrlf(final String content) {
        return content.replace("\r\n", "\n").replace("\n", CRLF);
    }

    private static String base64(final String text) {
        return Base64.getEncoder().encodeToString(text.getBytes(StandardCharsets.UTF_8));
    }
}
