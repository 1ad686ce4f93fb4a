package eu.virtualparadox.ewexport.export;

import eu.virtualparadox.ewexport.util.Pro6Constants;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Pattern;

/**
 * Serializes presentation documents.
 *
 * <p>Output is UTF-8, indented by two spaces and starts with the standalone declaration ProPresenter
 * writes itself. Empty {@code array} and {@code dictionary} elements are always written with an explicit
 * closing tag; ProPresenter 6 rejects the self-closing form.</p>
 */
@Component
public class Pro6XmlWriter {

    private static final Pattern SELF_CLOSING_CONTAINER =
            Pattern.compile("<(array|dictionary)(\\s[^<>]*?)?\\s*/>");

    private static final String INDENT_AMOUNT_KEY = "{http://xml.apache.org/xslt}indent-amount";

    /**
     * Serializes compactly, expands empty containers, pretty-prints the result and expands again, since
     * the indenting pass collapses empty elements back into the self-closing form.
     */
    public String serialize(final Document document) {
        final String compact = expandSelfClosing(transform(new DOMSource(document), false));
        final String indented = expandSelfClosing(transform(new DOMSource(reparse(compact)), true));
        return Pro6Constants.XML_DECLARATION + "\n" + indented + "\n";
    }

    /**
     * Writes the document to {@code target}, replacing an existing file.
     */
    public void write(final Document document, final Path target) throws IOException {
        Files.writeString(target, serialize(document), StandardCharsets.UTF_8);
    }

    /**
     * Rewrites {@code <array .../>} and {@code <dictionary .../>} into an open and a close tag.
     */
    static String expandSelfClosing(final String xml) {
        return SELF_CLOSING_CONTAINER.matcher(xml).replaceAll("<$1$2></$1>");
    }

    private static String transform(final DOMSource source, final boolean indent) {
        final StringWriter writer = new StringWriter();
        try {
            final Transformer transformer = TransformerFactory.newInstance().newTransformer();
            transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "yes");
            transformer.setOutputProperty(OutputKeys.ENCODING, StandardCharsets.UTF_8.name());
            transformer.setOutputProperty(OutputKeys.METHOD, "xml");
            if (indent) {
                transformer.setOutputProperty(OutputKeys.INDENT, "yes");
                transformer.setOutputProperty(INDENT_AMOUNT_KEY, "2");
            }
            transformer.transform(source, new StreamResult(writer));
        } catch (TransformerException e) {
            throw new IllegalStateException("Failed to serialize presentation", e);
        }
        return writer.toString().replace("\r\n", "\n").strip();
    }

    private static Document reparse(final String xml) {
        try {
            return DocumentBuilderFactory.newInstance().newDocumentBuilder()
                    .parse(new InputSource(new StringReader(xml)));
        } catch (ParserConfigurationException | SAXException | IOException e) {
            throw new IllegalStateException("Failed to re-read serialized presentation", e);
        }
    }
}
