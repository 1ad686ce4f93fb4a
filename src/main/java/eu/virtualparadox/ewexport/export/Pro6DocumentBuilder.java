package eu.virtualparadox.ewexport.export;

import eu.virtualparadox.ewexport.lyrics.mapping.SectionLabelFormatter;
import eu.virtualparadox.ewexport.lyrics.section.Section;
import eu.virtualparadox.ewexport.song.SongRecord;
import eu.virtualparadox.ewexport.util.Pro6Constants;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Builds the DOM of a ProPresenter 6 presentation.
 *
 * <pre>
 * RVPresentationDocument
 *   RVTimeline (timeline)
 *     array timeCues, array mediaTracks
 *   array groups
 *     RVSlideGrouping                 one per section
 *       array slides
 *         RVDisplaySlide              one per slide of the section
 *           array cues
 *           array displayElements
 *             RVTextElement
 *               RVRect3D position, shadow, dictionary stroke,
 *               NSString PlainText / RTFData / WinFlowData / WinFontData
 *   array arrangements
 * </pre>
 *
 * Sections without content are left out. Identifiers are fresh upper-case UUIDs on every call.
 * Song metadata is reduced to characters XML 1.0 can carry.
 */
@Component
@RequiredArgsConstructor
public class Pro6DocumentBuilder {

    private static final DateTimeFormatter LAST_USED_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ssXXX");

    private static final String IVAR = "rvXMLIvarName";
    private static final String DICTIONARY_KEY = "rvXMLDictionaryKey";
    private static final String TRANSPARENT = "0 0 0 0";

    private final Pro6TextEncoder textEncoder;
    private final SlideSplitter slideSplitter;

    public Document build(final SongRecord song, final List<Section> sections, final ExportOptions options) {
        final Document document = newDocument();

        final Element root = createRoot(document, song);
        document.appendChild(root);

        root.appendChild(createTimeline(document));

        final Element groups = array(document, "groups");
        for (final Section section : sections) {
            if (section.content().isBlank()) {
                continue;
            }
            groups.appendChild(createGroup(document, section, options));
        }
        root.appendChild(groups);

        root.appendChild(array(document, "arrangements"));
        return document;
    }

    private Element createRoot(final Document document, final SongRecord song) {
        final Element root = document.createElement("RVPresentationDocument");
        root.setAttribute("height", String.valueOf(Pro6Constants.CANVAS_HEIGHT));
        root.setAttribute("width", String.valueOf(Pro6Constants.CANVAS_WIDTH));
        root.setAttribute("versionNumber", Pro6Constants.VERSION_NUMBER);
        root.setAttribute("docType", Pro6Constants.DOC_TYPE);
        root.setAttribute("creatorCode", Pro6Constants.CREATOR_CODE);
        root.setAttribute("lastDateUsed", OffsetDateTime.now().format(LAST_USED_FORMAT));
        root.setAttribute("usedCount", "0");
        root.setAttribute("category", Pro6Constants.CATEGORY_SONG);
        root.setAttribute("resourcesDirectory", "");
        root.setAttribute("backgroundColor", "0 0 0 1");
        root.setAttribute("drawingBackgroundColor", "0");
        root.setAttribute("notes", xmlSafe(song.description()));
        root.setAttribute("artist", xmlSafe(song.author()));
        root.setAttribute("author", xmlSafe(song.author()));
        root.setAttribute("album", "");
        root.setAttribute("CCLIDisplay", song.hasReferenceNumber() ? "1" : "0");
        root.setAttribute("CCLIArtistCredits", xmlSafe(song.author()));
        root.setAttribute("CCLISongTitle", xmlSafe(song.title()));
        root.setAttribute("CCLIAuthor", xmlSafe(song.author()));
        root.setAttribute("CCLICopyright", xmlSafe(song.copyright()));
        root.setAttribute("CCLIPublisher", xmlSafe(song.administrator()));
        root.setAttribute("CCLISongNumber", xmlSafe(song.referenceNumber()));
        root.setAttribute("CCLILicenseNumber", "");
        root.setAttribute("chordChartPath", "");
        return root;
    }

    private Element createTimeline(final Document document) {
        final Element timeline = document.createElement("RVTimeline");
        timeline.setAttribute("timeOffset", "0");
        timeline.setAttribute("duration", "0");
        timeline.setAttribute("selectedMediaTrackIndex", "0");
        timeline.setAttribute("unitOfMeasure", "60");
        timeline.setAttribute("loop", "0");
        timeline.setAttribute(IVAR, "timeline");
        timeline.appendChild(array(document, "timeCues"));
        timeline.appendChild(array(document, "mediaTracks"));
        return timeline;
    }

    private Element createGroup(final Document document, final Section section, final ExportOptions options) {
        final Element group = document.createElement("RVSlideGrouping");
        group.setAttribute("name", xmlSafe(SectionLabelFormatter.displayName(section.type())));
        group.setAttribute("uuid", newUuid());
        group.setAttribute("color", SectionColorPalette.colorFor(section.type()));

        final Element slides = array(document, "slides");
        for (final String slideText : slideSplitter.split(section.content(), options)) {
            slides.appendChild(createSlide(document, slideText, options));
        }
        group.appendChild(slides);
        return group;
    }

    private Element createSlide(final Document document, final String text, final ExportOptions options) {
        final Element slide = document.createElement("RVDisplaySlide");
        slide.setAttribute("backgroundColor", TRANSPARENT);
        slide.setAttribute("highlightColor", TRANSPARENT);
        slide.setAttribute("drawingBackgroundColor", "0");
        slide.setAttribute("enabled", "1");
        slide.setAttribute("hotKey", "");
        slide.setAttribute("label", "");
        slide.setAttribute("notes", "");
        slide.setAttribute("UUID", newUuid());
        slide.setAttribute("chordChartPath", "");

        slide.appendChild(array(document, "cues"));

        final Element displayElements = array(document, "displayElements");
        displayElements.appendChild(createTextElement(document, text, options));
        slide.appendChild(displayElements);
        return slide;
    }

    private Element createTextElement(final Document document, final String text, final ExportOptions options) {
        final Element element = document.createElement("RVTextElement");
        element.setAttribute("displayName", "Default");
        element.setAttribute("UUID", newUuid());
        element.setAttribute("typeID", "0");
        element.setAttribute("displayDelay", "0");
        element.setAttribute("locked", "0");
        element.setAttribute("persistent", "0");
        element.setAttribute("fromTemplate", "0");
        element.setAttribute("opacity", "1");
        element.setAttribute("source", "");
        element.setAttribute("bezelRadius", "0");
        element.setAttribute("rotation", "0");
        element.setAttribute("drawingFill", "0");
        element.setAttribute("drawingShadow", "1");
        element.setAttribute("drawingStroke", "0");
        element.setAttribute("fillColor", TRANSPARENT);
        element.setAttribute("adjustsHeightToFit", "0");
        element.setAttribute("verticalAlignment", "0");
        element.setAttribute("revealType", "0");

        final Element position = document.createElement("RVRect3D");
        position.setAttribute(IVAR, "position");
        position.setTextContent(textBounds());
        element.appendChild(position);

        final Element shadow = document.createElement("shadow");
        shadow.setAttribute(IVAR, "shadow");
        shadow.setTextContent("5|0 0 0 1|{0, 0}");
        element.appendChild(shadow);

        final Element stroke = document.createElement("dictionary");
        stroke.setAttribute(IVAR, "stroke");
        final Element strokeColor = document.createElement("NSColor");
        strokeColor.setAttribute(DICTIONARY_KEY, "RVShapeElementStrokeColorKey");
        strokeColor.setTextContent("0 0 0 1");
        stroke.appendChild(strokeColor);
        final Element strokeWidth = document.createElement("NSNumber");
        strokeWidth.setAttribute(DICTIONARY_KEY, "RVShapeElementStrokeWidthKey");
        strokeWidth.setAttribute("hint", "float");
        strokeWidth.setTextContent("0");
        stroke.appendChild(strokeWidth);
        element.appendChild(stroke);

        element.appendChild(nsString(document, "PlainText", textEncoder.plainText(text)));
        element.appendChild(nsString(document, "RTFData", textEncoder.rtfData(text, options)));
        element.appendChild(nsString(document, "WinFlowData", textEncoder.winFlowData(text, options)));
        element.appendChild(nsString(document, "WinFontData", textEncoder.winFontData()));
        return element;
    }

    /**
     * Canvas shrunk by the padding on every side, as {@code {x y z width height}}.
     */
    static String textBounds() {
        final int padding = Pro6Constants.TEXT_PADDING;
        return "{" + padding + " " + padding + " 0 "
                + (Pro6Constants.CANVAS_WIDTH - 2 * padding) + " "
                + (Pro6Constants.CANVAS_HEIGHT - 2 * padding) + "}";
    }

    /**
     * Drops characters XML 1.0 cannot represent: C0 controls other than tab, line feed and carriage
     * return, unpaired surrogates, U+FFFE and U+FFFF.
     */
    static String xmlSafe(final String value) {
        if (value == null) {
            return "";
        }
        final StringBuilder sb = new StringBuilder(value.length());
        value.codePoints()
                .filter(Pro6DocumentBuilder::isXmlChar)
                .forEach(sb::appendCodePoint);
        return sb.toString();
    }

    private static boolean isXmlChar(final int codePoint) {
        return codePoint == 0x9 || codePoint == 0xA || codePoint == 0xD
                || (codePoint >= 0x20 && codePoint <= 0xD7FF)
                || (codePoint >= 0xE000 && codePoint <= 0xFFFD)
                || (codePoint >= 0x10000 && codePoint <= 0x10FFFF);
    }

    private static Element array(final Document document, final String name) {
        final Element array = document.createElement("array");
        array.setAttribute(IVAR, name);
        return array;
    }

    private static Element nsString(final Document document, final String name, final String value) {
        final Element element = document.createElement("NSString");
        element.setAttribute(IVAR, name);
        element.setTextContent(value);
        return element;
    }

    private static String newUuid() {
        return UUID.randomUUID().toString().toUpperCase(Locale.ROOT);
    }

    private static Document newDocument() {
        try {
            return DocumentBuilderFactory.newInstance().newDocumentBuilder().newDocument();
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser is not available", e);
        }
    }
}
