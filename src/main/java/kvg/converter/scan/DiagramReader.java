package kvg.converter.scan;

import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import kvg.converter.model.GroupNode;
import kvg.converter.model.Ids;
import kvg.converter.model.NumberPos;
import kvg.converter.model.SourceDiagram;
import kvg.converter.model.SourceNode;
import kvg.converter.model.StrokeNode;

/**
 * Reads one KanjiVG SVG file into a {@link SourceDiagram}.
 * <p>
 * Layout expected:
 * <pre>
 * &lt;g id="kvg:StrokePaths_04e00"&gt;
 *   &lt;g id="kvg:04e00" kvg:element="一"&gt;            root group, id carries code and variant
 *     &lt;path id="kvg:04e00-s1" kvg:type="㇐" d="..."/&gt;
 *   &lt;/g&gt;
 * &lt;/g&gt;
 * &lt;g id="kvg:StrokeNumbers_04e00"&gt;
 *   &lt;text transform="matrix(1 0 0 1 4.25 45.13)"&gt;1&lt;/text&gt;
 * &lt;/g&gt;
 * </pre>
 * The parser is not namespace aware, so {@code kvg:} attributes are looked up by their
 * qualified names. External DTDs are never fetched.
 */
public final class DiagramReader {

    private static final String LOAD_EXTERNAL_DTD = "http://apache.org/xml/features/nonvalidating/load-external-dtd";

    private static final String STROKE_PATHS_PREFIX = "kvg:StrokePaths_";
    private static final String STROKE_NUMBERS_PREFIX = "kvg:StrokeNumbers_";

    private static final Pattern ROOT_ID = Pattern.compile("kvg:([0-9a-fA-F]{1,8})(?:-(.+))?");
    // The variant ends up in an output file name.
    private static final Pattern VARIANT = Pattern.compile("[A-Za-z0-9_]+");
    private static final Pattern MATRIX = Pattern.compile("matrix\\(([^)]*)\\)");

    private final DocumentBuilderFactory factory;

    public DiagramReader() {
        this.factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(false);
        factory.setValidating(false);
        factory.setXIncludeAware(false);
        factory.setExpandEntityReferences(false);
        try {
            factory.setFeature(LOAD_EXTERNAL_DTD, false);
        } catch (ParserConfigurationException ex) {
            throw new IllegalStateException("XML parser does not support " + LOAD_EXTERNAL_DTD, ex);
        }
    }

    public SourceDiagram read(Path file) throws IOException, DiagramFormatException {
        Objects.requireNonNull(file, "file");
        final String fileName = file.getFileName() != null ? file.getFileName().toString() : file.toString();

        final Document doc;
        try (InputStream in = Files.newInputStream(file)) {
            final InputSource source = new InputSource(in);
            source.setSystemId(file.toUri().toString());
            doc = newBuilder().parse(source);
        } catch (SAXException ex) {
            throw new DiagramFormatException("malformed markup: " + ex.getMessage(), ex);
        }

        final Element strokePaths = findGroup(doc, STROKE_PATHS_PREFIX);
        if (strokePaths == null) {
            throw new DiagramFormatException("no " + STROKE_PATHS_PREFIX + " group");
        }
        final Element rootGroup = firstChildElement(strokePaths, "g");
        if (rootGroup == null) {
            throw new DiagramFormatException("no root group under " + strokePaths.getAttribute("id"));
        }

        final String rootId = rootGroup.getAttribute("id");
        final Matcher m = ROOT_ID.matcher(rootId);
        if (!m.matches()) {
            throw new DiagramFormatException("root group id missing or malformed: '" + rootId + "'");
        }
        final String code = m.group(1);
        final int codePoint;
        try {
            codePoint = Ids.codePoint(code);
        } catch (IllegalArgumentException ex) {
            throw new DiagramFormatException("root group code is not usable: " + code, ex);
        }
        if (!Ids.isScalarValue(codePoint)) {
            throw new DiagramFormatException("root group code is not a Unicode scalar value: " + code);
        }

        final String variant = m.group(2);
        if (variant != null && !VARIANT.matcher(variant).matches()) {
            throw new DiagramFormatException("root group variant has unsupported characters: '" + variant + "'");
        }

        final TreeBuilder tree = new TreeBuilder(readNumberPositions(findGroup(doc, STROKE_NUMBERS_PREFIX)));
        final GroupNode root = tree.group(rootGroup);

        return new SourceDiagram(code, variant, root, fileName);
    }

    private DocumentBuilder newBuilder() throws IOException {
        final DocumentBuilder builder;
        try {
            builder = factory.newDocumentBuilder();
        } catch (ParserConfigurationException ex) {
            throw new IOException("cannot create XML parser", ex);
        }
        // Anything external resolves to nothing.
        builder.setEntityResolver((publicId, systemId) -> new InputSource(new StringReader("")));
        builder.setErrorHandler(new ErrorHandler() {
            @Override
            public void warning(SAXParseException exception) {
                // non-fatal, the document is still usable
            }

            @Override
            public void error(SAXParseException exception) throws SAXException {
                throw exception;
            }

            @Override
            public void fatalError(SAXParseException exception) throws SAXException {
                throw exception;
            }
        });
        return builder;
    }

    /**
     * Walks the group elements, numbering strokes in document order so each one can pick up
     * its label position.
     */
    private static final class TreeBuilder {

        private final Map<Integer, NumberPos> labels;
        private int strokeCount;

        private TreeBuilder(Map<Integer, NumberPos> labels) {
            this.labels = labels;
        }

        GroupNode group(Element g) throws DiagramFormatException {
            final List<SourceNode> children = new ArrayList<>();
            final NodeList nodes = g.getChildNodes();
            for (int i = 0; i < nodes.getLength(); i++) {
                final Node n = nodes.item(i);
                if (!(n instanceof Element child)) {
                    continue;
                }
                switch (child.getTagName()) {
                    case "g" -> children.add(group(child));
                    case "path" -> children.add(stroke(child));
                    default -> {
                        // other elements carry no strokes
                    }
                }
            }

            return new GroupNode(
                    attr(g, "id"),
                    attr(g, "kvg:element"),
                    attr(g, "kvg:original"),
                    intAttr(g, "kvg:part"),
                    intAttr(g, "kvg:number"),
                    flagAttr(g, "kvg:variant"),
                    flagAttr(g, "kvg:partial"),
                    flagAttr(g, "kvg:tradForm"),
                    flagAttr(g, "kvg:radicalForm"),
                    attr(g, "kvg:position"),
                    attr(g, "kvg:radical"),
                    attr(g, "kvg:phon"),
                    children
            );
        }

        private StrokeNode stroke(Element path) {
            strokeCount++;
            return new StrokeNode(attr(path, "kvg:type"), attr(path, "d"), labels.get(strokeCount));
        }
    }

    /**
     * Stroke number -> label anchor. A label whose text is not a number counts as the label for
     * its own position in the list.
     */
    static Map<Integer, NumberPos> readNumberPositions(Element numbersGroup) {
        final Map<Integer, NumberPos> out = new HashMap<>();
        if (numbersGroup == null) {
            return out;
        }
        final NodeList texts = numbersGroup.getElementsByTagName("text");
        for (int i = 0; i < texts.getLength(); i++) {
            final Element text = (Element) texts.item(i);
            final NumberPos pos = parseMatrixTranslation(text.getAttribute("transform"));
            if (pos == null) {
                continue;
            }
            int number;
            try {
                number = Integer.parseInt(text.getTextContent().trim());
            } catch (NumberFormatException ex) {
                number = i + 1;
            }
            out.putIfAbsent(number, pos);
        }
        return out;
    }

    static NumberPos parseMatrixTranslation(String transform) {
        if (transform == null) {
            return null;
        }
        final Matcher m = MATRIX.matcher(transform);
        if (!m.find()) {
            return null;
        }
        final String[] parts = m.group(1).trim().split("[\\s,]+");
        if (parts.length != 6) {
            return null;
        }
        try {
            return new NumberPos(Double.parseDouble(parts[4]), Double.parseDouble(parts[5]));
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    private static Element findGroup(Document doc, String idPrefix) {
        final NodeList groups = doc.getElementsByTagName("g");
        for (int i = 0; i < groups.getLength(); i++) {
            final Element g = (Element) groups.item(i);
            if (g.getAttribute("id").startsWith(idPrefix)) {
                return g;
            }
        }
        return null;
    }

    private static Element firstChildElement(Element parent, String tagName) {
        final NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            if (nodes.item(i) instanceof Element e && tagName.equals(e.getTagName())) {
                return e;
            }
        }
        return null;
    }

    private static String attr(Element e, String name) {
        return e.hasAttribute(name) ? e.getAttribute(name) : null;
    }

    private static Integer intAttr(Element e, String name) throws DiagramFormatException {
        final String raw = attr(e, name);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Integer.valueOf(raw.trim());
        } catch (NumberFormatException ex) {
            throw new DiagramFormatException(name + " is not a number: '" + raw + "' in " + e.getAttribute("id"), ex);
        }
    }

    private static Boolean flagAttr(Element e, String name) {
        return "true".equalsIgnoreCase(attr(e, name)) ? Boolean.TRUE : null;
    }
}
