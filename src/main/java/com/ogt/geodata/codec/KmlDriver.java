package com.ogt.geodata.codec;

import com.ogt.geodata.crs.CrsRegistry;
import com.ogt.geodata.exception.GeodataException;
import com.ogt.geodata.model.AttributeType;
import com.ogt.geodata.model.Feature;
import com.ogt.geodata.model.FeatureCollection;
import com.ogt.geodata.util.GeoJSONHelper;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LinearRing;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.io.kml.KMLWriter;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * KML 2.2. Siempre en WGS84 (el codec reproyecta antes de escribir).
 */
@Slf4j
@Component
public class KmlDriver implements FormatDriver {

    private static final String SCHEMA_ID = "features_schema";
    private static final Set<String> GEOMETRY_TAGS = Set.of("Point", "LineString", "LinearRing", "Polygon", "MultiGeometry");

    private final GeometryFactory gf = GeoJSONHelper.geometryFactory();

    @Override
    public GeodataFormat format() {
        return GeodataFormat.KML;
    }

    // ============================================================
    // LECTURA
    // ============================================================
    @Override
    public FeatureCollection read(String payload) {
        Document doc = parseXml(payload);

        Map<String, String> fieldTypes = new HashMap<>();
        NodeList fields = doc.getElementsByTagName("SimpleField");
        for (int i = 0; i < fields.getLength(); i++) {
            Element field = (Element) fields.item(i);
            fieldTypes.put(field.getAttribute("name"), field.getAttribute("type").toLowerCase(Locale.ROOT));
        }

        NodeList placemarks = doc.getElementsByTagName("Placemark");
        List<Feature> features = new ArrayList<>(placemarks.getLength());
        for (int i = 0; i < placemarks.getLength(); i++) {
            features.add(readPlacemark((Element) placemarks.item(i), fieldTypes));
        }
        log.debug("KML leído: {} placemarks", features.size());
        return new FeatureCollection(features, CrsRegistry.WGS84);
    }

    private Document parseXml(String payload) {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            factory.setExpandEntityReferences(false);
            DocumentBuilder builder = factory.newDocumentBuilder();
            return builder.parse(new InputSource(new StringReader(payload)));
        } catch (ParserConfigurationException e) {
            throw GeodataException.processingFailure("No se pudo configurar el parser XML", e);
        } catch (SAXException | IOException e) {
            throw GeodataException.invalidParameter("KML inválido: " + e.getMessage(), e);
        }
    }

    private Feature readPlacemark(Element placemark, Map<String, String> fieldTypes) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        Geometry geometry = null;

        for (Element child : childElements(placemark)) {
            String tag = localName(child);
            if (tag.equals("name")) {
                attributes.put("Name", child.getTextContent().trim());
            } else if (tag.equals("description")) {
                attributes.put("Description", child.getTextContent().trim());
            } else if (geometry == null && GEOMETRY_TAGS.contains(tag)) {
                geometry = readGeometry(child);
            }
        }

        NodeList simpleData = placemark.getElementsByTagName("SimpleData");
        for (int i = 0; i < simpleData.getLength(); i++) {
            Element sd = (Element) simpleData.item(i);
            String name = sd.getAttribute("name");
            attributes.put(name, typedValue(sd.getTextContent(), fieldTypes.get(name)));
        }

        // <Data name="..."><value>...</value></Data>
        NodeList data = placemark.getElementsByTagName("Data");
        for (int i = 0; i < data.getLength(); i++) {
            Element d = (Element) data.item(i);
            String value = getXmlTagValue("value", d);
            attributes.put(d.getAttribute("name"), value);
        }

        return Feature.of(attributes, geometry);
    }

    private Geometry readGeometry(Element element) {
        try {
            switch (localName(element)) {
                case "Point":
                    return gf.createPoint(parseCoordinates(getXmlTagValue("coordinates", element))[0]);
                case "LineString":
                    return gf.createLineString(parseCoordinates(getXmlTagValue("coordinates", element)));
                case "LinearRing":
                    return gf.createLinearRing(parseCoordinates(getXmlTagValue("coordinates", element)));
                case "Polygon":
                    return readPolygon(element);
                case "MultiGeometry":
                    return readMultiGeometry(element);
                default:
                    return null;
            }
        } catch (IllegalArgumentException | ArrayIndexOutOfBoundsException e) {
            throw GeodataException.invalidParameter("Geometría KML inválida (" + localName(element) + "): " + e.getMessage(), e);
        }
    }

    private Polygon readPolygon(Element element) {
        LinearRing shell = null;
        List<LinearRing> holes = new ArrayList<>();
        for (Element boundary : childElements(element)) {
            String tag = localName(boundary);
            if (!tag.equals("outerBoundaryIs") && !tag.equals("innerBoundaryIs")) continue;
            LinearRing ring = gf.createLinearRing(parseCoordinates(getXmlTagValue("coordinates", boundary)));
            if (tag.equals("outerBoundaryIs")) {
                shell = ring;
            } else {
                holes.add(ring);
            }
        }
        if (shell == null) {
            throw new IllegalArgumentException("Polygon sin outerBoundaryIs");
        }
        return gf.createPolygon(shell, holes.toArray(new LinearRing[0]));
    }

    private Geometry readMultiGeometry(Element element) {
        List<Geometry> parts = new ArrayList<>();
        for (Element child : childElements(element)) {
            if (GEOMETRY_TAGS.contains(localName(child))) {
                parts.add(readGeometry(child));
            }
        }
        // buildGeometry devuelve Multi* si todas las partes son del mismo tipo
        return gf.buildGeometry(parts);
    }

    private Coordinate[] parseCoordinates(String text) {
        if (text == null || text.isBlank()) {
            return new Coordinate[0];
        }
        String[] tuples = text.trim().split("\\s+");
        List<Coordinate> coords = new ArrayList<>(tuples.length);
        for (String tuple : tuples) {
            String[] parts = tuple.split(",");
            coords.add(new Coordinate(Double.parseDouble(parts[0]), Double.parseDouble(parts[1])));
        }
        return coords.toArray(new Coordinate[0]);
    }

    private Object typedValue(String raw, String kmlType) {
        String text = raw == null ? "" : raw.trim();
        if (kmlType == null) return text;
        try {
            switch (kmlType) {
                case "int":
                case "uint":
                case "short":
                case "ushort":
                    return Long.parseLong(text);
                case "float":
                case "double":
                    return Double.parseDouble(text);
                case "bool":
                    return text.equals("1") || text.equalsIgnoreCase("true");
                default:
                    return text;
            }
        } catch (NumberFormatException e) {
            log.warn("Valor « {} » no es de tipo {}, se conserva como texto", text, kmlType);
            return text;
        }
    }

    // ============================================================
    // ESCRITURA
    // ============================================================
    @Override
    public String write(FeatureCollection collection) {
        Map<String, AttributeType> columns = new LinkedHashMap<>();
        for (String name : collection.attributeNames()) {
            columns.put(name, collection.columnType(name));
        }

        StringBuilder kml = new StringBuilder();
        kml.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n");
        kml.append("<kml xmlns=\"http://www.opengis.net/kml/2.2\">\n<Document id=\"root_doc\">\n");

        if (!columns.isEmpty()) {
            kml.append("<Schema name=\"features\" id=\"").append(SCHEMA_ID).append("\">\n");
            columns.forEach((name, type) -> kml.append("\t<SimpleField name=\"").append(escapeXml(name))
                    .append("\" type=\"").append(kmlType(type)).append("\"></SimpleField>\n"));
            kml.append("</Schema>\n");
        }

        kml.append("<Folder><name>features</name>\n");
        KMLWriter geometryWriter = new KMLWriter();
        for (Feature f : collection.getFeatures()) {
            kml.append("<Placemark>\n");
            kml.append("\t<ExtendedData><SchemaData schemaUrl=\"#").append(SCHEMA_ID).append("\">\n");
            columns.forEach((name, type) -> {
                Object value = f.getAttribute(name);
                if (value == null) return;
                kml.append("\t\t<SimpleData name=\"").append(escapeXml(name)).append("\">")
                        .append(escapeXml(formatValue(type.coerce(value)))).append("</SimpleData>\n");
            });
            kml.append("\t</SchemaData></ExtendedData>\n");
            kml.append(geometryWriter.write(f.getGeometry()));
            kml.append("</Placemark>\n");
        }
        kml.append("</Folder>\n</Document>\n</kml>");
        return kml.toString();
    }

    private static String kmlType(AttributeType type) {
        return switch (type) {
            case INTEGER -> "int";
            case REAL -> "float";
            case BOOLEAN -> "bool";
            case STRING -> "string";
        };
    }

    private static String formatValue(Object value) {
        if (value instanceof Double d) {
            return Double.toString(d);
        }
        return String.valueOf(value);
    }

    // ============================================================
    // HELPERS
    // ============================================================
    private static List<Element> childElements(Element parent) {
        List<Element> out = new ArrayList<>();
        NodeList children = parent.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node n = children.item(i);
            if (n.getNodeType() == Node.ELEMENT_NODE) {
                out.add((Element) n);
            }
        }
        return out;
    }

    private static String localName(Element e) {
        String tag = e.getTagName();
        int colon = tag.indexOf(':');
        return colon >= 0 ? tag.substring(colon + 1) : tag;
    }

    private static String getXmlTagValue(String tag, Element element) {
        NodeList nodeList = element.getElementsByTagName(tag);
        if (nodeList.getLength() > 0) {
            return nodeList.item(0).getTextContent();
        }
        return null;
    }

    private static String escapeXml(String s) {
        if (s == null) return "";
        return s.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;").replace("\"", "&quot;");
    }
}
