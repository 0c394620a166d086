package com.ogt.geodata.codec;

import com.ogt.geodata.exception.GeodataException;
import lombok.Value;
import org.locationtech.jts.algorithm.Orientation;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.CoordinateArrays;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.LinearRing;
import org.locationtech.jts.geom.MultiLineString;
import org.locationtech.jts.geom.MultiPoint;
import org.locationtech.jts.geom.MultiPolygon;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygon;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.List;

/**
 * Lectura/escritura de la parte geométrica de un shapefile (.shp + .shx).
 * Los tipos Z/M se leen como 2D; se escribe siempre 2D.
 */
final class ShpGeometryCodec {

    static final int NULL_SHAPE = 0;
    static final int POINT = 1;
    static final int POLYLINE = 3;
    static final int POLYGON = 5;
    static final int MULTIPOINT = 8;

    private static final int FILE_CODE = 9994;
    private static final int VERSION = 1000;
    private static final int HEADER_BYTES = 100;

    private ShpGeometryCodec() {}

    /** Resultado de la escritura: contenido .shp y .shx. */
    @Value
    static class Output {
        byte[] shp;
        byte[] shx;
    }

    // ============================================================
    // ESCRITURA
    // ============================================================

    /**
     * Determina el tipo de shape común a todas las geometrías.
     *
     * @throws GeodataException PROCESSING_FAILURE si se mezclan dimensiones
     */
    static int shapeTypeOf(List<Geometry> geometries) {
        int type = NULL_SHAPE;
        for (Geometry g : geometries) {
            if (g == null || g.isEmpty()) continue;
            int current;
            if (g instanceof Point) {
                current = POINT;
            } else if (g instanceof MultiPoint) {
                current = MULTIPOINT;
            } else if (g instanceof LineString || g instanceof MultiLineString) {
                current = POLYLINE;
            } else if (g instanceof Polygon || g instanceof MultiPolygon) {
                current = POLYGON;
            } else {
                throw GeodataException.processingFailure(
                        "Shapefile no admite geometrías de tipo " + g.getGeometryType(), null);
            }
            if (type == NULL_SHAPE || type == current) {
                type = current;
            } else if ((type == POINT && current == MULTIPOINT) || (type == MULTIPOINT && current == POINT)) {
                type = MULTIPOINT;
            } else {
                throw GeodataException.processingFailure(
                        "Shapefile no admite mezclar puntos, líneas y polígonos en una misma capa", null);
            }
        }
        return type == NULL_SHAPE ? POINT : type;
    }

    static Output write(List<Geometry> geometries, int shapeType) {
        List<byte[]> contents = new ArrayList<>(geometries.size());
        Envelope env = new Envelope();
        for (Geometry g : geometries) {
            contents.add(encodeRecord(g, shapeType));
            if (g != null && !g.isEmpty()) {
                env.expandToInclude(g.getEnvelopeInternal());
            }
        }

        int shpLength = HEADER_BYTES;
        for (byte[] c : contents) {
            shpLength += 8 + c.length;
        }
        int shxLength = HEADER_BYTES + 8 * contents.size();

        ByteBuffer shp = ByteBuffer.allocate(shpLength);
        ByteBuffer shx = ByteBuffer.allocate(shxLength);
        writeHeader(shp, shpLength, shapeType, env);
        writeHeader(shx, shxLength, shapeType, env);

        int recordNumber = 1;
        for (byte[] c : contents) {
            int offsetWords = shp.position() / 2;
            shp.order(ByteOrder.BIG_ENDIAN).putInt(recordNumber++).putInt(c.length / 2);
            shp.put(c);
            shx.order(ByteOrder.BIG_ENDIAN).putInt(offsetWords).putInt(c.length / 2);
        }
        return new Output(shp.array(), shx.array());
    }

    private static void writeHeader(ByteBuffer buf, int lengthBytes, int shapeType, Envelope env) {
        buf.order(ByteOrder.BIG_ENDIAN).putInt(FILE_CODE);
        for (int i = 0; i < 5; i++) {
            buf.putInt(0);
        }
        buf.putInt(lengthBytes / 2);
        buf.order(ByteOrder.LITTLE_ENDIAN).putInt(VERSION).putInt(shapeType);
        boolean empty = env.isNull();
        buf.putDouble(empty ? 0 : env.getMinX()).putDouble(empty ? 0 : env.getMinY())
                .putDouble(empty ? 0 : env.getMaxX()).putDouble(empty ? 0 : env.getMaxY());
        buf.putDouble(0).putDouble(0).putDouble(0).putDouble(0);
    }

    private static byte[] encodeRecord(Geometry g, int shapeType) {
        if (g == null || g.isEmpty()) {
            return ByteBuffer.allocate(4).order(ByteOrder.LITTLE_ENDIAN).putInt(NULL_SHAPE).array();
        }
        switch (shapeType) {
            case POINT: {
                Coordinate c = g.getCoordinate();
                return ByteBuffer.allocate(20).order(ByteOrder.LITTLE_ENDIAN)
                        .putInt(POINT).putDouble(c.x).putDouble(c.y).array();
            }
            case MULTIPOINT: {
                Coordinate[] coords = g.getCoordinates();
                ByteBuffer buf = ByteBuffer.allocate(40 + 16 * coords.length).order(ByteOrder.LITTLE_ENDIAN);
                buf.putInt(MULTIPOINT);
                putBox(buf, g.getEnvelopeInternal());
                buf.putInt(coords.length);
                for (Coordinate c : coords) {
                    buf.putDouble(c.x).putDouble(c.y);
                }
                return buf.array();
            }
            case POLYLINE: {
                List<Coordinate[]> parts = new ArrayList<>();
                for (int i = 0; i < g.getNumGeometries(); i++) {
                    parts.add(g.getGeometryN(i).getCoordinates());
                }
                return encodeParts(POLYLINE, parts, g.getEnvelopeInternal());
            }
            case POLYGON: {
                List<Coordinate[]> rings = new ArrayList<>();
                for (int i = 0; i < g.getNumGeometries(); i++) {
                    Polygon p = (Polygon) g.getGeometryN(i);
                    if (p.isEmpty()) continue;
                    // exterior en sentido horario, huecos antihorario
                    rings.add(oriented(p.getExteriorRing().getCoordinates(), false));
                    for (int h = 0; h < p.getNumInteriorRing(); h++) {
                        rings.add(oriented(p.getInteriorRingN(h).getCoordinates(), true));
                    }
                }
                return encodeParts(POLYGON, rings, g.getEnvelopeInternal());
            }
            default:
                throw new IllegalStateException("Tipo de shape no soportado: " + shapeType);
        }
    }

    private static Coordinate[] oriented(Coordinate[] ring, boolean counterClockwise) {
        if (Orientation.isCCW(ring) == counterClockwise) {
            return ring;
        }
        Coordinate[] copy = CoordinateArrays.copyDeep(ring);
        CoordinateArrays.reverse(copy);
        return copy;
    }

    private static byte[] encodeParts(int type, List<Coordinate[]> parts, Envelope env) {
        int numPoints = parts.stream().mapToInt(p -> p.length).sum();
        ByteBuffer buf = ByteBuffer.allocate(44 + 4 * parts.size() + 16 * numPoints).order(ByteOrder.LITTLE_ENDIAN);
        buf.putInt(type);
        putBox(buf, env);
        buf.putInt(parts.size()).putInt(numPoints);
        int start = 0;
        for (Coordinate[] part : parts) {
            buf.putInt(start);
            start += part.length;
        }
        for (Coordinate[] part : parts) {
            for (Coordinate c : part) {
                buf.putDouble(c.x).putDouble(c.y);
            }
        }
        return buf.array();
    }

    private static void putBox(ByteBuffer buf, Envelope env) {
        buf.putDouble(env.getMinX()).putDouble(env.getMinY()).putDouble(env.getMaxX()).putDouble(env.getMaxY());
    }

    // ============================================================
    // LECTURA
    // ============================================================
    static List<Geometry> read(byte[] shp, GeometryFactory gf) {
        try {
            ByteBuffer buf = ByteBuffer.wrap(shp);
            if (buf.order(ByteOrder.BIG_ENDIAN).getInt(0) != FILE_CODE) {
                throw GeodataException.invalidParameter("Fichero .shp inválido: código de fichero incorrecto.");
            }
            int fileLength = Math.min(buf.getInt(24) * 2, shp.length);

            List<Geometry> geometries = new ArrayList<>();
            int pos = HEADER_BYTES;
            while (pos + 8 <= fileLength) {
                buf.order(ByteOrder.BIG_ENDIAN);
                int contentLength = buf.getInt(pos + 4) * 2;
                int contentStart = pos + 8;
                buf.position(contentStart);
                buf.order(ByteOrder.LITTLE_ENDIAN);
                geometries.add(readShape(buf, gf));
                pos = contentStart + contentLength;
            }
            return geometries;
        } catch (BufferUnderflowException | IndexOutOfBoundsException | IllegalArgumentException e) {
            throw GeodataException.invalidParameter("Fichero .shp truncado o corrupto: " + e.getMessage(), e);
        }
    }

    private static Geometry readShape(ByteBuffer buf, GeometryFactory gf) {
        int type = buf.getInt();
        switch (type) {
            case NULL_SHAPE:
                return null;
            case 1: case 11: case 21:
                return gf.createPoint(new Coordinate(buf.getDouble(), buf.getDouble()));
            case 8: case 18: case 28: {
                skipBox(buf);
                Coordinate[] coords = readPoints(buf, readCount(buf, 16, "puntos"));
                return gf.createMultiPointFromCoords(coords);
            }
            case 3: case 13: case 23: {
                List<Coordinate[]> parts = readParts(buf);
                LineString[] lines = parts.stream().map(gf::createLineString).toArray(LineString[]::new);
                return lines.length == 1 ? lines[0] : gf.createMultiLineString(lines);
            }
            case 5: case 15: case 25:
                return assemblePolygons(readParts(buf), gf);
            default:
                throw GeodataException.invalidParameter("Tipo de shape no soportado: " + type);
        }
    }

    private static List<Coordinate[]> readParts(ByteBuffer buf) {
        skipBox(buf);
        int numParts = readCount(buf, 4, "partes");
        int numPoints = readCount(buf, 16, "puntos");
        int[] starts = new int[numParts];
        for (int i = 0; i < numParts; i++) {
            starts[i] = buf.getInt();
            if (starts[i] < 0 || starts[i] > numPoints || (i > 0 && starts[i] < starts[i - 1])) {
                throw GeodataException.invalidParameter("Fichero .shp corrupto: inicio de parte " + starts[i]
                        + " fuera de rango (" + numPoints + " puntos)");
            }
        }
        Coordinate[] all = readPoints(buf, numPoints);
        List<Coordinate[]> parts = new ArrayList<>(numParts);
        for (int i = 0; i < numParts; i++) {
            int end = i + 1 < numParts ? starts[i + 1] : numPoints;
            Coordinate[] part = new Coordinate[end - starts[i]];
            System.arraycopy(all, starts[i], part, 0, part.length);
            parts.add(part);
        }
        return parts;
    }

    /**
     * Anillos horarios = exteriores, antihorarios = huecos. Cada hueco se asigna
     * al exterior que lo contiene; un hueco huérfano se trata como exterior.
     */
    private static Geometry assemblePolygons(List<Coordinate[]> rings, GeometryFactory gf) {
        List<LinearRing> shells = new ArrayList<>();
        List<LinearRing> holes = new ArrayList<>();
        for (Coordinate[] coords : rings) {
            Coordinate[] closed = close(coords);
            if (closed.length < 4) continue;
            LinearRing ring = gf.createLinearRing(closed);
            if (Orientation.isCCW(closed)) {
                holes.add(ring);
            } else {
                shells.add(ring);
            }
        }

        List<List<LinearRing>> holesByShell = new ArrayList<>();
        List<Polygon> shellPolygons = new ArrayList<>();
        for (LinearRing shell : shells) {
            holesByShell.add(new ArrayList<>());
            shellPolygons.add(gf.createPolygon(shell));
        }
        for (LinearRing hole : holes) {
            int owner = -1;
            Point probe = gf.createPoint(hole.getCoordinateN(0));
            for (int i = 0; i < shellPolygons.size(); i++) {
                if (shellPolygons.get(i).getEnvelopeInternal().covers(hole.getEnvelopeInternal())
                        && shellPolygons.get(i).covers(probe)) {
                    owner = i;
                    break;
                }
            }
            if (owner >= 0) {
                holesByShell.get(owner).add(hole);
            } else {
                shells.add(hole);
                holesByShell.add(new ArrayList<>());
            }
        }

        Polygon[] polygons = new Polygon[shells.size()];
        for (int i = 0; i < shells.size(); i++) {
            polygons[i] = gf.createPolygon(shells.get(i), holesByShell.get(i).toArray(new LinearRing[0]));
        }
        if (polygons.length == 0) {
            return null;
        }
        return polygons.length == 1 ? polygons[0] : gf.createMultiPolygon(polygons);
    }

    private static Coordinate[] close(Coordinate[] coords) {
        if (coords.length == 0 || coords[0].equals2D(coords[coords.length - 1])) {
            return coords;
        }
        Coordinate[] closed = new Coordinate[coords.length + 1];
        System.arraycopy(coords, 0, closed, 0, coords.length);
        closed[coords.length] = new Coordinate(coords[0]);
        return closed;
    }

    /** Contador de la cabecera del registro, acotado por los bytes que quedan en el buffer. */
    private static int readCount(ByteBuffer buf, int bytesPerItem, String what) {
        int n = buf.getInt();
        if (n < 0 || n > buf.remaining() / bytesPerItem) {
            throw GeodataException.invalidParameter("Fichero .shp corrupto: número de " + what + " no válido (" + n + ")");
        }
        return n;
    }

    private static Coordinate[] readPoints(ByteBuffer buf, int n) {
        Coordinate[] coords = new Coordinate[n];
        for (int i = 0; i < n; i++) {
            coords[i] = new Coordinate(buf.getDouble(), buf.getDouble());
        }
        return coords;
    }

    private static void skipBox(ByteBuffer buf) {
        buf.position(buf.position() + 32);
    }
}
