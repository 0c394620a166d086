package com.ogt.geodata.codec;

import com.ogt.geodata.crs.CrsRegistry;
import com.ogt.geodata.crs.CrsWkt;
import com.ogt.geodata.exception.GeodataException;
import com.ogt.geodata.model.AttributeType;
import com.ogt.geodata.model.Feature;
import com.ogt.geodata.model.FeatureCollection;
import com.ogt.geodata.util.GeoJSONHelper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.io.ByteOrderValues;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.WKBReader;
import org.locationtech.jts.io.WKBWriter;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * GeoPackage 1.3 (SQLite). Una única tabla de features {@code features} con
 * columna de geometría {@code geom}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GeoPackageDriver extends BinaryFormatDriver {

    static final String TABLE = "features";
    static final String GEOM_COLUMN = "geom";
    private static final int APPLICATION_ID = 0x47504B47; // "GPKG"
    private static final int USER_VERSION = 10300;

    private final CrsRegistry crsRegistry;
    private final CrsWkt crsWkt;

    @Override
    public GeodataFormat format() {
        return GeodataFormat.GPKG;
    }

    // ============================================================
    // ESCRITURA
    // ============================================================
    @Override
    protected byte[] writeStaged(FeatureCollection collection, Path staging) throws IOException {
        Path file = staging.resolve("output.gpkg");
        SingleConnectionDataSource ds = new SingleConnectionDataSource("jdbc:sqlite:" + file, true);
        try {
            JdbcTemplate jdbc = new JdbcTemplate(ds);
            jdbc.execute("PRAGMA application_id = " + APPLICATION_ID);
            jdbc.execute("PRAGMA user_version = " + USER_VERSION);

            new TransactionTemplate(new DataSourceTransactionManager(ds))
                    .executeWithoutResult(status -> writeTables(jdbc, collection));
        } catch (DataAccessException e) {
            throw GeodataException.processingFailure("Error escribiendo GeoPackage: " + e.getMostSpecificCause().getMessage(), e);
        } finally {
            ds.destroy();
        }
        return Files.readAllBytes(file);
    }

    private void writeTables(JdbcTemplate jdbc, FeatureCollection collection) {
        createMetadataTables(jdbc);

        int srsId = -1;
        if (collection.hasCrs()) {
            srsId = crsRegistry.epsgCode(collection.getCrs());
            insertSrs(jdbc, collection.getCrs(), srsId);
        }

        Map<String, AttributeType> columns = new LinkedHashMap<>();
        for (String name : collection.attributeNames()) {
            columns.put(name, collection.columnType(name));
        }
        String pk = uniqueName("fid", columns.keySet());
        String geomColumn = uniqueName(GEOM_COLUMN, columns.keySet());

        StringBuilder ddl = new StringBuilder("CREATE TABLE ").append(quote(TABLE)).append(" (")
                .append(quote(pk)).append(" INTEGER PRIMARY KEY AUTOINCREMENT NOT NULL, ")
                .append(quote(geomColumn)).append(' ').append(geometryTypeName(collection));
        columns.forEach((name, type) -> ddl.append(", ").append(quote(name)).append(' ').append(sqlType(type)));
        jdbc.execute(ddl.append(')').toString());

        Envelope env = collection.envelope();
        jdbc.update("INSERT INTO gpkg_contents (table_name, data_type, identifier, min_x, min_y, max_x, max_y, srs_id) "
                        + "VALUES (?, 'features', ?, ?, ?, ?, ?, ?)",
                TABLE, TABLE, env.getMinX(), env.getMinY(), env.getMaxX(), env.getMaxY(), srsId);
        jdbc.update("INSERT INTO gpkg_geometry_columns (table_name, column_name, geometry_type_name, srs_id, z, m) "
                + "VALUES (?, ?, ?, ?, 0, 0)", TABLE, geomColumn, geometryTypeName(collection), srsId);

        List<String> names = new ArrayList<>(columns.keySet());
        String insert = "INSERT INTO " + quote(TABLE) + " (" + quote(geomColumn)
                + names.stream().map(n -> ", " + quote(n)).collect(Collectors.joining())
                + ") VALUES (?" + ", ?".repeat(names.size()) + ")";

        WKBWriter wkbWriter = new WKBWriter(2, ByteOrderValues.LITTLE_ENDIAN);
        List<Object[]> batch = new ArrayList<>(collection.size());
        for (Feature f : collection.getFeatures()) {
            Object[] row = new Object[names.size() + 1];
            row[0] = f.hasGeometry() ? encodeGeometry(f.getGeometry(), srsId, wkbWriter) : null;
            for (int i = 0; i < names.size(); i++) {
                row[i + 1] = columns.get(names.get(i)).coerce(f.getAttribute(names.get(i)));
            }
            batch.add(row);
        }
        jdbc.batchUpdate(insert, batch);
        log.debug("GeoPackage escrito: {} filas, srs_id={}", batch.size(), srsId);
    }

    private void createMetadataTables(JdbcTemplate jdbc) {
        jdbc.execute("CREATE TABLE gpkg_spatial_ref_sys (srs_name TEXT NOT NULL, srs_id INTEGER PRIMARY KEY, "
                + "organization TEXT NOT NULL, organization_coordsys_id INTEGER NOT NULL, "
                + "definition TEXT NOT NULL, description TEXT)");
        jdbc.execute("CREATE TABLE gpkg_contents (table_name TEXT NOT NULL PRIMARY KEY, data_type TEXT NOT NULL, "
                + "identifier TEXT UNIQUE, description TEXT DEFAULT '', "
                + "last_change DATETIME NOT NULL DEFAULT (strftime('%Y-%m-%dT%H:%M:%fZ','now')), "
                + "min_x DOUBLE, min_y DOUBLE, max_x DOUBLE, max_y DOUBLE, srs_id INTEGER, "
                + "CONSTRAINT fk_gc_r_srs_id FOREIGN KEY (srs_id) REFERENCES gpkg_spatial_ref_sys(srs_id))");
        jdbc.execute("CREATE TABLE gpkg_geometry_columns (table_name TEXT NOT NULL, column_name TEXT NOT NULL, "
                + "geometry_type_name TEXT NOT NULL, srs_id INTEGER NOT NULL, z TINYINT NOT NULL, m TINYINT NOT NULL, "
                + "CONSTRAINT pk_geom_cols PRIMARY KEY (table_name, column_name))");

        String insert = "INSERT OR IGNORE INTO gpkg_spatial_ref_sys "
                + "(srs_name, srs_id, organization, organization_coordsys_id, definition, description) VALUES (?, ?, ?, ?, ?, ?)";
        jdbc.update(insert, "Undefined cartesian SRS", -1, "NONE", -1, "undefined", "undefined cartesian coordinate reference system");
        jdbc.update(insert, "Undefined geographic SRS", 0, "NONE", 0, "undefined", "undefined geographic coordinate reference system");
        insertSrs(jdbc, CrsRegistry.WGS84, 4326);
    }

    private void insertSrs(JdbcTemplate jdbc, String crs, int code) {
        jdbc.update("INSERT OR IGNORE INTO gpkg_spatial_ref_sys "
                        + "(srs_name, srs_id, organization, organization_coordsys_id, definition) VALUES (?, ?, 'EPSG', ?, ?)",
                crs, code, code, crsWkt.toWkt(crs));
    }

    static byte[] encodeGeometry(Geometry geometry, int srsId, WKBWriter wkbWriter) {
        byte[] wkb = wkbWriter.write(geometry);
        byte flags = (byte) (geometry.isEmpty() ? 0x11 : 0x01); // little-endian, sin envelope
        return ByteBuffer.allocate(8 + wkb.length).order(ByteOrder.LITTLE_ENDIAN)
                .put((byte) 'G').put((byte) 'P').put((byte) 0).put(flags)
                .putInt(srsId)
                .put(wkb)
                .array();
    }

    // ============================================================
    // LECTURA
    // ============================================================
    @Override
    protected FeatureCollection readStaged(byte[] data, Path staging) throws IOException {
        Path file = staging.resolve("input.gpkg");
        Files.write(file, data);

        SingleConnectionDataSource ds = new SingleConnectionDataSource("jdbc:sqlite:" + file, true);
        try {
            return readTables(new JdbcTemplate(ds));
        } catch (DataAccessException e) {
            throw GeodataException.invalidParameter("GeoPackage inválido: " + e.getMostSpecificCause().getMessage(), e);
        } finally {
            ds.destroy();
        }
    }

    private FeatureCollection readTables(JdbcTemplate jdbc) {
        List<Map<String, Object>> contents = jdbc.queryForList(
                "SELECT table_name, srs_id FROM gpkg_contents WHERE data_type = 'features' LIMIT 1");
        if (contents.isEmpty()) {
            throw GeodataException.invalidParameter("El GeoPackage no contiene ninguna tabla de features.");
        }
        String table = (String) contents.get(0).get("table_name");
        String geomColumn = jdbc.queryForObject(
                "SELECT column_name FROM gpkg_geometry_columns WHERE table_name = ?", String.class, table);
        Number srsId = (Number) contents.get(0).get("srs_id");
        String crs = srsId == null ? null : resolveSrs(jdbc, srsId.intValue());

        Map<String, String> declaredTypes = new LinkedHashMap<>();
        jdbc.query("PRAGMA table_info(" + quote(table) + ")", (ResultSet rs) -> {
            String name = rs.getString("name");
            if (rs.getInt("pk") == 0 && !name.equals(geomColumn)) {
                declaredTypes.put(name, rs.getString("type").toUpperCase(Locale.ROOT));
            }
        });

        WKBReader wkbReader = new WKBReader(GeoJSONHelper.geometryFactory());
        List<Feature> features = jdbc.query("SELECT * FROM " + quote(table), (rs, rowNum) -> {
            Map<String, Object> attributes = new LinkedHashMap<>();
            for (Map.Entry<String, String> column : declaredTypes.entrySet()) {
                attributes.put(column.getKey(), readValue(rs, column.getKey(), column.getValue()));
            }
            byte[] blob = rs.getBytes(geomColumn);
            return Feature.of(attributes, blob == null ? null : decodeGeometry(blob, wkbReader));
        });

        log.debug("GeoPackage leído: tabla {}, {} filas, crs={}", table, features.size(), crs);
        return new FeatureCollection(features, crs);
    }

    private String resolveSrs(JdbcTemplate jdbc, int srsId) {
        if (srsId <= 0) {
            return null;
        }
        List<Map<String, Object>> rows = jdbc.queryForList(
                "SELECT organization, organization_coordsys_id, definition FROM gpkg_spatial_ref_sys WHERE srs_id = ?", srsId);
        if (rows.isEmpty()) {
            log.warn("srs_id {} no definido en gpkg_spatial_ref_sys", srsId);
            return null;
        }
        Map<String, Object> row = rows.get(0);
        if ("EPSG".equalsIgnoreCase(String.valueOf(row.get("organization")))) {
            return crsRegistry.canonicalize("EPSG:" + row.get("organization_coordsys_id"));
        }
        return crsWkt.fromWkt((String) row.get("definition"));
    }

    private static Object readValue(ResultSet rs, String column, String declaredType) throws SQLException {
        Object value = rs.getObject(column);
        if (value == null) return null;
        if (declaredType.startsWith("BOOL") && value instanceof Number n) {
            return n.intValue() != 0;
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float || value instanceof Double) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof byte[] bytes) {
            return Base64.getEncoder().encodeToString(bytes);
        }
        return value.toString();
    }

    static Geometry decodeGeometry(byte[] blob, WKBReader wkbReader) {
        if (blob.length < 8 || blob[0] != 'G' || blob[1] != 'P') {
            throw GeodataException.invalidParameter("Geometría GeoPackage inválida: cabecera GP ausente.");
        }
        int envelopeIndicator = (blob[3] >> 1) & 0x07;
        int envelopeSize;
        switch (envelopeIndicator) {
            case 0 -> envelopeSize = 0;
            case 1 -> envelopeSize = 32;
            case 2, 3 -> envelopeSize = 48;
            case 4 -> envelopeSize = 64;
            default -> throw GeodataException.invalidParameter("Indicador de envelope GeoPackage inválido: " + envelopeIndicator);
        }
        try {
            return wkbReader.read(Arrays.copyOfRange(blob, 8 + envelopeSize, blob.length));
        } catch (ParseException e) {
            throw GeodataException.invalidParameter("WKB inválido en GeoPackage: " + e.getMessage(), e);
        }
    }

    // ============================================================
    // HELPERS
    // ============================================================
    private static String geometryTypeName(FeatureCollection collection) {
        Set<String> types = collection.getFeatures().stream()
                .filter(Feature::hasGeometry)
                .map(f -> f.getGeometry().getGeometryType().toUpperCase(Locale.ROOT))
                .collect(Collectors.toSet());
        if (types.size() != 1) return "GEOMETRY";
        String type = types.iterator().next();
        return type.equals("LINEARRING") ? "LINESTRING" : type;
    }

    private static String sqlType(AttributeType type) {
        return switch (type) {
            case INTEGER -> "INTEGER";
            case REAL -> "REAL";
            case BOOLEAN -> "BOOLEAN";
            case STRING -> "TEXT";
        };
    }

    private static String uniqueName(String base, Set<String> taken) {
        String name = base;
        int i = 1;
        while (taken.contains(name)) {
            name = base + "_" + i++;
        }
        return name;
    }

    private static String quote(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }
}
