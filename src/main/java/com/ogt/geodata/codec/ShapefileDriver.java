package com.ogt.geodata.codec;

import com.linuxense.javadbf.DBFDataType;
import com.linuxense.javadbf.DBFException;
import com.linuxense.javadbf.DBFField;
import com.linuxense.javadbf.DBFReader;
import com.linuxense.javadbf.DBFWriter;
import com.ogt.geodata.crs.CrsWkt;
import com.ogt.geodata.exception.GeodataException;
import com.ogt.geodata.model.AttributeType;
import com.ogt.geodata.model.Feature;
import com.ogt.geodata.model.FeatureCollection;
import com.ogt.geodata.util.GeoJSONHelper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Geometry;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.math.BigDecimal;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipInputStream;
import java.util.zip.ZipOutputStream;

/**
 * ESRI Shapefile empaquetado en zip (.shp/.shx/.dbf/.prj/.cpg).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ShapefileDriver extends BinaryFormatDriver {

    static final int DBF_NAME_LENGTH = 10;
    private static final String BASENAME = "output";

    private final CrsWkt crsWkt;

    @Override
    public GeodataFormat format() {
        return GeodataFormat.SHAPEFILE;
    }

    // ============================================================
    // LECTURA
    // ============================================================
    @Override
    protected FeatureCollection readStaged(byte[] data, Path staging) throws IOException {
        List<Path> extracted = unzip(data, staging);
        Path shp = extracted.stream()
                .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".shp"))
                .findFirst()
                .orElseThrow(() -> GeodataException.invalidParameter("El zip no contiene ningún fichero .shp"));

        Path dbf = sibling(extracted, shp, "dbf");
        Path prj = sibling(extracted, shp, "prj");
        Path cpg = sibling(extracted, shp, "cpg");

        List<Geometry> geometries = ShpGeometryCodec.read(Files.readAllBytes(shp), GeoJSONHelper.geometryFactory());
        List<Map<String, Object>> rows = dbf != null ? readDbf(dbf, charsetOf(cpg)) : List.of();
        if (dbf != null && rows.size() != geometries.size()) {
            log.warn("⚠️ .dbf con {} registros y .shp con {} shapes", rows.size(), geometries.size());
        }

        List<Feature> features = new ArrayList<>(geometries.size());
        for (int i = 0; i < geometries.size(); i++) {
            Map<String, Object> attributes = i < rows.size() ? rows.get(i) : Map.of();
            features.add(Feature.of(attributes, geometries.get(i)));
        }

        String crs = prj != null ? crsWkt.fromWkt(Files.readString(prj, StandardCharsets.ISO_8859_1)) : null;
        log.debug("Shapefile leído: {} ({} features, crs={})", shp.getFileName(), features.size(), crs);
        return new FeatureCollection(features, crs);
    }

    private List<Path> unzip(byte[] data, Path staging) throws IOException {
        List<Path> files = new ArrayList<>();
        try (ZipInputStream zis = new ZipInputStream(new ByteArrayInputStream(data))) {
            ZipEntry entry;
            while ((entry = zis.getNextEntry()) != null) {
                if (entry.isDirectory()) continue;
                // se aplana la estructura: solo el nombre del fichero
                String name = Path.of(entry.getName().replace('\\', '/')).getFileName().toString();
                Path target = staging.resolve(name);
                Files.copy(zis, target, StandardCopyOption.REPLACE_EXISTING);
                files.add(target);
            }
        } catch (ZipException e) {
            throw GeodataException.invalidParameter("Zip de shapefile inválido: " + e.getMessage(), e);
        }
        return files;
    }

    private static Path sibling(List<Path> files, Path shp, String extension) {
        String name = shp.getFileName().toString();
        String base = name.substring(0, name.length() - 4);
        for (Path p : files) {
            String candidate = p.getFileName().toString();
            if (candidate.equalsIgnoreCase(base + "." + extension)) {
                return p;
            }
        }
        return null;
    }

    private static Charset charsetOf(Path cpg) throws IOException {
        if (cpg == null) {
            return StandardCharsets.ISO_8859_1;
        }
        String declared = Files.readString(cpg, StandardCharsets.US_ASCII).trim();
        if (declared.equals("65001")) {
            return StandardCharsets.UTF_8;
        }
        try {
            return Charset.forName(declared);
        } catch (IllegalArgumentException e) {
            log.warn("Codificación .cpg desconocida « {} », se usa ISO-8859-1", declared);
            return StandardCharsets.ISO_8859_1;
        }
    }

    private List<Map<String, Object>> readDbf(Path dbf, Charset charset) throws IOException {
        List<Map<String, Object>> rows = new ArrayList<>();
        try (InputStream in = Files.newInputStream(dbf)) {
            DBFReader reader = new DBFReader(in, charset);
            int count = reader.getFieldCount();
            DBFField[] fields = new DBFField[count];
            for (int i = 0; i < count; i++) {
                fields[i] = reader.getField(i);
            }
            Object[] record;
            while ((record = reader.nextRecord()) != null) {
                Map<String, Object> row = new LinkedHashMap<>();
                for (int i = 0; i < count; i++) {
                    row.put(fields[i].getName(), dbfValue(record[i], fields[i]));
                }
                rows.add(row);
            }
        } catch (DBFException e) {
            throw GeodataException.invalidParameter("Fichero .dbf inválido: " + e.getMessage(), e);
        }
        return rows;
    }

    private static Object dbfValue(Object value, DBFField field) {
        if (value == null) return null;
        if (value instanceof BigDecimal decimal) {
            if (field.getDecimalCount() == 0) {
                try {
                    return decimal.longValueExact();
                } catch (ArithmeticException e) {
                    return decimal.doubleValue();
                }
            }
            return decimal.doubleValue();
        }
        if (value instanceof Integer || value instanceof Long) {
            return ((Number) value).longValue();
        }
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof Boolean) {
            return value;
        }
        if (value instanceof Date date) {
            return date.toInstant().atZone(ZoneId.systemDefault()).toLocalDate().toString();
        }
        return value.toString();
    }

    // ============================================================
    // ESCRITURA
    // ============================================================
    @Override
    protected byte[] writeStaged(FeatureCollection collection, Path staging) throws IOException {
        List<Geometry> geometries = new ArrayList<>(collection.size());
        for (Feature f : collection.getFeatures()) {
            geometries.add(f.getGeometry());
        }
        int shapeType = ShpGeometryCodec.shapeTypeOf(geometries);
        ShpGeometryCodec.Output shapes = ShpGeometryCodec.write(geometries, shapeType);

        List<Path> files = new ArrayList<>();
        files.add(Files.write(staging.resolve(BASENAME + ".shp"), shapes.getShp()));
        files.add(Files.write(staging.resolve(BASENAME + ".shx"), shapes.getShx()));
        files.add(writeDbf(collection, staging.resolve(BASENAME + ".dbf")));
        if (collection.hasCrs()) {
            files.add(Files.writeString(staging.resolve(BASENAME + ".prj"), crsWkt.toWkt(collection.getCrs()),
                    StandardCharsets.ISO_8859_1));
        }
        files.add(Files.writeString(staging.resolve(BASENAME + ".cpg"), "UTF-8", StandardCharsets.US_ASCII));

        ByteArrayOutputStream zipped = new ByteArrayOutputStream();
        try (ZipOutputStream zos = new ZipOutputStream(zipped)) {
            for (Path file : files) {
                zos.putNextEntry(new ZipEntry(file.getFileName().toString()));
                Files.copy(file, zos);
                zos.closeEntry();
            }
        }
        return zipped.toByteArray();
    }

    private Path writeDbf(FeatureCollection collection, Path dbf) throws IOException {
        List<String> names = new ArrayList<>(collection.attributeNames());
        Map<String, String> dbfNames = dbfFieldNames(names);

        List<DBFField> fields = new ArrayList<>();
        List<AttributeType> types = new ArrayList<>();
        for (String name : names) {
            AttributeType type = collection.columnType(name);
            fields.add(dbfField(dbfNames.get(name), type));
            types.add(type);
        }
        boolean syntheticId = fields.isEmpty();
        if (syntheticId) {
            // un .dbf necesita al menos un campo
            fields.add(new DBFField("FID", DBFDataType.NUMERIC, 18, 0));
        }

        try (OutputStream out = Files.newOutputStream(dbf)) {
            DBFWriter writer = new DBFWriter(out, StandardCharsets.UTF_8);
            writer.setFields(fields.toArray(new DBFField[0]));
            int index = 0;
            for (Feature f : collection.getFeatures()) {
                Object[] record = new Object[fields.size()];
                if (syntheticId) {
                    record[0] = (long) index;
                } else {
                    for (int i = 0; i < names.size(); i++) {
                        record[i] = types.get(i).coerce(f.getAttribute(names.get(i)));
                    }
                }
                writer.addRecord(record);
                index++;
            }
            writer.close();
        } catch (DBFException e) {
            throw GeodataException.processingFailure("Error escribiendo .dbf: " + e.getMessage(), e);
        }
        return dbf;
    }

    private static DBFField dbfField(String name, AttributeType type) {
        return switch (type) {
            case INTEGER -> new DBFField(name, DBFDataType.NUMERIC, 18, 0);
            case REAL -> new DBFField(name, DBFDataType.NUMERIC, 24, 15);
            case BOOLEAN -> new DBFField(name, DBFDataType.LOGICAL);
            case STRING -> new DBFField(name, DBFDataType.CHARACTER, 254);
        };
    }

    /**
     * Nombres de campo DBF: máximo 10 caracteres y únicos (sin distinguir mayúsculas).
     */
    static Map<String, String> dbfFieldNames(Collection<String> names) {
        Map<String, String> out = new LinkedHashMap<>();
        Set<String> used = new HashSet<>();
        for (String name : names) {
            String candidate = name.length() > DBF_NAME_LENGTH ? name.substring(0, DBF_NAME_LENGTH) : name;
            int i = 1;
            while (used.contains(candidate.toUpperCase(Locale.ROOT))) {
                String suffix = "_" + i++;
                candidate = name.substring(0, Math.min(name.length(), DBF_NAME_LENGTH - suffix.length())) + suffix;
            }
            if (!candidate.equals(name)) {
                log.warn("⚠️ Campo « {} » renombrado a « {} » (límite DBF de {} caracteres)", name, candidate, DBF_NAME_LENGTH);
            }
            used.add(candidate.toUpperCase(Locale.ROOT));
            out.put(name, candidate);
        }
        return out;
    }
}
