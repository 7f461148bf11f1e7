package projectkoshi.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.MultiPolygon;
import org.locationtech.jts.geom.Polygon;
import projectkoshi.domain.vector.GlacierOutline;
import projectkoshi.domain.vector.MaskPolygon;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Exporta polígonos como GeoJSON {@code FeatureCollection}.
 * <p>
 * Los polígonos de máscara llevan las propiedades {@code id} (componente) y {@code count}
 * (píxeles); los contornos glaciares sólo {@code id}.
 */
@Slf4j
public class GeoJsonPolygonWriter {

    private final ObjectMapper mapper = JsonFileHandler.getObjectMapper();

    public ObjectNode toFeatureCollection(List<MaskPolygon> polygons) {
        ObjectNode collection = mapper.createObjectNode();
        collection.put("type", "FeatureCollection");
        ArrayNode features = collection.putArray("features");
        for (MaskPolygon polygon : polygons) {
            ObjectNode feature = features.addObject();
            feature.put("type", "Feature");
            feature.set("geometry", toGeometry(polygon.geometry()));
            ObjectNode properties = feature.putObject("properties");
            properties.put("id", polygon.componentId());
            properties.put("count", polygon.pixelCount());
        }
        return collection;
    }

    public ObjectNode glaciersToFeatureCollection(List<GlacierOutline> glaciers) {
        ObjectNode collection = mapper.createObjectNode();
        collection.put("type", "FeatureCollection");
        ArrayNode features = collection.putArray("features");
        for (GlacierOutline glacier : glaciers) {
            ObjectNode feature = features.addObject();
            feature.put("type", "Feature");
            feature.set("geometry", toGeometry(glacier.geometry()));
            feature.putObject("properties").put("id", glacier.id());
        }
        return collection;
    }

    public void writeToFile(List<MaskPolygon> polygons, Path path) throws IOException {
        log.info("Exportando {} polígonos a GeoJSON: {}", polygons.size(), path.toAbsolutePath());
        write(toFeatureCollection(polygons), path);
    }

    public void writeGlaciersToFile(List<GlacierOutline> glaciers, Path path) throws IOException {
        log.info("Exportando {} contornos glaciares a GeoJSON: {}", glaciers.size(), path.toAbsolutePath());
        write(glaciersToFeatureCollection(glaciers), path);
    }

    private void write(ObjectNode collection, Path path) throws IOException {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            mapper.writeValue(path.toFile(), collection);
        } catch (IOException e) {
            log.error("Error al escribir el GeoJSON en {}", path.toAbsolutePath(), e);
            throw e;
        }
    }

    ObjectNode toGeometry(Geometry geometry) {
        ObjectNode node = mapper.createObjectNode();
        if (geometry instanceof Polygon polygon) {
            node.put("type", "Polygon");
            writeRings(polygon, node.putArray("coordinates"));
        } else if (geometry instanceof MultiPolygon multi) {
            node.put("type", "MultiPolygon");
            ArrayNode coordinates = node.putArray("coordinates");
            for (int i = 0; i < multi.getNumGeometries(); i++) {
                writeRings((Polygon) multi.getGeometryN(i), coordinates.addArray());
            }
        } else {
            throw new IllegalArgumentException("Tipo de geometría no soportado: " + geometry.getGeometryType());
        }
        return node;
    }

    private void writeRings(Polygon polygon, ArrayNode rings) {
        writeRing(polygon.getExteriorRing(), rings.addArray());
        for (int i = 0; i < polygon.getNumInteriorRing(); i++) {
            writeRing(polygon.getInteriorRingN(i), rings.addArray());
        }
    }

    private void writeRing(LineString ring, ArrayNode positions) {
        for (Coordinate c : ring.getCoordinates()) {
            ArrayNode position = positions.addArray();
            position.add(c.getX());
            position.add(c.getY());
        }
    }
}
