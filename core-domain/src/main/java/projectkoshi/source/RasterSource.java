package projectkoshi.source;

import org.locationtech.jts.geom.Geometry;
import projectkoshi.domain.raster.RasterCollection;

import java.io.IOException;
import java.util.List;

/**
 * Colaborador externo que suministra colecciones de imágenes (archivo remoto, catálogo local...).
 * <p>
 * El núcleo de análisis no asume que la colección devuelta sea continua ni uniforme en el
 * tiempo, y trata un fallo de esta llamada para un periodo como un hueco de datos, no como
 * un error fatal del proceso.
 */
public interface RasterSource {

    /**
     * Recupera las imágenes de una fuente que cubren la geometría en el intervalo.
     *
     * @param bandSchema       Bandas requeridas, en orden.
     * @param boundingGeometry Geometría envolvente del área de estudio.
     * @param dateRange        Intervalo temporal {@code [start, end)}.
     * @param qualityFilter    Filtro de calidad que el proveedor puede aplicar en origen.
     * @return Colección (posiblemente vacía) con el esquema solicitado.
     * @throws IOException Si la fuente no está disponible o falla la descarga.
     */
    RasterCollection fetchCollection(List<String> bandSchema,
                                     Geometry boundingGeometry,
                                     DateRange dateRange,
                                     QualityFilter qualityFilter) throws IOException;
}
