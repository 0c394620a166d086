package com.ogt.geodata.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    public static final String TAG_GEOPROCESSING = "Geoprocesamiento";
    public static final String TAG_CACHE = "Caché de resultados";

    @Bean
    public OpenAPI geodataOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Geodata Service API")
                        .description("Conversión de formatos (geojson, kml, gpkg, shapefile), reproyección, "
                                + "operaciones geométricas y caché de resultados voluminosos.")
                        .version("1.0"))
                .addTagsItem(new Tag().name(TAG_GEOPROCESSING)
                        .description("Los formatos binarios (gpkg, shapefile) viajan en base64."))
                .addTagsItem(new Tag().name(TAG_CACHE)
                        .description("Entradas con TTL de 24 h; los resultados completos solo se obtienen exportando."));
    }
}
