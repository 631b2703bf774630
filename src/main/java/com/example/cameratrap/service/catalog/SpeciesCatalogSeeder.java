package com.example.cameratrap.service.catalog;

import com.example.cameratrap.config.PipelineProperties;
import com.example.cameratrap.model.SpeciesDefinition;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.InputStream;
import java.util.List;

/**
 * Loads the species catalog from a JSON resource at startup. Enabled with
 * {@code camera-trap.catalog.seed-enabled=true}.
 */
@Component
@ConditionalOnProperty(prefix = "camera-trap.catalog", name = "seed-enabled", havingValue = "true")
public class SpeciesCatalogSeeder implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(SpeciesCatalogSeeder.class);

    private final CatalogService catalogService;
    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;
    private final PipelineProperties properties;

    public SpeciesCatalogSeeder(CatalogService catalogService,
                                ResourceLoader resourceLoader,
                                ObjectMapper objectMapper,
                                PipelineProperties properties) {
        this.catalogService = catalogService;
        this.resourceLoader = resourceLoader;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        String location = properties.catalog().seedResource();
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.warn("Species seed resource {} not found, skipping", location);
            return;
        }
        List<SpeciesDefinition> definitions;
        try (InputStream input = resource.getInputStream()) {
            definitions = objectMapper.readValue(input, new TypeReference<List<SpeciesDefinition>>() {
            });
        }
        definitions.forEach(catalogService::upsertSpecies);
        log.info("Seeded {} species from {}", definitions.size(), location);
    }
}
