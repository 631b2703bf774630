package com.example.cameratrap.controller;

import com.example.cameratrap.domain.Location;
import com.example.cameratrap.domain.Species;
import com.example.cameratrap.model.CatalogEntryResponse;
import com.example.cameratrap.model.LocationRegistration;
import com.example.cameratrap.model.SpeciesDefinition;
import com.example.cameratrap.service.catalog.CatalogService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/catalog")
@Tag(name = "Catalog", description = "Species and camera location catalog")
public class CatalogController {

    private final CatalogService catalogService;

    public CatalogController(CatalogService catalogService) {
        this.catalogService = catalogService;
    }

    @PutMapping("/species")
    @Operation(summary = "Create or update a species by scientific name")
    public ResponseEntity<CatalogEntryResponse> upsertSpecies(@Valid @RequestBody SpeciesDefinition definition) {
        Species species = catalogService.upsertSpecies(definition);
        return ResponseEntity.ok(new CatalogEntryResponse(species.getId(), species.getScientificName()));
    }

    @PutMapping("/locations")
    @Operation(summary = "Register or move a camera location by camera id")
    public ResponseEntity<CatalogEntryResponse> upsertLocation(@Valid @RequestBody LocationRegistration registration) {
        Location location = catalogService.upsertLocation(registration);
        return ResponseEntity.ok(new CatalogEntryResponse(location.getId(), location.getCameraId()));
    }
}
