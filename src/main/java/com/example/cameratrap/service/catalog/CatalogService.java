package com.example.cameratrap.service.catalog;

import com.example.cameratrap.domain.Location;
import com.example.cameratrap.domain.Species;
import com.example.cameratrap.model.LocationRegistration;
import com.example.cameratrap.model.SpeciesDefinition;
import com.example.cameratrap.model.SpeciesDefinition.Taxonomy;
import com.example.cameratrap.repository.LocationRepository;
import com.example.cameratrap.repository.SpeciesRepository;
import com.example.cameratrap.util.GeoValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.function.Consumer;

/**
 * Upserts catalog rows by natural key. Fields left null in a request keep their stored value, so
 * enriching a species stub never blanks what is already known.
 */
@Service
public class CatalogService {

    private static final Logger log = LoggerFactory.getLogger(CatalogService.class);

    private final SpeciesRepository speciesRepository;
    private final LocationRepository locationRepository;

    public CatalogService(SpeciesRepository speciesRepository, LocationRepository locationRepository) {
        this.speciesRepository = speciesRepository;
        this.locationRepository = locationRepository;
    }

    @Transactional
    public Species upsertSpecies(SpeciesDefinition definition) {
        if (definition.scientificName() == null || definition.scientificName().isBlank()) {
            throw new IllegalArgumentException("Scientific name is required");
        }
        String name = definition.scientificName().trim();
        Species species = speciesRepository.findByScientificName(name).orElseGet(() -> new Species(name));
        boolean created = species.getId() == null;

        apply(definition.commonName(), species::setCommonName);
        Taxonomy taxonomy = definition.taxonomy();
        if (taxonomy != null) {
            apply(taxonomy.kingdom(), species::setTaxonomyKingdom);
            apply(taxonomy.phylum(), species::setTaxonomyPhylum);
            apply(taxonomy.taxonomicClass(), species::setTaxonomyClass);
            apply(taxonomy.order(), species::setTaxonomyOrder);
            apply(taxonomy.family(), species::setTaxonomyFamily);
            apply(taxonomy.genus(), species::setTaxonomyGenus);
        }
        apply(definition.conservationStatus(), species::setConservationStatus);
        apply(definition.iucnId(), species::setIucnId);
        apply(definition.description(), species::setDescription);
        apply(definition.habitatNotes(), species::setHabitatNotes);
        apply(definition.behaviorNotes(), species::setBehaviorNotes);
        apply(definition.averageWeightKg(), species::setAverageWeightKg);
        apply(definition.averageLengthCm(), species::setAverageLengthCm);
        apply(definition.thumbnailUrl(), species::setThumbnailUrl);

        Species saved = speciesRepository.save(species);
        log.info("{} species '{}' (id {})", created ? "Created" : "Updated", name, saved.getId());
        return saved;
    }

    @Transactional
    public Location upsertLocation(LocationRegistration registration) {
        if (registration.cameraId() == null || registration.cameraId().isBlank()) {
            throw new IllegalArgumentException("Camera id is required");
        }
        if (registration.latitude() == null || registration.longitude() == null) {
            throw new IllegalArgumentException("Latitude and longitude are required");
        }
        GeoValidator.requireValidCoordinate(registration.latitude(), registration.longitude());
        String cameraId = registration.cameraId().trim();

        Location location = locationRepository.findByCameraId(cameraId)
                .orElseGet(() -> new Location(cameraId, registration.latitude(), registration.longitude()));
        boolean created = location.getId() == null;
        location.moveTo(registration.latitude(), registration.longitude());
        apply(registration.locationName(), location::setLocationName);
        apply(registration.altitude(), location::setAltitude);
        apply(registration.country(), location::setCountry);
        apply(registration.stateProvince(), location::setStateProvince);
        apply(registration.protectedArea(), location::setProtectedArea);
        apply(registration.habitatType(), location::setHabitatType);
        apply(registration.vegetationType(), location::setVegetationType);
        apply(registration.installationDate(), location::setInstallationDate);
        apply(registration.active(), location::setActive);
        apply(registration.notes(), location::setNotes);

        Location saved = locationRepository.save(location);
        log.info("{} location for camera {} at ({}, {})", created ? "Registered" : "Updated", cameraId,
                saved.getLatitude(), saved.getLongitude());
        return saved;
    }

    private static <T> void apply(T value, Consumer<T> setter) {
        if (value != null) {
            setter.accept(value);
        }
    }
}
