package com.example.cameratrap.repository;

import com.example.cameratrap.domain.Species;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface SpeciesRepository extends JpaRepository<Species, Long> {

    Optional<Species> findByScientificName(String scientificName);
}
