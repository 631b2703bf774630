package com.example.cameratrap.repository;

import com.example.cameratrap.domain.SpeciesStatistics;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface SpeciesStatisticsRepository extends JpaRepository<SpeciesStatistics, Long> {

    List<SpeciesStatistics> findByTotalDetectionsGreaterThanOrderByTotalDetectionsDesc(long minimum, Pageable pageable);

    List<SpeciesStatistics> findByTotalDetectionsGreaterThanAndConservationStatusOrderByTotalDetectionsDesc(
            long minimum, String conservationStatus, Pageable pageable);
}
