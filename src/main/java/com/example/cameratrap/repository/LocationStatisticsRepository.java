package com.example.cameratrap.repository;

import com.example.cameratrap.domain.LocationStatistics;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface LocationStatisticsRepository extends JpaRepository<LocationStatistics, Long> {

    List<LocationStatistics> findAllByOrderByTotalDetectionsDesc();
}
