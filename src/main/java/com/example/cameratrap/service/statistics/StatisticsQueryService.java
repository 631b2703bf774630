package com.example.cameratrap.service.statistics;

import com.example.cameratrap.domain.LocationStatistics;
import com.example.cameratrap.domain.SpeciesStatistics;
import com.example.cameratrap.model.ConservationStatus;
import com.example.cameratrap.model.OverviewStatistics;
import com.example.cameratrap.model.ProcessingStatus;
import com.example.cameratrap.repository.CameraImageRepository;
import com.example.cameratrap.repository.DetectionRepository;
import com.example.cameratrap.repository.LocationStatisticsRepository;
import com.example.cameratrap.repository.SpeciesStatisticsRepository;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@Transactional(readOnly = true)
public class StatisticsQueryService {

    private final SpeciesStatisticsRepository speciesStatistics;
    private final LocationStatisticsRepository locationStatistics;
    private final CameraImageRepository images;
    private final DetectionRepository detections;

    public StatisticsQueryService(SpeciesStatisticsRepository speciesStatistics,
                                  LocationStatisticsRepository locationStatistics,
                                  CameraImageRepository images,
                                  DetectionRepository detections) {
        this.speciesStatistics = speciesStatistics;
        this.locationStatistics = locationStatistics;
        this.images = images;
        this.detections = detections;
    }

    /**
     * Species with at least one detection, most detected first.
     */
    public List<SpeciesStatistics> species(ConservationStatus conservationStatus, int limit, int offset) {
        if (limit < 1 || offset < 0) {
            throw new IllegalArgumentException("limit must be positive and offset non-negative");
        }
        Pageable page = PageRequest.of(offset / limit, limit);
        if (conservationStatus == null) {
            return speciesStatistics.findByTotalDetectionsGreaterThanOrderByTotalDetectionsDesc(0, page);
        }
        return speciesStatistics.findByTotalDetectionsGreaterThanAndConservationStatusOrderByTotalDetectionsDesc(
                0, conservationStatus.name(), page);
    }

    public List<LocationStatistics> locations() {
        return locationStatistics.findAllByOrderByTotalDetectionsDesc();
    }

    public OverviewStatistics overview() {
        return new OverviewStatistics(
                images.count(),
                detections.count(),
                detections.countDistinctSpecies(),
                images.countDistinctLocations(),
                images.countByProcessingStatus(ProcessingStatus.COMPLETED),
                images.countByProcessingStatus(ProcessingStatus.PENDING));
    }
}
