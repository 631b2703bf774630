package com.example.cameratrap.repository;

import com.example.cameratrap.domain.Detection;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface DetectionRepository extends JpaRepository<Detection, Long> {

    @Query("select count(d) from Detection d where d.image.id = :imageId")
    long countByImageId(@Param("imageId") Long imageId);

    @Query("""
            select d from Detection d
              left join fetch d.species
             where d.image.id = :imageId
             order by d.detectorConfidence desc
            """)
    List<Detection> findByImageIdOrderByConfidence(@Param("imageId") Long imageId);

    @Query("select count(distinct d.species.id) from Detection d")
    long countDistinctSpecies();
}
