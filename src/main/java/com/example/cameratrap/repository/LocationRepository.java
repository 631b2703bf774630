package com.example.cameratrap.repository;

import com.example.cameratrap.domain.Location;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface LocationRepository extends JpaRepository<Location, Long> {

    Optional<Location> findByCameraId(String cameraId);
}
