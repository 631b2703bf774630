package com.example.cameratrap.repository;

import com.example.cameratrap.domain.CameraImage;
import com.example.cameratrap.model.ProcessingStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Optional;

public interface CameraImageRepository extends JpaRepository<CameraImage, Long> {

    Optional<CameraImage> findByS3Key(String s3Key);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select i from CameraImage i where i.id = :id")
    Optional<CameraImage> findByIdForUpdate(@Param("id") Long id);

    /**
     * Moves an image into {@code processing} for one worker. Succeeds for a pending row, or for a
     * processing row whose previous claim is older than {@code staleBefore}.
     *
     * @return number of rows updated, 0 when another worker owns the image or it is terminal
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update CameraImage i
               set i.processingStatus = :processing,
                   i.claimToken = :token,
                   i.claimedAt = :now,
                   i.errorMessage = null
             where i.id = :id
               and (i.processingStatus = :pending
                    or (i.processingStatus = :processing and i.claimedAt < :staleBefore))
            """)
    int claim(@Param("id") Long id,
              @Param("token") String token,
              @Param("now") Instant now,
              @Param("staleBefore") Instant staleBefore,
              @Param("pending") ProcessingStatus pending,
              @Param("processing") ProcessingStatus processing);

    long countByProcessingStatus(ProcessingStatus status);

    @Query("select count(distinct i.location.id) from CameraImage i")
    long countDistinctLocations();
}
