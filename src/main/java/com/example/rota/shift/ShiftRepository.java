package com.example.rota.shift;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;

@Repository
public interface ShiftRepository extends JpaRepository<Shift, Long> {

    Page<Shift> findByStatus(ShiftStatus status, Pageable pageable);

    Page<Shift> findByWorker_Id(Long workerId, Pageable pageable);

    Page<Shift> findByWorker_IdAndStatus(Long workerId, ShiftStatus status, Pageable pageable);

    long countByStatus(ShiftStatus status);

    long countByWorker_Id(Long workerId);

    long countByWorker_IdAndStatus(Long workerId, ShiftStatus status);

    /**
     * Status-gated clock-in write. Returns 0 when the shift is no longer in
     * {@code expected}, e.g. because a concurrent request already moved it on.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update Shift s set s.status = :target, s.clockInTime = :at, s.updatedAt = :at, s.version = s.version + 1 "
            + "where s.id = :id and s.status = :expected")
    int markClockedIn(@Param("id") Long id,
                      @Param("expected") ShiftStatus expected,
                      @Param("target") ShiftStatus target,
                      @Param("at") LocalDateTime at);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update Shift s set s.status = :target, s.clockOutTime = :at, s.updatedAt = :at, s.version = s.version + 1 "
            + "where s.id = :id and s.status = :expected")
    int markClockedOut(@Param("id") Long id,
                       @Param("expected") ShiftStatus expected,
                       @Param("target") ShiftStatus target,
                       @Param("at") LocalDateTime at);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update Shift s set s.status = :target, s.updatedAt = :at, s.version = s.version + 1 "
            + "where s.id = :id and s.status = :expected")
    int markCancelled(@Param("id") Long id,
                      @Param("expected") ShiftStatus expected,
                      @Param("target") ShiftStatus target,
                      @Param("at") LocalDateTime at);
}
