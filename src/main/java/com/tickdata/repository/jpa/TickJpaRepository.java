package com.tickdata.repository.jpa;

import com.tickdata.entity.TickEntity;
import java.time.LocalDateTime;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the tbt table. Range bounds are [from, to).
 */
@Repository
public interface TickJpaRepository extends JpaRepository<TickEntity, Long> {

    @Query("SELECT t FROM TickEntity t WHERE t.timestamp >= :from AND t.timestamp < :to ORDER BY t.timestamp ASC")
    List<TickEntity> findInRange(@Param("from") LocalDateTime from, @Param("to") LocalDateTime to);

    @Query(
            "SELECT t FROM TickEntity t WHERE t.instrumentId = :instrumentId AND t.timestamp >= :from AND t.timestamp < :to ORDER BY t.timestamp ASC")
    List<TickEntity> findByInstrumentInRange(
            @Param("instrumentId") String instrumentId,
            @Param("from") LocalDateTime from,
            @Param("to") LocalDateTime to);
}
