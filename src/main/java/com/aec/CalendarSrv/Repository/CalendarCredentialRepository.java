package com.aec.CalendarSrv.Repository;

import com.aec.CalendarSrv.model.CalendarCredential;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface CalendarCredentialRepository extends JpaRepository<CalendarCredential, Long> {
    Optional<CalendarCredential> findByUserId(Long userId);

    @Modifying
    @Query("delete from CalendarCredential c where c.userId = :userId")
    int deleteByUserId(@Param("userId") Long userId);
}
