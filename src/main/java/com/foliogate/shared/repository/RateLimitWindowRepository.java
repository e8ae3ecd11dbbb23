package com.foliogate.shared.repository;

import com.foliogate.shared.model.RateLimitWindow;
import com.foliogate.shared.model.RateLimitWindowId;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

/**
 * Repository for rate limit windows with row-level locking.
 */
@Repository
public interface RateLimitWindowRepository extends JpaRepository<RateLimitWindow, RateLimitWindowId> {

    /**
     * Find and lock the window for a principal and operation class (SELECT ... FOR UPDATE).
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
        SELECT w
        FROM RateLimitWindow w
        WHERE w.principalId = :principalId
        AND w.operationClass = :operationClass
        """)
    Optional<RateLimitWindow> findForUpdate(
            @Param("principalId") String principalId,
            @Param("operationClass") String operationClass
    );

    /**
     * Delete windows that have not been touched since the cutoff (cleanup task).
     * @return number of rows deleted
     */
    @Modifying
    @Query("DELETE FROM RateLimitWindow w WHERE w.updatedAt < :before")
    int deleteIdleSince(@Param("before") Instant before);
}
