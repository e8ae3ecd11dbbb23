package com.foliogate.shared.repository;

import com.foliogate.shared.model.ShareLink;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for ShareLink entities.
 */
@Repository
public interface ShareLinkRepository extends JpaRepository<ShareLink, Long> {

    /**
     * Find a share link by its token.
     * @param token the share token
     * @return Optional containing the ShareLink if found
     */
    Optional<ShareLink> findByToken(String token);

    boolean existsByToken(String token);

    /**
     * Find the link currently holding a resource's slot, without locking.
     */
    Optional<ShareLink> findByActiveSlot(String activeSlot);

    /**
     * Find and row-lock the link currently holding a resource's slot.
     * Concurrent create/revoke calls for the same resource queue behind this lock.
     * @param activeSlot slot key from {@link ShareLink#slotKey}
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM ShareLink s WHERE s.activeSlot = :activeSlot")
    Optional<ShareLink> findByActiveSlotForUpdate(@Param("activeSlot") String activeSlot);
}
