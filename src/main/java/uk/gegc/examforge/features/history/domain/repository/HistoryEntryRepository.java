package uk.gegc.examforge.features.history.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.examforge.features.history.domain.model.HistoryEntry;
import uk.gegc.examforge.features.history.domain.model.HistoryStatus;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface HistoryEntryRepository extends JpaRepository<HistoryEntry, UUID> {

    List<HistoryEntry> findByOwnerIdOrderByCreatedAtDesc(String ownerId);

    Optional<HistoryEntry> findByIdAndOwnerId(UUID id, String ownerId);

    Optional<HistoryEntry> findByIdAndStatus(UUID id, HistoryStatus status);

    @Modifying
    @Query("DELETE FROM HistoryEntry h WHERE h.ownerId = :ownerId")
    int deleteAllByOwnerId(@Param("ownerId") String ownerId);
}
