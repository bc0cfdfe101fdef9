package uk.gegc.examforge.features.paper.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.examforge.features.paper.domain.model.Paper;
import uk.gegc.examforge.features.paper.domain.model.PaperStatus;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PaperRepository extends JpaRepository<Paper, UUID> {

    Optional<Paper> findByIdAndOwnerId(UUID id, String ownerId);

    List<Paper> findByOwnerIdOrderByCreatedAtDesc(String ownerId);

    List<Paper> findByOwnerIdAndStatusOrderByCreatedAtDesc(String ownerId, PaperStatus status);

    /**
     * Case-insensitive substring match on subject and department. A null filter matches everything.
     */
    @Query("""
            SELECT p FROM Paper p
            WHERE p.ownerId = :ownerId
              AND p.status = :status
              AND (:subject IS NULL OR LOWER(p.subject) LIKE LOWER(CONCAT('%', :subject, '%')))
              AND (:department IS NULL OR LOWER(p.department) LIKE LOWER(CONCAT('%', :department, '%')))
            ORDER BY p.createdAt DESC
            """)
    List<Paper> search(@Param("ownerId") String ownerId,
                       @Param("status") PaperStatus status,
                       @Param("subject") String subject,
                       @Param("department") String department);

    @Query("""
            SELECT DISTINCT p.subject FROM Paper p
            WHERE p.ownerId = :ownerId AND p.status = :status
            ORDER BY p.subject
            """)
    List<String> findDistinctSubjects(@Param("ownerId") String ownerId, @Param("status") PaperStatus status);
}
