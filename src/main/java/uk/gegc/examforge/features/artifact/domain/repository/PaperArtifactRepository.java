package uk.gegc.examforge.features.artifact.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.examforge.features.artifact.domain.model.PaperArtifact;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface PaperArtifactRepository extends JpaRepository<PaperArtifact, UUID> {

    Optional<PaperArtifact> findByIdAndOwnerId(UUID id, String ownerId);

    long countByPaperId(UUID paperId);

    @Modifying
    @Query("DELETE FROM PaperArtifact a WHERE a.paperId = :paperId")
    int deleteAllByPaperId(@Param("paperId") UUID paperId);
}
