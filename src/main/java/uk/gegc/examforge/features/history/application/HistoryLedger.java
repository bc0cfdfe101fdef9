package uk.gegc.examforge.features.history.application;

import uk.gegc.examforge.features.history.domain.model.HistoryEntry;
import uk.gegc.examforge.features.history.domain.model.HistoryKind;

import java.util.List;
import java.util.UUID;

/**
 * Append-only record of generation attempts. Entries move from IN_PROGRESS to exactly one terminal
 * status and are never touched again except to be deleted.
 */
public interface HistoryLedger {

    /**
     * Opens an IN_PROGRESS entry.
     *
     * @param requestParameters serialized to JSON as-is
     * @return the new entry id
     */
    UUID open(String ownerId, HistoryKind kind, Object requestParameters, String prompt,
              String feedbackPrompt, UUID sourcePaperId);

    /**
     * @throws uk.gegc.examforge.shared.exception.ResourceNotFoundException if the entry does not
     *                                                                      exist or is already terminal
     */
    HistoryEntry complete(UUID entryId, UUID paperId);

    /**
     * @throws uk.gegc.examforge.shared.exception.ResourceNotFoundException if the entry does not
     *                                                                      exist or is already terminal
     */
    HistoryEntry fail(UUID entryId, String errorMessage);

    List<HistoryEntry> list(String ownerId);

    HistoryEntry get(String ownerId, UUID entryId);

    void delete(String ownerId, UUID entryId);

    int clearAll(String ownerId);
}
