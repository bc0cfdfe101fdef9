package uk.gegc.examforge.features.history.application.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.examforge.features.history.application.HistoryLedger;
import uk.gegc.examforge.features.history.domain.model.HistoryEntry;
import uk.gegc.examforge.features.history.domain.model.HistoryKind;
import uk.gegc.examforge.features.history.domain.model.HistoryStatus;
import uk.gegc.examforge.features.history.domain.repository.HistoryEntryRepository;
import uk.gegc.examforge.shared.exception.ResourceNotFoundException;
import uk.gegc.examforge.shared.exception.ValidationException;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
@Transactional
public class HistoryLedgerImpl implements HistoryLedger {

    private final HistoryEntryRepository historyEntryRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public UUID open(String ownerId, HistoryKind kind, Object requestParameters, String prompt,
                     String feedbackPrompt, UUID sourcePaperId) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new ValidationException("Owner id cannot be blank");
        }
        if (kind == null) {
            throw new ValidationException("History kind cannot be null");
        }

        HistoryEntry entry = new HistoryEntry();
        entry.setOwnerId(ownerId);
        entry.setKind(kind);
        entry.setStatus(HistoryStatus.IN_PROGRESS);
        entry.setRequestParameters(toJson(requestParameters));
        entry.setPrompt(prompt);
        entry.setFeedbackPrompt(feedbackPrompt);
        entry.setSourcePaperId(sourcePaperId);
        entry.setCreatedAt(Instant.now(clock));

        HistoryEntry saved = historyEntryRepository.save(entry);
        log.info("Opened {} history entry {} for owner {}", kind, saved.getId(), ownerId);
        return saved.getId();
    }

    @Override
    public HistoryEntry complete(UUID entryId, UUID paperId) {
        HistoryEntry entry = findOpen(entryId);
        entry.markSucceeded(paperId, Instant.now(clock));
        log.info("History entry {} succeeded with paper {}", entryId, paperId);
        return historyEntryRepository.save(entry);
    }

    @Override
    public HistoryEntry fail(UUID entryId, String errorMessage) {
        HistoryEntry entry = findOpen(entryId);
        entry.markFailed(errorMessage, Instant.now(clock));
        log.info("History entry {} failed: {}", entryId, errorMessage);
        return historyEntryRepository.save(entry);
    }

    @Override
    @Transactional(readOnly = true)
    public List<HistoryEntry> list(String ownerId) {
        return historyEntryRepository.findByOwnerIdOrderByCreatedAtDesc(ownerId);
    }

    @Override
    @Transactional(readOnly = true)
    public HistoryEntry get(String ownerId, UUID entryId) {
        return historyEntryRepository.findByIdAndOwnerId(entryId, ownerId)
                .orElseThrow(() -> new ResourceNotFoundException("History entry " + entryId + " not found"));
    }

    @Override
    public void delete(String ownerId, UUID entryId) {
        HistoryEntry entry = get(ownerId, entryId);
        historyEntryRepository.delete(entry);
        log.info("Deleted history entry {} for owner {}", entryId, ownerId);
    }

    @Override
    public int clearAll(String ownerId) {
        int deleted = historyEntryRepository.deleteAllByOwnerId(ownerId);
        log.info("Cleared {} history entries for owner {}", deleted, ownerId);
        return deleted;
    }

    private HistoryEntry findOpen(UUID entryId) {
        return historyEntryRepository.findByIdAndStatus(entryId, HistoryStatus.IN_PROGRESS)
                .orElseThrow(() -> new ResourceNotFoundException(
                        "No in-progress history entry with id " + entryId));
    }

    private String toJson(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Request parameters are not serializable", e);
        }
    }
}
