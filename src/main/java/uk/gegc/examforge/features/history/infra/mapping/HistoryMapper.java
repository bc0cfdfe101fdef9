package uk.gegc.examforge.features.history.infra.mapping;

import org.springframework.stereotype.Component;
import uk.gegc.examforge.features.history.api.dto.HistoryEntryDto;
import uk.gegc.examforge.features.history.domain.model.HistoryEntry;

@Component
public class HistoryMapper {

    public HistoryEntryDto toDto(HistoryEntry entry) {
        return new HistoryEntryDto(
                entry.getId(),
                entry.getKind(),
                entry.getStatus(),
                entry.getRequestParameters(),
                entry.getPrompt(),
                entry.getFeedbackPrompt(),
                entry.getSourcePaperId(),
                entry.getPaperId(),
                entry.getErrorMessage(),
                entry.getCreatedAt(),
                entry.getCompletedAt()
        );
    }
}
