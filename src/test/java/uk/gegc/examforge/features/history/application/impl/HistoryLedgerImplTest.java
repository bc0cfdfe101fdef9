package uk.gegc.examforge.features.history.application.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import uk.gegc.examforge.BaseUnitTest;
import uk.gegc.examforge.features.history.domain.model.HistoryEntry;
import uk.gegc.examforge.features.history.domain.model.HistoryKind;
import uk.gegc.examforge.features.history.domain.model.HistoryStatus;
import uk.gegc.examforge.features.history.domain.repository.HistoryEntryRepository;
import uk.gegc.examforge.shared.exception.ResourceNotFoundException;
import uk.gegc.examforge.shared.exception.ValidationException;
import uk.gegc.examforge.support.TestPapers;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static uk.gegc.examforge.support.TestPapers.OWNER;

class HistoryLedgerImplTest extends BaseUnitTest {

    private static final Instant NOW = Instant.parse("2024-01-01T12:00:00Z");

    @Mock
    private HistoryEntryRepository historyEntryRepository;

    private HistoryLedgerImpl ledger;

    @BeforeEach
    void setUp() {
        ledger = new HistoryLedgerImpl(historyEntryRepository, new ObjectMapper().findAndRegisterModules()
                        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private HistoryEntry inProgress(UUID id) {
        HistoryEntry entry = new HistoryEntry();
        entry.setId(id);
        entry.setOwnerId(OWNER);
        entry.setKind(HistoryKind.GENERATION);
        entry.setStatus(HistoryStatus.IN_PROGRESS);
        entry.setCreatedAt(NOW);
        return entry;
    }

    @Test
    @DisplayName("open: stores an in-progress entry with the serialized request")
    void open_storesInProgressEntry() {
        UUID id = UUID.randomUUID();
        when(historyEntryRepository.save(any(HistoryEntry.class))).thenAnswer(inv -> {
            HistoryEntry entry = inv.getArgument(0);
            entry.setId(id);
            return entry;
        });

        UUID result = ledger.open(OWNER, HistoryKind.GENERATION, TestPapers.request(), "prompt", null, null);

        assertThat(result).isEqualTo(id);
        ArgumentCaptor<HistoryEntry> captor = ArgumentCaptor.forClass(HistoryEntry.class);
        verify(historyEntryRepository).save(captor.capture());
        HistoryEntry saved = captor.getValue();
        assertThat(saved.getStatus()).isEqualTo(HistoryStatus.IN_PROGRESS);
        assertThat(saved.getCreatedAt()).isEqualTo(NOW);
        assertThat(saved.getRequestParameters()).contains("\"subject\":\"Physics\"").contains("2024-06-01");
    }

    @Test
    @DisplayName("open: blank owner is rejected")
    void open_blankOwner_throws() {
        assertThatThrownBy(() -> ledger.open(" ", HistoryKind.GENERATION, null, "p", null, null))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("open: missing kind is rejected")
    void open_nullKind_throws() {
        assertThatThrownBy(() -> ledger.open(TestPapers.OWNER, null, null, "p", null, null))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("kind");
    }

    @Test
    @DisplayName("complete: in-progress entry becomes SUCCESS with the paper id")
    void complete_inProgress_succeeds() {
        UUID id = UUID.randomUUID();
        UUID paperId = UUID.randomUUID();
        HistoryEntry entry = inProgress(id);
        when(historyEntryRepository.findByIdAndStatus(id, HistoryStatus.IN_PROGRESS)).thenReturn(Optional.of(entry));
        when(historyEntryRepository.save(entry)).thenReturn(entry);

        HistoryEntry result = ledger.complete(id, paperId);

        assertThat(result.getStatus()).isEqualTo(HistoryStatus.SUCCESS);
        assertThat(result.getPaperId()).isEqualTo(paperId);
        assertThat(result.getCompletedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("fail: in-progress entry becomes FAILED with the message")
    void fail_inProgress_recordsMessage() {
        UUID id = UUID.randomUUID();
        HistoryEntry entry = inProgress(id);
        when(historyEntryRepository.findByIdAndStatus(id, HistoryStatus.IN_PROGRESS)).thenReturn(Optional.of(entry));
        when(historyEntryRepository.save(entry)).thenReturn(entry);

        HistoryEntry result = ledger.fail(id, "timed out");

        assertThat(result.getStatus()).isEqualTo(HistoryStatus.FAILED);
        assertThat(result.getErrorMessage()).isEqualTo("timed out");
        assertThat(result.getStatus().isTerminal()).isTrue();
    }

    @Test
    @DisplayName("complete: terminal entry cannot be completed again")
    void complete_terminal_notFound() {
        UUID id = UUID.randomUUID();
        when(historyEntryRepository.findByIdAndStatus(id, HistoryStatus.IN_PROGRESS)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> ledger.complete(id, UUID.randomUUID()))
                .isInstanceOf(ResourceNotFoundException.class);
        verify(historyEntryRepository, never()).save(any());
    }

    @Test
    @DisplayName("delete: entry of another owner is not found")
    void delete_otherOwner_notFound() {
        UUID id = UUID.randomUUID();
        when(historyEntryRepository.findByIdAndOwnerId(id, OWNER)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> ledger.delete(OWNER, id)).isInstanceOf(ResourceNotFoundException.class);
        verify(historyEntryRepository, never()).delete(any());
    }

    @Test
    @DisplayName("clearAll: returns the number of deleted entries")
    void clearAll_returnsCount() {
        when(historyEntryRepository.deleteAllByOwnerId(OWNER)).thenReturn(3);

        assertThat(ledger.clearAll(OWNER)).isEqualTo(3);
    }
}
