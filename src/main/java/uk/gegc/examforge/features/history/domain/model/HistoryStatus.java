package uk.gegc.examforge.features.history.domain.model;

public enum HistoryStatus {
    IN_PROGRESS,
    SUCCESS,
    FAILED;

    public boolean isTerminal() {
        return this != IN_PROGRESS;
    }
}
