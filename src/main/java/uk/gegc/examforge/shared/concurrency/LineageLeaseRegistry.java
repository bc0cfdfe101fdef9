package uk.gegc.examforge.shared.concurrency;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.examforge.shared.exception.ConflictException;

import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * In-process exclusive lease per paper lineage. A second mutating call on a lineage that is already
 * leased fails fast instead of queueing behind the first.
 */
@Slf4j
@Component
public class LineageLeaseRegistry {

    private final Set<UUID> leased = ConcurrentHashMap.newKeySet();

    public boolean tryAcquire(UUID lineageId) {
        return leased.add(lineageId);
    }

    public void release(UUID lineageId) {
        leased.remove(lineageId);
    }

    public boolean isLeased(UUID lineageId) {
        return leased.contains(lineageId);
    }

    /**
     * Runs {@code action} while holding the lease for {@code lineageId}.
     *
     * @throws ConflictException if another call already holds the lease
     */
    public <T> T runExclusive(UUID lineageId, Supplier<T> action) {
        if (!tryAcquire(lineageId)) {
            log.warn("Paper {} is busy with another operation", lineageId);
            throw new ConflictException("Paper " + lineageId + " is being modified by another request");
        }
        try {
            return action.get();
        } finally {
            release(lineageId);
        }
    }

    public void runExclusive(UUID lineageId, Runnable action) {
        runExclusive(lineageId, () -> {
            action.run();
            return null;
        });
    }
}
