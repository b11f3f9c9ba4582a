package org.openphc.insight.realtime.source;

import lombok.extern.slf4j.Slf4j;
import org.openphc.insight.realtime.config.RealtimeProperties;
import org.openphc.insight.realtime.domain.model.SourceCheckpoint;
import org.openphc.insight.realtime.domain.repository.SourceCheckpointRepository;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;

/**
 * Hands out strictly increasing sequence numbers. Blocks are reserved in
 * {@code source_checkpoint} ahead of use, so a restart skips the unused tail of a block
 * instead of reusing numbers.
 */
@Component
@Slf4j
public class SequenceAllocator {

    private final SourceCheckpointRepository repository;
    private final Clock clock;
    private final String sourceId;
    private final int blockSize;

    private SourceCheckpoint checkpoint;
    private long next;

    public SequenceAllocator(SourceCheckpointRepository repository, Clock clock, RealtimeProperties properties) {
        this.repository = repository;
        this.clock = clock;
        this.sourceId = properties.getSource().getSourceId();
        this.blockSize = properties.getSource().getSequenceBlockSize();
    }

    public synchronized void initialize() {
        checkpoint = repository.findById(sourceId).orElseGet(() -> SourceCheckpoint.builder()
                .sourceId(sourceId)
                .reservedThrough(0L)
                .updatedAt(OffsetDateTime.now(clock))
                .build());
        next = checkpoint.getReservedThrough() + 1;
        log.info("Sequence allocator for source '{}' resumes at {} (last position {})",
                sourceId, next, checkpoint.getLastPosition());
    }

    public synchronized long next() {
        ensureInitialized();
        if (next > checkpoint.getReservedThrough()) {
            long reserved = checkpoint.getReservedThrough();
            checkpoint.setReservedThrough(next + blockSize - 1);
            try {
                save();
            } catch (RuntimeException e) {
                checkpoint.setReservedThrough(reserved);
                throw e;
            }
            log.debug("Reserved sequences {}..{}", next, checkpoint.getReservedThrough());
        }
        return next++;
    }

    /** Highest sequence handed out so far; 0 before the first event. */
    public synchronized long lastAssigned() {
        ensureInitialized();
        return next - 1;
    }

    public synchronized String lastPosition() {
        ensureInitialized();
        return checkpoint.getLastPosition();
    }

    public synchronized void recordPosition(String position) {
        ensureInitialized();
        if (position == null || position.equals(checkpoint.getLastPosition())) {
            return;
        }
        String previous = checkpoint.getLastPosition();
        checkpoint.setLastPosition(position);
        try {
            save();
        } catch (RuntimeException e) {
            checkpoint.setLastPosition(previous);
            throw e;
        }
    }

    public String sourceId() {
        return sourceId;
    }

    private void save() {
        checkpoint.setUpdatedAt(OffsetDateTime.now(clock));
        checkpoint = repository.save(checkpoint);
    }

    private void ensureInitialized() {
        if (checkpoint == null) {
            throw new IllegalStateException("Sequence allocator not initialized");
        }
    }
}
