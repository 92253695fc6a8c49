package ch.so.arp.recall.memory;

import java.util.List;

/**
 * Outcome of a batch write. A batch with errors may still have persisted some
 * of its objects; {@link #insertedIds()} lists those.
 */
public record BatchInsertResult(boolean hasErrors, List<String> insertedIds) {

    public BatchInsertResult {
        insertedIds = List.copyOf(insertedIds);
    }
}
