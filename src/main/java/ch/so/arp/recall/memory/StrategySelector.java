package ch.so.arp.recall.memory;

import java.util.Objects;
import java.util.Optional;

/**
 * Pair of response and retrieval mode addressing exactly one exchange routine.
 * Every combination of the two enums is a valid selector.
 */
public record StrategySelector(ResponseMode responseMode, RetrievalMode retrievalMode) {

    public StrategySelector {
        Objects.requireNonNull(responseMode, "responseMode");
        Objects.requireNonNull(retrievalMode, "retrievalMode");
    }

    public static StrategySelector of(ResponseMode responseMode, RetrievalMode retrievalMode) {
        return new StrategySelector(responseMode, retrievalMode);
    }

    /**
     * Parses the wire names used by callers, for example {@code ("semantic", "nearText")}.
     *
     * @return the selector, or empty when either name is unknown
     */
    public static Optional<StrategySelector> parse(String responseMode, String retrievalMode) {
        Optional<ResponseMode> response = ResponseMode.fromWireName(responseMode);
        Optional<RetrievalMode> retrieval = RetrievalMode.fromWireName(retrievalMode);
        if (response.isEmpty() || retrieval.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new StrategySelector(response.get(), retrieval.get()));
    }

    @Override
    public String toString() {
        return responseMode.wireName() + "/" + retrievalMode.wireName();
    }
}
