package ch.so.arp.recall.memory;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fixed retrieval parameters per exchange routine.
 */
public final class RetrievalPresets {

    static final List<String> DIALOGUE_PROPERTIES = List.of("timestamp", "role", "content");

    private static final Map<StrategySelector, SearchOptions> PRESETS = Map.of(
            StrategySelector.of(ResponseMode.SEMANTIC, RetrievalMode.HYBRID),
            SearchOptions.hybrid(10, 0.5d, DIALOGUE_PROPERTIES),
            StrategySelector.of(ResponseMode.SEMANTIC, RetrievalMode.NEAR_TEXT),
            SearchOptions.nearText(10, 0.85d),
            StrategySelector.of(ResponseMode.GENERATIVE, RetrievalMode.HYBRID),
            SearchOptions.hybrid(0, 0.3d, List.of()),
            StrategySelector.of(ResponseMode.GENERATIVE, RetrievalMode.NEAR_TEXT),
            SearchOptions.nearText(0, 0.72d));

    /** Transport exchanges search all properties of the message schema. */
    private static final SearchOptions TRANSPORT = SearchOptions.hybrid(10, 0.5d, List.of());

    private RetrievalPresets() {
    }

    public static Optional<SearchOptions> forSelector(StrategySelector selector) {
        return Optional.ofNullable(PRESETS.get(selector));
    }

    public static SearchOptions transport() {
        return TRANSPORT;
    }

    static Map<StrategySelector, SearchOptions> all() {
        return PRESETS;
    }
}
