package ch.so.arp.recall.memory;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Selects and runs the exchange routine for a {@link StrategySelector}. The
 * retrieval parameters come from a preset table, the composition from the
 * composer registered for the response mode.
 */
public class RetrievalDispatcher {

    private static final Logger LOGGER = LoggerFactory.getLogger(RetrievalDispatcher.class);

    private final Map<StrategySelector, SearchOptions> presets;
    private final Map<ResponseMode, ResponseComposer> composers = new EnumMap<>(ResponseMode.class);

    RetrievalDispatcher(Collection<? extends ResponseComposer> composers) {
        this(RetrievalPresets.all(), composers);
    }

    RetrievalDispatcher(Map<StrategySelector, SearchOptions> presets,
            Collection<? extends ResponseComposer> composers) {
        this.presets = Map.copyOf(presets);
        composers.forEach(composer -> this.composers.put(composer.mode(), composer));
    }

    /**
     * Run the routine addressed by the selector.
     *
     * @throws ExchangeException of kind {@link ErrorKind#DISPATCH} when no routine
     *                           is registered for the selector
     */
    public String run(CollectionHandle collection, StrategySelector selector, String query, String prompt) {
        Objects.requireNonNull(collection, "collection");
        Objects.requireNonNull(query, "query");
        SearchOptions options = selector == null ? null : presets.get(selector);
        ResponseComposer composer = selector == null ? null : composers.get(selector.responseMode());
        if (options == null || composer == null) {
            throw new ExchangeException(ErrorKind.DISPATCH, "No exchange routine for " + selector);
        }
        LOGGER.debug("Dispatching {} on {}", selector, collection.name());
        return composer.compose(collection, query, options, prompt);
    }
}
