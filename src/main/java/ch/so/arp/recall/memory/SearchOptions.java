package ch.so.arp.recall.memory;

import java.util.List;
import java.util.Objects;

/**
 * Immutable retrieval parameters for one query against a collection.
 *
 * @param mode            hybrid or pure vector search
 * @param limit           maximum number of objects, {@code 0} for no cap
 * @param alpha           keyword/vector weighting of hybrid search, {@code null} for near text
 * @param certainty       similarity threshold of near text search, {@code null} for hybrid
 * @param queryProperties properties searched by the keyword part, empty for all
 * @param fusionType      fusion of keyword and vector ranking for hybrid search
 */
public record SearchOptions(RetrievalMode mode, int limit, Double alpha, Double certainty,
        List<String> queryProperties, FusionType fusionType) {

    public SearchOptions {
        Objects.requireNonNull(mode, "mode");
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative");
        }
        queryProperties = List.copyOf(queryProperties);
    }

    public static SearchOptions hybrid(int limit, double alpha, List<String> queryProperties) {
        return new SearchOptions(RetrievalMode.HYBRID, limit, alpha, null, queryProperties, FusionType.RANKED);
    }

    public static SearchOptions nearText(int limit, double certainty) {
        return new SearchOptions(RetrievalMode.NEAR_TEXT, limit, null, certainty, List.of(), null);
    }

    public boolean unlimited() {
        return limit == 0;
    }

    /**
     * Fusion algorithms of hybrid search, named as the store's query language
     * expects them.
     */
    public enum FusionType {

        RANKED("rankedFusion"),
        RELATIVE_SCORE("relativeScoreFusion");

        private final String queryValue;

        FusionType(String queryValue) {
            this.queryValue = queryValue;
        }

        public String queryValue() {
            return queryValue;
        }
    }
}
