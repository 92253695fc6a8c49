package ch.so.arp.recall.memory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lightweight replacement for the remote vector store. Collections live in
 * memory and are shared by every session opened from the same instance, the
 * way a remote cluster is shared by all clients. Relevance is approximated
 * with {@link TokenOverlapScorer}.
 */
class InMemoryVectorStore implements VectorStoreSessionFactory {

    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryVectorStore.class);

    private final Map<String, InMemoryCollection> collections = new ConcurrentHashMap<>();

    @Override
    public VectorStoreSession open(ProviderCredentials credentials) {
        LOGGER.debug("Opening in-memory session for {}", credentials.modelProvider());
        return new Session();
    }

    private final class Session implements VectorStoreSession {

        @Override
        public boolean isReady() {
            return true;
        }

        @Override
        public boolean exists(String collectionName) {
            return collections.containsKey(collectionName);
        }

        @Override
        public CollectionHandle create(CollectionSchema schema) {
            InMemoryCollection created = new InMemoryCollection(schema.name());
            if (collections.putIfAbsent(schema.name(), created) != null) {
                throw new IllegalStateException("class name " + schema.name() + " already exists");
            }
            return created;
        }

        @Override
        public CollectionHandle collection(CollectionSchema schema) {
            InMemoryCollection collection = collections.get(schema.name());
            if (collection == null) {
                throw new IllegalStateException("collection " + schema.name() + " does not exist");
            }
            return collection;
        }
    }

    static final class InMemoryCollection implements CollectionHandle {

        private static final List<String> VECTORIZED = List.of("content");

        private final String name;
        private final List<StoredObject> objects = new ArrayList<>();

        InMemoryCollection(String name) {
            this.name = name;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public synchronized List<StoredObject> query(String query, SearchOptions options) {
            Set<String> queryTokens = TokenOverlapScorer.tokenize(query);
            List<ScoredObject> matches = new ArrayList<>();
            for (StoredObject object : objects) {
                Set<String> textTokens = TokenOverlapScorer.tokenize(object.properties(), searched(object, options));
                double similarity = TokenOverlapScorer.similarity(queryTokens, textTokens);
                double score;
                if (options.mode() == RetrievalMode.HYBRID) {
                    double keyword = TokenOverlapScorer.keywordScore(queryTokens, textTokens);
                    score = options.alpha() * similarity + (1.0d - options.alpha()) * keyword;
                    if (score <= 0.0d) {
                        continue;
                    }
                } else {
                    score = similarity;
                    if (score < options.certainty()) {
                        continue;
                    }
                }
                matches.add(new ScoredObject(object, score));
            }
            return matches.stream()
                    .sorted(Comparator.comparingDouble(ScoredObject::score).reversed())
                    .limit(options.unlimited() ? Long.MAX_VALUE : options.limit())
                    .map(ScoredObject::object)
                    .toList();
        }

        /**
         * Hybrid search looks at the selected properties; the vector part only
         * looks at the message content, if the object has one.
         */
        private static List<String> searched(StoredObject object, SearchOptions options) {
            if (options.mode() == RetrievalMode.HYBRID || !object.properties().containsKey("content")) {
                return options.queryProperties();
            }
            return VECTORIZED;
        }

        @Override
        public Optional<String> generate(String query, SearchOptions options, String groupedTask) {
            List<StoredObject> retrieved = query(query, options);
            if (retrieved.isEmpty()) {
                return Optional.empty();
            }
            String context = retrieved.stream().map(StoredObject::formatForPrompt).collect(Collectors.joining(" | "));
            return Optional.of("[generated] " + groupedTask + " | " + context);
        }

        @Override
        public synchronized String insert(StoredObject object) {
            if (object.id() == null) {
                throw new IllegalArgumentException("id is required");
            }
            if (containsNull(object.properties().values())) {
                throw new IllegalArgumentException("explicit null property values are not accepted");
            }
            if (objects.stream().anyMatch(existing -> existing.id().equals(object.id()))) {
                throw new IllegalArgumentException("id '" + object.id() + "' already exists");
            }
            objects.add(object);
            return object.id();
        }

        @Override
        public synchronized BatchInsertResult insertMany(List<StoredObject> batch) {
            List<String> inserted = new ArrayList<>();
            boolean hasErrors = false;
            for (StoredObject object : batch) {
                try {
                    inserted.add(insert(object));
                } catch (IllegalArgumentException ex) {
                    LOGGER.debug("Batch object rejected: {}", ex.getMessage());
                    hasErrors = true;
                }
            }
            return new BatchInsertResult(hasErrors, inserted);
        }

        @Override
        public synchronized long count() {
            return objects.size();
        }

        private static boolean containsNull(Collection<?> values) {
            for (Object value : values) {
                if (value == null) {
                    return true;
                }
                if (value instanceof Map<?, ?> map && containsNull(map.values())) {
                    return true;
                }
                if (value instanceof Collection<?> nested && containsNull(nested)) {
                    return true;
                }
            }
            return false;
        }
    }

    private record ScoredObject(StoredObject object, double score) {
    }
}
