package ch.so.arp.recall.memory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes conversation memory into the collection of a {@link CollectionManager}.
 * Every stored object gets a freshly generated identifier.
 */
public class MemoryStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(MemoryStore.class);

    /** Identifier property reserved by the store. */
    static final String RESERVED_ID = "id";

    /** Property receiving an externally supplied identifier. */
    static final String EXTERNAL_ID = "messageID";

    private final CollectionManager collectionManager;
    private final Clock clock;

    public MemoryStore(CollectionManager collectionManager) {
        this(collectionManager, Clock.systemUTC());
    }

    MemoryStore(CollectionManager collectionManager, Clock clock) {
        this.collectionManager = Objects.requireNonNull(collectionManager, "collectionManager");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Store a single conversation turn.
     *
     * @return the identifier of the new entry
     * @throws ExchangeException of kind {@link ErrorKind#PERSISTENCE} when the
     *                           collection is not open or the insert fails
     */
    public String appendTurn(Role role, String content) {
        CollectionHandle collection = openCollection();
        DialogueEntry entry = new DialogueEntry(now(), role, content);
        return insert(collection, new StoredObject(newId(), entry.toProperties()));
    }

    /**
     * Store a user turn and the assistant reply with one batch write. Both
     * entries share the same timestamp. The batch is not atomic: when it reports
     * errors the entries that succeeded stay persisted.
     *
     * @return {@code true} if the batch reported at least one failed insert
     */
    public boolean appendPair(String userContent, String assistantContent) {
        CollectionHandle collection = openCollection();
        String timestamp = now();
        List<StoredObject> entries = List.of(
                new StoredObject(newId(), new DialogueEntry(timestamp, Role.USER, userContent).toProperties()),
                new StoredObject(newId(), new DialogueEntry(timestamp, Role.ASSISTANT, assistantContent).toProperties()));
        BatchInsertResult result;
        try {
            result = collection.insertMany(entries);
        } catch (RuntimeException ex) {
            throw new ExchangeException(ErrorKind.PERSISTENCE, "Storing message pair failed: " + ex.getMessage(), ex);
        }
        if (result.hasErrors()) {
            LOGGER.warn("Batch write into {} stored {} of {} entries", collection.name(), result.insertedIds().size(),
                    entries.size());
        }
        return result.hasErrors();
    }

    /**
     * Store an arbitrary payload such as an inbound or outbound transport
     * message. An {@code id} field of the payload is kept as {@code messageID},
     * the sender role is added and null values are dropped at every depth since
     * the store rejects explicit nulls.
     *
     * @return the identifier of the new entry
     */
    public String appendStructured(Role role, Map<String, ?> payload) {
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(payload, "payload");
        CollectionHandle collection = openCollection();
        return insert(collection, new StoredObject(newId(), toStorableProperties(role, payload)));
    }

    static Map<String, Object> toStorableProperties(Role role, Map<String, ?> payload) {
        Map<String, Object> properties = new LinkedHashMap<>(payload);
        Object externalId = properties.remove(RESERVED_ID);
        if (externalId != null) {
            properties.put(EXTERNAL_ID, externalId);
        }
        properties.put("role", role.value());
        return withoutNulls(properties);
    }

    static Map<String, Object> withoutNulls(Map<?, ?> source) {
        Map<String, Object> cleaned = new LinkedHashMap<>();
        source.forEach((key, value) -> {
            if (value != null) {
                cleaned.put(String.valueOf(key), withoutNullsValue(value));
            }
        });
        return cleaned;
    }

    private static Object withoutNullsValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            return withoutNulls(map);
        }
        if (value instanceof List<?> list) {
            List<Object> cleaned = new ArrayList<>(list.size());
            for (Object element : list) {
                if (element != null) {
                    cleaned.add(withoutNullsValue(element));
                }
            }
            return cleaned;
        }
        return value;
    }

    private CollectionHandle openCollection() {
        return collectionManager.currentCollection()
                .orElseThrow(() -> new ExchangeException(ErrorKind.PERSISTENCE, "collection not ready"));
    }

    private String insert(CollectionHandle collection, StoredObject object) {
        try {
            return collection.insert(object);
        } catch (RuntimeException ex) {
            throw new ExchangeException(ErrorKind.PERSISTENCE,
                    "Insert into " + collection.name() + " failed: " + ex.getMessage(), ex);
        }
    }

    private String now() {
        return Instant.now(clock).toString();
    }

    private static String newId() {
        return UUID.randomUUID().toString();
    }
}
