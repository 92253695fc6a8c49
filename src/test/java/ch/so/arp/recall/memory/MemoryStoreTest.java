package ch.so.arp.recall.memory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import org.junit.jupiter.api.Test;

class MemoryStoreTest {

    private static final ProviderCredentials CREDENTIALS = new ProviderCredentials(ModelProvider.MISTRAL, "key");
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-10-19T10:15:30Z"), ZoneOffset.UTC);
    private static final SearchOptions ALL_DIALOGUE = SearchOptions.hybrid(10, 0.5d,
            RetrievalPresets.DIALOGUE_PROPERTIES);

    @Test
    void appendTurnStoresEntryUnderGeneratedId() {
        CollectionManager manager = openManager(new InMemoryVectorStore(), SourceKind.HISTORY);
        MemoryStore memoryStore = new MemoryStore(manager, CLOCK);

        String id = memoryStore.appendTurn(Role.USER, "hello");

        assertThat(UUID.fromString(id)).isNotNull();
        List<StoredObject> stored = manager.ensureOpen().query("hello", ALL_DIALOGUE);
        assertThat(stored).hasSize(1);
        assertThat(stored.get(0).id()).isEqualTo(id);
        assertThat(stored.get(0).properties())
                .containsEntry("timestamp", "2026-10-19T10:15:30Z")
                .containsEntry("role", "user")
                .containsEntry("content", "hello");
    }

    @Test
    void appendPairStoresBothTurnsWithSharedTimestamp() {
        CollectionManager manager = openManager(new InMemoryVectorStore(), SourceKind.HISTORY);
        MemoryStore memoryStore = new MemoryStore(manager, CLOCK);

        boolean hasErrors = memoryStore.appendPair("hi", "bye");

        assertThat(hasErrors).isFalse();
        CollectionHandle collection = manager.ensureOpen();
        assertThat(collection.count()).isEqualTo(2);
        List<StoredObject> stored = collection.query("hi bye", ALL_DIALOGUE);
        assertThat(stored).extracting(object -> object.property("role"))
                .containsExactlyInAnyOrder("user", "assistant");
        assertThat(stored).extracting(object -> object.property("timestamp"))
                .containsOnly("2026-10-19T10:15:30Z");
        assertThat(stored).extracting(StoredObject::id).doesNotHaveDuplicates();
    }

    @Test
    void reportsPartialBatchFailureAndKeepsAcceptedEntry() {
        InMemoryVectorStore.InMemoryCollection backing = new InMemoryVectorStore.InMemoryCollection(
                "History_TestRoom");
        VectorStoreSession session = mock(VectorStoreSession.class);
        when(session.isReady()).thenReturn(true);
        when(session.exists("History_TestRoom")).thenReturn(false);
        when(session.create(any())).thenReturn(new RejectingCollection(backing, "bye"));
        CollectionManager manager = new CollectionManager(
                new StoreConnector(credentials -> session, Duration.ofMillis(5), Duration.ofSeconds(1)),
                CREDENTIALS, SourceKind.HISTORY, "Test Room");
        manager.ensureOpen();

        boolean hasErrors = new MemoryStore(manager, CLOCK).appendPair("hi", "bye");

        assertThat(hasErrors).isTrue();
        assertThat(backing.count()).isEqualTo(1);
        assertThat(backing.query("hi bye", ALL_DIALOGUE))
                .singleElement()
                .satisfies(object -> assertThat(object.property("content")).isEqualTo("hi"));
    }

    @Test
    void refusesWritesWhileCollectionIsNotOpen() {
        CollectionManager manager = new CollectionManager(
                new StoreConnector(new InMemoryVectorStore(), Duration.ofMillis(5), Duration.ofSeconds(1)),
                CREDENTIALS, SourceKind.HISTORY, "Test Room");
        MemoryStore memoryStore = new MemoryStore(manager, CLOCK);

        assertThatThrownBy(() -> memoryStore.appendTurn(Role.USER, "hello"))
                .isInstanceOf(ExchangeException.class)
                .hasMessage("collection not ready")
                .satisfies(ex -> assertThat(((ExchangeException) ex).getKind()).isEqualTo(ErrorKind.PERSISTENCE));
        assertThatThrownBy(() -> memoryStore.appendPair("hi", "bye"))
                .isInstanceOf(ExchangeException.class)
                .hasMessage("collection not ready");
        assertThatThrownBy(() -> memoryStore.appendStructured(Role.USER, Map.of("content", "hi")))
                .isInstanceOf(ExchangeException.class)
                .hasMessage("collection not ready");
        assertThat(manager.state()).isEqualTo(CollectionManager.State.UNOPENED);
    }

    @Test
    void wrapsInsertFailuresAsPersistenceErrors() {
        CollectionHandle collection = mock(CollectionHandle.class);
        when(collection.name()).thenReturn("History_TestRoom");
        when(collection.insert(any())).thenThrow(new IllegalStateException("HTTP 500"));
        CollectionManager manager = mock(CollectionManager.class);
        when(manager.currentCollection()).thenReturn(Optional.of(collection));

        assertThatThrownBy(() -> new MemoryStore(manager, CLOCK).appendTurn(Role.ASSISTANT, "reply"))
                .isInstanceOf(ExchangeException.class)
                .hasMessageContaining("HTTP 500")
                .satisfies(ex -> assertThat(((ExchangeException) ex).getKind()).isEqualTo(ErrorKind.PERSISTENCE));
    }

    @Test
    void appendStructuredDropsNullsAtEveryDepth() {
        CollectionManager manager = openManager(new InMemoryVectorStore(), SourceKind.DISCORD);
        MemoryStore memoryStore = new MemoryStore(manager, CLOCK);

        Map<String, Object> author = new LinkedHashMap<>();
        author.put("id", "u-1");
        author.put("username", "alice");
        author.put("avatar", null);
        Map<String, Object> mention = new LinkedHashMap<>();
        mention.put("id", "u-2");
        mention.put("global_name", null);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("id", "1234");
        payload.put("content", "see you tomorrow");
        payload.put("channel_id", "c-1");
        payload.put("guild_id", null);
        payload.put("author", author);
        payload.put("mentions", new ArrayList<>(Arrays.asList(mention, null)));

        String id = memoryStore.appendStructured(Role.USER, payload);

        StoredObject stored = manager.ensureOpen().query("tomorrow", RetrievalPresets.transport()).get(0);
        assertThat(stored.id()).isEqualTo(id).isNotEqualTo("1234");
        assertThat(stored.properties())
                .containsEntry("messageID", "1234")
                .containsEntry("role", "user")
                .doesNotContainKeys("id", "guild_id");
        assertThat(stored.property("author")).isEqualTo(Map.of("id", "u-1", "username", "alice"));
        assertThat(stored.property("mentions")).isEqualTo(List.of(Map.of("id", "u-2")));
    }

    @Test
    void storablePropertiesKeepPayloadWithoutExternalId() {
        Map<String, Object> properties = MemoryStore.toStorableProperties(Role.ASSISTANT,
                Map.of("content", "reply", "channel_id", "c-1"));

        assertThat(properties)
                .containsEntry("role", "assistant")
                .containsEntry("content", "reply")
                .doesNotContainKey("messageID");
    }

    private static CollectionManager openManager(InMemoryVectorStore store, SourceKind kind) {
        CollectionManager manager = new CollectionManager(
                new StoreConnector(store, Duration.ofMillis(5), Duration.ofSeconds(1)), CREDENTIALS, kind,
                "Test Room");
        manager.ensureOpen();
        return manager;
    }

    /**
     * Accepts every object of a batch except those with the given content, the
     * way the store reports per object errors in a batch response.
     */
    private static final class RejectingCollection implements CollectionHandle {

        private final CollectionHandle delegate;
        private final String rejectedContent;

        private RejectingCollection(CollectionHandle delegate, String rejectedContent) {
            this.delegate = delegate;
            this.rejectedContent = rejectedContent;
        }

        @Override
        public String name() {
            return delegate.name();
        }

        @Override
        public List<StoredObject> query(String query, SearchOptions options) {
            return delegate.query(query, options);
        }

        @Override
        public Optional<String> generate(String query, SearchOptions options, String groupedTask) {
            return delegate.generate(query, options, groupedTask);
        }

        @Override
        public String insert(StoredObject object) {
            return delegate.insert(object);
        }

        @Override
        public BatchInsertResult insertMany(List<StoredObject> objects) {
            List<StoredObject> accepted = objects.stream()
                    .filter(object -> !rejectedContent.equals(object.property("content")))
                    .toList();
            BatchInsertResult result = delegate.insertMany(accepted);
            return new BatchInsertResult(result.hasErrors() || accepted.size() < objects.size(),
                    result.insertedIds());
        }

        @Override
        public long count() {
            return delegate.count();
        }
    }
}
