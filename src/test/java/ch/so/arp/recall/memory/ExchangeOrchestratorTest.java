package ch.so.arp.recall.memory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class ExchangeOrchestratorTest {

    private static final ProviderCredentials CREDENTIALS = new ProviderCredentials(ModelProvider.MISTRAL, "test-key");

    private final InMemoryVectorStore store = new InMemoryVectorStore();
    private final StoreConnector connector = new StoreConnector(store, Duration.ofMillis(5), Duration.ofSeconds(1));

    @Test
    void semanticNearTextOnEmptyCollectionStoresQueryAndReply() {
        CompletionClient completionClient = mock(CompletionClient.class);
        when(completionClient.complete(any())).thenReturn("Hi there");
        ExchangeOrchestrator orchestrator = orchestrator(completionClient, "Test Room");

        String reply = orchestrator.exchange("semantic", "nearText", "hello", null);

        assertThat(reply).isEqualTo("Hi there");
        assertThat(orchestrator.collectionName()).isEqualTo("History_TestRoom");
        ArgumentCaptor<CompletionRequest> request = ArgumentCaptor.forClass(CompletionRequest.class);
        verify(completionClient).complete(request.capture());
        assertThat(request.getValue().query()).isEqualTo("hello");
        assertThat(request.getValue().context()).isEmpty();
        assertThat(storedCount(orchestrator)).isEqualTo(2);
    }

    @Test
    void everyStrategyProducesAReply() {
        ExchangeOrchestrator orchestrator = orchestrator(new MockCompletionClient(), "Planning");
        orchestrator.exchange("semantic", "hybrid", "zoning plan for the old town", null);

        for (ResponseMode responseMode : ResponseMode.values()) {
            for (RetrievalMode retrievalMode : RetrievalMode.values()) {
                String reply = orchestrator.exchange(StrategySelector.of(responseMode, retrievalMode),
                        "zoning plan for the old town", "Summarize the discussion");

                assertThat(reply).as("%s/%s", responseMode, retrievalMode).isNotBlank();
            }
        }
    }

    @Test
    void unknownStrategyIsReportedWithoutOpeningTheCollection() {
        ExchangeOrchestrator orchestrator = orchestrator(new MockCompletionClient(), "Test Room");

        assertThat(orchestrator.exchange("semantic", "keyword", "hello", null)).isEqualTo("Error exchanging messages");
        assertThat(orchestrator.exchange("creative", "hybrid", "hello", null)).isEqualTo("Error exchanging messages");
        assertThat(orchestrator.collectionManager().state()).isEqualTo(CollectionManager.State.UNOPENED);
    }

    @Test
    void generativeExchangeWithoutMatchesStoresNothing() {
        ExchangeOrchestrator orchestrator = orchestrator(new MockCompletionClient(), "Test Room");

        String reply = orchestrator.exchange("generative", "nearText", "something unrelated", "Summarize");

        assertThat(reply).isEqualTo("Error generating response");
        assertThat(storedCount(orchestrator)).isZero();
    }

    @Test
    void generativeExchangeStoresGeneratedReply() {
        ExchangeOrchestrator orchestrator = orchestrator(new MockCompletionClient(), "Test Room");
        orchestrator.exchange("semantic", "hybrid", "weather in Solothurn", null);

        String reply = orchestrator.exchange("generative", "hybrid", "weather Solothurn", "Summarize");

        assertThat(reply).startsWith("[generated] Summarize");
        assertThat(storedCount(orchestrator)).isEqualTo(3);
    }

    @Test
    void semanticExchangeStoresCompletionFailureText() {
        CompletionClient completionClient = mock(CompletionClient.class);
        when(completionClient.complete(any()))
                .thenThrow(new ExchangeException(ErrorKind.GENERATION, "Completion API returned HTTP 401"));
        ExchangeOrchestrator orchestrator = orchestrator(completionClient, "Test Room");

        String reply = orchestrator.exchange("semantic", "hybrid", "hello", null);

        assertThat(reply).isEqualTo("An error occurred while generating response: Completion API returned HTTP 401");
        assertThat(storedCount(orchestrator)).isEqualTo(2);
    }

    @Test
    void semanticReplySurvivesFailedBatchWrite() {
        CollectionHandle collection = remoteCollection();
        when(collection.query(anyString(), any())).thenReturn(List.of());
        when(collection.insertMany(any())).thenThrow(new IllegalStateException("HTTP 503"));
        CompletionClient completionClient = mock(CompletionClient.class);
        when(completionClient.complete(any())).thenReturn("the real answer");
        ExchangeOrchestrator orchestrator = ExchangeOrchestrator.create(connectorFor(collection), completionClient,
                new MockTransportClient(), CREDENTIALS, SourceKind.HISTORY, "Test Room");

        String reply = orchestrator.exchange("semantic", "hybrid", "hello", null);

        assertThat(reply).isEqualTo("the real answer");
        verify(collection).insertMany(any());
    }

    @Test
    void generatedReplyThatCannotBeStoredIsReportedAsPersistenceError() {
        CollectionHandle collection = remoteCollection();
        when(collection.generate(eq("hello"), any(), eq("Summarize"))).thenReturn(Optional.of("A summary"));
        when(collection.insert(any())).thenThrow(new IllegalStateException("HTTP 500"));
        ExchangeOrchestrator orchestrator = ExchangeOrchestrator.create(connectorFor(collection),
                new MockCompletionClient(), new MockTransportClient(), CREDENTIALS, SourceKind.HISTORY, "Test Room");

        String reply = orchestrator.exchange("generative", "hybrid", "hello", "Summarize");

        assertThat(reply).isEqualTo("Error adding ai response to history");
        verify(collection).insert(any());
    }

    @Test
    void opensTheCollectionOnlyOnce() {
        AtomicInteger opened = new AtomicInteger();
        StoreConnector countingConnector = new StoreConnector(credentials -> {
            opened.incrementAndGet();
            return store.open(credentials);
        }, Duration.ofMillis(5), Duration.ofSeconds(1));
        ExchangeOrchestrator orchestrator = ExchangeOrchestrator.create(countingConnector, new MockCompletionClient(),
                new MockTransportClient(), CREDENTIALS, SourceKind.HISTORY, "Test Room");

        assertThat(orchestrator.collectionManager().state()).isEqualTo(CollectionManager.State.UNOPENED);
        orchestrator.exchange("semantic", "hybrid", "first", null);
        orchestrator.exchange("semantic", "nearText", "second", null);

        assertThat(opened).hasValue(1);
        assertThat(storedCount(orchestrator)).isEqualTo(4);
    }

    @Test
    void unreachableStoreIsReportedAsCollectionError() {
        StoreConnector failing = new StoreConnector(credentials -> {
            throw new IllegalStateException("connection refused");
        }, Duration.ofMillis(5), Duration.ofSeconds(1));
        ExchangeOrchestrator orchestrator = ExchangeOrchestrator.create(failing, new MockCompletionClient(),
                new MockTransportClient(), CREDENTIALS, SourceKind.HISTORY, "Test Room");

        String reply = orchestrator.exchange("semantic", "hybrid", "hello", null);

        assertThat(reply).startsWith("Error getting collection: ").contains("connection refused");
        assertThat(orchestrator.collectionManager().state()).isEqualTo(CollectionManager.State.FAILED);
    }

    @Test
    void orchestratorsOnTheSameNameShareTheCollection() {
        ExchangeOrchestrator first = orchestrator(new MockCompletionClient(), "Test Room");
        ExchangeOrchestrator second = orchestrator(new MockCompletionClient(), "TestRoom");

        first.exchange("semantic", "hybrid", "hello", null);
        second.exchange("semantic", "hybrid", "hello again", null);

        assertThat(storedCount(first)).isEqualTo(4);
        assertThat(storedCount(second)).isEqualTo(4);
    }

    @Test
    void rendersErrorKinds() {
        assertThat(ExchangeOrchestrator.render(new ExchangeException(ErrorKind.DISPATCH, "x")))
                .isEqualTo("Error exchanging messages");
        assertThat(ExchangeOrchestrator.render(new ExchangeException(ErrorKind.GENERATION, "x")))
                .isEqualTo("Error generating response");
        assertThat(ExchangeOrchestrator.render(new ExchangeException(ErrorKind.PERSISTENCE, "x")))
                .isEqualTo("Error adding ai response to history");
        assertThat(ExchangeOrchestrator.render(new ExchangeException(ErrorKind.COLLECTION, "boom")))
                .isEqualTo("Error getting collection: boom");
    }

    private ExchangeOrchestrator orchestrator(CompletionClient completionClient, String logicalName) {
        return ExchangeOrchestrator.create(connector, completionClient, new MockTransportClient(), CREDENTIALS,
                SourceKind.HISTORY, logicalName);
    }

    private static CollectionHandle remoteCollection() {
        CollectionHandle collection = mock(CollectionHandle.class);
        when(collection.name()).thenReturn("History_TestRoom");
        return collection;
    }

    private static StoreConnector connectorFor(CollectionHandle collection) {
        VectorStoreSession session = mock(VectorStoreSession.class);
        when(session.isReady()).thenReturn(true);
        when(session.exists(anyString())).thenReturn(true);
        when(session.collection(any())).thenReturn(collection);
        return new StoreConnector(credentials -> session, Duration.ofMillis(5), Duration.ofSeconds(1));
    }

    private static long storedCount(ExchangeOrchestrator orchestrator) {
        return orchestrator.collectionManager().currentCollection().orElseThrow().count();
    }
}
