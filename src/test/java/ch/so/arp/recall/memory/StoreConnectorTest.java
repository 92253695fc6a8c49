package ch.so.arp.recall.memory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.Test;

class StoreConnectorTest {

    private static final ProviderCredentials CREDENTIALS = new ProviderCredentials(ModelProvider.MISTRAL, "key");

    @Test
    void pollsUntilTheStoreIsReady() {
        VectorStoreSession session = mock(VectorStoreSession.class);
        when(session.isReady()).thenReturn(false, false, true);
        StoreConnector connector = new StoreConnector(credentials -> session, Duration.ofMillis(1),
                Duration.ofSeconds(5));

        assertThat(connector.connect(CREDENTIALS)).isSameAs(session);
        verify(session, times(3)).isReady();
    }

    @Test
    void givesUpAfterTheDeadline() {
        VectorStoreSession session = mock(VectorStoreSession.class);
        when(session.isReady()).thenReturn(false);
        StoreConnector connector = new StoreConnector(credentials -> session, Duration.ofMillis(5),
                Duration.ofMillis(30));

        assertThatThrownBy(() -> connector.connect(CREDENTIALS))
                .isInstanceOf(ExchangeException.class)
                .hasMessageContaining("not ready")
                .satisfies(ex -> assertThat(((ExchangeException) ex).getKind()).isEqualTo(ErrorKind.CONNECTION));
    }

    @Test
    void treatsFailingProbesAsNotReady() {
        VectorStoreSession session = mock(VectorStoreSession.class);
        when(session.isReady()).thenThrow(new IllegalStateException("503")).thenReturn(true);
        StoreConnector connector = new StoreConnector(credentials -> session, Duration.ofMillis(1),
                Duration.ofSeconds(5));

        assertThat(connector.connect(CREDENTIALS)).isSameAs(session);
    }

    @Test
    void stopsWaitingWhenCancelled() {
        VectorStoreSession session = mock(VectorStoreSession.class);
        AtomicInteger probes = new AtomicInteger();
        when(session.isReady()).thenAnswer(invocation -> {
            probes.incrementAndGet();
            return false;
        });
        StoreConnector connector = new StoreConnector(credentials -> session, Duration.ofMillis(1),
                Duration.ofSeconds(30));

        assertThatThrownBy(() -> connector.connect(CREDENTIALS, () -> probes.get() >= 2))
                .isInstanceOf(ExchangeException.class)
                .hasMessageContaining("cancelled");
        assertThat(probes).hasValue(2);
    }

    @Test
    void wrapsFailuresWhileOpeningTheSession() {
        IllegalStateException refused = new IllegalStateException("connection refused");
        StoreConnector connector = new StoreConnector(credentials -> {
            throw refused;
        }, Duration.ofMillis(1), Duration.ofSeconds(1));

        assertThatThrownBy(() -> connector.connect(CREDENTIALS))
                .isInstanceOf(ExchangeException.class)
                .hasCause(refused)
                .hasMessageContaining("connection refused");
    }

    @Test
    void forwardsCredentialsToTheSessionFactory() {
        AtomicReference<ProviderCredentials> forwarded = new AtomicReference<>();
        VectorStoreSession session = mock(VectorStoreSession.class);
        when(session.isReady()).thenReturn(true);
        StoreConnector connector = new StoreConnector(credentials -> {
            forwarded.set(credentials);
            return session;
        }, Duration.ofMillis(1), Duration.ofSeconds(1));

        connector.connect(CREDENTIALS);

        assertThat(forwarded.get()).isEqualTo(CREDENTIALS);
    }

    @Test
    void rejectsNonPositivePollInterval() {
        assertThatThrownBy(() -> new StoreConnector(credentials -> null, Duration.ZERO, Duration.ofSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
