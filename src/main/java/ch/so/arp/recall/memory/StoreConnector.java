package ch.so.arp.recall.memory;

import java.time.Duration;
import java.util.Objects;
import java.util.function.BooleanSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Obtains a ready session with the vector store. After the session is opened
 * the connector polls the readiness endpoint on a fixed interval until the
 * store is ready, the deadline passes or the caller cancels the wait.
 */
public class StoreConnector {

    private static final Logger LOGGER = LoggerFactory.getLogger(StoreConnector.class);

    private final VectorStoreSessionFactory sessionFactory;
    private final Duration pollInterval;
    private final Duration readyTimeout;

    public StoreConnector(VectorStoreSessionFactory sessionFactory, Duration pollInterval, Duration readyTimeout) {
        this.sessionFactory = Objects.requireNonNull(sessionFactory, "sessionFactory");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
        this.readyTimeout = Objects.requireNonNull(readyTimeout, "readyTimeout");
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive");
        }
    }

    public VectorStoreSession connect(ProviderCredentials credentials) {
        return connect(credentials, () -> false);
    }

    /**
     * Open a session and wait for the store to become ready.
     *
     * @param credentials provider credentials forwarded to the store
     * @param cancelled   checked before every probe; the wait ends once it returns {@code true}
     * @return a session whose store reported itself ready
     * @throws ExchangeException of kind {@link ErrorKind#CONNECTION} when the
     *                           session cannot be opened or the store is not ready in time
     */
    public VectorStoreSession connect(ProviderCredentials credentials, BooleanSupplier cancelled) {
        Objects.requireNonNull(credentials, "credentials");
        Objects.requireNonNull(cancelled, "cancelled");
        VectorStoreSession session;
        try {
            session = sessionFactory.open(credentials);
        } catch (RuntimeException ex) {
            throw new ExchangeException(ErrorKind.CONNECTION, "Unable to open vector store session: " + ex.getMessage(),
                    ex);
        }
        awaitReady(session, cancelled);
        return session;
    }

    private void awaitReady(VectorStoreSession session, BooleanSupplier cancelled) {
        long deadline = System.nanoTime() + readyTimeout.toNanos();
        int attempts = 0;
        while (true) {
            if (cancelled.getAsBoolean()) {
                throw new ExchangeException(ErrorKind.CONNECTION, "Readiness wait cancelled after " + attempts
                        + " probes");
            }
            attempts++;
            if (probe(session)) {
                LOGGER.info("Vector store ready after {} probe(s)", attempts);
                return;
            }
            if (System.nanoTime() + pollInterval.toNanos() > deadline) {
                throw new ExchangeException(ErrorKind.CONNECTION, "Vector store not ready within " + readyTimeout);
            }
            LOGGER.debug("Vector store not ready yet, next probe in {}", pollInterval);
            try {
                Thread.sleep(pollInterval.toMillis());
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new ExchangeException(ErrorKind.CONNECTION, "Interrupted while waiting for the vector store", ex);
            }
        }
    }

    private boolean probe(VectorStoreSession session) {
        try {
            return session.isReady();
        } catch (RuntimeException ex) {
            LOGGER.debug("Readiness probe failed: {}", ex.getMessage());
            return false;
        }
    }
}
