package ch.so.arp.recall.memory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Answers an inbound transport message: hybrid search over the message
 * memory, client side completion grounded by the caller's prompt, reply over
 * the transport. Inbound and outbound message are stored whether or not the
 * reply could be sent.
 */
public class TransportExchange {

    private static final Logger LOGGER = LoggerFactory.getLogger(TransportExchange.class);

    private final CompletionClient completionClient;
    private final TransportClient transportClient;
    private final MemoryStore memoryStore;

    TransportExchange(CompletionClient completionClient, TransportClient transportClient, MemoryStore memoryStore) {
        this.completionClient = Objects.requireNonNull(completionClient, "completionClient");
        this.transportClient = Objects.requireNonNull(transportClient, "transportClient");
        this.memoryStore = Objects.requireNonNull(memoryStore, "memoryStore");
    }

    public String run(CollectionHandle collection, Map<String, Object> inbound, String prompt) {
        Objects.requireNonNull(inbound, "inbound");
        String query = Objects.toString(inbound.get("content"), "");
        String channelId = Objects.toString(inbound.get("channel_id"), null);

        try {
            transportClient.sendTypingIndicator(channelId);
        } catch (RuntimeException ex) {
            LOGGER.warn("Typing indicator for channel {} failed: {}", channelId, ex.getMessage());
        }

        List<StoredObject> retrieved = collection.query(query, RetrievalPresets.transport());
        String reply = ClientSideResponseComposer.complete(completionClient,
                new CompletionRequest(query, retrieved, prompt));

        Map<String, Object> outbound = send(channelId, reply);
        store(Role.USER, inbound);
        store(Role.ASSISTANT, outbound);
        return reply;
    }

    private void store(Role role, Map<String, Object> payload) {
        try {
            memoryStore.appendStructured(role, payload);
        } catch (ExchangeException ex) {
            LOGGER.warn("Storing {} message failed: {}", role.value(), ex.getMessage());
        }
    }

    private Map<String, Object> send(String channelId, String reply) {
        try {
            Map<String, Object> sent = transportClient.sendMessage(channelId, reply);
            if (sent != null) {
                return sent;
            }
        } catch (RuntimeException ex) {
            LOGGER.warn("Sending reply to channel {} failed: {}", channelId, ex.getMessage());
        }
        Map<String, Object> unsent = new LinkedHashMap<>();
        unsent.put("content", reply);
        unsent.put("channel_id", channelId);
        return unsent;
    }
}
