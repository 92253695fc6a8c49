package ch.so.arp.recall.memory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link TransportClient} that only logs outbound traffic. Used in local
 * development and tests where no bot token is available.
 */
class MockTransportClient implements TransportClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(MockTransportClient.class);

    @Override
    public void sendTypingIndicator(String channelId) {
        LOGGER.debug("Typing in channel {}", channelId);
    }

    @Override
    public Map<String, Object> sendMessage(String channelId, String content) {
        LOGGER.info("Message for channel {}: {}", channelId, content);
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("id", UUID.randomUUID().toString());
        message.put("channel_id", channelId);
        message.put("content", content);
        message.put("timestamp", Instant.now().toString());
        return message;
    }
}
