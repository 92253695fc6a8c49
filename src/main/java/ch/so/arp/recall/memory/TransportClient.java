package ch.so.arp.recall.memory;

import java.util.Map;

/**
 * Outbound side of the chat transport the transport exchange replies on.
 */
public interface TransportClient {

    void sendTypingIndicator(String channelId);

    /**
     * Post a message to a channel.
     *
     * @return the message object returned by the transport
     */
    Map<String, Object> sendMessage(String channelId, String content);
}
