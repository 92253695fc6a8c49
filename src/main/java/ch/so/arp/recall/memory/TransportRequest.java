package ch.so.arp.recall.memory;

import java.util.Map;

import jakarta.validation.constraints.NotEmpty;

/**
 * Inbound transport message together with the prompt grounding the reply.
 */
public record TransportRequest(String prompt, @NotEmpty Map<String, Object> message) {
}
