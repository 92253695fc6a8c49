package ch.so.arp.recall.memory;

import jakarta.validation.constraints.NotBlank;

/**
 * Incoming payload for exchanges against a history collection.
 */
public record ExchangeRequest(@NotBlank String collection, @NotBlank String responseMode,
        @NotBlank String retrievalMode, @NotBlank String query, String prompt) {
}
