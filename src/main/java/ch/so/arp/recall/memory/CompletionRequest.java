package ch.so.arp.recall.memory;

import java.util.List;
import java.util.Objects;

/**
 * Input of a client side completion: the live user query, the objects retrieved
 * for it and an optional grounding prompt.
 */
public record CompletionRequest(String query, List<StoredObject> context, String groundingPrompt) {

    public CompletionRequest {
        Objects.requireNonNull(query, "query");
        context = List.copyOf(context);
    }

    public static CompletionRequest of(String query, List<StoredObject> context) {
        return new CompletionRequest(query, context, null);
    }

    public boolean hasGroundingPrompt() {
        return groundingPrompt != null && !groundingPrompt.isBlank();
    }
}
