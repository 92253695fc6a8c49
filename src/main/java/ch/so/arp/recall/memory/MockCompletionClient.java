package ch.so.arp.recall.memory;

import java.util.StringJoiner;

/**
 * Deterministic {@link CompletionClient} used in tests and local development
 * where the model provider should not be contacted.
 */
class MockCompletionClient implements CompletionClient {

    @Override
    public String complete(CompletionRequest request) {
        StringJoiner joiner = new StringJoiner(" | ");
        joiner.add("[mocked answer]");
        if (request.hasGroundingPrompt()) {
            joiner.add("Prompt: " + request.groundingPrompt());
        }
        joiner.add("Question was: " + request.query());
        joiner.add("Total context entries: " + request.context().size());
        return joiner.toString();
    }
}
