package ch.so.arp.recall.memory;

import static ch.so.arp.recall.memory.CollectionSchema.PropertyDefinition.integer;
import static ch.so.arp.recall.memory.CollectionSchema.PropertyDefinition.text;

import java.util.List;

/**
 * Schema definitions per source kind.
 */
final class CollectionSchemas {

    private static final List<CollectionSchema.PropertyDefinition> DIALOGUE = List.of(
            text("timestamp", "The timestamp of the message"),
            text("role", "The role of the message sender (user or assistant)"),
            text("content", "The message content"));

    private static final List<CollectionSchema.PropertyDefinition> DISCORD_MESSAGE = List.of(
            text("messageID", "Identifier of the message assigned by Discord"),
            text("role", "The role of the message sender (user or assistant)"),
            text("content", "The message content"),
            text("channel_id", "Channel the message was posted in"),
            text("guild_id", "Guild the channel belongs to"),
            text("timestamp", "When the message was sent"),
            text("edited_timestamp", "When the message was last edited"),
            integer("type", "Discord message type"));

    private CollectionSchemas() {
    }

    static CollectionSchema forKind(SourceKind kind, String collectionName, ModelProvider modelProvider) {
        return switch (kind) {
            case HISTORY -> new CollectionSchema(collectionName, "Dialog history collection", DIALOGUE, modelProvider);
            case DISCORD -> new CollectionSchema(collectionName, "Discord message collection", DISCORD_MESSAGE,
                    modelProvider);
        };
    }
}
