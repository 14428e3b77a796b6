package io.maestro.server.chat;

import io.maestro.core.util.Payloads;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// One chat exchange: the user's message, the assistant's reply and the request it produced.
///
/// @implNote Thread-safe. Mutators and getters synchronize on the instance.
public class Conversation {

    private final String id;
    private final String caller;
    private final String title;
    private final Instant createdAt;
    private final List<Message> messages = new ArrayList<>();
    private ConversationState state = ConversationState.ACTIVE;
    private ChatIntent intent;
    private String requestId;
    private Instant endedAt;

    public Conversation(String id, String caller, String title) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.caller = caller;
        this.title = title;
        this.createdAt = Instant.now();
    }

    public String getId() {
        return id;
    }

    public String getCaller() {
        return caller;
    }

    public String getTitle() {
        return title;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public synchronized List<Message> getMessages() {
        return List.copyOf(messages);
    }

    public synchronized ConversationState getState() {
        return state;
    }

    public synchronized ChatIntent getIntent() {
        return intent;
    }

    public synchronized String getRequestId() {
        return requestId;
    }

    public synchronized Instant getEndedAt() {
        return endedAt;
    }

    /// Appends a message to the history.
    ///
    /// @param role `user` or `assistant`
    /// @param content message text
    /// @param metadata extra detail, may be null
    public synchronized void addMessage(
            String role, String content, Map<String, Object> metadata) {
        messages.add(new Message(role, content, Instant.now(), metadata));
    }

    synchronized void classify(ChatIntent intent) {
        this.intent = intent;
    }

    synchronized void linkRequest(String requestId) {
        this.requestId = requestId;
    }

    /// Ends the conversation. Ending an already ended conversation has no effect.
    ///
    /// @param finalState `COMPLETED` or `FAILED`
    synchronized void end(ConversationState finalState) {
        if (state != ConversationState.ACTIVE) {
            return;
        }
        state = finalState;
        endedAt = Instant.now();
    }

    /// One entry of a conversation history.
    ///
    /// @param role `user` or `assistant`
    /// @param content message text
    /// @param timestamp when the message was recorded
    /// @param metadata extra detail, never null
    public record Message(
            String role, String content, Instant timestamp, Map<String, Object> metadata) {

        public Message {
            metadata = Payloads.copy(metadata);
        }
    }
}
