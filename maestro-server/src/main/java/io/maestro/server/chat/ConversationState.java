package io.maestro.server.chat;

/// Lifecycle of a {@link Conversation}.
public enum ConversationState {
    ACTIVE,
    COMPLETED,
    FAILED
}
