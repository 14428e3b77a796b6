package io.maestro.server.chat;

import io.maestro.core.orchestrator.RequestResult;

/// Answer to one chat message.
///
/// @param conversationId conversation the exchange was recorded under
/// @param intent detected intent
/// @param reply plain-text reply
/// @param requestId request started for the message, null unless `intent` is `REQUEST`
/// @param status aggregated result status, null unless `intent` is `REQUEST`
public record ChatReply(
        String conversationId,
        ChatIntent intent,
        String reply,
        String requestId,
        RequestResult.Status status) {}
