package io.maestro.core.orchestrator;

import java.util.concurrent.CompletableFuture;

/// A request the orchestrator has planned and started.
///
/// The identifier is known before any task runs, so callers can subscribe to the request's
/// events while it executes.
///
/// @param requestId request identifier, never null
/// @param result completed with the aggregated result once every task is terminal
public record AcceptedRequest(String requestId, CompletableFuture<RequestResult> result) {}
