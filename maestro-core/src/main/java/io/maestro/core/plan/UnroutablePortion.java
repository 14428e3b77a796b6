package io.maestro.core.plan;

/// Part of a goal that produced no executable task.
///
/// @param text the goal portion, not null
/// @param reason why it could not be planned, not null
public record UnroutablePortion(String text, String reason) {}
