package io.maestro.server.chat;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/// What a chat message asks for.
///
/// Detection is by keyword phrase, whole-word and case-insensitive, checked in declaration
/// order; the first intent with a matching phrase wins and anything else is a {@link #REQUEST}.
/// A message starting with "help me" is a request, not a help query.
public enum ChatIntent {
    HELP("help", "what can you do", "capabilities", "features"),
    STATUS("status", "health"),
    AGENTS("list agents", "show agents", "available agents"),
    EXAMPLES("examples", "show me how", "how to", "usage"),
    REQUEST;

    private static final Pattern HELP_ME = Pattern.compile("^\\s*help me\\b");

    private final List<Pattern> phrases;

    ChatIntent(String... phrases) {
        this.phrases =
                Arrays.stream(phrases)
                        .map(phrase -> Pattern.compile("\\b" + Pattern.quote(phrase) + "\\b"))
                        .toList();
    }

    /// Detects the intent of a message.
    ///
    /// @param message chat message, not null
    /// @return detected intent, never null
    public static ChatIntent detect(String message) {
        String text = message.toLowerCase(Locale.ROOT);
        boolean helpMe = HELP_ME.matcher(text).find();
        for (ChatIntent intent : values()) {
            if (intent == HELP && helpMe) {
                continue;
            }
            if (intent.matches(text)) {
                return intent;
            }
        }
        return REQUEST;
    }

    private boolean matches(String text) {
        return phrases.stream().anyMatch(pattern -> pattern.matcher(text).find());
    }
}
