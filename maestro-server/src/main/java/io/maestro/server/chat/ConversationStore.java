package io.maestro.server.chat;

import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.eclipse.microprofile.config.inject.ConfigProperty;

/// In-memory store of recent conversations.
///
/// Keeps at most `maestro.chat.history-limit` conversations; the oldest is evicted first.
///
/// @implNote Thread-safe. All access synchronizes on the backing map.
@ApplicationScoped
public class ConversationStore {

    private final Map<String, Conversation> conversations;

    public ConversationStore(
            @ConfigProperty(name = "maestro.chat.history-limit", defaultValue = "200")
                    int historyLimit) {
        if (historyLimit < 1) {
            throw new IllegalArgumentException("historyLimit must be positive: " + historyLimit);
        }
        this.conversations =
                Collections.synchronizedMap(
                        new LinkedHashMap<>() {
                            @Override
                            protected boolean removeEldestEntry(
                                    Map.Entry<String, Conversation> eldest) {
                                return size() > historyLimit;
                            }
                        });
    }

    /// Opens a new conversation.
    ///
    /// @param caller caller identity, may be null
    /// @param title short description, may be null
    /// @return the stored conversation, never null
    public Conversation create(String caller, String title) {
        Conversation conversation =
                new Conversation("conv-" + UUID.randomUUID(), caller, title);
        conversations.put(conversation.getId(), conversation);
        return conversation;
    }

    public Optional<Conversation> find(String id) {
        return Optional.ofNullable(conversations.get(id));
    }

    /// Returns conversations newest first.
    ///
    /// @param limit maximum number returned
    /// @return conversations, never null
    public List<Conversation> recent(int limit) {
        List<Conversation> all;
        synchronized (conversations) {
            all = new ArrayList<>(conversations.values());
        }
        Collections.reverse(all);
        return all.size() > limit ? List.copyOf(all.subList(0, limit)) : all;
    }

    public int size() {
        return conversations.size();
    }
}
