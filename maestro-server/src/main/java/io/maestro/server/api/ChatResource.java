package io.maestro.server.api;

import io.maestro.server.chat.ChatReply;
import io.maestro.server.chat.Conversation;
import io.maestro.server.chat.ConversationStore;
import io.maestro.server.chat.ConversationalFrontEnd;
import io.maestro.server.security.CallerResolver;
import io.maestro.server.validation.ValidId;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import java.util.List;
import java.util.Map;

/// REST resource of the conversational front end.
///
/// ### Request
/// ```
/// POST /api/v1/chat
/// X-Caller-Id: jane
///
/// {"message": "Create a lead for ACME", "context": {"record_model": "res.partner"}}
/// ```
///
/// ### Response (200 OK)
/// ```json
/// {"conversationId": "conv-...", "intent": "REQUEST", "reply": "Goal: ...",
///  "requestId": "req-...", "status": "SUCCESS"}
/// ```
@Path("/api/v1/chat")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class ChatResource {

    private final ConversationalFrontEnd frontEnd;
    private final ConversationStore conversations;
    private final CallerResolver callerResolver;

    @Inject
    public ChatResource(
            ConversationalFrontEnd frontEnd,
            ConversationStore conversations,
            CallerResolver callerResolver) {
        this.frontEnd = frontEnd;
        this.conversations = conversations;
        this.callerResolver = callerResolver;
    }

    @POST
    public ChatReply chat(
            @Valid @NotNull ChatMessage request,
            @HeaderParam(CallerResolver.HEADER) String callerHeader) {
        return frontEnd.respond(
                request.message(), request.context(), callerResolver.resolve(callerHeader));
    }

    @GET
    @Path("/conversations")
    public List<Conversation> conversations(@QueryParam("limit") @DefaultValue("20") int limit) {
        return conversations.recent(Math.max(1, Math.min(limit, 200)));
    }

    /// Returns one recorded conversation.
    ///
    /// @param conversationId conversation identifier
    /// @return 200 with the conversation, or 404 if unknown or evicted
    @GET
    @Path("/conversations/{id}")
    public Conversation conversation(@PathParam("id") @ValidId String conversationId) {
        return conversations
                .find(conversationId)
                .orElseThrow(() -> new NotFoundException("Conversation not found"));
    }

    /// Body of `POST /api/v1/chat`.
    ///
    /// @param message user message, not blank
    /// @param context the record the user is looking at, may be null
    public record ChatMessage(
            @NotBlank(message = "message is required") String message,
            Map<String, Object> context) {}
}
