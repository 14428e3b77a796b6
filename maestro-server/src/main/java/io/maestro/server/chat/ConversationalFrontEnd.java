package io.maestro.server.chat;

import io.maestro.core.agent.AgentSnapshot;
import io.maestro.core.agent.AgentState;
import io.maestro.core.orchestrator.OrchestratorStatus;
import io.maestro.core.orchestrator.RequestResult;
import io.maestro.core.orchestrator.TaskFailure;
import io.maestro.core.orchestrator.TaskOutput;
import io.maestro.core.plan.UnroutablePortion;
import io.maestro.server.gateway.ProtocolGateway;
import io.maestro.server.validation.LogSanitizer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.jboss.logging.Logger;

/// Chat entry point: answers help, status, agent and example queries itself and turns every
/// other message into a `process_request` call.
///
/// Requests are submitted with the caller's record context and the constraints
/// `maxTasks=5, timeout=60s`. Replies are plain text. Each exchange is recorded as a
/// {@link Conversation}.
///
/// @see ChatIntent for intent detection
@ApplicationScoped
public class ConversationalFrontEnd {

    private static final Logger LOG = Logger.getLogger(ConversationalFrontEnd.class);

    static final Map<String, Object> REQUEST_CONSTRAINTS = Map.of("maxTasks", 5, "timeout", 60);

    static final String ERROR_REPLY =
            "Sorry, I encountered an error processing your request. Please try again or contact"
                    + " support.";

    static final String HELP_TEXT =
            """
            I'm your AI assistant! I can help you with various tasks:

            CRM Tasks:
            - Create leads and opportunities
            - Search for customers
            - Analyze sales data

            Sales Tasks:
            - Create sales orders
            - Generate quotations
            - Track sales performance

            Inventory Tasks:
            - Check stock levels
            - Manage products
            - Warehouse operations

            Accounting Tasks:
            - Create invoices
            - Generate reports
            - Financial analysis

            HR Tasks:
            - Search employees
            - Attendance tracking
            - HR analytics

            Just ask me what you need! For example:
            - "Create a new lead for ABC Company"
            - "Find all customers in New York"
            - "Check stock levels for product XYZ"
            - "Generate a sales report for this month\"""";

    static final String EXAMPLES_TEXT =
            """
            AI Assistant Examples:

            CRM:
            - "Create a new lead for Microsoft with contact John Doe"
            - "Find all leads with value over $10,000"
            - "Show me opportunities closing this month"

            Sales:
            - "Create a sales order for customer ABC Corp"
            - "Generate a quotation for product XYZ"
            - "Show sales performance for Q1"

            Inventory:
            - "Check stock levels for all products"
            - "Find products with low stock"
            - "Show warehouse locations"

            Accounting:
            - "Create an invoice for customer XYZ"
            - "Generate financial report for this month"
            - "Show outstanding payments"

            HR:
            - "Find employees in the sales department"
            - "Show attendance for this week"
            - "List all active employees"

            Just ask naturally - I'll understand and help you!""";

    private final ProtocolGateway gateway;
    private final ConversationStore conversations;

    @Inject
    public ConversationalFrontEnd(ProtocolGateway gateway, ConversationStore conversations) {
        this.gateway = gateway;
        this.conversations = conversations;
    }

    /// Answers one chat message.
    ///
    /// Never throws for engine or agent failures; those are rendered into the reply.
    ///
    /// @param message user message, not blank
    /// @param recordContext the record the user is looking at, may be null
    /// @param caller resolved caller identity, may be null
    /// @return the reply, never null
    /// @throws IllegalArgumentException if the message is blank
    public ChatReply respond(String message, Map<String, Object> recordContext, String caller) {
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message is required");
        }
        String text = message.strip();
        ChatIntent intent = ChatIntent.detect(text);
        Conversation conversation = conversations.create(caller, title(text));
        conversation.classify(intent);
        conversation.addMessage("user", text, recordContext);
        LOG.debugv(
                "Chat message from {0} classified as {1}: {2}",
                LogSanitizer.sanitize(caller), intent, LogSanitizer.sanitize(text));

        String reply;
        RequestResult result = null;
        try {
            switch (intent) {
                case HELP -> reply = HELP_TEXT;
                case STATUS -> reply = renderStatus(gateway.agentStatus());
                case AGENTS -> reply = renderAgents(gateway.listAgents());
                case EXAMPLES -> reply = EXAMPLES_TEXT;
                default -> {
                    result =
                            gateway.processRequest(
                                    text, recordContext, REQUEST_CONSTRAINTS, caller);
                    conversation.linkRequest(result.requestId());
                    reply = renderResult(result);
                }
            }
        } catch (RuntimeException e) {
            LOG.errorv(e, "Chat request failed: {0}", LogSanitizer.sanitize(text));
            reply = ERROR_REPLY;
            conversation.addMessage("assistant", reply, Map.of("error", String.valueOf(e)));
            conversation.end(ConversationState.FAILED);
            return new ChatReply(conversation.getId(), intent, reply, null, null);
        }

        conversation.addMessage("assistant", reply, null);
        conversation.end(failed(result) ? ConversationState.FAILED : ConversationState.COMPLETED);
        return new ChatReply(
                conversation.getId(),
                intent,
                reply,
                result != null ? result.requestId() : null,
                result != null ? result.status() : null);
    }

    private static boolean failed(RequestResult result) {
        return result != null
                && (result.status() == RequestResult.Status.REJECTED
                        || result.status() == RequestResult.Status.UNROUTABLE
                        || result.outputs().isEmpty());
    }

    private static String title(String text) {
        return text.length() > 50 ? text.substring(0, 50) + "..." : text;
    }

    // -- Rendering ------------------------------------------------------------------------

    static String renderStatus(OrchestratorStatus status) {
        return String.format(
                Locale.ROOT,
                "AI System Status:%n"
                        + "- Orchestrator: %s%n"
                        + "- Active Agents: %d/%d%n"
                        + "- Total Tasks: %d%n"
                        + "- Success Rate: %.1f%%",
                status.state().name().toLowerCase(Locale.ROOT),
                status.activeAgentCount(),
                status.agents().size(),
                status.tasksProcessed(),
                status.successRate());
    }

    static String renderAgents(List<AgentSnapshot> agents) {
        if (agents.isEmpty()) {
            return "No AI agents are currently available.";
        }
        StringBuilder sb = new StringBuilder("Available AI Agents:");
        for (AgentSnapshot agent : agents) {
            sb.append(System.lineSeparator())
                    .append(agent.state() == AgentState.ACTIVE ? "[on] " : "[off] ")
                    .append(agent.name())
                    .append(" (")
                    .append(agent.type())
                    .append(')');
            if (!agent.description().isBlank()) {
                sb.append(System.lineSeparator()).append("   ").append(agent.description());
            }
            sb.append(System.lineSeparator())
                    .append(
                            String.format(
                                    Locale.ROOT,
                                    "   Tasks: %d, Success: %.1f%%",
                                    agent.totalTasks(),
                                    agent.successRate()));
        }
        return sb.toString();
    }

    static String renderResult(RequestResult result) {
        StringBuilder sb = new StringBuilder();
        switch (result.status()) {
            case REJECTED -> {
                return "Sorry, I couldn't process your request: " + result.message();
            }
            case UNROUTABLE ->
                    sb.append("I couldn't match your request to any available agent.");
            default -> sb.append("Goal: ").append(result.goal());
        }

        if (!result.outputs().isEmpty() || !result.failures().isEmpty()) {
            sb.append(System.lineSeparator()).append("Results:");
            for (TaskOutput output : result.outputs()) {
                sb.append(System.lineSeparator())
                        .append("  [done] Step ")
                        .append(output.index() + 1)
                        .append(" (")
                        .append(output.capability())
                        .append("): completed by ")
                        .append(output.agentId());
                Object status = output.output().get("status");
                if (status != null) {
                    sb.append(", status ").append(status);
                }
            }
            for (TaskFailure failure : result.failures()) {
                sb.append(System.lineSeparator())
                        .append("  [failed] Step ")
                        .append(failure.index() + 1)
                        .append(" (")
                        .append(failure.capability())
                        .append("): ")
                        .append(failure.message());
            }
        }

        if (!result.unroutablePortions().isEmpty()) {
            sb.append(System.lineSeparator()).append("Not handled:");
            for (UnroutablePortion portion : result.unroutablePortions()) {
                sb.append(System.lineSeparator())
                        .append("  - \"")
                        .append(portion.text())
                        .append("\": ")
                        .append(portion.reason());
            }
        }
        return sb.toString();
    }
}
