package me.golemcore.agent.domain.system.toolloop.view;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.model.Message;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Default assembler.
 *
 * <p>
 * Exactly one system message is prepended. History entries keep their order;
 * tool messages without a {@code toolCallId} are dropped with a diagnostic and
 * unknown roles are sent as {@code user}. The query is always last.
 */
@Slf4j
public class DefaultMessageAssembler implements MessageAssembler {

    static final String DROPPED_TOOL_MESSAGE = "Dropping invalid tool message: missing toolCallId";

    private static final Set<String> KNOWN_ROLES = Set.of(Message.ROLE_SYSTEM, Message.ROLE_USER,
            Message.ROLE_ASSISTANT, Message.ROLE_TOOL);

    private final String systemPrompt;

    public DefaultMessageAssembler(String systemPrompt) {
        this.systemPrompt = systemPrompt != null ? systemPrompt : "";
    }

    @Override
    public ConversationView assemble(String query, List<Message> history) {
        List<Message> messages = new ArrayList<>();
        List<String> diagnostics = new ArrayList<>();

        messages.add(Message.system(systemPrompt));

        if (history != null) {
            for (Message entry : history) {
                Message converted = convert(entry, diagnostics);
                if (converted != null) {
                    messages.add(converted);
                }
            }
        }

        messages.add(Message.user(query != null ? query : ""));
        return new ConversationView(messages, diagnostics);
    }

    private Message convert(Message entry, List<String> diagnostics) {
        if (entry == null) {
            return null;
        }
        if (entry.isToolMessage()) {
            if (entry.getToolCallId() == null || entry.getToolCallId().isEmpty()) {
                log.warn("[Assembler] {} (tool: {})", DROPPED_TOOL_MESSAGE, entry.getName());
                diagnostics.add(DROPPED_TOOL_MESSAGE);
                return null;
            }
            return entry;
        }
        if (entry.getRole() == null || !KNOWN_ROLES.contains(entry.getRole())) {
            log.debug("[Assembler] Unknown message role '{}', sending as user", entry.getRole());
            return entry.toBuilder().role(Message.ROLE_USER).build();
        }
        return entry;
    }
}
