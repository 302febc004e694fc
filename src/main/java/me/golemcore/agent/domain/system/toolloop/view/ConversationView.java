package me.golemcore.agent.domain.system.toolloop.view;

import me.golemcore.agent.domain.model.Message;

import java.util.List;

/**
 * Assembled message sequence for a run, plus diagnostics about history entries
 * that were dropped or rewritten while assembling it.
 */
public record ConversationView(List<Message> messages, List<String> diagnostics) {

    public ConversationView {
        messages = messages == null ? List.of() : List.copyOf(messages);
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    public static ConversationView ofMessages(List<Message> messages) {
        return new ConversationView(messages, List.of());
    }
}
