package me.golemcore.agent.domain.system.toolloop.view;

import me.golemcore.agent.domain.model.Message;

import java.util.List;

/**
 * Builds the initial message sequence of a run: system prompt, converted
 * history, then the current query.
 */
public interface MessageAssembler {

    ConversationView assemble(String query, List<Message> history);
}
