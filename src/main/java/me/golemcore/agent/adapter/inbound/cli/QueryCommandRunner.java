package me.golemcore.agent.adapter.inbound.cli;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.loop.AgentLoop;
import me.golemcore.agent.domain.loop.AgentLoopFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.List;

/**
 * Runs a single query at startup and prints the answer.
 *
 * <p>
 * Active only when {@code agent.cli.enabled=true}. Usage:
 *
 * <pre>
 * java -jar golemcore-agent.jar --agent.cli.enabled=true --query="What time is it in Tokyo?"
 * java -jar golemcore-agent.jar --agent.cli.enabled=true --query="Tell me a story" --stream
 * </pre>
 */
@Component
@ConditionalOnProperty(prefix = "agent.cli", name = "enabled", havingValue = "true")
@Slf4j
public class QueryCommandRunner implements ApplicationRunner {

    static final String OPTION_QUERY = "query";
    static final String OPTION_STREAM = "stream";

    private final AgentLoopFactory agentLoopFactory;
    private final PrintStream out;

    @Autowired
    public QueryCommandRunner(AgentLoopFactory agentLoopFactory) {
        this(agentLoopFactory, System.out);
    }

    QueryCommandRunner(AgentLoopFactory agentLoopFactory, PrintStream out) {
        this.agentLoopFactory = agentLoopFactory;
        this.out = out;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> values = args.getOptionValues(OPTION_QUERY);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            log.info("[CLI] No --query given, nothing to run");
            return;
        }
        String query = values.get(0);
        AgentLoop agent = agentLoopFactory.create();

        if (args.containsOption(OPTION_STREAM)) {
            agent.runStream(query, null)
                    .doOnNext(out::print)
                    .blockLast();
            out.println();
        } else {
            out.println(agent.run(query, null));
        }
        out.flush();
    }
}
