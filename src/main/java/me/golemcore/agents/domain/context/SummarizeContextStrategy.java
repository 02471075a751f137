package me.golemcore.agents.domain.context;

import me.golemcore.agents.domain.model.Message;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Replaces older history with a one-line synthetic summary once the history
 * exceeds {@code max_context_length}, keeping the last {@code keep_recent}
 * messages verbatim.
 *
 * <p>
 * The summary counts user and assistant messages and lists the topic keywords
 * found in the summarized part, in a fixed order.
 */
@Component
public class SummarizeContextStrategy implements ContextStrategy {

    public static final String NAME = "summarize";
    static final int DEFAULT_MAX_CONTEXT_LENGTH = 20;
    static final int DEFAULT_KEEP_RECENT = 5;

    private static final List<String> TOPIC_KEYWORDS = List.of(
            "code", "programming", "bug", "error", "help", "question", "problem", "solution");

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Map<String, Object> defaultConfig() {
        return Map.of("max_context_length", DEFAULT_MAX_CONTEXT_LENGTH, "keep_recent", DEFAULT_KEEP_RECENT);
    }

    @Override
    public List<Message> buildContext(String systemPrompt, String agentPrompt, List<Message> history,
            Map<String, Object> config) {
        int maxContextLength = ContextSupport.intParam(config, "max_context_length", DEFAULT_MAX_CONTEXT_LENGTH);
        int keepRecent = ContextSupport.intParam(config, "keep_recent", DEFAULT_KEEP_RECENT);
        if (maxContextLength <= 0 || keepRecent <= 0) {
            throw new ContextStrategyException("max_context_length and keep_recent must be positive");
        }

        List<Message> safeHistory = history != null ? history : List.of();
        List<Message> context = new ArrayList<>();
        context.add(ContextSupport.systemMessage(systemPrompt, agentPrompt));

        int toSummarize = safeHistory.size() - keepRecent;
        if (safeHistory.size() <= maxContextLength || toSummarize <= 0) {
            context.addAll(safeHistory);
            return context;
        }

        List<Message> older = safeHistory.subList(0, toSummarize);
        context.add(Message.system("Previous conversation summary: " + summarize(older)));
        context.addAll(safeHistory.subList(toSummarize, safeHistory.size()));
        return context;
    }

    String summarize(List<Message> messages) {
        int user = 0;
        int assistant = 0;
        for (Message message : messages) {
            if (message.isUserMessage()) {
                user++;
            } else if (message.isAssistantMessage()) {
                assistant++;
            }
        }

        StringBuilder summary = new StringBuilder()
                .append("The conversation included ").append(user)
                .append(" user messages and ").append(assistant).append(" assistant responses");

        List<String> topics = extractTopics(messages);
        if (!topics.isEmpty()) {
            summary.append(". Topics discussed: ").append(String.join(", ", topics));
        }
        return summary.append('.').toString();
    }

    private List<String> extractTopics(List<Message> messages) {
        List<String> found = new ArrayList<>();
        for (String keyword : TOPIC_KEYWORDS) {
            for (Message message : messages) {
                String content = message.getContent();
                if (content != null && content.toLowerCase(Locale.ROOT).contains(keyword)) {
                    found.add(keyword);
                    break;
                }
            }
        }
        return found;
    }
}
