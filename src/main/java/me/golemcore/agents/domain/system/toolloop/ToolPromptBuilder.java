package me.golemcore.agents.domain.system.toolloop;

import me.golemcore.agents.domain.model.ToolExample;
import me.golemcore.agents.domain.model.ToolParameter;
import me.golemcore.agents.domain.model.ToolSchema;
import me.golemcore.agents.domain.tools.ToolRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds the system prompt for tool-enabled turns: the agent's base prompt
 * followed by a description of every offered tool and a short usage reminder.
 */
public class ToolPromptBuilder {

    static final String TOOL_ENABLED_PROMPT = """
            You are a helpful AI assistant with access to external tools. When you need to perform \
            specific tasks that you have tools for, you MUST use the appropriate tools rather than trying \
            to do the work manually.

            IMPORTANT TOOL USAGE RULES:
            1. Always use tools when they are available for the task at hand
            2. Don't perform calculations manually if you have a calculator tool
            3. Don't guess at information if you have tools to fetch it
            4. Use tools even for simple tasks to ensure accuracy
            5. Explain what tool you're using and why

            Available tools will be described below. Pay attention to when each tool should be used.""";

    static final String MATH_PROMPT = """
            You are a mathematical assistant with access to calculation tools. Your primary role is to help \
            users with mathematical problems, equations, and numerical calculations.

            MATHEMATICAL TOOL USAGE:
            - ALWAYS use the calculator tool for ANY mathematical operations, even simple ones
            - Never perform mental math when tools are available
            - Show your work by explaining what calculation you're performing
            - Break down complex problems into steps and use tools for each step

            Be precise, accurate, and always rely on tools for calculations.""";

    static final String CODING_PROMPT = """
            You are a coding assistant that helps with programming tasks. You have access to various tools \
            to help analyze code, fetch documentation, and assist with development tasks.

            CODING TOOL USAGE:
            - Use text processing tools to analyze and format code
            - Use HTTP tools to test API endpoints
            - Always verify information with tools when possible

            Provide practical, working solutions with clear explanations.""";

    static final String RESEARCH_PROMPT = """
            You are a research assistant that helps gather and analyze information. You have access to \
            various tools to fetch data, process text, and analyze content.

            RESEARCH TOOL USAGE:
            - Use HTTP tools to fetch information from APIs and websites
            - Use text processing tools to analyze and summarize content
            - Use JSON tools to parse and analyze structured data
            - Always cite your sources and verify information with tools

            Be thorough, accurate, and always use tools to gather fresh information.""";

    static final String GENERAL_PROMPT = """
            You are a versatile AI assistant with access to various tools. You can help with calculations, \
            research, text processing, web requests, and more.

            GENERAL TOOL USAGE GUIDELINES:
            - Assess each request to determine which tools would be helpful
            - Use calculator tools for any mathematical operations
            - Use HTTP tools for fetching external information
            - Use text processing tools for analyzing or manipulating text
            - Use JSON tools for working with structured data
            - Always prefer tool-based solutions over manual work

            Be helpful, accurate, and make full use of your available tools.""";

    private static final Map<String, String> USAGE_HINTS = Map.of(
            "calculator", """
                    CALCULATOR TOOL USAGE:
                    - Use for ANY mathematical calculation, even simple addition
                    - Supported operations: addition (+), subtraction (-), multiplication (*), division (/), \
                    modulo (%), power (^), square root (sqrt(n)), absolute value (abs(n))
                    - Format: Use expressions like "5 + 3", "2 * 7", "sqrt(16)", "abs(-5)", or "2^3"
                    - ALWAYS use this tool instead of mental math
                    - Example: To calculate 15 * 23, call calculator with "15 * 23\"""",
            "http_get", """
                    HTTP GET TOOL USAGE:
                    - Use to fetch data from web APIs and URLs
                    - Can retrieve JSON data, HTML content, or plain text
                    - Include timeout parameter (recommended: 10 seconds)
                    - Add custom headers if needed for API authentication
                    - Example: Fetch data from "https://api.example.com/data\"""",
            "text_processor", """
                    TEXT PROCESSOR TOOL USAGE:
                    - Use for text manipulation and analysis operations
                    - Operations: uppercase, lowercase, title_case, word_count, char_count, reverse, trim, \
                    extract_emails, extract_urls
                    - Always specify both "text" and "operation" parameters
                    - Example: Count words in text using operation "word_count\"""",
            "json_processor", """
                    JSON PROCESSOR TOOL USAGE:
                    - Use for JSON data manipulation and analysis
                    - Operations: validate, pretty_print, minify, extract_keys, get_value
                    - For get_value operation, specify "path" parameter (e.g., "user.name")
                    - Example: Extract keys from JSON object or format JSON data""",
            "memory", """
                    MEMORY TOOL USAGE:
                    - Use to remember user preferences, facts and behaviors across conversations
                    - Actions: store, recall, search, update, delete, stats
                    - store needs "topic" and "content"; set "importance" (1-10) for things that matter
                    - Recall by topic before answering questions about the user
                    - Example: Store that the user prefers brief answers under topic "user_preferences\"""");

    private final ToolRegistry toolRegistry;

    public ToolPromptBuilder(ToolRegistry toolRegistry) {
        this.toolRegistry = toolRegistry;
    }

    /**
     * Base prompt (or the default tool-enabled prompt when blank), then one
     * section per registered tool in {@code toolNames}. Unknown names are
     * skipped.
     */
    public String buildSystemPrompt(String basePrompt, List<String> toolNames) {
        StringBuilder prompt = new StringBuilder();
        prompt.append(basePrompt == null || basePrompt.isEmpty() ? TOOL_ENABLED_PROMPT : basePrompt);
        prompt.append("\n\n");

        if (toolNames == null || toolNames.isEmpty()) {
            return prompt.toString();
        }

        prompt.append("=== AVAILABLE TOOLS ===\n");
        prompt.append("You have access to the following tools. Use them whenever appropriate:\n\n");

        for (String toolName : toolNames) {
            toolRegistry.get(toolName).ifPresent(tool -> {
                ToolSchema schema = tool.getSchema();
                prompt.append("**").append(schema.getName()).append("**: ")
                        .append(schema.getDescription()).append('\n');
                String hint = USAGE_HINTS.get(toolName);
                prompt.append(hint != null ? hint + "\n" : describeParameters(schema));
                prompt.append('\n');
            });
        }

        prompt.append("=== TOOL USAGE REMINDER ===\n");
        prompt.append("- ALWAYS use tools when they match the task requirements\n");
        prompt.append("- Don't perform manual work that tools can do\n");
        prompt.append("- Explain which tool you're using and why\n");
        prompt.append("- Use multiple tools if needed to complete complex tasks\n\n");
        return prompt.toString();
    }

    /**
     * Prompt for a named assistant persona ({@code math}, {@code coding},
     * {@code research}, anything else is general). A custom prompt replaces the
     * persona text.
     */
    public String buildAgentTypePrompt(String agentType, List<String> toolNames, String customPrompt) {
        String base;
        if (customPrompt != null && !customPrompt.isEmpty()) {
            base = customPrompt + "\n\n"
                    + "You have access to tools that can help you complete tasks more accurately and efficiently.";
        } else {
            String type = agentType != null ? agentType.toLowerCase(Locale.ROOT) : "";
            base = switch (type) {
            case "math", "calculator", "mathematical" -> MATH_PROMPT;
            case "coding", "programming", "development" -> CODING_PROMPT;
            case "research", "analysis", "investigation" -> RESEARCH_PROMPT;
            default -> GENERAL_PROMPT;
            };
        }
        return buildSystemPrompt(base, toolNames);
    }

    /**
     * Keyword-based hints naming tools that look relevant for a request.
     */
    public List<String> suggestTools(String request, List<String> toolNames) {
        List<String> suggestions = new ArrayList<>();
        if (request == null || toolNames == null) {
            return suggestions;
        }
        String text = request.toLowerCase(Locale.ROOT);

        if (containsAny(text, "calculate", "add", "subtract", "multiply", "divide", "square root", "sqrt", "+",
                "-", "*", "/", "=", "math") && toolNames.contains("calculator")) {
            suggestions.add("calculator: This request involves mathematical calculations");
        }
        if (containsAny(text, "fetch", "get data", "api", "url", "website", "http", "download")
                && toolNames.contains("http_get")) {
            suggestions.add("http_get: This request involves fetching web data");
        }
        if (containsAny(text, "count words", "extract", "uppercase", "lowercase", "process text", "analyze text")
                && toolNames.contains("text_processor")) {
            suggestions.add("text_processor: This request involves text manipulation");
        }
        if (containsAny(text, "json", "parse", "format json", "validate json")
                && toolNames.contains("json_processor")) {
            suggestions.add("json_processor: This request involves JSON processing");
        }
        if (containsAny(text, "remember", "recall", "forget", "my preference", "last time")
                && toolNames.contains("memory")) {
            suggestions.add("memory: This request involves remembering or recalling information");
        }
        return suggestions;
    }

    private String describeParameters(ToolSchema schema) {
        StringBuilder usage = new StringBuilder("Parameters:\n");
        for (ToolParameter parameter : schema.getParameters()) {
            usage.append("  - ").append(parameter.getName())
                    .append(" (").append(parameter.getType().jsonName())
                    .append(", ").append(parameter.isRequired() ? "required" : "optional")
                    .append("): ").append(parameter.getDescription()).append('\n');
        }
        if (!schema.getExamples().isEmpty()) {
            usage.append("Examples:\n");
            for (ToolExample example : schema.getExamples()) {
                usage.append("  - ").append(example.description()).append('\n');
            }
        }
        return usage.toString();
    }

    private static boolean containsAny(String text, String... keywords) {
        for (String keyword : keywords) {
            if (text.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
