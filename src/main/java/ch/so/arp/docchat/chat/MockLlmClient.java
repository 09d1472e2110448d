package ch.so.arp.docchat.chat;

/**
 * Deterministic {@link LlmClient} used in tests and local development where the
 * OpenAI API should not be contacted.
 */
class MockLlmClient implements LlmClient {

    @Override
    public String generate(String prompt, String context, AgentMode agentMode) {
        StringBuilder answer = new StringBuilder();
        answer.append("[mocked ").append(agentMode.value()).append(" answer]\n\n");
        answer.append("Provide an API key to reach the real OpenAI service.\n");
        answer.append("Question was: ").append(prompt).append('\n');
        if (context.isEmpty()) {
            answer.append("No document excerpts were found.");
        } else {
            answer.append("Document excerpts (").append(context.length()).append(" characters):\n\n");
            answer.append(context);
        }
        return answer.toString();
    }
}
