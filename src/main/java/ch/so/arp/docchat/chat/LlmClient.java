package ch.so.arp.docchat.chat;

/**
 * Abstraction over the language model integration. Implementations can either
 * invoke the real OpenAI API or return predictable responses for testing.
 */
public interface LlmClient {

    /**
     * Generate an answer for the prompt.
     *
     * @param prompt    the user prompt
     * @param context   assembled document excerpts, may be empty
     * @param agentMode selects the system prompt
     * @return the generated text
     * @throws ch.so.arp.docchat.error.ServiceException if the model cannot be
     *                                                  reached or rejects the
     *                                                  request
     */
    String generate(String prompt, String context, AgentMode agentMode);
}
