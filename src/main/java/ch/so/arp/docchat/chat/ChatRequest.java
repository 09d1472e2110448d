package ch.so.arp.docchat.chat;

import jakarta.validation.constraints.NotBlank;

/**
 * Incoming payload for chat requests. Without an agent mode the document
 * search assistant answers.
 */
public record ChatRequest(@NotBlank String prompt, AgentMode agentMode) {
}
