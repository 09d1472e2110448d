package ch.so.arp.docchat.chat;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import ch.so.arp.docchat.error.ValidationException;

/**
 * The two assistants offered by the chat endpoint. Each one answers with its
 * own system prompt.
 */
public enum AgentMode {

    DOCUMENT_SEARCH("document-search", """
            You are a document search assistant. Answer the question using only the provided document \
            excerpts. Cite the document titles you rely on. If the excerpts do not contain the answer, \
            say so instead of guessing."""),

    DOCUMENT_CREATOR("document-creator", """
            You are a document creation assistant. Write a complete, well structured document in Markdown \
            with headings for each section. Use the provided document excerpts as reference material for \
            tone, terminology and existing rules.""");

    private final String value;
    private final String systemPrompt;

    AgentMode(String value, String systemPrompt) {
        this.value = value;
        this.systemPrompt = systemPrompt;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public String systemPrompt() {
        return systemPrompt;
    }

    @JsonCreator
    public static AgentMode fromValue(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (AgentMode mode : values()) {
                if (mode.value.equals(normalized)) {
                    return mode;
                }
            }
        }
        throw new ValidationException("Unknown agent mode '" + value + "', expected one of "
                + Arrays.stream(values()).map(AgentMode::value).collect(Collectors.joining(", ")));
    }

    @Override
    public String toString() {
        return value;
    }
}
