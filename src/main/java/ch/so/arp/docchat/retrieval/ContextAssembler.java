package ch.so.arp.docchat.retrieval;

import java.util.List;
import java.util.stream.Collectors;

import ch.so.arp.docchat.document.SearchResult;
import ch.so.arp.docchat.error.ValidationException;

/**
 * Formats retrieved chunks into the context string handed to the language
 * model. Blocks keep the order of the results; the joined string is cut at the
 * requested number of characters, even inside a block.
 */
public class ContextAssembler {

    static final String SEPARATOR = "\n\n---\n\n";

    public String buildContext(List<SearchResult> results, int maxChars) {
        if (maxChars < 0) {
            throw new ValidationException("Maximum context length must not be negative (got " + maxChars + ")");
        }
        if (results == null || results.isEmpty()) {
            return "";
        }
        String context = results.stream()
                .map(ContextAssembler::block)
                .collect(Collectors.joining(SEPARATOR));
        return context.length() <= maxChars ? context : context.substring(0, maxChars);
    }

    private static String block(SearchResult result) {
        return "Document: " + result.document().title() + " (" + result.document().category().value() + ")\n"
                + "Content: " + result.chunk().content();
    }
}
