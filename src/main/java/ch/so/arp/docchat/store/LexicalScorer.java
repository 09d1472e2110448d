package ch.so.arp.docchat.store;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

import ch.so.arp.docchat.error.ValidationException;

/**
 * Deterministic keyword relevance used by lexical search. A chunk containing
 * the whole query scores {@code 1.0}; otherwise the score is the share of
 * distinct query terms found in the chunk.
 */
final class LexicalScorer {

    private static final Pattern NON_WORD = Pattern.compile("\\W+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final int MIN_TERM_LENGTH = 2;

    private final String phrase;
    private final Set<String> terms;

    private LexicalScorer(String phrase, Set<String> terms) {
        this.phrase = phrase;
        this.terms = terms;
    }

    static LexicalScorer forQuery(String query) {
        if (query == null || query.isBlank()) {
            throw new ValidationException("Search query must not be empty");
        }
        String phrase = WHITESPACE.matcher(query.strip().toLowerCase(Locale.ROOT)).replaceAll(" ");
        Set<String> terms = new LinkedHashSet<>();
        for (String token : NON_WORD.split(phrase)) {
            if (token.length() >= MIN_TERM_LENGTH) {
                terms.add(token);
            }
        }
        return new LexicalScorer(phrase, Set.copyOf(terms));
    }

    String phrase() {
        return phrase;
    }

    Set<String> terms() {
        return terms;
    }

    double score(String content) {
        if (content == null || content.isEmpty()) {
            return 0.0d;
        }
        String normalized = WHITESPACE.matcher(content.toLowerCase(Locale.ROOT)).replaceAll(" ");
        if (normalized.contains(phrase)) {
            return 1.0d;
        }
        if (terms.isEmpty()) {
            return 0.0d;
        }
        long matched = terms.stream().filter(normalized::contains).count();
        return (double) matched / (double) terms.size();
    }
}
