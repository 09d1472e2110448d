package ch.so.arp.docchat.store;

import java.util.List;
import java.util.Objects;

import ch.so.arp.docchat.document.SearchResult;

/**
 * Answer of {@link ChunkStore#vectorSearch(float[], int)}: either a ranked
 * result list or the statement that vector search cannot serve the query.
 */
public sealed interface VectorSearchOutcome permits VectorSearchOutcome.Ranked, VectorSearchOutcome.Unavailable {

    static VectorSearchOutcome ranked(List<SearchResult> results) {
        return new Ranked(List.copyOf(results));
    }

    static VectorSearchOutcome unavailable(String reason) {
        return new Unavailable(reason);
    }

    record Ranked(List<SearchResult> results) implements VectorSearchOutcome {

        public Ranked {
            Objects.requireNonNull(results, "results");
        }
    }

    record Unavailable(String reason) implements VectorSearchOutcome {

        public Unavailable {
            Objects.requireNonNull(reason, "reason");
        }
    }
}
