package ch.so.arp.docchat.retrieval;

import java.util.List;

import org.springframework.http.MediaType;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import jakarta.validation.Valid;

/**
 * REST endpoint for similarity search over the stored chunks.
 */
@RestController
@RequestMapping(path = "/api/search", produces = MediaType.APPLICATION_JSON_VALUE)
@Validated
public class SearchController {

    private final RetrievalEngine retrievalEngine;

    public SearchController(RetrievalEngine retrievalEngine) {
        this.retrievalEngine = retrievalEngine;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public List<SearchHit> search(@Valid @RequestBody SearchRequest request) {
        int limit = request.limit() != null ? request.limit() : retrievalEngine.defaultLimit();
        return retrievalEngine.search(request.query(), limit).stream()
                .map(SearchHit::of)
                .toList();
    }
}
