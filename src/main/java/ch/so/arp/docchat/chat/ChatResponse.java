package ch.so.arp.docchat.chat;

import java.util.List;

import ch.so.arp.docchat.retrieval.SearchHit;

/**
 * Generated answer together with the chunks it was grounded on.
 */
public record ChatResponse(String response, List<SearchHit> sources) {
}
