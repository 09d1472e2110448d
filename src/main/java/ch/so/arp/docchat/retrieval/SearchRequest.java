package ch.so.arp.docchat.retrieval;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * Incoming payload for search requests. A missing limit selects the configured
 * default.
 */
public record SearchRequest(@NotBlank String query, @Min(1) Integer limit) {
}
