package ch.so.arp.docchat.document;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Raw document text submitted for ingestion. The owner is optional.
 */
public record IngestionRequest(
        @NotBlank String title,
        @NotNull String content,
        @NotBlank String category,
        String sourceFileName,
        String ownerId) {
}
