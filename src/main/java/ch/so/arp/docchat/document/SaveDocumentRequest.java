package ch.so.arp.docchat.document;

import jakarta.validation.constraints.NotBlank;

/**
 * A generated document that should become searchable.
 */
public record SaveDocumentRequest(@NotBlank String title, @NotBlank String content, @NotBlank String category) {
}
