package ch.so.arp.docchat.document;

import java.time.Instant;
import java.util.Objects;

/**
 * An ingested document. Documents are never modified after creation, they can
 * only be deleted together with their chunks.
 *
 * @param ownerId optional owner, {@code null} for shared documents
 */
public record Document(
        String id,
        String title,
        String content,
        DocumentCategory category,
        String sourceFileName,
        Instant uploadedAt,
        String ownerId) {

    public Document {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(sourceFileName, "sourceFileName");
        Objects.requireNonNull(uploadedAt, "uploadedAt");
    }
}
