package ch.so.arp.docchat.document;

/**
 * Window produced by the {@link Chunker} before it is attached to a document.
 *
 * @param startOffset offset of the first character within the source text
 */
public record TextChunk(String content, int chunkIndex, int startOffset) {
}
