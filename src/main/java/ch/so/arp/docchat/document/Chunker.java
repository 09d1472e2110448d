package ch.so.arp.docchat.document;

import java.util.ArrayList;
import java.util.List;

import ch.so.arp.docchat.error.ConfigurationException;

/**
 * Deterministic sliding window splitter. Windows of {@code windowSize}
 * characters are taken every {@code windowSize - overlap} characters until a
 * window reaches the end of the text. Blank windows are dropped; the index of
 * a window is derived from its offset, so dropped windows leave a gap.
 */
public final class Chunker {

    private final int windowSize;
    private final int overlap;

    public Chunker(int windowSize, int overlap) {
        if (windowSize <= 0) {
            throw new ConfigurationException("Chunk window size must be positive (got " + windowSize + ")");
        }
        if (overlap < 0 || overlap >= windowSize) {
            throw new ConfigurationException(
                    "Chunk overlap must be >= 0 and < window size " + windowSize + " (got " + overlap + ")");
        }
        this.windowSize = windowSize;
        this.overlap = overlap;
    }

    public int windowSize() {
        return windowSize;
    }

    public int overlap() {
        return overlap;
    }

    public List<TextChunk> chunk(String text) {
        List<TextChunk> chunks = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return chunks;
        }
        int step = windowSize - overlap;
        int length = text.length();
        for (int offset = 0; offset < length; offset += step) {
            int end = Math.min(offset + windowSize, length);
            String window = text.substring(offset, end);
            if (!window.isBlank()) {
                chunks.add(new TextChunk(window, offset / step, offset));
            }
            if (end == length) {
                break;
            }
        }
        return chunks;
    }

    /**
     * Convenience for one-off splits with explicit parameters.
     */
    public static List<TextChunk> chunk(String text, int windowSize, int overlap) {
        return new Chunker(windowSize, overlap).chunk(text);
    }
}
