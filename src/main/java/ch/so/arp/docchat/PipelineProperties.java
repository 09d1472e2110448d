package ch.so.arp.docchat;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings of the ingestion and retrieval pipeline. Embedding and OpenAI chat
 * settings live in their own property classes.
 */
@ConfigurationProperties(prefix = "rag")
public class PipelineProperties {

    private final Chunking chunking = new Chunking();

    private final Retrieval retrieval = new Retrieval();

    private final Chat chat = new Chat();

    public Chunking getChunking() {
        return chunking;
    }

    public Retrieval getRetrieval() {
        return retrieval;
    }

    public Chat getChat() {
        return chat;
    }

    public static class Chunking {

        /**
         * Length of a chunk in characters.
         */
        private int windowSize = 1000;

        /**
         * Characters shared by two consecutive chunks. Must be smaller than the
         * window size.
         */
        private int overlap = 200;

        public int getWindowSize() {
            return windowSize;
        }

        public void setWindowSize(int windowSize) {
            this.windowSize = windowSize;
        }

        public int getOverlap() {
            return overlap;
        }

        public void setOverlap(int overlap) {
            this.overlap = overlap;
        }
    }

    public static class Retrieval {

        /**
         * Number of results when a search does not ask for a limit.
         */
        private int defaultLimit = 5;

        /**
         * Upper bound of the context handed to the language model.
         */
        private int maxContextChars = 8000;

        public int getDefaultLimit() {
            return defaultLimit;
        }

        public void setDefaultLimit(int defaultLimit) {
            this.defaultLimit = defaultLimit;
        }

        public int getMaxContextChars() {
            return maxContextChars;
        }

        public void setMaxContextChars(int maxContextChars) {
            this.maxContextChars = maxContextChars;
        }
    }

    public static class Chat {

        /**
         * Time a chat request may take, retrieval and generation included.
         */
        private Duration requestTimeout = Duration.ofSeconds(60);

        public Duration getRequestTimeout() {
            return requestTimeout;
        }

        public void setRequestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
        }
    }
}
