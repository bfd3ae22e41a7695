package com.williamcallahan.videochat.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private Chunking chunking = new Chunking();
    private Retrieval retrieval = new Retrieval();
    private Rerank rerank = new Rerank();
    private Embedding embedding = new Embedding();
    private Llm llm = new Llm();
    private Transcription transcription = new Transcription();
    private Ingestion ingestion = new Ingestion();
    private Qdrant qdrant = new Qdrant();
    private Summary summary = new Summary();
    private Quiz quiz = new Quiz();
    private Conversation conversation = new Conversation();

    public Chunking getChunking() {
        return chunking;
    }

    public void setChunking(Chunking chunking) {
        this.chunking = chunking;
    }

    public Retrieval getRetrieval() {
        return retrieval;
    }

    public void setRetrieval(Retrieval retrieval) {
        this.retrieval = retrieval;
    }

    public Rerank getRerank() {
        return rerank;
    }

    public void setRerank(Rerank rerank) {
        this.rerank = rerank;
    }

    public Embedding getEmbedding() {
        return embedding;
    }

    public void setEmbedding(Embedding embedding) {
        this.embedding = embedding;
    }

    public Llm getLlm() {
        return llm;
    }

    public void setLlm(Llm llm) {
        this.llm = llm;
    }

    public Transcription getTranscription() {
        return transcription;
    }

    public void setTranscription(Transcription transcription) {
        this.transcription = transcription;
    }

    public Ingestion getIngestion() {
        return ingestion;
    }

    public void setIngestion(Ingestion ingestion) {
        this.ingestion = ingestion;
    }

    public Qdrant getQdrant() {
        return qdrant;
    }

    public void setQdrant(Qdrant qdrant) {
        this.qdrant = qdrant;
    }

    public Summary getSummary() {
        return summary;
    }

    public void setSummary(Summary summary) {
        this.summary = summary;
    }

    public Quiz getQuiz() {
        return quiz;
    }

    public void setQuiz(Quiz quiz) {
        this.quiz = quiz;
    }

    public Conversation getConversation() {
        return conversation;
    }

    public void setConversation(Conversation conversation) {
        this.conversation = conversation;
    }

    /** Transcript windowing in seconds. */
    public static class Chunking {
        private double windowSeconds = 60.0;
        private double overlapSeconds = 10.0;

        public double getWindowSeconds() {
            return windowSeconds;
        }

        public void setWindowSeconds(double windowSeconds) {
            this.windowSeconds = windowSeconds;
        }

        public double getOverlapSeconds() {
            return overlapSeconds;
        }

        public void setOverlapSeconds(double overlapSeconds) {
            this.overlapSeconds = overlapSeconds;
        }
    }

    public static class Retrieval {
        private int topK = 5;
        private int lexicalK = 20;
        private int vectorK = 20;
        private double lexicalScoreCeiling = 10.0;
        private long timeoutSeconds = 15;

        public int getTopK() {
            return topK;
        }

        public void setTopK(int topK) {
            this.topK = topK;
        }

        public int getLexicalK() {
            return lexicalK;
        }

        public void setLexicalK(int lexicalK) {
            this.lexicalK = lexicalK;
        }

        public int getVectorK() {
            return vectorK;
        }

        public void setVectorK(int vectorK) {
            this.vectorK = vectorK;
        }

        public double getLexicalScoreCeiling() {
            return lexicalScoreCeiling;
        }

        public void setLexicalScoreCeiling(double lexicalScoreCeiling) {
            this.lexicalScoreCeiling = lexicalScoreCeiling;
        }

        public long getTimeoutSeconds() {
            return timeoutSeconds;
        }

        public void setTimeoutSeconds(long timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
        }
    }

    public static class Rerank {
        private boolean enabled = false;
        private String baseUrl = "http://localhost:8082";
        private String model = "cross-encoder/ms-marco-MiniLM-L-6-v2";
        private int candidateK = 20;
        private long timeoutSeconds = 15;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public int getCandidateK() {
            return candidateK;
        }

        public void setCandidateK(int candidateK) {
            this.candidateK = candidateK;
        }

        public long getTimeoutSeconds() {
            return timeoutSeconds;
        }

        public void setTimeoutSeconds(long timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
        }
    }

    public static class Embedding {
        private String baseUrl = "http://localhost:8081/v1";
        private String apiKey = "";
        private String model = "sentence-transformers/all-MiniLM-L6-v2";
        private int dimensions = 384;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public int getDimensions() {
            return dimensions;
        }

        public void setDimensions(int dimensions) {
            this.dimensions = dimensions;
        }
    }

    public static class Llm {
        private String baseUrl = "https://api.groq.com/openai/v1";
        private String apiKey = "";
        private String model = "llama-3.3-70b-versatile";
        private double temperature = 0.3;
        private long maxTokens = 2048;
        private long timeoutSeconds = 60;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public double getTemperature() {
            return temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }

        public long getMaxTokens() {
            return maxTokens;
        }

        public void setMaxTokens(long maxTokens) {
            this.maxTokens = maxTokens;
        }

        public long getTimeoutSeconds() {
            return timeoutSeconds;
        }

        public void setTimeoutSeconds(long timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
        }
    }

    public static class Transcription {
        private String baseUrl = "https://api.groq.com/openai/v1";
        private String apiKey = "";
        private String model = "whisper-large-v3-turbo";
        private double segmentGapSeconds = 2.0;
        private long timeoutSeconds = 300;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public double getSegmentGapSeconds() {
            return segmentGapSeconds;
        }

        public void setSegmentGapSeconds(double segmentGapSeconds) {
            this.segmentGapSeconds = segmentGapSeconds;
        }

        public long getTimeoutSeconds() {
            return timeoutSeconds;
        }

        public void setTimeoutSeconds(long timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
        }
    }

    public static class Ingestion {
        private String ytDlpPath = "yt-dlp";
        private String downloadDir = "data/audio";
        private String transcriptDir = "data/transcripts";
        private long downloadTimeoutSeconds = 600;

        public String getYtDlpPath() {
            return ytDlpPath;
        }

        public void setYtDlpPath(String ytDlpPath) {
            this.ytDlpPath = ytDlpPath;
        }

        public String getDownloadDir() {
            return downloadDir;
        }

        public void setDownloadDir(String downloadDir) {
            this.downloadDir = downloadDir;
        }

        public String getTranscriptDir() {
            return transcriptDir;
        }

        public void setTranscriptDir(String transcriptDir) {
            this.transcriptDir = transcriptDir;
        }

        public long getDownloadTimeoutSeconds() {
            return downloadTimeoutSeconds;
        }

        public void setDownloadTimeoutSeconds(long downloadTimeoutSeconds) {
            this.downloadTimeoutSeconds = downloadTimeoutSeconds;
        }
    }

    public static class Qdrant {
        private String host = "localhost";
        private int port = 6334;
        private boolean useTls = false;
        private String apiKey = "";
        private String collection = "youtubelm_transcripts";
        private long operationTimeoutSeconds = 30;
        private boolean ensureOnStartup = true;

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }

        public boolean isUseTls() {
            return useTls;
        }

        public void setUseTls(boolean useTls) {
            this.useTls = useTls;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getCollection() {
            return collection;
        }

        public void setCollection(String collection) {
            this.collection = collection;
        }

        public long getOperationTimeoutSeconds() {
            return operationTimeoutSeconds;
        }

        public void setOperationTimeoutSeconds(long operationTimeoutSeconds) {
            this.operationTimeoutSeconds = operationTimeoutSeconds;
        }

        public boolean isEnsureOnStartup() {
            return ensureOnStartup;
        }

        public void setEnsureOnStartup(boolean ensureOnStartup) {
            this.ensureOnStartup = ensureOnStartup;
        }
    }

    public static class Summary {
        private boolean cacheEnabled = true;
        private int maxTranscriptChunks = 200;
        private int maxPromptTokens = 24_000;

        public boolean isCacheEnabled() {
            return cacheEnabled;
        }

        public void setCacheEnabled(boolean cacheEnabled) {
            this.cacheEnabled = cacheEnabled;
        }

        public int getMaxTranscriptChunks() {
            return maxTranscriptChunks;
        }

        public void setMaxTranscriptChunks(int maxTranscriptChunks) {
            this.maxTranscriptChunks = maxTranscriptChunks;
        }

        public int getMaxPromptTokens() {
            return maxPromptTokens;
        }

        public void setMaxPromptTokens(int maxPromptTokens) {
            this.maxPromptTokens = maxPromptTokens;
        }
    }

    public static class Quiz {
        private int maxQuestions = 20;
        private int maxTranscriptChunks = 60;
        private int maxPromptTokens = 16_000;

        public int getMaxQuestions() {
            return maxQuestions;
        }

        public void setMaxQuestions(int maxQuestions) {
            this.maxQuestions = maxQuestions;
        }

        public int getMaxTranscriptChunks() {
            return maxTranscriptChunks;
        }

        public void setMaxTranscriptChunks(int maxTranscriptChunks) {
            this.maxTranscriptChunks = maxTranscriptChunks;
        }

        public int getMaxPromptTokens() {
            return maxPromptTokens;
        }

        public void setMaxPromptTokens(int maxPromptTokens) {
            this.maxPromptTokens = maxPromptTokens;
        }
    }

    public static class Conversation {
        private int historyLimit = 10;
        private String defaultUserId = "default_user";

        public int getHistoryLimit() {
            return historyLimit;
        }

        public void setHistoryLimit(int historyLimit) {
            this.historyLimit = historyLimit;
        }

        public String getDefaultUserId() {
            return defaultUserId;
        }

        public void setDefaultUserId(String defaultUserId) {
            this.defaultUserId = defaultUserId;
        }
    }
}
