package it.aw.normativerag.config;

import it.aw.normativerag.model.ChunkingParams;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configurazione dell'applicazione, prefisso {@code normative}.
 * <p>
 * Costruita una sola volta da Spring e passata ai costruttori dei componenti;
 * i default corrispondono ai valori di riferimento della pipeline di retrieval.
 */
@ConfigurationProperties(prefix = "normative")
public class NormativeRagProperties {

    public static class Chunking {
        private int chunkSize = ChunkingParams.DEFAULT_CHUNK_SIZE;
        private int chunkOverlap = ChunkingParams.DEFAULT_OVERLAP;
        private double overflowFactor = ChunkingParams.DEFAULT_OVERFLOW_FACTOR;
        private boolean preserveArticles = true;

        public int getChunkSize() { return chunkSize; }
        public void setChunkSize(int chunkSize) { this.chunkSize = chunkSize; }

        public int getChunkOverlap() { return chunkOverlap; }
        public void setChunkOverlap(int chunkOverlap) { this.chunkOverlap = chunkOverlap; }

        public double getOverflowFactor() { return overflowFactor; }
        public void setOverflowFactor(double overflowFactor) { this.overflowFactor = overflowFactor; }

        public boolean isPreserveArticles() { return preserveArticles; }
        public void setPreserveArticles(boolean preserveArticles) { this.preserveArticles = preserveArticles; }

        public ChunkingParams toParams() {
            return new ChunkingParams(chunkSize, chunkOverlap, overflowFactor);
        }
    }

    public static class Retrieval {
        private int topK = 5;
        private double scoreThreshold = 0.7;
        private boolean rerank = true;
        private boolean hybridSearch = true;
        private double keywordWeight = 0.3;
        private Duration tierTimeout = Duration.ofSeconds(10);
        /** Thread per le ricerche gerarchiche: una per tier, fino a quattro in parallelo. */
        private int searchThreads = 4;

        public int getTopK() { return topK; }
        public void setTopK(int topK) { this.topK = topK; }

        public double getScoreThreshold() { return scoreThreshold; }
        public void setScoreThreshold(double scoreThreshold) { this.scoreThreshold = scoreThreshold; }

        public boolean isRerank() { return rerank; }
        public void setRerank(boolean rerank) { this.rerank = rerank; }

        public boolean isHybridSearch() { return hybridSearch; }
        public void setHybridSearch(boolean hybridSearch) { this.hybridSearch = hybridSearch; }

        public double getKeywordWeight() { return keywordWeight; }
        public void setKeywordWeight(double keywordWeight) { this.keywordWeight = keywordWeight; }

        public Duration getTierTimeout() { return tierTimeout; }
        public void setTierTimeout(Duration tierTimeout) { this.tierTimeout = tierTimeout; }

        public int getSearchThreads() { return searchThreads; }
        public void setSearchThreads(int searchThreads) { this.searchThreads = searchThreads; }
    }

    public static class Store {
        private String path = "./data/vectordb";
        private String registryFile = "./data/vectordb/registry.duckdb";
        private int batchSize = 100;

        public String getPath() { return path; }
        public void setPath(String path) { this.path = path; }

        public String getRegistryFile() { return registryFile; }
        public void setRegistryFile(String registryFile) { this.registryFile = registryFile; }

        public int getBatchSize() { return batchSize; }
        public void setBatchSize(int batchSize) { this.batchSize = batchSize; }
    }

    public static class Embedding {
        private boolean enabled = true;
        private String modelId = "all-minilm-l6-v2-q";
        private int dimension = 384;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getModelId() { return modelId; }
        public void setModelId(String modelId) { this.modelId = modelId; }

        public int getDimension() { return dimension; }
        public void setDimension(int dimension) { this.dimension = dimension; }
    }

    public static class Llm {
        private String apiKey;
        private String model = "gpt-3.5-turbo";
        private Duration timeout = Duration.ofSeconds(30);

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }

        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }

        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
    }

    public static class Library {
        private boolean importOnStartup = false;
        private String path = "./data/library";
        private String defaultRegion = "Lazio";
        private String reportFile;

        public boolean isImportOnStartup() { return importOnStartup; }
        public void setImportOnStartup(boolean importOnStartup) { this.importOnStartup = importOnStartup; }

        public String getPath() { return path; }
        public void setPath(String path) { this.path = path; }

        public String getDefaultRegion() { return defaultRegion; }
        public void setDefaultRegion(String defaultRegion) { this.defaultRegion = defaultRegion; }

        public String getReportFile() { return reportFile; }
        public void setReportFile(String reportFile) { this.reportFile = reportFile; }
    }

    private Chunking chunking = new Chunking();
    private Retrieval retrieval = new Retrieval();
    private Store store = new Store();
    private Embedding embedding = new Embedding();
    private Llm llm = new Llm();
    private Library library = new Library();

    public Chunking getChunking() { return chunking; }
    public void setChunking(Chunking chunking) { this.chunking = chunking; }

    public Retrieval getRetrieval() { return retrieval; }
    public void setRetrieval(Retrieval retrieval) { this.retrieval = retrieval; }

    public Store getStore() { return store; }
    public void setStore(Store store) { this.store = store; }

    public Embedding getEmbedding() { return embedding; }
    public void setEmbedding(Embedding embedding) { this.embedding = embedding; }

    public Llm getLlm() { return llm; }
    public void setLlm(Llm llm) { this.llm = llm; }

    public Library getLibrary() { return library; }
    public void setLibrary(Library library) { this.library = library; }
}
