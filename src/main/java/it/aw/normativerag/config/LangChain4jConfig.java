package it.aw.normativerag.config;

import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.allminilml6v2q.AllMiniLmL6V2QuantizedEmbeddingModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import it.aw.normativerag.index.LevelIndexManager;
import it.aw.normativerag.index.MultiLevelIndexRouter;
import it.aw.normativerag.index.PseudoEmbeddingModel;
import it.aw.normativerag.index.TierEmbeddingStores;
import it.aw.normativerag.ingestion.NormativeIngestionService;
import it.aw.normativerag.model.NormativeLevel;
import it.aw.normativerag.processing.DocumentLoader;
import it.aw.normativerag.processing.NormativeDocumentProcessor;
import it.aw.normativerag.registry.ChunkRegistry;
import it.aw.normativerag.retrieval.ChatModelCompletionProvider;
import it.aw.normativerag.retrieval.CompletionRouter;
import it.aw.normativerag.retrieval.ContextCompressor;
import it.aw.normativerag.retrieval.LlmContextCompressor;
import it.aw.normativerag.retrieval.NormativeRetriever;
import it.aw.normativerag.retrieval.TaskType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Paths;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Configura i bean LangChain4j e la pipeline normativa.
 *
 * EmbeddingModel: AllMiniLM-L6-v2 quantizzato, gira in locale senza API key.
 *                 Se disabilitato o non caricabile si usa PseudoEmbeddingModel.
 * EmbeddingStore: un InMemoryEmbeddingStore per livello con persistenza su file JSON,
 *                 salvati allo shutdown tramite StoreLifecycle.
 * ChatModel:      OpenAI, registrato per la compressione del contesto solo se è presente l'API key.
 */
@Configuration
@EnableConfigurationProperties(NormativeRagProperties.class)
public class LangChain4jConfig {

    private static final Logger log = LoggerFactory.getLogger(LangChain4jConfig.class);

    private final NormativeRagProperties properties;

    public LangChain4jConfig(NormativeRagProperties properties) {
        this.properties = properties;
    }

    @Bean
    public EmbeddingModel embeddingModel() {
        NormativeRagProperties.Embedding config = properties.getEmbedding();
        if (!config.isEnabled()) {
            log.warn("Embedding disabilitato: uso PseudoEmbeddingModel (dim={})", config.getDimension());
            return new PseudoEmbeddingModel(config.getDimension());
        }
        try {
            log.info("Inizializzazione EmbeddingModel: AllMiniLmL6V2Quantized (locale)");
            return new AllMiniLmL6V2QuantizedEmbeddingModel();
        } catch (RuntimeException | LinkageError e) {
            log.warn("EmbeddingModel non disponibile ({}): uso PseudoEmbeddingModel", e.getMessage());
            return new PseudoEmbeddingModel(config.getDimension());
        }
    }

    @Bean
    public TierEmbeddingStores tierEmbeddingStores() {
        return TierEmbeddingStores.load(Paths.get(properties.getStore().getPath()));
    }

    @Bean(destroyMethod = "close")
    public ChunkRegistry chunkRegistry() {
        return new ChunkRegistry(Paths.get(properties.getStore().getRegistryFile()));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService tierSearchExecutor() {
        return Executors.newFixedThreadPool(properties.getRetrieval().getSearchThreads());
    }

    @Bean
    public MultiLevelIndexRouter multiLevelIndexRouter(EmbeddingModel embeddingModel,
                                                       TierEmbeddingStores stores,
                                                       ChunkRegistry registry,
                                                       ExecutorService tierSearchExecutor) {
        NormativeRagProperties.Embedding embedding = properties.getEmbedding();
        String modelId = embeddingModel instanceof PseudoEmbeddingModel
                ? PseudoEmbeddingModel.MODEL_ID
                : embedding.getModelId();
        List<LevelIndexManager> managers = new ArrayList<>();
        for (NormativeLevel level : TierEmbeddingStores.STORE_LEVELS) {
            managers.add(new LevelIndexManager(level, embeddingModel, modelId, stores.get(level), registry,
                    properties.getStore().getBatchSize(), embedding.getDimension()));
        }
        return new MultiLevelIndexRouter(managers, tierSearchExecutor, properties.getRetrieval().getTierTimeout());
    }

    @Bean
    public DocumentLoader documentLoader() {
        return new DocumentLoader();
    }

    @Bean
    public NormativeDocumentProcessor normativeDocumentProcessor(DocumentLoader loader) {
        NormativeRagProperties.Chunking chunking = properties.getChunking();
        return new NormativeDocumentProcessor(chunking.toParams(), chunking.isPreserveArticles(),
                loader, Clock.systemDefaultZone());
    }

    @Bean
    public CompletionRouter completionRouter() {
        CompletionRouter router = new CompletionRouter();
        NormativeRagProperties.Llm llm = properties.getLlm();
        if (llm.getApiKey() != null && !llm.getApiKey().isBlank()) {
            log.info("Compressione del contesto: OpenAI {}", llm.getModel());
            OpenAiChatModel model = OpenAiChatModel.builder()
                    .apiKey(llm.getApiKey())
                    .modelName(llm.getModel())
                    .temperature(0.0)
                    .timeout(llm.getTimeout())
                    .build();
            router.register(TaskType.CONTEXT_COMPRESSION, new ChatModelCompletionProvider("openai", model));
        } else {
            log.info("Nessuna API key LLM: re-ranking disattivato, si userà l'ordine della ricerca");
        }
        return router;
    }

    @Bean
    public ContextCompressor contextCompressor(CompletionRouter completionRouter) {
        return new LlmContextCompressor(completionRouter);
    }

    @Bean
    public NormativeRetriever normativeRetriever(MultiLevelIndexRouter router, ContextCompressor compressor) {
        return new NormativeRetriever(router, compressor, properties.getRetrieval());
    }

    @Bean
    public NormativeIngestionService normativeIngestionService(NormativeDocumentProcessor processor,
                                                               MultiLevelIndexRouter router) {
        return new NormativeIngestionService(processor, router, properties.getLibrary());
    }
}
