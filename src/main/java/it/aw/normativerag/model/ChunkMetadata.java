package it.aw.normativerag.model;

import dev.langchain4j.data.document.Metadata;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Metadati a schema fisso di un chunk normativo.
 * <p>
 * I campi null indicano assenza dell'informazione (es. nessun articolo riconosciuto).
 * {@code hierarchyLevel}, {@code contextScope} e {@code score} sono valorizzati solo
 * in fase di ricerca e non vengono persistiti. Le chiavi non riconosciute presenti
 * nello store vengono conservate in {@code extra}.
 */
public record ChunkMetadata(
        String  normativeLevel,   // nazionale | regionale | comunale
        String  region,
        String  province,
        String  municipality,
        String  article,          // numero articolo come stringa
        Integer articlePart,      // 1-based, solo per articoli suddivisi
        String  lawType,
        String  lawNumber,
        String  lawYear,
        String  processedDate,    // ISO-8601
        String  source,           // file di origine
        String  hierarchyLevel,   // Nazionale | Regionale | Provinciale | Comunale
        String  contextScope,     // comune/provincia/regione, oppure "Italia"
        Double  score,
        Map<String, String> extra
) {

    public static final String NORMATIVE_LEVEL = "normative_level";
    public static final String REGION          = "region";
    public static final String PROVINCE        = "province";
    public static final String MUNICIPALITY    = "municipality";
    public static final String ARTICLE         = "article";
    public static final String ARTICLE_PART    = "article_part";
    public static final String LAW_TYPE        = "law_type";
    public static final String LAW_NUMBER      = "law_number";
    public static final String LAW_YEAR        = "law_year";
    public static final String PROCESSED_DATE  = "processed_date";
    public static final String SOURCE          = "source";
    public static final String HIERARCHY_LEVEL = "hierarchy_level";
    public static final String CONTEXT_SCOPE   = "context_scope";
    public static final String SCORE           = "score";

    /** Chiavi persistite e utilizzabili nei filtri di uguaglianza. */
    public static final List<String> PERSISTED_KEYS = List.of(
            NORMATIVE_LEVEL, REGION, PROVINCE, MUNICIPALITY, ARTICLE, ARTICLE_PART,
            LAW_TYPE, LAW_NUMBER, LAW_YEAR, PROCESSED_DATE, SOURCE);

    private static final Set<String> KNOWN_KEYS = Set.of(
            NORMATIVE_LEVEL, REGION, PROVINCE, MUNICIPALITY, ARTICLE, ARTICLE_PART,
            LAW_TYPE, LAW_NUMBER, LAW_YEAR, PROCESSED_DATE, SOURCE,
            HIERARCHY_LEVEL, CONTEXT_SCOPE, SCORE);

    public ChunkMetadata {
        extra = extra == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(extra));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .normativeLevel(normativeLevel).region(region).province(province)
                .municipality(municipality).article(article).articlePart(articlePart)
                .lawType(lawType).lawNumber(lawNumber).lawYear(lawYear)
                .processedDate(processedDate).source(source)
                .hierarchyLevel(hierarchyLevel).contextScope(contextScope)
                .score(score).extra(extra);
    }

    /** Copia con i tag assegnati dalla ricerca gerarchica. */
    public ChunkMetadata withHierarchy(String hierarchyLevel, String contextScope) {
        return toBuilder().hierarchyLevel(hierarchyLevel).contextScope(contextScope).build();
    }

    public ChunkMetadata withScore(Double score) {
        return toBuilder().score(score).build();
    }

    /** Riferimento normativo "tipo numero/anno", oppure null se tipo o numero mancano. */
    public String lawReference() {
        if (lawType == null || lawNumber == null) return null;
        return lawType + " " + lawNumber + "/" + (lawYear != null ? lawYear : "");
    }

    /**
     * Valore di una chiave di metadato come stringa (null se assente).
     * Supporta sia le chiavi a schema fisso sia quelle in {@code extra}.
     */
    public String get(String key) {
        return switch (key) {
            case NORMATIVE_LEVEL -> normativeLevel;
            case REGION          -> region;
            case PROVINCE        -> province;
            case MUNICIPALITY    -> municipality;
            case ARTICLE         -> article;
            case ARTICLE_PART    -> articlePart != null ? articlePart.toString() : null;
            case LAW_TYPE        -> lawType;
            case LAW_NUMBER      -> lawNumber;
            case LAW_YEAR        -> lawYear;
            case PROCESSED_DATE  -> processedDate;
            case SOURCE          -> source;
            case HIERARCHY_LEVEL -> hierarchyLevel;
            case CONTEXT_SCOPE   -> contextScope;
            case SCORE           -> score != null ? score.toString() : null;
            default              -> extra.get(key);
        };
    }

    /** Vista piatta di tutti i metadati valorizzati, in ordine stabile. */
    public Map<String, String> asMap() {
        Map<String, String> map = new LinkedHashMap<>();
        for (String key : List.of(NORMATIVE_LEVEL, REGION, PROVINCE, MUNICIPALITY, ARTICLE, ARTICLE_PART,
                LAW_TYPE, LAW_NUMBER, LAW_YEAR, PROCESSED_DATE, SOURCE, HIERARCHY_LEVEL, CONTEXT_SCOPE, SCORE)) {
            String value = get(key);
            if (value != null) map.put(key, value);
        }
        map.putAll(extra);
        return map;
    }

    /**
     * Converte nei metadati LangChain4j da salvare nell'embedding store.
     * I tag di ricerca (hierarchy_level, context_scope, score) non vengono scritti.
     */
    public Metadata toMetadata() {
        Metadata metadata = new Metadata();
        for (String key : PERSISTED_KEYS) {
            String value = get(key);
            if (value != null) metadata.put(key, value);
        }
        extra.forEach(metadata::put);
        return metadata;
    }

    /** Ricostruisce i metadati a partire da quelli letti dall'embedding store. */
    public static ChunkMetadata fromMetadata(Metadata metadata) {
        Map<String, String> values = new LinkedHashMap<>();
        metadata.toMap().forEach((k, v) -> {
            if (v != null) values.put(k, String.valueOf(v));
        });
        Map<String, String> extra = new LinkedHashMap<>();
        values.forEach((k, v) -> {
            if (!KNOWN_KEYS.contains(k)) extra.put(k, v);
        });
        String part = values.get(ARTICLE_PART);
        String score = values.get(SCORE);
        return new ChunkMetadata(
                values.get(NORMATIVE_LEVEL),
                values.get(REGION),
                values.get(PROVINCE),
                values.get(MUNICIPALITY),
                values.get(ARTICLE),
                part != null ? Integer.valueOf(part) : null,
                values.get(LAW_TYPE),
                values.get(LAW_NUMBER),
                values.get(LAW_YEAR),
                values.get(PROCESSED_DATE),
                values.get(SOURCE),
                values.get(HIERARCHY_LEVEL),
                values.get(CONTEXT_SCOPE),
                score != null ? Double.valueOf(score) : null,
                extra);
    }

    public static final class Builder {
        private String normativeLevel;
        private String region;
        private String province;
        private String municipality;
        private String article;
        private Integer articlePart;
        private String lawType;
        private String lawNumber;
        private String lawYear;
        private String processedDate;
        private String source;
        private String hierarchyLevel;
        private String contextScope;
        private Double score;
        private Map<String, String> extra = new LinkedHashMap<>();

        private Builder() {}

        public Builder normativeLevel(String normativeLevel) { this.normativeLevel = normativeLevel; return this; }
        public Builder region(String region) { this.region = region; return this; }
        public Builder province(String province) { this.province = province; return this; }
        public Builder municipality(String municipality) { this.municipality = municipality; return this; }
        public Builder article(String article) { this.article = article; return this; }
        public Builder articlePart(Integer articlePart) { this.articlePart = articlePart; return this; }
        public Builder lawType(String lawType) { this.lawType = lawType; return this; }
        public Builder lawNumber(String lawNumber) { this.lawNumber = lawNumber; return this; }
        public Builder lawYear(String lawYear) { this.lawYear = lawYear; return this; }
        public Builder processedDate(String processedDate) { this.processedDate = processedDate; return this; }
        public Builder source(String source) { this.source = source; return this; }
        public Builder hierarchyLevel(String hierarchyLevel) { this.hierarchyLevel = hierarchyLevel; return this; }
        public Builder contextScope(String contextScope) { this.contextScope = contextScope; return this; }
        public Builder score(Double score) { this.score = score; return this; }

        public Builder extra(Map<String, String> extra) {
            this.extra = new LinkedHashMap<>(extra);
            return this;
        }

        public ChunkMetadata build() {
            return new ChunkMetadata(normativeLevel, region, province, municipality, article, articlePart,
                    lawType, lawNumber, lawYear, processedDate, source, hierarchyLevel, contextScope,
                    score, extra);
        }
    }
}
