package it.aw.normativerag.model;

/**
 * Parametri di una richiesta di retrieval.
 * <p>
 * {@code level} null attiva la ricerca gerarchica; {@code topK} e {@code rerank}
 * null usano i default di configurazione.
 */
public record RetrievalRequest(
        String  query,
        String  municipality,
        String  region,
        String  province,
        String  level,
        Integer topK,
        Boolean rerank
) {
    public static RetrievalRequest of(String query) {
        return new RetrievalRequest(query, null, null, null, null, null, null);
    }

    public RetrievalRequest withLocation(String municipality, String province, String region) {
        return new RetrievalRequest(query, municipality, region, province, level, topK, rerank);
    }

    public RetrievalRequest withLevel(String level) {
        return new RetrievalRequest(query, municipality, region, province, level, topK, rerank);
    }

    public RetrievalRequest withTopK(int topK) {
        return new RetrievalRequest(query, municipality, region, province, level, topK, rerank);
    }

    public RetrievalRequest withRerank(boolean rerank) {
        return new RetrievalRequest(query, municipality, region, province, level, topK, rerank);
    }
}
