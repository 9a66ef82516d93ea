package it.aw.normativerag.index;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Embedding deterministico e indipendente dal contenuto, usato quando il modello
 * reale non è disponibile. Ha la stessa dimensione del modello configurato, quindi
 * lo schema delle collection non cambia; la similarità diventa uniforme e il
 * ranking resta affidato allo scoring per keyword del retriever.
 */
public class PseudoEmbeddingModel implements EmbeddingModel {

    public static final String MODEL_ID = "pseudo-embedding";

    private final int dimension;
    private final float[] vector;

    public PseudoEmbeddingModel(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension deve essere > 0 (ricevuto: " + dimension + ")");
        }
        this.dimension = dimension;
        this.vector = new float[dimension];
        Arrays.fill(vector, (float) (1.0 / Math.sqrt(dimension)));
    }

    @Override
    public Response<List<Embedding>> embedAll(List<TextSegment> textSegments) {
        List<Embedding> embeddings = new ArrayList<>(textSegments.size());
        for (int i = 0; i < textSegments.size(); i++) {
            embeddings.add(Embedding.from(vector.clone()));
        }
        return Response.from(embeddings);
    }

    @Override
    public int dimension() {
        return dimension;
    }
}
