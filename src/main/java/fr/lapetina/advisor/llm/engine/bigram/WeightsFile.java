package fr.lapetina.advisor.llm.engine.bigram;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * On-disk layout of {@code weights.json}: for each token, the logits of the
 * tokens that may follow it.
 * <pre>
 * {"transitions": {" stock": {" price": 2.5, " looks": 1.0}}}
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class WeightsFile {

    private Map<String, Map<String, Float>> transitions;

    public Map<String, Map<String, Float>> getTransitions() { return transitions; }
    public void setTransitions(Map<String, Map<String, Float>> transitions) { this.transitions = transitions; }

    BigramWeights toWeights(Vocabulary vocabulary) {
        if (transitions == null) {
            throw new IllegalArgumentException("Weights file has no transitions");
        }
        int[][] successors = new int[vocabulary.size()][];
        float[][] logits = new float[vocabulary.size()][];
        for (Map.Entry<String, Map<String, Float>> row : transitions.entrySet()) {
            int from = requireId(vocabulary, row.getKey());
            // successors sorted by id so greedy ties resolve to the lowest id
            SortedMap<Integer, Float> next = new TreeMap<>();
            for (Map.Entry<String, Float> candidate : row.getValue().entrySet()) {
                if (candidate.getValue() == null || !Float.isFinite(candidate.getValue())) {
                    throw new IllegalArgumentException("Invalid logit for '" + row.getKey()
                            + "' -> '" + candidate.getKey() + "'");
                }
                next.put(requireId(vocabulary, candidate.getKey()), candidate.getValue());
            }
            int[] ids = new int[next.size()];
            float[] scores = new float[next.size()];
            int i = 0;
            for (Map.Entry<Integer, Float> candidate : next.entrySet()) {
                ids[i] = candidate.getKey();
                scores[i] = candidate.getValue();
                i++;
            }
            successors[from] = ids;
            logits[from] = scores;
        }
        return new BigramWeights(successors, logits);
    }

    private static int requireId(Vocabulary vocabulary, String token) {
        return vocabulary.id(token)
                .orElseThrow(() -> new IllegalArgumentException("Weights reference unknown token: '" + token + "'"));
    }
}
