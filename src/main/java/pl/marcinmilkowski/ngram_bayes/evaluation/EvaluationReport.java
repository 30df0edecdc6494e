package pl.marcinmilkowski.ngram_bayes.evaluation;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;

import java.util.List;

/**
 * Outcome of classifying every validation sample of a training set.
 */
public record EvaluationReport(String tokenizerName, List<Outcome> outcomes) {

    public EvaluationReport {
        outcomes = List.copyOf(outcomes);
    }

    public int getErrorCount() {
        return (int) outcomes.stream().filter(o -> !o.correct()).count();
    }

    /**
     * Fraction of correctly classified samples, 0 when there are none.
     */
    public double getAccuracy() {
        if (outcomes.isEmpty()) {
            return 0.0;
        }
        return (double) (outcomes.size() - getErrorCount()) / outcomes.size();
    }

    public boolean isAllCorrect() {
        return getErrorCount() == 0;
    }

    public JSONObject toJson() {
        JSONObject root = new JSONObject();
        root.put("tokenizer", tokenizerName);
        root.put("samples", outcomes.size());
        root.put("errors", getErrorCount());
        root.put("accuracy", getAccuracy());

        JSONArray results = new JSONArray();
        for (Outcome outcome : outcomes) {
            results.add(outcome.toJson());
        }
        root.put("results", results);
        return root;
    }

    /**
     * Predicted versus expected category for one validation document.
     */
    public record Outcome(String text, String predicted, String expected) {

        public boolean correct() {
            return predicted.equals(expected);
        }

        public JSONObject toJson() {
            JSONObject obj = new JSONObject();
            obj.put("text", text);
            obj.put("predicted", predicted);
            obj.put("expected", expected);
            obj.put("correct", correct());
            return obj;
        }
    }
}
