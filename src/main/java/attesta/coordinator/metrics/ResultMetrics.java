package attesta.coordinator.metrics;

import attesta.coordinator.util.Jsons;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Map;
import java.util.TreeMap;

/**
 * Fills in requested metrics a worker did not report, from the
 * {@code predictions} and {@code labels} arrays of its result document.
 */
public final class ResultMetrics {

    private static final Logger log = LoggerFactory.getLogger(ResultMetrics.class);

    private ResultMetrics() {
    }

    /**
     * @param output   result document as fetched from the worker
     * @param requested metrics the group asked for
     * @param reported metrics the worker declared itself; these always win
     * @return reported metrics plus any derivable requested ones
     */
    public static Map<String, Double> derive(String output, Collection<MetricKind> requested,
            Map<String, Double> reported) {
        Map<String, Double> metrics = new TreeMap<>(reported);
        if (requested.isEmpty() || output == null || output.isBlank()) {
            return metrics;
        }
        if (requested.stream().allMatch(k -> metrics.containsKey(k.metricName()))) {
            return metrics;
        }

        JsonNode root;
        try {
            root = Jsons.mapper().readTree(output);
        } catch (JsonProcessingException e) {
            log.debug("Result is not JSON, skipping metric derivation: {}", e.getOriginalMessage());
            return metrics;
        }
        double[] predicted = numbers(root.path("predictions"));
        double[] actual = numbers(root.path("labels"));
        if (predicted == null || actual == null || predicted.length == 0 || predicted.length != actual.length) {
            return metrics;
        }

        for (MetricKind kind : requested) {
            if (!metrics.containsKey(kind.metricName())) {
                metrics.put(kind.metricName(), kind.compute(predicted, actual));
            }
        }
        return metrics;
    }

    private static double[] numbers(JsonNode node) {
        if (!node.isArray()) {
            return null;
        }
        double[] values = new double[node.size()];
        for (int i = 0; i < node.size(); i++) {
            JsonNode item = node.get(i);
            if (!item.isNumber()) {
                return null;
            }
            values[i] = item.asDouble();
        }
        return values;
    }
}
