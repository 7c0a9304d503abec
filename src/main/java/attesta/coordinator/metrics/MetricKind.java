package attesta.coordinator.metrics;

import attesta.coordinator.exception.ConfigurationException;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Registry of metrics that can be derived from a partition's predictions and
 * labels. Classification metrics treat values as class labels and the label
 * {@code 1.0} as the positive class.
 *
 * <p>Unknown names fail fast through {@link #fromName(String)}.
 */
public enum MetricKind {
    ACCURACY("accuracy", MetricFamily.CLASSIFICATION) {
        @Override
        double evaluate(double[] predicted, double[] actual) {
            int hits = 0;
            for (int i = 0; i < predicted.length; i++) {
                if (predicted[i] == actual[i])
                    hits++;
            }
            return (double) hits / predicted.length;
        }
    },
    PRECISION("precision", MetricFamily.CLASSIFICATION) {
        @Override
        double evaluate(double[] predicted, double[] actual) {
            Confusion c = Confusion.of(predicted, actual);
            return ratio(c.tp, c.tp + c.fp);
        }
    },
    RECALL("recall", MetricFamily.CLASSIFICATION) {
        @Override
        double evaluate(double[] predicted, double[] actual) {
            Confusion c = Confusion.of(predicted, actual);
            return ratio(c.tp, c.tp + c.fn);
        }
    },
    F1_SCORE("f1_score", MetricFamily.CLASSIFICATION) {
        @Override
        double evaluate(double[] predicted, double[] actual) {
            Confusion c = Confusion.of(predicted, actual);
            return ratio(2.0 * c.tp, 2.0 * c.tp + c.fp + c.fn);
        }
    },
    BALANCED_ACCURACY("balanced_accuracy", MetricFamily.CLASSIFICATION) {
        @Override
        double evaluate(double[] predicted, double[] actual) {
            Confusion c = Confusion.of(predicted, actual);
            double tpr = ratio(c.tp, c.tp + c.fn);
            double tnr = ratio(c.tn, c.tn + c.fp);
            return (tpr + tnr) / 2.0;
        }
    },
    MSE("mse", MetricFamily.REGRESSION) {
        @Override
        double evaluate(double[] predicted, double[] actual) {
            double sum = 0;
            for (int i = 0; i < predicted.length; i++) {
                double d = predicted[i] - actual[i];
                sum += d * d;
            }
            return sum / predicted.length;
        }
    },
    RMSE("rmse", MetricFamily.REGRESSION) {
        @Override
        double evaluate(double[] predicted, double[] actual) {
            return Math.sqrt(MSE.evaluate(predicted, actual));
        }
    },
    MAE("mae", MetricFamily.REGRESSION) {
        @Override
        double evaluate(double[] predicted, double[] actual) {
            double sum = 0;
            for (int i = 0; i < predicted.length; i++) {
                sum += Math.abs(predicted[i] - actual[i]);
            }
            return sum / predicted.length;
        }
    },
    R2_SCORE("r2_score", MetricFamily.REGRESSION) {
        @Override
        double evaluate(double[] predicted, double[] actual) {
            double mean = Arrays.stream(actual).average().orElse(0.0);
            double ssRes = 0;
            double ssTot = 0;
            for (int i = 0; i < predicted.length; i++) {
                ssRes += (actual[i] - predicted[i]) * (actual[i] - predicted[i]);
                ssTot += (actual[i] - mean) * (actual[i] - mean);
            }
            if (ssTot == 0) {
                return ssRes == 0 ? 1.0 : 0.0;
            }
            return 1.0 - ssRes / ssTot;
        }
    },
    MAX_ERROR("max_error", MetricFamily.REGRESSION) {
        @Override
        double evaluate(double[] predicted, double[] actual) {
            double max = 0;
            for (int i = 0; i < predicted.length; i++) {
                max = Math.max(max, Math.abs(predicted[i] - actual[i]));
            }
            return max;
        }
    };

    private final String metricName;
    private final MetricFamily family;

    MetricKind(String metricName, MetricFamily family) {
        this.metricName = metricName;
        this.family = family;
    }

    abstract double evaluate(double[] predicted, double[] actual);

    public String metricName() {
        return metricName;
    }

    public MetricFamily family() {
        return family;
    }

    /**
     * Compute this metric over paired predictions and labels.
     *
     * @throws IllegalArgumentException if the arrays are empty or differ in length
     */
    public double compute(double[] predicted, double[] actual) {
        if (predicted == null || actual == null || predicted.length == 0) {
            throw new IllegalArgumentException(metricName + ": predictions and labels must be non-empty");
        }
        if (predicted.length != actual.length) {
            throw new IllegalArgumentException(metricName + ": " + predicted.length + " predictions vs "
                    + actual.length + " labels");
        }
        return evaluate(predicted, actual);
    }

    public static MetricKind fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (MetricKind kind : values()) {
                if (kind.metricName.equals(normalized)) {
                    return kind;
                }
            }
        }
        throw new ConfigurationException("Unknown metric: " + name + " (known: " + knownNames() + ")");
    }

    /**
     * Resolve every name, failing on the first unknown one.
     */
    public static List<MetricKind> resolveAll(Collection<String> names) {
        return names.stream().map(MetricKind::fromName).distinct().toList();
    }

    public static List<MetricKind> ofFamily(MetricFamily family) {
        return Arrays.stream(values()).filter(k -> k.family == family).toList();
    }

    private static String knownNames() {
        return Arrays.stream(values()).map(MetricKind::metricName).collect(Collectors.joining(", "));
    }

    private static double ratio(double numerator, double denominator) {
        return denominator == 0 ? 0.0 : numerator / denominator;
    }

    private static final class Confusion {
        int tp;
        int fp;
        int tn;
        int fn;

        static Confusion of(double[] predicted, double[] actual) {
            Confusion c = new Confusion();
            for (int i = 0; i < predicted.length; i++) {
                boolean p = predicted[i] == 1.0;
                boolean a = actual[i] == 1.0;
                if (p && a)
                    c.tp++;
                else if (p)
                    c.fp++;
                else if (a)
                    c.fn++;
                else
                    c.tn++;
            }
            return c;
        }
    }
}
