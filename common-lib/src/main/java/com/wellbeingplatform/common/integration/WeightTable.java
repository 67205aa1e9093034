package com.wellbeingplatform.common.integration;

import com.wellbeingplatform.common.exception.WeightConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered {@code algorithmName → weight} table for one family (or a combination of
 * families). Validated at construction:
 * <ul>
 *   <li>empty tables, negative, NaN or infinite weights, and zero-sum tables are rejected
 *       with {@link WeightConfigurationException}</li>
 *   <li>a sum within {@value #TOLERANCE} of 1.0 is kept as given</li>
 *   <li>any other sum is renormalised so the weights sum to 1.0</li>
 * </ul>
 * Key order is the declaration order used for insight concatenation.
 */
public final class WeightTable {

    private static final Logger log = LoggerFactory.getLogger(WeightTable.class);

    public static final double TOLERANCE = 1e-6;

    private final String label;
    private final Map<String, Double> weights;
    private final boolean renormalized;

    private WeightTable(String label, Map<String, Double> weights, boolean renormalized) {
        this.label        = label;
        this.weights      = Collections.unmodifiableMap(weights);
        this.renormalized = renormalized;
    }

    public static WeightTable of(String label, Map<String, Double> raw) {
        if (raw == null || raw.isEmpty()) {
            throw new WeightConfigurationException("Weight table '" + label + "' is empty");
        }
        double sum = 0.0;
        for (Map.Entry<String, Double> e : raw.entrySet()) {
            Double w = e.getValue();
            if (e.getKey() == null || e.getKey().isBlank()) {
                throw new WeightConfigurationException("Weight table '" + label + "' has a blank algorithm name");
            }
            if (w == null || !Double.isFinite(w) || w < 0.0) {
                throw new WeightConfigurationException(
                    "Weight table '" + label + "' has invalid weight " + w + " for " + e.getKey());
            }
            sum += w;
        }
        if (sum <= 0.0) {
            throw new WeightConfigurationException("Weight table '" + label + "' sums to zero");
        }

        Map<String, Double> normalized = new LinkedHashMap<>();
        boolean renormalize = Math.abs(sum - 1.0) > TOLERANCE;
        for (Map.Entry<String, Double> e : raw.entrySet()) {
            normalized.put(e.getKey(), renormalize ? e.getValue() / sum : e.getValue());
        }
        if (renormalize) {
            log.warn("[WeightTable] label={} sum={} renormalised to 1.0", label, sum);
        }
        return new WeightTable(label, normalized, renormalize);
    }

    /**
     * Merges several tables into one, scaling each by its share. Shares are
     * renormalised like any other weight table, so the result always sums to 1.0.
     */
    public static WeightTable combine(String label, Map<WeightTable, Double> shares) {
        WeightTable shareTable = WeightTable.of(label + "-shares", labelled(shares));
        Map<String, Double> merged = new LinkedHashMap<>();
        for (Map.Entry<WeightTable, Double> e : shares.entrySet()) {
            double share = shareTable.weight(e.getKey().label());
            e.getKey().weights.forEach((name, w) -> merged.merge(name, w * share, Double::sum));
        }
        return WeightTable.of(label, merged);
    }

    /**
     * Sub-table restricted to {@code names} (unknown names ignored), renormalised.
     *
     * @throws WeightConfigurationException if none of the names are in this table
     */
    public WeightTable restrictTo(Collection<String> names) {
        Map<String, Double> subset = new LinkedHashMap<>();
        weights.forEach((name, w) -> {
            if (names.contains(name)) subset.put(name, w);
        });
        return WeightTable.of(label + "-subset", subset);
    }

    public String label() { return label; }

    public double weight(String algorithmName) {
        return weights.getOrDefault(algorithmName, 0.0);
    }

    public boolean contains(String algorithmName) {
        return weights.containsKey(algorithmName);
    }

    public List<String> names() {
        return List.copyOf(weights.keySet());
    }

    public Map<String, Double> asMap() {
        return weights;
    }

    public double sum() {
        return weights.values().stream().mapToDouble(Double::doubleValue).sum();
    }

    public int size() { return weights.size(); }

    public boolean wasRenormalized() { return renormalized; }

    private static Map<String, Double> labelled(Map<WeightTable, Double> shares) {
        if (shares == null || shares.isEmpty()) {
            throw new WeightConfigurationException("No tables to combine");
        }
        Map<String, Double> byLabel = new LinkedHashMap<>();
        shares.forEach((table, share) -> {
            if (byLabel.put(table.label(), share) != null) {
                throw new WeightConfigurationException("Duplicate table label " + table.label());
            }
        });
        return byLabel;
    }

    @Override
    public String toString() {
        return "WeightTable[" + label + "=" + weights + "]";
    }
}
