package ddg.backend.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Labels attached to a dependence edge: an ordered map from label key to value.
 * <p>
 * Annotating a key appends to a tuple (an unmodifiable list) rather than overwriting it. Outside this package the
 * labels are read-only once built by the {@code of} factories.
 */
public final class EdgeLabels {

    public static final String TYPE = "type";
    public static final String SUBTYPE = "subtype";
    public static final String DATA = "data";
    public static final String COUNT = "count";

    public static final String REG = "reg";
    public static final String MEM = "mem";
    public static final String TMP = "tmp";
    public static final String EXIT = "exit";
    public static final String MEM_ADDR = "mem_addr";
    public static final String MEM_DATA = "mem_data";

    private final LinkedHashMap<String, Object> labels = new LinkedHashMap<>();

    public EdgeLabels() {
    }

    public static EdgeLabels of(String key, Object value) {
        return new EdgeLabels().put(key, value);
    }

    public static EdgeLabels of(String key1, Object value1, String key2, Object value2) {
        return new EdgeLabels().put(key1, value1).put(key2, value2);
    }

    EdgeLabels put(String key, Object value) {
        labels.put(key, value);
        return this;
    }

    public Optional<Object> get(String key) {
        return Optional.ofNullable(labels.get(key));
    }

    public boolean containsKey(String key) {
        return labels.containsKey(key);
    }

    public boolean isEmpty() {
        return labels.isEmpty();
    }

    /**
     * Extend the tuple stored under {@code key} with {@code value}, creating a one-element tuple if absent.
     *
     * @param key   label key
     * @param value value to append
     */
    void append(String key, Object value) {
        var tuple = new ArrayList<>();
        var old = labels.get(key);
        if (old instanceof List) {
            tuple.addAll((List<?>) old);
        } else if (old != null) {
            tuple.add(old);
        }
        tuple.add(value);
        labels.put(key, Collections.unmodifiableList(tuple));
    }

    public EdgeLabels copy() {
        var copy = new EdgeLabels();
        copy.labels.putAll(labels);
        return copy;
    }

    /**
     * A copy of these labels with {@code other} laid over them: keys present in both take the value from
     * {@code other}.
     *
     * @param other labels on top
     * @return merged labels
     */
    public EdgeLabels overlaidWith(EdgeLabels other) {
        var merged = copy();
        merged.labels.putAll(other.labels);
        return merged;
    }

    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(labels);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EdgeLabels)) return false;
        return labels.equals(((EdgeLabels) o).labels);
    }

    @Override
    public int hashCode() {
        return labels.hashCode();
    }

    @Override
    public String toString() {
        return labels.toString();
    }
}
