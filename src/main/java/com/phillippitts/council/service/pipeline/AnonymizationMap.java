package com.phillippitts.council.service.pipeline;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.TreeMap;

/**
 * Per-query bijection between surviving backends and opaque labels ("Response A", ...).
 *
 * <p>Built fresh for every Stage2 run and dropped when the run ends; it is never part of a
 * result or a log line.
 */
public final class AnonymizationMap {

    static final String LABEL_PREFIX = "Response ";

    private final Map<String, String> labelToBackend;
    private final Map<String, String> backendToLabel;

    private AnonymizationMap(Map<String, String> labelToBackend) {
        this.labelToBackend = Collections.unmodifiableMap(labelToBackend);
        Map<String, String> inverse = new HashMap<>();
        labelToBackend.forEach((label, backend) -> inverse.put(backend, label));
        this.backendToLabel = Collections.unmodifiableMap(inverse);
    }

    /**
     * Assigns labels to backends.
     *
     * @param backendIds distinct surviving backends
     * @param shuffle    whether to randomize the assignment
     * @param seed       seed for the shuffle
     */
    public static AnonymizationMap assign(List<String> backendIds, boolean shuffle, long seed) {
        if (backendIds.size() > 26) {
            throw new IllegalArgumentException("At most 26 responses can be labelled, got: " + backendIds.size());
        }
        List<String> order = new ArrayList<>(backendIds);
        if (order.stream().distinct().count() != order.size()) {
            throw new IllegalArgumentException("Backend ids must be distinct: " + backendIds);
        }
        if (shuffle) {
            Collections.shuffle(order, new Random(seed));
        }
        Map<String, String> labels = new TreeMap<>();
        for (int i = 0; i < order.size(); i++) {
            labels.put(labelFor(i), order.get(i));
        }
        return new AnonymizationMap(labels);
    }

    static String labelFor(int index) {
        return LABEL_PREFIX + (char) ('A' + index);
    }

    public String labelOf(String backendId) {
        String label = backendToLabel.get(backendId);
        if (label == null) {
            throw new IllegalArgumentException("Backend has no label: " + backendId);
        }
        return label;
    }

    public Optional<String> backendOf(String label) {
        return Optional.ofNullable(labelToBackend.get(label));
    }

    /** Labels in lexical order. */
    public List<String> labels() {
        return List.copyOf(labelToBackend.keySet());
    }

    public int size() {
        return labelToBackend.size();
    }
}
