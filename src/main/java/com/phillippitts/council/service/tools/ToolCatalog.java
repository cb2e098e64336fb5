package com.phillippitts.council.service.tools;

import com.phillippitts.council.config.properties.ToolProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Registered tool collaborators and their merge priority.
 *
 * <p>Priority comes from {@code council.tools.priority}; tools missing from that list sort
 * after all listed ones, by id.
 */
@Component
public class ToolCatalog {

    private static final Logger LOG = LogManager.getLogger(ToolCatalog.class);

    private final Map<String, ToolCollaborator> tools = new LinkedHashMap<>();
    private final List<String> priority;

    public ToolCatalog(List<ToolCollaborator> collaborators, ToolProperties properties) {
        for (ToolCollaborator c : collaborators) {
            ToolCollaborator previous = tools.putIfAbsent(c.toolId(), c);
            if (previous != null) {
                LOG.warn("Duplicate tool id '{}': keeping {}, ignoring {}", c.toolId(),
                        previous.getClass().getSimpleName(), c.getClass().getSimpleName());
            }
        }
        this.priority = List.copyOf(properties.getPriority());
        LOG.info("Tool catalog: {}", tools.keySet());
    }

    public Optional<ToolCollaborator> find(String toolId) {
        return Optional.ofNullable(tools.get(toolId));
    }

    public boolean contains(String toolId) {
        return tools.containsKey(toolId);
    }

    public Set<String> toolIds() {
        return tools.keySet();
    }

    /**
     * Sorts tool ids by catalog priority. The result is independent of input order.
     */
    public List<String> order(Collection<String> toolIds) {
        List<String> sorted = new ArrayList<>(toolIds);
        sorted.sort(Comparator.comparingInt(this::rank).thenComparing(Comparator.naturalOrder()));
        return sorted;
    }

    private int rank(String toolId) {
        int i = priority.indexOf(toolId);
        return i < 0 ? Integer.MAX_VALUE : i;
    }
}
