package com.phillippitts.council.service.governor;

import com.phillippitts.council.config.properties.CouncilProperties;
import com.phillippitts.council.config.properties.CouncilProperties.BackendProperties;
import com.phillippitts.council.exception.ConfigurationException;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Per-million-token prices of the configured backends.
 */
@Component
public class PricingTable {

    private static final double PER_MILLION = 1_000_000.0;

    private final CouncilProperties properties;

    public PricingTable(CouncilProperties properties) {
        this.properties = properties;
    }

    public boolean knows(String backendId) {
        return backendId != null && properties.getBackends().containsKey(backendId);
    }

    public Set<String> backendIds() {
        return properties.getBackends().keySet();
    }

    /**
     * @throws ConfigurationException if the backend is not in {@code council.backends}
     */
    public BackendProperties require(String backendId) {
        BackendProperties pricing = backendId == null ? null : properties.getBackends().get(backendId);
        if (pricing == null) {
            throw new ConfigurationException("council.backends", "unknown backend id '" + backendId + "'");
        }
        return pricing;
    }

    public double cost(String backendId, int promptTokens, int completionTokens) {
        BackendProperties pricing = require(backendId);
        return (promptTokens * pricing.getInputCostPerMillion()
                + completionTokens * pricing.getOutputCostPerMillion()) / PER_MILLION;
    }
}
