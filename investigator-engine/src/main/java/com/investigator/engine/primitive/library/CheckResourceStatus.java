package com.investigator.engine.primitive.library;

import com.investigator.core.model.Fact;
import com.investigator.core.model.PrimitiveName;
import com.investigator.core.model.PrimitiveParameters;
import com.investigator.core.provider.ProviderCapability;
import com.investigator.core.provider.ProviderException;
import com.investigator.core.provider.ResourceProvider;
import com.investigator.engine.primitive.DiagnosticPrimitive;
import com.investigator.engine.primitive.Observations;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Is the resource itself in a running state?
 */
public class CheckResourceStatus implements DiagnosticPrimitive {
    
    @Override
    public PrimitiveName name() {
        return PrimitiveName.CHECK_RESOURCE_STATUS;
    }
    
    @Override
    public Set<ProviderCapability> requiredCapabilities() {
        return EnumSet.of(ProviderCapability.CONFIGURATION);
    }
    
    @Override
    public List<Fact> run(PrimitiveParameters parameters, ResourceProvider provider, Instant now)
            throws ProviderException {
        
        Map<String, String> configuration = provider.readConfiguration(parameters.resource());
        Optional<String> status = ResourceHealth.status(configuration);
        if (status.isEmpty()) {
            return List.of(Fact.partial(name(), parameters.resource(),
                Observations.create().put("config_key_count", configuration.size()).build(), now,
                "Resource reports no status"));
        }
        
        Observations observations = Observations.create()
            .put("status", status.get())
            .put("available", ResourceHealth.isHealthy(status.get()));
        return List.of(Fact.ok(name(), parameters.resource(), observations.build(), now));
    }
}
