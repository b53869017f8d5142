package com.investigator.engine.primitive.library;

import com.investigator.core.model.Fact;
import com.investigator.core.model.PrimitiveName;
import com.investigator.core.model.PrimitiveParameters;
import com.investigator.core.model.ResourceRef;
import com.investigator.core.provider.ProviderCapability;
import com.investigator.core.provider.ProviderException;
import com.investigator.core.provider.ResourceProvider;
import com.investigator.engine.primitive.DiagnosticPrimitive;
import com.investigator.engine.primitive.Observations;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * What does the resource depend on, and are those dependencies healthy?
 * Health is read from each dependency's reported status.
 */
public class TraceDependencies implements DiagnosticPrimitive {
    
    private static final Logger log = LoggerFactory.getLogger(TraceDependencies.class);
    
    @Override
    public PrimitiveName name() {
        return PrimitiveName.TRACE_DEPENDENCIES;
    }
    
    @Override
    public Set<ProviderCapability> requiredCapabilities() {
        return EnumSet.of(ProviderCapability.DEPENDENCY_GRAPH, ProviderCapability.CONFIGURATION);
    }
    
    @Override
    public List<Fact> run(PrimitiveParameters parameters, ResourceProvider provider, Instant now)
            throws ProviderException {
        
        List<ResourceRef> dependencies = provider.readDependencies(parameters.resource());
        
        List<Object> names = new ArrayList<>();
        List<Object> unhealthy = new ArrayList<>();
        List<Object> unknown = new ArrayList<>();
        for (ResourceRef dependency : dependencies) {
            names.add(dependency.toString());
            try {
                Optional<String> status = ResourceHealth.status(provider.readConfiguration(dependency));
                if (status.isEmpty()) {
                    unknown.add(dependency.toString());
                } else if (!ResourceHealth.isHealthy(status.get())) {
                    unhealthy.add(dependency + " (" + status.get() + ")");
                }
            } catch (ProviderException e) {
                if (e.isGlobal()) {
                    throw e;
                }
                log.debug("Could not read status of dependency {}: {}", dependency, e.getMessage());
                unknown.add(dependency.toString());
            }
        }
        
        Observations observations = Observations.create()
            .put("dependency_count", dependencies.size())
            .put("dependencies", names)
            .put("unhealthy_count", unhealthy.size())
            .put("unhealthy", unhealthy)
            .put("unknown_count", unknown.size());
        
        if (!unknown.isEmpty() && unknown.size() == dependencies.size()) {
            return List.of(Fact.partial(name(), parameters.resource(), observations.build(), now,
                "Health of every dependency is unknown"));
        }
        return List.of(Fact.ok(name(), parameters.resource(), observations.build(), now));
    }
}
