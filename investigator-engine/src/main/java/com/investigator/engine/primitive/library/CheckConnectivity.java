package com.investigator.engine.primitive.library;

import com.investigator.core.model.Fact;
import com.investigator.core.model.PrimitiveName;
import com.investigator.core.model.PrimitiveParameters;
import com.investigator.core.model.ResourceRef;
import com.investigator.core.provider.ConnectivityResult;
import com.investigator.core.provider.ProviderCapability;
import com.investigator.core.provider.ProviderException;
import com.investigator.core.provider.ResourceProvider;
import com.investigator.engine.primitive.DiagnosticPrimitive;
import com.investigator.engine.primitive.Observations;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Can the resource reach each of its dependencies?
 * Produces one fact per dependency; a check that errors yields a failed fact for that dependency only.
 */
public class CheckConnectivity implements DiagnosticPrimitive {
    
    @Override
    public PrimitiveName name() {
        return PrimitiveName.CHECK_CONNECTIVITY;
    }
    
    @Override
    public Set<ProviderCapability> requiredCapabilities() {
        return EnumSet.of(ProviderCapability.DEPENDENCY_GRAPH, ProviderCapability.CONNECTIVITY);
    }
    
    @Override
    public List<Fact> run(PrimitiveParameters parameters, ResourceProvider provider, Instant now)
            throws ProviderException {
        
        ResourceRef source = parameters.resource();
        List<ResourceRef> dependencies = provider.readDependencies(source);
        if (dependencies.isEmpty()) {
            return List.of(Fact.ok(name(), source,
                Observations.create().put("dependency_count", 0).build(), now));
        }
        
        List<Fact> facts = new ArrayList<>(dependencies.size());
        for (ResourceRef target : dependencies) {
            try {
                ConnectivityResult result = provider.checkConnectivity(source, target);
                Observations observations = Observations.create()
                    .put("target", target.toString())
                    .put("reachable", result.reachable())
                    .put("detail", result.detail());
                if (result.latency() != null) {
                    observations.put("latency_ms", result.latency().toMillis());
                }
                facts.add(Fact.ok(name(), source, observations.build(), now));
            } catch (ProviderException e) {
                if (e.isGlobal()) {
                    throw e;
                }
                facts.add(Fact.failed(name(), source, now, e.getErrorCode(),
                    "Connectivity check to " + target + " failed: " + e.getMessage()));
            }
        }
        return facts;
    }
}
