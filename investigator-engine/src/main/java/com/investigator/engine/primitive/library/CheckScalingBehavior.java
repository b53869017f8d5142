package com.investigator.engine.primitive.library;

import com.investigator.core.model.Fact;
import com.investigator.core.model.PrimitiveName;
import com.investigator.core.model.PrimitiveParameters;
import com.investigator.core.provider.ProviderCapability;
import com.investigator.core.provider.ProviderException;
import com.investigator.core.provider.ResourceProvider;
import com.investigator.core.provider.ScalingState;
import com.investigator.engine.primitive.DiagnosticPrimitive;
import com.investigator.engine.primitive.Observations;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Is auto-scaling enabled, and did it keep up?
 */
public class CheckScalingBehavior implements DiagnosticPrimitive {
    
    @Override
    public PrimitiveName name() {
        return PrimitiveName.CHECK_SCALING_BEHAVIOR;
    }
    
    @Override
    public Set<ProviderCapability> requiredCapabilities() {
        return EnumSet.of(ProviderCapability.SCALING_STATE);
    }
    
    @Override
    public List<Fact> run(PrimitiveParameters parameters, ResourceProvider provider, Instant now)
            throws ProviderException {
        
        ScalingState state = provider.readScalingState(parameters.resource());
        
        Observations observations = Observations.create()
            .put("scaling_enabled", state.enabled())
            .put("min_capacity", state.minCapacity())
            .put("max_capacity", state.maxCapacity())
            .put("desired_capacity", state.desiredCapacity())
            .put("current_capacity", state.currentCapacity())
            .put("at_max_capacity", state.atMaxCapacity())
            .put("lagging_desired", state.currentCapacity() < state.desiredCapacity())
            .put("recent_activities", List.copyOf(state.recentActivities()));
        
        return List.of(Fact.ok(name(), parameters.resource(), observations.build(), now));
    }
}
