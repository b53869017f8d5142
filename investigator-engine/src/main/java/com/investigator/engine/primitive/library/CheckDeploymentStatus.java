package com.investigator.engine.primitive.library;

import com.investigator.core.model.Fact;
import com.investigator.core.model.PrimitiveName;
import com.investigator.core.model.PrimitiveParameters;
import com.investigator.core.provider.ChangeCategory;
import com.investigator.core.provider.ChangeEvent;
import com.investigator.core.provider.ProviderCapability;
import com.investigator.core.provider.ProviderException;
import com.investigator.core.provider.ResourceProvider;
import com.investigator.core.provider.TimeWindow;
import com.investigator.engine.primitive.DiagnosticPrimitive;
import com.investigator.engine.primitive.Observations;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Was anything deployed in the last 24 hours, and which version is live?
 */
public class CheckDeploymentStatus implements DiagnosticPrimitive {
    
    @Override
    public PrimitiveName name() {
        return PrimitiveName.CHECK_DEPLOYMENT_STATUS;
    }
    
    @Override
    public Set<ProviderCapability> requiredCapabilities() {
        return EnumSet.of(ProviderCapability.CHANGE_HISTORY);
    }
    
    @Override
    public List<Fact> run(PrimitiveParameters parameters, ResourceProvider provider, Instant now)
            throws ProviderException {
        
        TimeWindow window = TimeWindow.ending(now, ChangeHistory.LOOKBACK);
        List<ChangeEvent> deployments = ChangeHistory.newestFirst(provider.readRecentChanges(parameters.resource(), window))
            .stream()
            .filter(event -> ChangeHistory.categorize(event) == ChangeCategory.DEPLOYMENT)
            .toList();
        
        Observations observations = Observations.create()
            .put("deployment_count", deployments.size());
        if (!deployments.isEmpty()) {
            ChangeEvent latest = deployments.get(0);
            long minutesAgo = ChangeHistory.minutesBefore(now, latest.occurredAt());
            observations
                .put("latest_action", latest.action())
                .put("latest_actor", latest.actor())
                .put("latest_minutes_ago", minutesAgo)
                .put("current_version", latest.newValues().get("version"))
                .put("previous_version", latest.previousValues().get("version"))
                .put("deployment_status", latest.newValues().get("status"))
                .put("within_incident_window", minutesAgo <= parameters.lookbackWindow().toMinutes());
        }
        return List.of(Fact.ok(name(), parameters.resource(), observations.build(), now));
    }
}
