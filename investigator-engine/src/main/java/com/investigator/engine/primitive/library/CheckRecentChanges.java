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
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * What changed on the resource in the last 24 hours?
 */
public class CheckRecentChanges implements DiagnosticPrimitive {
    
    static final int MAX_LISTED = 10;
    
    @Override
    public PrimitiveName name() {
        return PrimitiveName.CHECK_RECENT_CHANGES;
    }
    
    @Override
    public Set<ProviderCapability> requiredCapabilities() {
        return EnumSet.of(ProviderCapability.CHANGE_HISTORY);
    }
    
    @Override
    public List<Fact> run(PrimitiveParameters parameters, ResourceProvider provider, Instant now)
            throws ProviderException {
        
        TimeWindow window = TimeWindow.ending(now, ChangeHistory.LOOKBACK);
        List<ChangeEvent> events = ChangeHistory.newestFirst(provider.readRecentChanges(parameters.resource(), window));
        
        int configurationChanges = 0;
        int deployments = 0;
        List<Object> listed = new ArrayList<>();
        for (ChangeEvent event : events) {
            ChangeCategory category = ChangeHistory.categorize(event);
            if (category == ChangeCategory.CONFIGURATION || category == ChangeCategory.PERMISSION) {
                configurationChanges++;
            } else if (category == ChangeCategory.DEPLOYMENT) {
                deployments++;
            }
            if (listed.size() < MAX_LISTED) {
                listed.add(Observations.create()
                    .put("action", event.action())
                    .put("category", category.name())
                    .put("actor", event.actor())
                    .put("minutes_ago", ChangeHistory.minutesBefore(now, event.occurredAt()))
                    .build());
            }
        }
        
        Observations observations = Observations.create()
            .put("change_count", events.size())
            .put("configuration_changes", configurationChanges)
            .put("deployments", deployments)
            .put("changes", listed);
        if (!events.isEmpty()) {
            ChangeEvent latest = events.get(0);
            long minutesAgo = ChangeHistory.minutesBefore(now, latest.occurredAt());
            observations
                .put("latest_action", latest.action())
                .put("latest_category", ChangeHistory.categorize(latest).name())
                .put("latest_minutes_ago", minutesAgo)
                .put("within_incident_window", minutesAgo <= parameters.lookbackWindow().toMinutes());
        }
        return List.of(Fact.ok(name(), parameters.resource(), observations.build(), now));
    }
}
