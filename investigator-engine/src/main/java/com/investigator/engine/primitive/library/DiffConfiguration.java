package com.investigator.engine.primitive.library;

import com.investigator.core.model.Fact;
import com.investigator.core.model.PrimitiveName;
import com.investigator.core.model.PrimitiveParameters;
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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Which configuration keys differ from their values 24 hours ago?
 * 
 * The current configuration is compared against the earliest recorded
 * previous value of each key changed in the window.
 */
public class DiffConfiguration implements DiagnosticPrimitive {
    
    @Override
    public PrimitiveName name() {
        return PrimitiveName.DIFF_CONFIGURATION;
    }
    
    @Override
    public Set<ProviderCapability> requiredCapabilities() {
        return EnumSet.of(ProviderCapability.CONFIGURATION, ProviderCapability.CHANGE_HISTORY);
    }
    
    @Override
    public List<Fact> run(PrimitiveParameters parameters, ResourceProvider provider, Instant now)
            throws ProviderException {
        
        Map<String, String> current = provider.readConfiguration(parameters.resource());
        TimeWindow window = TimeWindow.ending(now, ChangeHistory.LOOKBACK);
        List<ChangeEvent> events = ChangeHistory.newestFirst(provider.readRecentChanges(parameters.resource(), window));
        
        // oldest event last, so its previous value overwrites newer ones
        Map<String, String> original = new LinkedHashMap<>();
        Map<String, ChangeEvent> changedBy = new LinkedHashMap<>();
        boolean anyDetail = false;
        for (ChangeEvent event : events) {
            if (!event.previousValues().isEmpty() || !event.newValues().isEmpty()) {
                anyDetail = true;
            }
            for (String key : new TreeSet<>(event.previousValues().keySet())) {
                original.put(key, event.previousValues().get(key));
                changedBy.putIfAbsent(key, event);
            }
            for (String key : new TreeSet<>(event.newValues().keySet())) {
                original.putIfAbsent(key, null);
                changedBy.putIfAbsent(key, event);
            }
        }
        
        List<Object> differences = new ArrayList<>();
        for (String key : new TreeSet<>(original.keySet())) {
            String before = original.get(key);
            String after = current.get(key);
            if (before == null ? after == null : before.equals(after)) {
                continue;
            }
            ChangeEvent event = changedBy.get(key);
            differences.add(Observations.create()
                .put("key", key)
                .put("previous", before)
                .put("current", after)
                .put("changed_by", event.actor())
                .put("action", event.action())
                .build());
        }
        
        Observations observations = Observations.create()
            .put("config_key_count", current.size())
            .put("changed_key_count", differences.size())
            .put("differences", differences);
        
        if (!events.isEmpty() && !anyDetail) {
            return List.of(Fact.partial(name(), parameters.resource(), observations.build(), now,
                events.size() + " change events carry no value details"));
        }
        return List.of(Fact.ok(name(), parameters.resource(), observations.build(), now));
    }
}
