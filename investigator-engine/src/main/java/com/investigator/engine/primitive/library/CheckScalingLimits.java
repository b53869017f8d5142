package com.investigator.engine.primitive.library;

import com.investigator.core.model.Fact;
import com.investigator.core.model.PrimitiveName;
import com.investigator.core.model.PrimitiveParameters;
import com.investigator.core.provider.ProviderCapability;
import com.investigator.core.provider.ProviderException;
import com.investigator.core.provider.QuotaUsage;
import com.investigator.core.provider.ResourceProvider;
import com.investigator.engine.primitive.DiagnosticPrimitive;
import com.investigator.engine.primitive.Observations;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Are quotas or hard limits close to exhausted? Near limit at 90% usage.
 */
public class CheckScalingLimits implements DiagnosticPrimitive {
    
    public static final double NEAR_LIMIT_PERCENT = 90.0;
    
    @Override
    public PrimitiveName name() {
        return PrimitiveName.CHECK_SCALING_LIMITS;
    }
    
    @Override
    public Set<ProviderCapability> requiredCapabilities() {
        return EnumSet.of(ProviderCapability.QUOTAS);
    }
    
    @Override
    public List<Fact> run(PrimitiveParameters parameters, ResourceProvider provider, Instant now)
            throws ProviderException {
        
        List<QuotaUsage> quotas = provider.readQuotas(parameters.resource()).stream()
            .sorted(Comparator.comparing(QuotaUsage::name))
            .toList();
        
        List<Object> listed = new ArrayList<>();
        List<Object> nearLimit = new ArrayList<>();
        double maxUtilization = 0.0;
        for (QuotaUsage quota : quotas) {
            double utilization = quota.utilizationPercent();
            maxUtilization = Math.max(maxUtilization, utilization);
            listed.add(Observations.create()
                .put("name", quota.name())
                .put("limit", quota.limit())
                .put("used", quota.used())
                .put("utilization_percent", utilization)
                .build());
            if (utilization >= NEAR_LIMIT_PERCENT) {
                nearLimit.add(quota.name());
            }
        }
        
        Observations observations = Observations.create()
            .put("quota_count", quotas.size())
            .put("quotas", listed)
            .put("max_utilization_percent", maxUtilization)
            .put("near_limit", !nearLimit.isEmpty())
            .put("near_limit_quotas", nearLimit);
        
        return List.of(Fact.ok(name(), parameters.resource(), observations.build(), now));
    }
}
