package com.investigator.engine.primitive;

import com.investigator.core.exception.ParameterContractException;
import com.investigator.core.model.Fact;
import com.investigator.core.model.PrimitiveName;
import com.investigator.core.model.PrimitiveParameters;
import com.investigator.core.provider.ProviderCapability;
import com.investigator.core.provider.ProviderException;
import com.investigator.core.provider.ResourceProvider;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A named, read-only, provider-agnostic diagnostic check.
 * 
 * Implementations are stateless and idempotent. They only ever call read
 * methods of the provider. Identity is the {@link #name()}; the set of
 * primitives is fixed by the {@link PrimitiveRegistry}.
 */
public interface DiagnosticPrimitive {
    
    PrimitiveName name();
    
    /**
     * Provider capabilities this primitive calls.
     */
    Set<ProviderCapability> requiredCapabilities();
    
    /**
     * Parameter fields that must be bound for {@link #run} to make sense.
     */
    default Set<RequiredParameter> requiredParameters() {
        return EnumSet.of(RequiredParameter.RESOURCE_TYPE, RequiredParameter.RESOURCE_ID);
    }
    
    /**
     * Inspect the resource. Called only with required parameters present and
     * required capabilities advertised.
     * 
     * @param parameters bound parameters
     * @param provider   read-only provider
     * @param now        observation time; windows end here
     * @return one or more unstamped facts
     * @throws PrimitiveException when nothing useful could be observed
     * @throws ProviderException  when a provider call fails
     */
    List<Fact> run(PrimitiveParameters parameters, ResourceProvider provider, Instant now)
        throws PrimitiveException, ProviderException;
    
    /**
     * Run with the failure contract applied: missing parameters, missing capabilities,
     * primitive errors and resource-scoped provider errors become a failed fact.
     * Global provider errors propagate. A null parameter object is a programmer error.
     */
    default List<Fact> execute(PrimitiveParameters parameters, ResourceProvider provider, Instant now)
            throws ProviderException {
        
        if (parameters == null) {
            throw new ParameterContractException("parameters", "must not be null for " + name().wireName());
        }
        if (provider == null) {
            throw new ParameterContractException("provider", "must not be null for " + name().wireName());
        }
        
        Set<ProviderCapability> missingCapabilities = requiredCapabilities().stream()
            .filter(capability -> !provider.capabilities().contains(capability))
            .collect(Collectors.toCollection(() -> EnumSet.noneOf(ProviderCapability.class)));
        if (!missingCapabilities.isEmpty()) {
            return List.of(Fact.failed(name(), parameters.resource(), now,
                PrimitiveException.CAPABILITY_UNAVAILABLE,
                "Provider does not support " + missingCapabilities));
        }
        
        List<String> missingParameters = requiredParameters().stream()
            .filter(required -> !required.isPresentIn(parameters))
            .map(RequiredParameter::fieldName)
            .toList();
        if (!missingParameters.isEmpty()) {
            return List.of(Fact.failed(name(), parameters.resource(), now,
                PrimitiveException.MISSING_PARAMETER,
                "Missing required parameter: " + String.join(", ", missingParameters)));
        }
        
        try {
            List<Fact> facts = run(parameters, provider, now);
            if (facts == null || facts.isEmpty()) {
                return List.of(Fact.partial(name(), parameters.resource(), null, now, "no observations returned"));
            }
            return facts;
        } catch (PrimitiveException e) {
            return List.of(Fact.failed(name(), parameters.resource(), now, e.getErrorCode(), e.getMessage()));
        } catch (ProviderException e) {
            if (e.isGlobal()) {
                throw e;
            }
            return List.of(Fact.failed(name(), parameters.resource(), now, e.getErrorCode(), e.getMessage()));
        }
    }
}
