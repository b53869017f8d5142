package com.investigator.engine.primitive.library;

import com.investigator.core.model.Fact;
import com.investigator.core.model.PrimitiveName;
import com.investigator.core.model.PrimitiveParameters;
import com.investigator.core.provider.PermissionCheck;
import com.investigator.core.provider.ProviderCapability;
import com.investigator.core.provider.ProviderException;
import com.investigator.core.provider.ResourceProvider;
import com.investigator.engine.primitive.DiagnosticPrimitive;
import com.investigator.engine.primitive.MetricCatalog;
import com.investigator.engine.primitive.Observations;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Can the resource's identity perform the actions it normally needs?
 * The action list comes from a per-resource-type table.
 */
public class CheckPermissions implements DiagnosticPrimitive {
    
    static final Map<String, List<String>> REQUIRED_ACTIONS = Map.of(
        "ec2", List.of("ec2:DescribeInstances", "ssm:GetParameter", "logs:PutLogEvents"),
        "rds", List.of("rds:DescribeDBInstances", "rds-db:connect", "kms:Decrypt"),
        "lambda", List.of("lambda:InvokeFunction", "logs:CreateLogStream", "logs:PutLogEvents"),
        "dynamodb", List.of("dynamodb:GetItem", "dynamodb:PutItem", "dynamodb:Query"),
        "s3", List.of("s3:GetObject", "s3:PutObject", "s3:ListBucket"),
        "sqs", List.of("sqs:SendMessage", "sqs:ReceiveMessage", "sqs:DeleteMessage")
    );
    
    @Override
    public PrimitiveName name() {
        return PrimitiveName.CHECK_PERMISSIONS;
    }
    
    @Override
    public Set<ProviderCapability> requiredCapabilities() {
        return EnumSet.of(ProviderCapability.PERMISSIONS);
    }
    
    @Override
    public List<Fact> run(PrimitiveParameters parameters, ResourceProvider provider, Instant now)
            throws ProviderException {
        
        List<String> actions = actionsFor(parameters.resource().type());
        List<PermissionCheck> checks = provider.checkPermissions(parameters.resource(), actions);
        
        List<Object> denied = new ArrayList<>();
        for (PermissionCheck check : checks) {
            if (!check.allowed()) {
                denied.add(Observations.create()
                    .put("action", check.action())
                    .put("reason", check.reason())
                    .build());
            }
        }
        
        Observations observations = Observations.create()
            .put("checked_actions", List.copyOf(actions))
            .put("checked_count", checks.size())
            .put("denied_count", denied.size())
            .put("denied", denied);
        
        if (checks.size() < actions.size()) {
            return List.of(Fact.partial(name(), parameters.resource(), observations.build(), now,
                "Only " + checks.size() + " of " + actions.size() + " actions could be evaluated"));
        }
        return List.of(Fact.ok(name(), parameters.resource(), observations.build(), now));
    }
    
    static List<String> actionsFor(String resourceType) {
        String type = MetricCatalog.normalizeType(resourceType);
        return REQUIRED_ACTIONS.getOrDefault(type, List.of(type + ":Describe*"));
    }
}
