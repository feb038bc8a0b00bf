package com.example.ttlreaper.service;

import com.example.ttlreaper.access.ClusterApiException;
import com.example.ttlreaper.access.ClusterResourceAccess;
import com.example.ttlreaper.models.LabelSelector;
import com.example.ttlreaper.models.ReaperPolicy;
import com.example.ttlreaper.models.ResourceLocator;
import com.example.ttlreaper.models.TargetInstance;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class TargetLister {

    private final ClusterResourceAccess clusterResourceAccess;

    /**
     * Lists instances of a kind in one namespace. A kind that is not installed on the cluster
     * lists as empty so one misconfigured policy does not block the others.
     *
     * @throws TtlReaperException with {@code TRANSIENT_LIST_ERROR} for any other failure
     */
    public List<TargetInstance> list(ResourceLocator locator, String namespace, String labelSelector) {
        try {
            return clusterResourceAccess.list(locator, namespace, labelSelector);
        } catch (ClusterApiException ex) {
            if (ex.isNotFound()) {
                log.debug("Resource type {} is not installed, treating namespace {} as empty", locator, namespace);
                return List.of();
            }
            throw TtlReaperException.transientList(locator + " in namespace " + namespace, ex);
        } catch (RuntimeException ex) {
            throw TtlReaperException.transientList(locator + " in namespace " + namespace, ex);
        }
    }

    /**
     * The namespaces a pass covers: the policy's own namespace, or every namespace on the
     * cluster when the policy is cluster-wide.
     */
    public List<String> namespacesFor(ReaperPolicy policy) {
        if (!policy.clusterWide()) {
            return List.of(policy.getTargetNamespace());
        }
        try {
            return clusterResourceAccess.listNamespaces();
        } catch (RuntimeException ex) {
            throw TtlReaperException.transientList("namespaces", ex);
        }
    }

    /**
     * Renders a selector in the API's string form, e.g. {@code app=ci,tier in (a,b),!legacy}.
     * Returns null for an absent or empty selector.
     */
    public static String selectorString(LabelSelector selector) {
        if (selector == null || selector.isEmpty()) {
            return null;
        }
        List<String> parts = new ArrayList<>();
        if (selector.getMatchLabels() != null) {
            for (Map.Entry<String, String> label : new TreeMap<>(selector.getMatchLabels()).entrySet()) {
                if (label.getKey() == null || label.getKey().isBlank()) {
                    throw TtlReaperException.invalidLabelSelector("matchLabels contains a blank key");
                }
                parts.add(label.getKey() + "=" + (label.getValue() == null ? "" : label.getValue()));
            }
        }
        if (selector.getMatchExpressions() != null) {
            for (LabelSelector.Requirement requirement : selector.getMatchExpressions()) {
                parts.add(render(requirement));
            }
        }
        return String.join(",", parts);
    }

    private static String render(LabelSelector.Requirement requirement) {
        String key = requirement.getKey();
        if (key == null || key.isBlank()) {
            throw TtlReaperException.invalidLabelSelector("matchExpressions entry has no key");
        }
        List<String> values = requirement.getValues() == null ? List.of() : requirement.getValues();
        String operator = requirement.getOperator() == null ? "" : requirement.getOperator();
        switch (operator) {
            case "In", "NotIn" -> {
                if (values.isEmpty()) {
                    throw TtlReaperException.invalidLabelSelector(operator + " on " + key + " needs values");
                }
                String keyword = operator.equals("In") ? " in " : " notin ";
                return key + keyword + "(" + String.join(",", values) + ")";
            }
            case "Exists", "DoesNotExist" -> {
                if (!values.isEmpty()) {
                    throw TtlReaperException.invalidLabelSelector(operator + " on " + key + " takes no values");
                }
                return operator.equals("Exists") ? key : "!" + key;
            }
            default -> throw TtlReaperException.invalidLabelSelector(
                    "unknown operator '" + operator + "' on " + key);
        }
    }
}
