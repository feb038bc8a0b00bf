package com.example.ttlreaper.access;

import com.example.ttlreaper.models.PolicyChange;
import com.example.ttlreaper.models.ReaperPolicy;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

public interface ReaperPolicyAccess {

    List<ReaperPolicy> findAll();

    Optional<ReaperPolicy> findByName(String name);

    /**
     * Subscribes to create/update/delete notifications, delivered in store order.
     */
    ClusterResourceAccess.WatchHandle watch(Consumer<PolicyChange> listener);
}
