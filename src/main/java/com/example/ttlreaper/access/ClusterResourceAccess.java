package com.example.ttlreaper.access;

import com.example.ttlreaper.models.ResourceEvent;
import com.example.ttlreaper.models.ResourceLocator;
import com.example.ttlreaper.models.TargetInstance;
import java.util.List;
import java.util.function.Consumer;

/**
 * Generic list/watch/delete capability over arbitrary resource kinds. Failures surface as
 * {@link ClusterApiException}.
 */
public interface ClusterResourceAccess {

    /**
     * Current snapshot of instances.
     *
     * @param locator       kind to list
     * @param namespace     namespace to list in; empty string lists across all namespaces
     * @param labelSelector rendered label selector, or null for no filtering
     * @return matching instances
     */
    List<TargetInstance> list(ResourceLocator locator, String namespace, String labelSelector);

    /**
     * Opens a long-lived change stream. The stream re-establishes itself after disconnects
     * until the returned handle is closed.
     */
    WatchHandle watch(ResourceLocator locator, String namespace, Consumer<ResourceEvent> listener);

    /**
     * Deletes one instance. An empty namespace addresses a cluster-scoped instance.
     */
    void delete(ResourceLocator locator, String namespace, String name);

    List<String> listNamespaces();

    interface WatchHandle extends AutoCloseable {
        @Override
        void close();
    }
}
