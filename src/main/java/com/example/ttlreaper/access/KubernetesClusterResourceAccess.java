package com.example.ttlreaper.access;

import com.example.ttlreaper.config.ReaperProperties;
import com.example.ttlreaper.config.SchedulerConfig;
import com.example.ttlreaper.models.ResourceEvent;
import com.example.ttlreaper.models.ResourceLocator;
import com.example.ttlreaper.models.TargetInstance;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.kubernetes.client.openapi.ApiClient;
import io.kubernetes.client.openapi.ApiException;
import io.kubernetes.client.openapi.apis.CoreV1Api;
import io.kubernetes.client.openapi.models.V1Namespace;
import io.kubernetes.client.openapi.models.V1Status;
import io.kubernetes.client.util.Watch;
import io.kubernetes.client.util.Watchable;
import io.kubernetes.client.util.generic.KubernetesApiResponse;
import io.kubernetes.client.util.generic.dynamic.DynamicKubernetesApi;
import io.kubernetes.client.util.generic.dynamic.DynamicKubernetesListObject;
import io.kubernetes.client.util.generic.dynamic.DynamicKubernetesObject;
import io.kubernetes.client.util.generic.options.ListOptions;
import java.io.IOException;
import java.net.HttpURLConnection;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;

/**
 * {@link ClusterResourceAccess} backed by the dynamic client of the official Kubernetes Java
 * client. Objects are handed out as Jackson trees so callers never touch Gson types.
 */
@Component
@Slf4j
public class KubernetesClusterResourceAccess implements ClusterResourceAccess {

    // server-side watch timeout; the stream is re-opened when it expires
    private static final int WATCH_TIMEOUT_SECONDS = 300;

    private final ApiClient apiClient;
    private final ApiClient watchClient;
    private final CoreV1Api coreApi;
    private final ObjectMapper objectMapper;
    private final TaskExecutor watchExecutor;
    private final Duration reconnectBackoff;
    private final Map<ResourceLocator, DynamicKubernetesApi> requestApis = new ConcurrentHashMap<>();

    public KubernetesClusterResourceAccess(@Qualifier("kubernetesApiClient") ApiClient apiClient,
                                           @Qualifier("kubernetesWatchClient") ApiClient watchClient,
                                           CoreV1Api coreApi,
                                           ObjectMapper objectMapper,
                                           @Qualifier(SchedulerConfig.WATCH_EXECUTOR) TaskExecutor watchExecutor,
                                           ReaperProperties properties) {
        this.apiClient = apiClient;
        this.watchClient = watchClient;
        this.coreApi = coreApi;
        this.objectMapper = objectMapper;
        this.watchExecutor = watchExecutor;
        this.reconnectBackoff = properties.getWatchReconnectBackoff();
    }

    @Override
    public List<TargetInstance> list(ResourceLocator locator, String namespace, String labelSelector) {
        String operation = "list " + locator + scope(namespace);
        ListOptions options = new ListOptions();
        if (labelSelector != null && !labelSelector.isBlank()) {
            options.setLabelSelector(labelSelector);
        }

        KubernetesApiResponse<DynamicKubernetesListObject> response;
        try {
            DynamicKubernetesApi api = requestApi(locator);
            response = isAllNamespaces(namespace) ? api.list(options) : api.list(namespace, options);
        } catch (RuntimeException ex) {
            throw ClusterApiException.transport(operation, ex);
        }
        checkResponse(operation, response);

        List<TargetInstance> instances = new ArrayList<>();
        DynamicKubernetesListObject body = response.getObject();
        if (body == null || body.getItems() == null) {
            return instances;
        }
        for (DynamicKubernetesObject item : body.getItems()) {
            instances.add(toInstance(item));
        }
        return instances;
    }

    @Override
    public WatchHandle watch(ResourceLocator locator, String namespace, Consumer<ResourceEvent> listener) {
        WatchSubscription subscription = new WatchSubscription(locator, namespace, listener);
        watchExecutor.execute(subscription::run);
        return subscription;
    }

    @Override
    public void delete(ResourceLocator locator, String namespace, String name) {
        String operation = "delete " + locator + " " + name + scope(namespace);
        KubernetesApiResponse<DynamicKubernetesObject> response;
        try {
            DynamicKubernetesApi api = requestApi(locator);
            response = isAllNamespaces(namespace) ? api.delete(name) : api.delete(namespace, name);
        } catch (RuntimeException ex) {
            throw ClusterApiException.transport(operation, ex);
        }
        checkResponse(operation, response);
    }

    @Override
    public List<String> listNamespaces() {
        try {
            List<String> names = new ArrayList<>();
            for (V1Namespace namespace : coreApi.listNamespace().execute().getItems()) {
                if (namespace.getMetadata() != null && namespace.getMetadata().getName() != null) {
                    names.add(namespace.getMetadata().getName());
                }
            }
            return names;
        } catch (ApiException ex) {
            throw ClusterApiException.fromApiException("list namespaces", ex);
        } catch (RuntimeException ex) {
            throw ClusterApiException.transport("list namespaces", ex);
        }
    }

    private DynamicKubernetesApi requestApi(ResourceLocator locator) {
        return requestApis.computeIfAbsent(locator, l -> newApi(l, apiClient));
    }

    private static DynamicKubernetesApi newApi(ResourceLocator locator, ApiClient client) {
        return new DynamicKubernetesApi(locator.group(), locator.version(), locator.resource(), client);
    }

    private TargetInstance toInstance(DynamicKubernetesObject object) {
        try {
            return TargetInstance.of(objectMapper.readTree(object.getRaw().toString()));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Cluster API returned an unreadable object", ex);
        }
    }

    private static void checkResponse(String operation, KubernetesApiResponse<?> response) {
        if (response.isSuccess()) {
            return;
        }
        V1Status status = response.getStatus();
        String detail = status != null && status.getMessage() != null ? status.getMessage() : "no status";
        throw new ClusterApiException(
                "%s failed with status %d: %s".formatted(operation, response.getHttpStatusCode(), detail),
                response.getHttpStatusCode());
    }

    private static boolean isAllNamespaces(String namespace) {
        return namespace == null || namespace.isEmpty();
    }

    private static String scope(String namespace) {
        return isAllNamespaces(namespace) ? " (all namespaces)" : " in namespace " + namespace;
    }

    /**
     * One logical watch. Re-opens the stream after it ends or fails, resuming from the last
     * seen resource version when the server still has it.
     */
    private final class WatchSubscription implements WatchHandle {

        private final ResourceLocator locator;
        private final String namespace;
        private final Consumer<ResourceEvent> listener;
        private final DynamicKubernetesApi api;
        private volatile boolean closed;
        private volatile Watchable<DynamicKubernetesObject> stream;
        private String resourceVersion;

        private WatchSubscription(ResourceLocator locator, String namespace, Consumer<ResourceEvent> listener) {
            this.locator = locator;
            this.namespace = namespace;
            this.listener = listener;
            this.api = newApi(locator, watchClient);
        }

        void run() {
            while (!closed) {
                try (Watchable<DynamicKubernetesObject> current = open()) {
                    stream = current;
                    for (Watch.Response<DynamicKubernetesObject> event : current) {
                        if (closed) {
                            break;
                        }
                        handle(event);
                    }
                } catch (ApiException ex) {
                    if (ex.getCode() == HttpURLConnection.HTTP_GONE) {
                        resourceVersion = null;
                    }
                    log.warn("Watch on {}{} failed with status {}: {}",
                            locator, scope(namespace), ex.getCode(), ex.getMessage());
                } catch (IOException | RuntimeException ex) {
                    if (!closed) {
                        log.warn("Watch stream on {}{} ended abnormally: {}",
                                locator, scope(namespace), ex.getMessage());
                    }
                } finally {
                    stream = null;
                }
                if (!closed && !pause()) {
                    return;
                }
            }
            log.debug("Watch on {}{} closed", locator, scope(namespace));
        }

        private Watchable<DynamicKubernetesObject> open() throws ApiException {
            ListOptions options = new ListOptions();
            options.setTimeoutSeconds(WATCH_TIMEOUT_SECONDS);
            if (resourceVersion != null) {
                options.setResourceVersion(resourceVersion);
            }
            return isAllNamespaces(namespace) ? api.watch(options) : api.watch(namespace, options);
        }

        private void handle(Watch.Response<DynamicKubernetesObject> event) {
            if ("ERROR".equals(event.type)) {
                // usually 410 Gone: the remembered version was compacted away
                resourceVersion = null;
                log.debug("Watch on {} reported an error, restarting: {}",
                        locator, event.status != null ? event.status.getMessage() : "no status");
                return;
            }
            if (event.object == null || event.type == null) {
                return;
            }
            if (event.object.getMetadata() != null) {
                resourceVersion = event.object.getMetadata().getResourceVersion();
            }
            ResourceEvent.Type type;
            switch (event.type) {
                case "ADDED" -> type = ResourceEvent.Type.ADDED;
                case "MODIFIED" -> type = ResourceEvent.Type.MODIFIED;
                case "DELETED" -> type = ResourceEvent.Type.DELETED;
                default -> {
                    return;
                }
            }
            try {
                listener.accept(new ResourceEvent(type, toInstance(event.object)));
            } catch (RuntimeException ex) {
                log.error("Watch listener on {} failed for a {} event", locator, type, ex);
            }
        }

        private boolean pause() {
            try {
                Thread.sleep(reconnectBackoff.toMillis());
                return true;
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                return false;
            }
        }

        @Override
        public void close() {
            closed = true;
            Watchable<DynamicKubernetesObject> current = stream;
            if (current == null) {
                return;
            }
            try {
                current.close();
            } catch (IOException ex) {
                log.debug("Closing watch on {} failed: {}", locator, ex.getMessage());
            }
        }
    }
}
