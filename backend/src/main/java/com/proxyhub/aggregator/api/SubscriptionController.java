package com.proxyhub.aggregator.api;

import com.proxyhub.aggregator.model.EndpointFilter;
import com.proxyhub.aggregator.model.EndpointSnapshot;
import com.proxyhub.aggregator.model.EndpointSort;
import com.proxyhub.aggregator.model.FilterResult;
import com.proxyhub.aggregator.model.Subscription;
import com.proxyhub.aggregator.model.SubscriptionSummary;
import com.proxyhub.aggregator.model.UpdateOutcome;
import com.proxyhub.aggregator.service.SubscriptionNotFoundException;
import com.proxyhub.aggregator.service.SubscriptionStore;
import com.proxyhub.aggregator.service.SubscriptionValidationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
public class SubscriptionController {
    private final SubscriptionStore store;

    public SubscriptionController(SubscriptionStore store) {
        this.store = store;
    }

    @GetMapping("/subscriptions")
    public List<SubscriptionSummary> listSubscriptions() {
        return store.list();
    }

    @PostMapping("/subscriptions")
    public ResponseEntity<SubscriptionSummary> addSubscription(@RequestBody(required = false) AddSubscriptionRequest request) {
        if (request == null) {
            throw new SubscriptionValidationException("Request body with a url is required");
        }
        Subscription subscription = store.add(
            request.url(),
            request.name(),
            Boolean.TRUE.equals(request.autoUpdate()),
            request.updateIntervalSeconds(),
            request.fetchNow() == null || request.fetchNow(),
            request.priority(),
            request.tags()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(store.summary(subscription));
    }

    @GetMapping("/subscriptions/{id}")
    public SubscriptionDetailResponse getSubscription(@PathVariable("id") String id) {
        Subscription subscription = store.get(id);
        return new SubscriptionDetailResponse(store.summary(subscription), subscription.endpointSnapshots());
    }

    @PatchMapping("/subscriptions/{id}")
    public SubscriptionSummary updateSettings(
        @PathVariable("id") String id,
        @RequestBody SubscriptionSettingsRequest request
    ) {
        Subscription subscription = store.updateSettings(
            id,
            request.name(),
            request.enabled(),
            request.priority(),
            request.tags(),
            request.updateIntervalSeconds()
        );
        return store.summary(subscription);
    }

    @DeleteMapping("/subscriptions/{id}")
    public ResponseEntity<Void> removeSubscription(@PathVariable("id") String id) {
        if (!store.removeById(id)) {
            throw new SubscriptionNotFoundException(id);
        }
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/subscriptions/{id}/update")
    public SubscriptionDetailResponse updateSubscription(
        @PathVariable("id") String id,
        @RequestParam(name = "timeoutSeconds", required = false) Integer timeoutSeconds
    ) {
        List<EndpointSnapshot> endpoints = store.update(id, fetchTimeout(timeoutSeconds));
        return new SubscriptionDetailResponse(store.summary(store.get(id)), endpoints);
    }

    @PostMapping("/subscriptions/update-all")
    public Map<String, UpdateOutcome> updateAll(
        @RequestParam(name = "timeoutSeconds", required = false) Integer timeoutSeconds
    ) {
        return store.updateAll(fetchTimeout(timeoutSeconds));
    }

    @PostMapping("/subscriptions/{id}/auto-update/start")
    public AutoUpdateResponse startAutoUpdate(@PathVariable("id") String id) {
        boolean started = store.startAutoUpdate(id);
        return new AutoUpdateResponse(id, started, store.refreshState(id));
    }

    @PostMapping("/subscriptions/{id}/auto-update/stop")
    public AutoUpdateResponse stopAutoUpdate(@PathVariable("id") String id) {
        boolean stopped = store.stopAutoUpdate(id);
        return new AutoUpdateResponse(id, stopped, store.refreshState(id));
    }

    @PostMapping("/subscriptions/{id}/endpoints/tags")
    public ResponseEntity<Map<String, Object>> tagEndpoint(
        @PathVariable("id") String id,
        @RequestBody EndpointTagRequest request
    ) {
        if (request.descriptor() == null || request.descriptor().isBlank()) {
            throw new SubscriptionValidationException("descriptor is required");
        }
        boolean tagged = store.tagEndpoint(id, request.descriptor(), request.tags());
        HttpStatus status = tagged ? HttpStatus.OK : HttpStatus.NOT_FOUND;
        return ResponseEntity.status(status).body(Map.of("subscriptionId", id, "tagged", tagged));
    }

    @GetMapping("/endpoints")
    public EndpointListResponse listEndpoints(
        @RequestParam(name = "protocol", required = false) List<String> protocols,
        @RequestParam(name = "minSuccessRate", required = false) Double minSuccessRate,
        @RequestParam(name = "maxLatency", required = false) Long maxLatency,
        @RequestParam(name = "subscriptionTag", required = false) List<String> subscriptionTags,
        @RequestParam(name = "tag", required = false) List<String> configTags,
        @RequestParam(name = "name", required = false) String nameContains,
        @RequestParam(name = "sort", required = false) String sort,
        @RequestParam(name = "limit", required = false) Integer limit
    ) {
        FilterResult result = store.filter(new EndpointFilter(
            protocols,
            minSuccessRate,
            maxLatency,
            subscriptionTags,
            configTags,
            nameContains
        ));
        List<EndpointSnapshot> endpoints = store.sort(result.endpoints(), EndpointSort.fromParam(sort), limit);
        return new EndpointListResponse(endpoints.size(), result.diagnostic(), result.message(), endpoints);
    }

    private Duration fetchTimeout(Integer timeoutSeconds) {
        return timeoutSeconds == null || timeoutSeconds <= 0
            ? store.defaultFetchTimeout()
            : Duration.ofSeconds(timeoutSeconds);
    }
}
