package io.tiermesh.health;

import io.tiermesh.model.EndpointState;
import io.tiermesh.model.HealthResult;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Current {@link EndpointState} per endpoint. Each state is immutable and replaced by
 * compare-and-set, so concurrent probe results and router reports never lose an update.
 */
public final class HealthBoard {
    private final Map<String, AtomicReference<EndpointState>> states;
    private final HealthPolicy policy;

    public HealthBoard(Collection<String> endpointIds, HealthPolicy policy) {
        this.policy = policy;
        Map<String, AtomicReference<EndpointState>> map = new LinkedHashMap<>();
        for (String id : endpointIds) {
            map.put(id, new AtomicReference<>(EndpointState.initial(id)));
        }
        this.states = Map.copyOf(map);
    }

    public Transition record(HealthResult result) {
        AtomicReference<EndpointState> ref = ref(result.endpointId());
        while (true) {
            EndpointState before = ref.get();
            EndpointState after = HealthTransitions.apply(before, result, policy);
            if (ref.compareAndSet(before, after)) {
                return new Transition(before, after);
            }
        }
    }

    public Optional<EndpointState> state(String endpointId) {
        AtomicReference<EndpointState> ref = states.get(endpointId);
        return ref == null ? Optional.empty() : Optional.of(ref.get());
    }

    public List<EndpointState> states() {
        List<EndpointState> out = new ArrayList<>();
        for (AtomicReference<EndpointState> ref : states.values()) {
            out.add(ref.get());
        }
        out.sort((a, b) -> a.endpointId().compareTo(b.endpointId()));
        return out;
    }

    private AtomicReference<EndpointState> ref(String endpointId) {
        AtomicReference<EndpointState> ref = states.get(endpointId);
        if (ref == null) {
            throw new IllegalArgumentException("Unknown endpoint: " + endpointId);
        }
        return ref;
    }

    public record Transition(EndpointState before, EndpointState after) {
        public boolean statusChanged() {
            return before.status() != after.status();
        }
    }
}
