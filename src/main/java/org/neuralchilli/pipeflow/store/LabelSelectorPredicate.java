package org.neuralchilli.pipeflow.store;

import com.hazelcast.query.Predicate;
import org.neuralchilli.pipeflow.domain.ClusterObject;

import java.io.Serial;
import java.util.Map;

/**
 * Hazelcast query predicate: same namespace and all selector labels present with equal values.
 */
final class LabelSelectorPredicate<T extends ClusterObject<T>> implements Predicate<ObjectKey, T> {

    @Serial
    private static final long serialVersionUID = 1L;

    private final String namespace;
    private final Map<String, String> selector;

    LabelSelectorPredicate(String namespace, Map<String, String> selector) {
        this.namespace = namespace == null ? "" : namespace;
        this.selector = selector == null ? Map.of() : Map.copyOf(selector);
    }

    @Override
    public boolean apply(Map.Entry<ObjectKey, T> entry) {
        if (!namespace.equals(entry.getKey().namespace())) {
            return false;
        }
        Map<String, String> labels = entry.getValue().metadata().labels();
        return selector.entrySet().stream()
                .allMatch(s -> s.getValue().equals(labels.get(s.getKey())));
    }
}
