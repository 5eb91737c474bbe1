package com.intteq.queue.client.handler;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Maps routing keys to the ordered list of handlers registered for them.
 *
 * <p>Registration keys are either exact routing keys or AMQP topic patterns
 * ({@code *} matches exactly one word, {@code #} zero or more). {@link #resolve(String)}
 * returns every matching registration in registration order.
 *
 * <p>The registry is populated at startup and {@link #freeze() frozen} before the first
 * delivery is consumed; it is read-only afterwards.
 */
@Slf4j
public class MessageHandlerRegistry {

    private final List<Registration> registrations = new CopyOnWriteArrayList<>();

    /** Resolutions of the registered keys themselves, filled once on {@link #freeze()}. */
    private final Map<String, List<HandlerDescriptor>> resolved = new ConcurrentHashMap<>();

    private volatile boolean frozen;

    /**
     * Appends {@code descriptor} to the handlers of {@code routingKey}.
     *
     * @throws IllegalStateException if the registry is frozen
     */
    public void register(String routingKey, HandlerDescriptor descriptor) {
        Objects.requireNonNull(routingKey, "routingKey must not be null");
        Objects.requireNonNull(descriptor, "descriptor must not be null");
        if (frozen) {
            throw new IllegalStateException(
                    "Handler registry is read-only once consumers have started; cannot register "
                            + descriptor.name() + " for routingKey=" + routingKey);
        }
        registrations.add(new Registration(routingKey, descriptor));
        log.info("Registered handler {} ({}) for routingKey={}", descriptor.name(), descriptor.kind(), routingKey);
    }

    /**
     * Handlers for {@code routingKey} in registration order; empty when nothing matches.
     */
    public List<HandlerDescriptor> resolve(String routingKey) {
        if (routingKey == null) {
            return List.of();
        }
        List<HandlerDescriptor> cached = resolved.get(routingKey);
        return cached != null ? cached : match(routingKey);
    }

    /**
     * Makes the registry read-only. Keys arriving on deliveries are matched on every call and
     * never cached, so wildcard bindings carrying ids cannot grow the registry.
     */
    public synchronized void freeze() {
        if (frozen) {
            return;
        }
        for (Registration registration : registrations) {
            resolved.putIfAbsent(registration.key(), match(registration.key()));
        }
        frozen = true;
    }

    public boolean isFrozen() {
        return frozen;
    }

    public boolean isEmpty() {
        return registrations.isEmpty();
    }

    int cachedResolutions() {
        return resolved.size();
    }

    /**
     * Registered keys and patterns, in first-registration order.
     */
    public Set<String> routingKeys() {
        Set<String> keys = new LinkedHashSet<>();
        registrations.forEach(r -> keys.add(r.key()));
        return keys;
    }

    private List<HandlerDescriptor> match(String routingKey) {
        List<HandlerDescriptor> result = new ArrayList<>();
        for (Registration registration : registrations) {
            if (matches(registration.key(), routingKey)) {
                result.add(registration.descriptor());
            }
        }
        return List.copyOf(result);
    }

    // -------------------------------------------------------------------------
    // Topic pattern matching
    // -------------------------------------------------------------------------

    static boolean matches(String pattern, String routingKey) {
        if (pattern.equals(routingKey)) {
            return true;
        }
        if (!pattern.contains("*") && !pattern.contains("#")) {
            return false;
        }
        return matchWords(pattern.split("\\.", -1), 0, routingKey.split("\\.", -1), 0);
    }

    private static boolean matchWords(String[] pattern, int p, String[] key, int k) {
        if (p == pattern.length) {
            return k == key.length;
        }
        String word = pattern[p];
        if ("#".equals(word)) {
            // '#' absorbs zero or more words
            for (int skip = k; skip <= key.length; skip++) {
                if (matchWords(pattern, p + 1, key, skip)) {
                    return true;
                }
            }
            return false;
        }
        if (k == key.length) {
            return false;
        }
        if ("*".equals(word) || word.equals(key[k])) {
            return matchWords(pattern, p + 1, key, k + 1);
        }
        return false;
    }

    @Getter
    @Accessors(fluent = true)
    @RequiredArgsConstructor
    private static final class Registration {
        private final String key;
        private final HandlerDescriptor descriptor;
    }
}
