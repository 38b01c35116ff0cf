package io.tradeload.registry;

import io.tradeload.error.DuplicateEntityException;
import io.tradeload.error.InvalidDescriptorException;
import io.tradeload.error.UnknownEntityException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;

/**
 * Constructed-once registry of entity types. Determines execution order (parents first) and the
 * upsert keys of the pipeline. Not a process-wide singleton; build one and hand it to the orchestrator.
 */
public class EntityRegistry {
    private final Map<String, EntityDescriptor> entities = new LinkedHashMap<>();

    public synchronized EntityRegistry register(EntityDescriptor descriptor) {
        if (entities.containsKey(descriptor.name())) throw new DuplicateEntityException(descriptor.name());
        entities.put(descriptor.name(), descriptor);
        return this;
    }

    public synchronized EntityDescriptor lookup(String name) {
        EntityDescriptor d = entities.get(name);
        if (d == null) throw new UnknownEntityException(name, entities.keySet());
        return d;
    }

    public synchronized boolean isRegistered(String name) { return entities.containsKey(name); }

    public synchronized List<String> names() { return new ArrayList<>(entities.keySet()); }

    /**
     * All descriptors with every parent ahead of its children. Unrelated entities keep registration order.
     * Fails on an unregistered parent or a referenced column the parent does not declare, and on cycles.
     */
    public synchronized List<EntityDescriptor> orderedEntities() {
        Map<String, Integer> position = new HashMap<>();
        Map<String, List<EntityDescriptor>> children = new HashMap<>();
        List<EntityDescriptor> roots = new ArrayList<>();
        int i = 0;
        for (EntityDescriptor d : entities.values()) {
            position.put(d.name(), i++);
            if (d.parentEntity().isEmpty()) {
                roots.add(d);
                continue;
            }
            String parent = d.parentEntity().get();
            EntityDescriptor parentDescriptor = entities.get(parent);
            if (parentDescriptor == null) throw new UnknownEntityException(parent, entities.keySet());
            if (!parentDescriptor.hasColumn(d.referencedKeyColumn())) {
                throw new InvalidDescriptorException("'" + d.name() + "' references column '" + d.referencedKeyColumn()
                        + "' which '" + parent + "' does not declare");
            }
            children.computeIfAbsent(parent, k -> new ArrayList<>()).add(d);
        }

        PriorityQueue<EntityDescriptor> ready = new PriorityQueue<>(Comparator.comparingInt(d -> position.get(d.name())));
        ready.addAll(roots);
        List<EntityDescriptor> ordered = new ArrayList<>(entities.size());
        while (!ready.isEmpty()) {
            EntityDescriptor next = ready.poll();
            ordered.add(next);
            ready.addAll(children.getOrDefault(next.name(), List.of()));
        }
        if (ordered.size() != entities.size()) {
            List<String> stuck = new ArrayList<>(entities.keySet());
            ordered.forEach(d -> stuck.remove(d.name()));
            throw new InvalidDescriptorException("parent references form a cycle among " + stuck);
        }
        return ordered;
    }
}
