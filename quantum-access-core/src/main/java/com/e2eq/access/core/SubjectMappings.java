package com.e2eq.access.core;

import com.e2eq.access.exceptions.DuplicateElementException;
import com.e2eq.access.exceptions.ElementKind;
import com.e2eq.access.exceptions.ElementNotFoundException;

import java.util.*;

/**
 * Component and entity mappings for one kind of subject (users or groups).
 * <p>
 * Subject existence is not checked here; the owning engine validates subjects against the
 * {@link MembershipGraph} before calling in. Empty inner collections are pruned so a subject without mappings
 * leaves no trace.
 * </p>
 *
 * @param <S> the type of subject
 * @param <C> the type of application components
 * @param <A> the type of access levels
 */
public final class SubjectMappings<S, C, A> {

    private final ElementKind subjectKind;
    private final Map<S, Set<ComponentAccess<C, A>>> componentMappings = new LinkedHashMap<>();
    // subject -> entity type -> entities
    private final Map<S, Map<String, Set<String>>> entityMappings = new LinkedHashMap<>();

    public SubjectMappings(ElementKind subjectKind) {
        this.subjectKind = Objects.requireNonNull(subjectKind, "subjectKind");
    }

    public ElementKind subjectKind() {
        return subjectKind;
    }

    public void addComponentMapping(S subject, C component, A accessLevel) {
        ComponentAccess<C, A> pair = new ComponentAccess<>(component, accessLevel);
        Set<ComponentAccess<C, A>> mapped = componentMappings.get(subject);
        if (mapped != null && mapped.contains(pair)) {
            throw new DuplicateElementException(ElementKind.COMPONENT_MAPPING, describe(subject, pair),
                    String.format("A mapping between %s '%s' application component '%s' and access level '%s' already exists.",
                            subjectName(), subject, component, accessLevel));
        }
        componentMappings.computeIfAbsent(subject, k -> new LinkedHashSet<>()).add(pair);
    }

    public void removeComponentMapping(S subject, C component, A accessLevel) {
        ComponentAccess<C, A> pair = new ComponentAccess<>(component, accessLevel);
        Set<ComponentAccess<C, A>> mapped = componentMappings.get(subject);
        if (mapped == null || !mapped.remove(pair)) {
            throw new ElementNotFoundException(ElementKind.COMPONENT_MAPPING, describe(subject, pair), null);
        }
        if (mapped.isEmpty()) {
            componentMappings.remove(subject);
        }
    }

    public boolean hasComponentMapping(S subject, C component, A accessLevel) {
        Set<ComponentAccess<C, A>> mapped = componentMappings.get(subject);
        return mapped != null && mapped.contains(new ComponentAccess<>(component, accessLevel));
    }

    /**
     * Returns a read-only view of the subject's component mappings; empty if it has none.
     */
    public Set<ComponentAccess<C, A>> componentMappingsOf(S subject) {
        return Collections.unmodifiableSet(componentMappings.getOrDefault(subject, Set.of()));
    }

    public void addEntityMapping(S subject, String entityType, String entity) {
        if (hasEntityMapping(subject, entityType, entity)) {
            throw new DuplicateElementException(ElementKind.ENTITY_MAPPING, describe(subject, entityType, entity),
                    String.format("A mapping between %s '%s' and entity '%s' with type '%s' already exists.",
                            subjectName(), subject, entity, entityType));
        }
        entityMappings.computeIfAbsent(subject, k -> new LinkedHashMap<>())
                .computeIfAbsent(entityType, k -> new LinkedHashSet<>())
                .add(entity);
    }

    public void removeEntityMapping(S subject, String entityType, String entity) {
        Map<String, Set<String>> byType = entityMappings.get(subject);
        Set<String> entities = byType == null ? null : byType.get(entityType);
        if (entities == null || !entities.remove(entity)) {
            throw new ElementNotFoundException(ElementKind.ENTITY_MAPPING, describe(subject, entityType, entity), null);
        }
        prune(subject, byType, entityType, entities);
    }

    public boolean hasEntityMapping(S subject, String entityType, String entity) {
        return entityMappingsOf(subject, entityType).contains(entity);
    }

    /**
     * Returns a read-only view of the entities of the given type mapped to the subject; empty if there are none.
     */
    public Set<String> entityMappingsOf(S subject, String entityType) {
        Map<String, Set<String>> byType = entityMappings.get(subject);
        if (byType == null) {
            return Set.of();
        }
        return Collections.unmodifiableSet(byType.getOrDefault(entityType, Set.of()));
    }

    /**
     * Returns a copy of all entity mappings of the subject, keyed by entity type.
     */
    public Map<String, Set<String>> entityMappingsOf(S subject) {
        Map<String, Set<String>> byType = entityMappings.get(subject);
        if (byType == null) {
            return Map.of();
        }
        Map<String, Set<String>> copy = new LinkedHashMap<>();
        byType.forEach((type, entities) -> copy.put(type, Collections.unmodifiableSet(new LinkedHashSet<>(entities))));
        return Collections.unmodifiableMap(copy);
    }

    /**
     * Drops every mapping held by the subject.
     *
     * @return the number of mappings removed
     */
    public int removeSubject(S subject) {
        int removed = 0;
        Set<ComponentAccess<C, A>> components = componentMappings.remove(subject);
        if (components != null) {
            removed += components.size();
        }
        Map<String, Set<String>> byType = entityMappings.remove(subject);
        if (byType != null) {
            for (Set<String> entities : byType.values()) {
                removed += entities.size();
            }
        }
        return removed;
    }

    /**
     * Scans every subject and removes mappings to the given entity.
     *
     * @return the number of mappings removed
     */
    public int purgeEntity(String entityType, String entity) {
        int removed = 0;
        Iterator<Map.Entry<S, Map<String, Set<String>>>> it = entityMappings.entrySet().iterator();
        while (it.hasNext()) {
            Map<String, Set<String>> byType = it.next().getValue();
            Set<String> entities = byType.get(entityType);
            if (entities != null && entities.remove(entity)) {
                removed++;
                if (entities.isEmpty()) {
                    byType.remove(entityType);
                }
            }
            if (byType.isEmpty()) {
                it.remove();
            }
        }
        return removed;
    }

    /**
     * Scans every subject and removes all mappings to entities of the given type.
     *
     * @return the number of mappings removed
     */
    public int purgeEntityType(String entityType) {
        int removed = 0;
        Iterator<Map.Entry<S, Map<String, Set<String>>>> it = entityMappings.entrySet().iterator();
        while (it.hasNext()) {
            Map<String, Set<String>> byType = it.next().getValue();
            Set<String> entities = byType.remove(entityType);
            if (entities != null) {
                removed += entities.size();
            }
            if (byType.isEmpty()) {
                it.remove();
            }
        }
        return removed;
    }

    public int componentMappingCount() {
        return componentMappings.values().stream().mapToInt(Set::size).sum();
    }

    public int entityMappingCount() {
        return entityMappings.values().stream()
                .flatMap(byType -> byType.values().stream())
                .mapToInt(Set::size)
                .sum();
    }

    private void prune(S subject, Map<String, Set<String>> byType, String entityType, Set<String> entities) {
        if (entities.isEmpty()) {
            byType.remove(entityType);
        }
        if (byType.isEmpty()) {
            entityMappings.remove(subject);
        }
    }

    private String subjectName() {
        return subjectKind.displayName().toLowerCase();
    }

    private String describe(S subject, ComponentAccess<C, A> pair) {
        return subjectName() + " " + subject + " -> " + pair;
    }

    private String describe(S subject, String entityType, String entity) {
        return subjectName() + " " + subject + " -> " + entityType + ":" + entity;
    }
}
