package com.e2eq.access.core;

import com.e2eq.access.exceptions.DuplicateElementException;
import com.e2eq.access.exceptions.ElementKind;
import com.e2eq.access.exceptions.ElementNotFoundException;
import com.e2eq.access.exceptions.InvalidReferenceException;

import java.util.*;

/**
 * Holds the entity type/entity registry and the component and entity mappings of users and groups.
 * <p>
 * Entity references are validated here. Subject references are validated by the caller against the
 * {@link MembershipGraph}, which is the only place users and groups are registered.
 * </p>
 *
 * @param <U> the type of users
 * @param <G> the type of groups
 * @param <C> the type of application components
 * @param <A> the type of access levels
 */
public final class MappingStore<U, G, C, A> {

    // entity type -> entities of that type
    private final Map<String, Set<String>> entities = new LinkedHashMap<>();
    private final SubjectMappings<U, C, A> userMappings = new SubjectMappings<>(ElementKind.USER);
    private final SubjectMappings<G, C, A> groupMappings = new SubjectMappings<>(ElementKind.GROUP);

    public SubjectMappings<U, C, A> userMappings() {
        return userMappings;
    }

    public SubjectMappings<G, C, A> groupMappings() {
        return groupMappings;
    }

    public void addEntityType(String entityType) {
        requireText(entityType, "entityType", "Entity type");
        if (entities.containsKey(entityType)) {
            throw new DuplicateElementException(ElementKind.ENTITY_TYPE, entityType);
        }
        entities.put(entityType, new LinkedHashSet<>());
    }

    public boolean containsEntityType(String entityType) {
        return entities.containsKey(entityType);
    }

    public Set<String> entityTypes() {
        return Collections.unmodifiableSet(entities.keySet());
    }

    /**
     * Removes an entity type, all of its entities and every user and group mapping to them.
     *
     * @return the number of mappings removed
     */
    public int removeEntityType(String entityType) {
        requireEntityType(entityType, "entityType");
        int removed = userMappings.purgeEntityType(entityType) + groupMappings.purgeEntityType(entityType);
        entities.remove(entityType);
        return removed;
    }

    public void addEntity(String entityType, String entity) {
        requireEntityType(entityType, "entityType");
        requireText(entity, "entity", "Entity");
        Set<String> ofType = entities.get(entityType);
        if (ofType.contains(entity)) {
            throw new DuplicateElementException(ElementKind.ENTITY, entity,
                    String.format("Entity '%s' of type '%s' already exists.", entity, entityType));
        }
        ofType.add(entity);
    }

    public boolean containsEntity(String entityType, String entity) {
        Set<String> ofType = entities.get(entityType);
        return ofType != null && ofType.contains(entity);
    }

    public Set<String> entitiesOf(String entityType) {
        requireEntityType(entityType, "entityType");
        return Collections.unmodifiableSet(entities.get(entityType));
    }

    /**
     * Removes an entity and every user and group mapping to it.
     *
     * @return the number of mappings removed
     */
    public int removeEntity(String entityType, String entity) {
        requireEntity(entityType, entity);
        int removed = userMappings.purgeEntity(entityType, entity) + groupMappings.purgeEntity(entityType, entity);
        entities.get(entityType).remove(entity);
        return removed;
    }

    public void addUserEntityMapping(U user, String entityType, String entity) {
        requireEntityReference(entityType, entity);
        userMappings.addEntityMapping(user, entityType, entity);
    }

    public void addGroupEntityMapping(G group, String entityType, String entity) {
        requireEntityReference(entityType, entity);
        groupMappings.addEntityMapping(group, entityType, entity);
    }

    public void requireEntityType(String entityType, String parameterName) {
        if (!containsEntityType(entityType)) {
            throw new ElementNotFoundException(ElementKind.ENTITY_TYPE, entityType, parameterName);
        }
    }

    public void requireEntity(String entityType, String entity) {
        requireEntityType(entityType, "entityType");
        if (!containsEntity(entityType, entity)) {
            throw new ElementNotFoundException(ElementKind.ENTITY, entity, "entity");
        }
    }

    private void requireEntityReference(String entityType, String entity) {
        if (!containsEntityType(entityType)) {
            throw new InvalidReferenceException(ElementKind.ENTITY_MAPPING, ElementKind.ENTITY_TYPE, entityType, "entityType");
        }
        if (!containsEntity(entityType, entity)) {
            throw new InvalidReferenceException(ElementKind.ENTITY_MAPPING, ElementKind.ENTITY, entity, "entity");
        }
    }

    private static void requireText(String value, String parameterName, String label) {
        Objects.requireNonNull(value, parameterName);
        if (value.isBlank()) {
            throw new IllegalArgumentException(String.format("%s '%s' in argument '%s' must contain a valid character.", label, value, parameterName));
        }
    }
}
