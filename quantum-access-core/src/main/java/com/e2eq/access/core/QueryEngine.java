package com.e2eq.access.core;

import org.jboss.logging.Logger;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Answers permission and entity visibility questions by walking the membership graph from a subject and
 * probing the mappings of every node reached.
 * <p>
 * Read only. The boolean checks stop at the first node holding a match; entity enumeration visits every
 * reachable node once. Unknown subjects raise
 * {@link com.e2eq.access.exceptions.ElementNotFoundException} rather than answering "no access".
 * </p>
 */
public final class QueryEngine<U, G, C, A> {
    private static final Logger LOG = Logger.getLogger(QueryEngine.class);

    private final MembershipGraph<U, G> graph;
    private final MappingStore<U, G, C, A> store;

    public QueryEngine(MembershipGraph<U, G> graph, MappingStore<U, G, C, A> store) {
        this.graph = graph;
        this.store = store;
    }

    public boolean hasAccessToComponent(U user, C component, A accessLevel) {
        graph.requireUser(user, "user");
        if (store.userMappings().hasComponentMapping(user, component, accessLevel)) {
            return true;
        }
        return !graph.traverseFromUser(user, group -> !groupHasComponent(group, component, accessLevel));
    }

    public boolean hasGroupAccessToComponent(G group, C component, A accessLevel) {
        return !graph.traverseFromGroup(group, current -> !groupHasComponent(current, component, accessLevel));
    }

    public boolean hasAccessToEntity(U user, String entityType, String entity) {
        graph.requireUser(user, "user");
        store.requireEntity(entityType, entity);
        if (store.userMappings().hasEntityMapping(user, entityType, entity)) {
            return true;
        }
        return !graph.traverseFromUser(user, group -> !groupHasEntity(group, entityType, entity));
    }

    public boolean hasGroupAccessToEntity(G group, String entityType, String entity) {
        graph.requireGroup(group, "group");
        store.requireEntity(entityType, entity);
        return !graph.traverseFromGroup(group, current -> !groupHasEntity(current, entityType, entity));
    }

    /**
     * Returns the entities of the given type mapped to the user or to any of its ancestor groups. An entity type
     * which does not exist has no accessible entities.
     */
    public Set<String> accessibleEntities(U user, String entityType) {
        graph.requireUser(user, "user");
        if (!store.containsEntityType(entityType)) {
            return Set.of();
        }
        Set<String> result = new LinkedHashSet<>(store.userMappings().entityMappingsOf(user, entityType));
        graph.traverseFromUser(user, group -> collectEntities(group, entityType, result));
        return Collections.unmodifiableSet(result);
    }

    public Set<String> groupAccessibleEntities(G group, String entityType) {
        graph.requireGroup(group, "group");
        if (!store.containsEntityType(entityType)) {
            return Set.of();
        }
        Set<String> result = new LinkedHashSet<>();
        graph.traverseFromGroup(group, current -> collectEntities(current, entityType, result));
        return Collections.unmodifiableSet(result);
    }

    private boolean groupHasComponent(G group, C component, A accessLevel) {
        boolean found = store.groupMappings().hasComponentMapping(group, component, accessLevel);
        if (LOG.isTraceEnabled()) {
            LOG.tracef("component check %s:%s at group %s -> %s", component, accessLevel, group, found);
        }
        return found;
    }

    private boolean groupHasEntity(G group, String entityType, String entity) {
        boolean found = store.groupMappings().hasEntityMapping(group, entityType, entity);
        if (LOG.isTraceEnabled()) {
            LOG.tracef("entity check %s:%s at group %s -> %s", entityType, entity, group, found);
        }
        return found;
    }

    private boolean collectEntities(G group, String entityType, Set<String> result) {
        result.addAll(store.groupMappings().entityMappingsOf(group, entityType));
        return true;
    }
}
