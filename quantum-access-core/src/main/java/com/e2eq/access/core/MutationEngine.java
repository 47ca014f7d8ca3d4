package com.e2eq.access.core;

import com.e2eq.access.exceptions.CircularReferenceException;
import com.e2eq.access.exceptions.ElementKind;
import com.e2eq.access.exceptions.InvalidReferenceException;
import org.jboss.logging.Logger;

/**
 * The single writer of the membership graph and mapping store.
 * <p>
 * Every operation validates all of its references before it changes anything, so a failed call leaves the state
 * untouched. Removing a user, group, entity or entity type cascades to the edges and mappings which reference it;
 * incoming references are found by scanning the whole structure rather than through reverse indexes.
 * </p>
 */
public final class MutationEngine<U, G, C, A> {
    private static final Logger LOG = Logger.getLogger(MutationEngine.class);

    private final MembershipGraph<U, G> graph;
    private final MappingStore<U, G, C, A> store;
    private final AccessManagerOptions options;

    public MutationEngine(MembershipGraph<U, G> graph, MappingStore<U, G, C, A> store, AccessManagerOptions options) {
        this.graph = graph;
        this.store = store;
        this.options = options;
    }

    public void addUser(U user) {
        graph.addUser(user);
        if (LOG.isDebugEnabled()) LOG.debugf("Added user %s", user);
    }

    public void removeUser(U user) {
        graph.requireUser(user, "user");
        int mappings = store.userMappings().removeSubject(user);
        int edges = graph.removeUser(user);
        if (LOG.isDebugEnabled()) {
            LOG.debugf("Removed user %s with %d group memberships and %d mappings", user, edges, mappings);
        }
    }

    public void addGroup(G group) {
        graph.addGroup(group);
        if (LOG.isDebugEnabled()) LOG.debugf("Added group %s", group);
    }

    public void removeGroup(G group) {
        graph.requireGroup(group, "group");
        int mappings = store.groupMappings().removeSubject(group);
        int edges = graph.removeGroup(group);
        if (LOG.isDebugEnabled()) {
            LOG.debugf("Removed group %s with %d membership edges and %d mappings", group, edges, mappings);
        }
    }

    public void addUserToGroupMapping(U user, G group) {
        graph.addUserToGroupEdge(user, group);
    }

    public void removeUserToGroupMapping(U user, G group) {
        graph.removeUserToGroupEdge(user, group);
    }

    public void addGroupToGroupMapping(G fromGroup, G toGroup) {
        if (options.rejectCircularGroupMappings()
                && graph.containsGroup(fromGroup)
                && graph.containsGroup(toGroup)
                && !fromGroup.equals(toGroup)
                && graph.isReachable(toGroup, fromGroup)) {
            throw new CircularReferenceException(String.valueOf(fromGroup), String.valueOf(toGroup));
        }
        graph.addGroupToGroupEdge(fromGroup, toGroup);
    }

    public void removeGroupToGroupMapping(G fromGroup, G toGroup) {
        graph.removeGroupToGroupEdge(fromGroup, toGroup);
    }

    public void addUserToComponentMapping(U user, C component, A accessLevel) {
        if (!graph.containsUser(user)) {
            throw new InvalidReferenceException(ElementKind.COMPONENT_MAPPING, ElementKind.USER, String.valueOf(user), "user");
        }
        store.userMappings().addComponentMapping(user, component, accessLevel);
    }

    public void removeUserToComponentMapping(U user, C component, A accessLevel) {
        graph.requireUser(user, "user");
        store.userMappings().removeComponentMapping(user, component, accessLevel);
    }

    public void addGroupToComponentMapping(G group, C component, A accessLevel) {
        if (!graph.containsGroup(group)) {
            throw new InvalidReferenceException(ElementKind.COMPONENT_MAPPING, ElementKind.GROUP, String.valueOf(group), "group");
        }
        store.groupMappings().addComponentMapping(group, component, accessLevel);
    }

    public void removeGroupToComponentMapping(G group, C component, A accessLevel) {
        graph.requireGroup(group, "group");
        store.groupMappings().removeComponentMapping(group, component, accessLevel);
    }

    public void addEntityType(String entityType) {
        store.addEntityType(entityType);
        if (LOG.isDebugEnabled()) LOG.debugf("Added entity type %s", entityType);
    }

    public void removeEntityType(String entityType) {
        int entities = store.entitiesOf(entityType).size();
        int mappings = store.removeEntityType(entityType);
        if (LOG.isDebugEnabled()) {
            LOG.debugf("Removed entity type %s with %d entities and %d mappings", entityType, entities, mappings);
        }
    }

    public void addEntity(String entityType, String entity) {
        store.addEntity(entityType, entity);
    }

    public void removeEntity(String entityType, String entity) {
        int mappings = store.removeEntity(entityType, entity);
        if (LOG.isDebugEnabled()) {
            LOG.debugf("Removed entity %s:%s with %d mappings", entityType, entity, mappings);
        }
    }

    public void addUserToEntityMapping(U user, String entityType, String entity) {
        if (!graph.containsUser(user)) {
            throw new InvalidReferenceException(ElementKind.ENTITY_MAPPING, ElementKind.USER, String.valueOf(user), "user");
        }
        store.addUserEntityMapping(user, entityType, entity);
    }

    public void removeUserToEntityMapping(U user, String entityType, String entity) {
        graph.requireUser(user, "user");
        store.requireEntity(entityType, entity);
        store.userMappings().removeEntityMapping(user, entityType, entity);
    }

    public void addGroupToEntityMapping(G group, String entityType, String entity) {
        if (!graph.containsGroup(group)) {
            throw new InvalidReferenceException(ElementKind.ENTITY_MAPPING, ElementKind.GROUP, String.valueOf(group), "group");
        }
        store.addGroupEntityMapping(group, entityType, entity);
    }

    public void removeGroupToEntityMapping(G group, String entityType, String entity) {
        graph.requireGroup(group, "group");
        store.requireEntity(entityType, entity);
        store.groupMappings().removeEntityMapping(group, entityType, entity);
    }
}
