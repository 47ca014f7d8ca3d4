package com.e2eq.access.core;

import org.jboss.logging.Logger;

import java.util.*;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Manages the access of users, and groups of users, to application components and entities.
 * <p>
 * Callers build the model with the add/remove operations and then ask {@link #hasAccessToComponent},
 * {@link #hasAccessToEntity} and {@link #getAccessibleEntities} at request time. A user is granted anything
 * mapped to it directly or to any group reachable from it through group membership.
 * </p>
 * <p>
 * Instances are safe to share between threads. Queries and reads run in parallel under a shared read lock;
 * each mutation, including its cascade, runs under the exclusive write lock so no query observes a partially
 * applied change. Collections returned by read operations are copies.
 * </p>
 *
 * @param <U> the type of users; must implement {@code equals} and {@code hashCode}
 * @param <G> the type of groups; must implement {@code equals} and {@code hashCode}
 * @param <C> the type of application components to manage access to
 * @param <A> the type of levels of access which can be assigned to a component
 */
public class AccessManager<U, G, C, A> {
    private static final Logger LOG = Logger.getLogger(AccessManager.class);

    private final MembershipGraph<U, G> graph = new MembershipGraph<>();
    private final MappingStore<U, G, C, A> store = new MappingStore<>();
    private final QueryEngine<U, G, C, A> queries;
    private final MutationEngine<U, G, C, A> mutations;
    private final AccessManagerOptions options;
    private final Lock readLock;
    private final Lock writeLock;

    public AccessManager() {
        this(AccessManagerOptions.defaults());
    }

    public AccessManager(AccessManagerOptions options) {
        this.options = Objects.requireNonNull(options, "options");
        ReentrantReadWriteLock lock = new ReentrantReadWriteLock(options.fairLocking());
        this.readLock = lock.readLock();
        this.writeLock = lock.writeLock();
        this.queries = new QueryEngine<>(graph, store);
        this.mutations = new MutationEngine<>(graph, store, options);
        LOG.infof("Created access manager (rejectCircularGroupMappings=%s, fairLocking=%s)",
                options.rejectCircularGroupMappings(), options.fairLocking());
    }

    public AccessManagerOptions getOptions() {
        return options;
    }

    // Users and groups

    public void addUser(U user) {
        write(() -> mutations.addUser(user));
    }

    public boolean containsUser(U user) {
        return read(() -> graph.containsUser(user));
    }

    /**
     * Removes a user along with its group memberships and mappings.
     */
    public void removeUser(U user) {
        write(() -> mutations.removeUser(user));
    }

    public Set<U> getUsers() {
        return read(() -> copyOf(graph.users()));
    }

    public void addGroup(G group) {
        write(() -> mutations.addGroup(group));
    }

    public boolean containsGroup(G group) {
        return read(() -> graph.containsGroup(group));
    }

    /**
     * Removes a group along with every membership edge into or out of it and all of its mappings.
     */
    public void removeGroup(G group) {
        write(() -> mutations.removeGroup(group));
    }

    public Set<G> getGroups() {
        return read(() -> copyOf(graph.groups()));
    }

    // Membership

    public void addUserToGroupMapping(U user, G group) {
        write(() -> mutations.addUserToGroupMapping(user, group));
    }

    /**
     * Gets the groups the user is directly a member of.
     */
    public Set<G> getUserToGroupMappings(U user) {
        return read(() -> copyOf(graph.outgoingGroupsOfUser(user)));
    }

    public void removeUserToGroupMapping(U user, G group) {
        write(() -> mutations.removeUserToGroupMapping(user, group));
    }

    /**
     * Makes {@code fromGroup} a member of {@code toGroup}.
     *
     * @throws com.e2eq.access.exceptions.CircularReferenceException if the groups are the same, or if
     *                                                               circular mappings are rejected and
     *                                                               {@code fromGroup} is reachable from
     *                                                               {@code toGroup}
     */
    public void addGroupToGroupMapping(G fromGroup, G toGroup) {
        write(() -> mutations.addGroupToGroupMapping(fromGroup, toGroup));
    }

    /**
     * Gets the groups the group is directly a member of.
     */
    public Set<G> getGroupToGroupMappings(G group) {
        return read(() -> copyOf(graph.outgoingGroupsOfGroup(group)));
    }

    public void removeGroupToGroupMapping(G fromGroup, G toGroup) {
        write(() -> mutations.removeGroupToGroupMapping(fromGroup, toGroup));
    }

    // Component mappings

    public void addUserToComponentMapping(U user, C component, A accessLevel) {
        write(() -> mutations.addUserToComponentMapping(user, component, accessLevel));
    }

    public Set<ComponentAccess<C, A>> getUserToComponentMappings(U user) {
        return read(() -> {
            graph.requireUser(user, "user");
            return copyOf(store.userMappings().componentMappingsOf(user));
        });
    }

    public void removeUserToComponentMapping(U user, C component, A accessLevel) {
        write(() -> mutations.removeUserToComponentMapping(user, component, accessLevel));
    }

    public void addGroupToComponentMapping(G group, C component, A accessLevel) {
        write(() -> mutations.addGroupToComponentMapping(group, component, accessLevel));
    }

    public Set<ComponentAccess<C, A>> getGroupToComponentMappings(G group) {
        return read(() -> {
            graph.requireGroup(group, "group");
            return copyOf(store.groupMappings().componentMappingsOf(group));
        });
    }

    public void removeGroupToComponentMapping(G group, C component, A accessLevel) {
        write(() -> mutations.removeGroupToComponentMapping(group, component, accessLevel));
    }

    // Entity types and entities

    public void addEntityType(String entityType) {
        write(() -> mutations.addEntityType(entityType));
    }

    public boolean containsEntityType(String entityType) {
        return read(() -> store.containsEntityType(entityType));
    }

    public Set<String> getEntityTypes() {
        return read(() -> copyOf(store.entityTypes()));
    }

    /**
     * Removes an entity type, every entity of that type, and every user and group mapping to those entities.
     */
    public void removeEntityType(String entityType) {
        write(() -> mutations.removeEntityType(entityType));
    }

    public void addEntity(String entityType, String entity) {
        write(() -> mutations.addEntity(entityType, entity));
    }

    public boolean containsEntity(String entityType, String entity) {
        return read(() -> store.containsEntity(entityType, entity));
    }

    public Set<String> getEntities(String entityType) {
        return read(() -> copyOf(store.entitiesOf(entityType)));
    }

    /**
     * Removes an entity and every user and group mapping to it.
     */
    public void removeEntity(String entityType, String entity) {
        write(() -> mutations.removeEntity(entityType, entity));
    }

    // Entity mappings

    public void addUserToEntityMapping(U user, String entityType, String entity) {
        write(() -> mutations.addUserToEntityMapping(user, entityType, entity));
    }

    /**
     * Gets all entities mapped directly to the user, keyed by entity type.
     */
    public Map<String, Set<String>> getUserToEntityMappings(U user) {
        return read(() -> {
            graph.requireUser(user, "user");
            return store.userMappings().entityMappingsOf(user);
        });
    }

    /**
     * Gets the entities of the given type mapped directly to the user.
     */
    public Set<String> getUserToEntityMappings(U user, String entityType) {
        return read(() -> {
            graph.requireUser(user, "user");
            store.requireEntityType(entityType, "entityType");
            return copyOf(store.userMappings().entityMappingsOf(user, entityType));
        });
    }

    public void removeUserToEntityMapping(U user, String entityType, String entity) {
        write(() -> mutations.removeUserToEntityMapping(user, entityType, entity));
    }

    public void addGroupToEntityMapping(G group, String entityType, String entity) {
        write(() -> mutations.addGroupToEntityMapping(group, entityType, entity));
    }

    /**
     * Gets all entities mapped directly to the group, keyed by entity type.
     */
    public Map<String, Set<String>> getGroupToEntityMappings(G group) {
        return read(() -> {
            graph.requireGroup(group, "group");
            return store.groupMappings().entityMappingsOf(group);
        });
    }

    /**
     * Gets the entities of the given type mapped directly to the group.
     */
    public Set<String> getGroupToEntityMappings(G group, String entityType) {
        return read(() -> {
            graph.requireGroup(group, "group");
            store.requireEntityType(entityType, "entityType");
            return copyOf(store.groupMappings().entityMappingsOf(group, entityType));
        });
    }

    public void removeGroupToEntityMapping(G group, String entityType, String entity) {
        write(() -> mutations.removeGroupToEntityMapping(group, entityType, entity));
    }

    // Queries

    /**
     * Checks whether the user, or a group it is a member of directly or transitively, has the given level of
     * access to the component.
     *
     * @throws com.e2eq.access.exceptions.ElementNotFoundException if the user does not exist
     */
    public boolean hasAccessToComponent(U user, C component, A accessLevel) {
        return read(() -> queries.hasAccessToComponent(user, component, accessLevel));
    }

    /**
     * Checks whether the group, or a group it is a member of directly or transitively, has the given level of
     * access to the component.
     */
    public boolean hasGroupAccessToComponent(G group, C component, A accessLevel) {
        return read(() -> queries.hasGroupAccessToComponent(group, component, accessLevel));
    }

    /**
     * Checks whether the user, or a group it is a member of directly or transitively, is mapped to the entity.
     *
     * @throws com.e2eq.access.exceptions.ElementNotFoundException if the user, entity type or entity does not
     *                                                             exist
     */
    public boolean hasAccessToEntity(U user, String entityType, String entity) {
        return read(() -> queries.hasAccessToEntity(user, entityType, entity));
    }

    public boolean hasGroupAccessToEntity(G group, String entityType, String entity) {
        return read(() -> queries.hasGroupAccessToEntity(group, entityType, entity));
    }

    /**
     * Gets all entities of the given type that the user, or a group it is a member of directly or
     * transitively, is mapped to. Empty if the entity type does not exist.
     *
     * @throws com.e2eq.access.exceptions.ElementNotFoundException if the user does not exist
     */
    public Set<String> getAccessibleEntities(U user, String entityType) {
        return read(() -> queries.accessibleEntities(user, entityType));
    }

    public Set<String> getGroupAccessibleEntities(G group, String entityType) {
        return read(() -> queries.groupAccessibleEntities(group, entityType));
    }

    /**
     * Runs the action while holding the read lock, so a sequence of read operations made from inside it
     * observes a single consistent state. The action must not call any mutating operation.
     */
    public <T> T withConsistentRead(Supplier<T> action) {
        return read(action);
    }

    private <T> T read(Supplier<T> action) {
        readLock.lock();
        try {
            return action.get();
        } finally {
            readLock.unlock();
        }
    }

    private void write(Runnable action) {
        writeLock.lock();
        try {
            action.run();
        } finally {
            writeLock.unlock();
        }
    }

    private static <T> Set<T> copyOf(Set<T> source) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(source));
    }
}
