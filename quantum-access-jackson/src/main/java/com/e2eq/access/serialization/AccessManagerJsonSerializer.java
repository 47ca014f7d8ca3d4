package com.e2eq.access.serialization;

import com.e2eq.access.core.AccessManager;
import com.e2eq.access.core.AccessManagerOptions;
import com.e2eq.access.core.ComponentAccess;
import com.e2eq.access.serialization.AccessManagerDocument.*;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.util.*;
import java.util.function.Function;

/**
 * Serializes an {@link AccessManager} to a JSON document and rebuilds an access manager from one.
 * <p>
 * Caller types are converted with the supplied {@link UniqueStringifier}s. Where the document is stored is the
 * caller's concern. Rebuilding replays the document through the public add operations, so a document which
 * breaks any invariant (duplicate element, dangling reference, circular group mapping when rejected) fails with
 * the same exception the add would raise.
 * </p>
 */
public class AccessManagerJsonSerializer<U, G, C, A> {
    private static final Logger LOG = Logger.getLogger(AccessManagerJsonSerializer.class);

    private final ObjectMapper mapper;
    private final UniqueStringifier<U> userStringifier;
    private final UniqueStringifier<G> groupStringifier;
    private final UniqueStringifier<C> componentStringifier;
    private final UniqueStringifier<A> accessLevelStringifier;

    public AccessManagerJsonSerializer(UniqueStringifier<U> userStringifier,
                                       UniqueStringifier<G> groupStringifier,
                                       UniqueStringifier<C> componentStringifier,
                                       UniqueStringifier<A> accessLevelStringifier) {
        this(new ObjectMapper(), userStringifier, groupStringifier, componentStringifier, accessLevelStringifier);
    }

    public AccessManagerJsonSerializer(ObjectMapper mapper,
                                       UniqueStringifier<U> userStringifier,
                                       UniqueStringifier<G> groupStringifier,
                                       UniqueStringifier<C> componentStringifier,
                                       UniqueStringifier<A> accessLevelStringifier) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.userStringifier = Objects.requireNonNull(userStringifier, "userStringifier");
        this.groupStringifier = Objects.requireNonNull(groupStringifier, "groupStringifier");
        this.componentStringifier = Objects.requireNonNull(componentStringifier, "componentStringifier");
        this.accessLevelStringifier = Objects.requireNonNull(accessLevelStringifier, "accessLevelStringifier");
    }

    public String serialize(AccessManager<U, G, C, A> accessManager) {
        AccessManagerDocument document = toDocument(accessManager);
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(document);
        } catch (IOException e) {
            throw new AccessManagerSerializationException("Failed to write access manager to JSON", e);
        }
    }

    /**
     * Captures the state of the access manager under a single read lock.
     */
    public AccessManagerDocument toDocument(AccessManager<U, G, C, A> accessManager) {
        Objects.requireNonNull(accessManager, "accessManager");
        return accessManager.withConsistentRead(() -> capture(accessManager));
    }

    public AccessManager<U, G, C, A> deserialize(String json) {
        return deserialize(json, AccessManagerOptions.defaults());
    }

    public AccessManager<U, G, C, A> deserialize(String json, AccessManagerOptions options) {
        Objects.requireNonNull(json, "json");
        try {
            return fromDocument(mapper.readValue(json, AccessManagerDocument.class), options);
        } catch (IOException e) {
            throw new AccessManagerSerializationException("Failed to read access manager from JSON", e);
        }
    }

    public AccessManager<U, G, C, A> deserialize(InputStream in, AccessManagerOptions options) {
        Objects.requireNonNull(in, "in");
        try {
            return fromDocument(mapper.readValue(in, AccessManagerDocument.class), options);
        } catch (IOException e) {
            throw new AccessManagerSerializationException("Failed to read access manager from JSON", e);
        }
    }

    public AccessManager<U, G, C, A> fromDocument(AccessManagerDocument document, AccessManagerOptions options) {
        Objects.requireNonNull(document, "document");
        AccessManager<U, G, C, A> accessManager = new AccessManager<>(options);

        for (String user : listOf(document.users())) {
            accessManager.addUser(parse(userStringifier, user, "user"));
        }
        for (String group : listOf(document.groups())) {
            accessManager.addGroup(parse(groupStringifier, group, "group"));
        }
        for (EntityTypeEntities type : listOf(document.entityTypes())) {
            accessManager.addEntityType(type.entityType());
            for (String entity : listOf(type.entities())) {
                accessManager.addEntity(type.entityType(), entity);
            }
        }
        for (UserGroups mapping : listOf(document.userToGroupMappings())) {
            U user = parse(userStringifier, mapping.user(), "user");
            for (String group : listOf(mapping.groups())) {
                accessManager.addUserToGroupMapping(user, parse(groupStringifier, group, "group"));
            }
        }
        for (GroupGroups mapping : listOf(document.groupToGroupMappings())) {
            G fromGroup = parse(groupStringifier, mapping.group(), "group");
            for (String toGroup : listOf(mapping.groups())) {
                accessManager.addGroupToGroupMapping(fromGroup, parse(groupStringifier, toGroup, "group"));
            }
        }
        for (UserComponent mapping : listOf(document.userToComponentMappings())) {
            accessManager.addUserToComponentMapping(
                    parse(userStringifier, mapping.user(), "user"),
                    parse(componentStringifier, mapping.component(), "component"),
                    parse(accessLevelStringifier, mapping.accessLevel(), "access level"));
        }
        for (GroupComponent mapping : listOf(document.groupToComponentMappings())) {
            accessManager.addGroupToComponentMapping(
                    parse(groupStringifier, mapping.group(), "group"),
                    parse(componentStringifier, mapping.component(), "component"),
                    parse(accessLevelStringifier, mapping.accessLevel(), "access level"));
        }
        for (UserEntity mapping : listOf(document.userToEntityMappings())) {
            accessManager.addUserToEntityMapping(parse(userStringifier, mapping.user(), "user"), mapping.entityType(), mapping.entity());
        }
        for (GroupEntity mapping : listOf(document.groupToEntityMappings())) {
            accessManager.addGroupToEntityMapping(parse(groupStringifier, mapping.group(), "group"), mapping.entityType(), mapping.entity());
        }

        if (LOG.isDebugEnabled()) {
            LOG.debugf("Rebuilt access manager with %d users, %d groups and %d entity types",
                    listOf(document.users()).size(), listOf(document.groups()).size(), listOf(document.entityTypes()).size());
        }
        return accessManager;
    }

    private AccessManagerDocument capture(AccessManager<U, G, C, A> accessManager) {
        List<String> users = new ArrayList<>();
        List<UserGroups> userGroups = new ArrayList<>();
        List<UserComponent> userComponents = new ArrayList<>();
        List<UserEntity> userEntities = new ArrayList<>();
        for (U user : accessManager.getUsers()) {
            String key = userStringifier.toString(user);
            users.add(key);
            Set<G> memberOf = accessManager.getUserToGroupMappings(user);
            if (!memberOf.isEmpty()) {
                userGroups.add(new UserGroups(key, stringify(memberOf, g -> groupStringifier.toString(g))));
            }
            for (ComponentAccess<C, A> access : accessManager.getUserToComponentMappings(user)) {
                userComponents.add(new UserComponent(key,
                        componentStringifier.toString(access.component()),
                        accessLevelStringifier.toString(access.accessLevel())));
            }
            accessManager.getUserToEntityMappings(user).forEach((type, entities) ->
                    entities.forEach(entity -> userEntities.add(new UserEntity(key, type, entity))));
        }

        List<String> groups = new ArrayList<>();
        List<GroupGroups> groupGroups = new ArrayList<>();
        List<GroupComponent> groupComponents = new ArrayList<>();
        List<GroupEntity> groupEntities = new ArrayList<>();
        for (G group : accessManager.getGroups()) {
            String key = groupStringifier.toString(group);
            groups.add(key);
            Set<G> memberOf = accessManager.getGroupToGroupMappings(group);
            if (!memberOf.isEmpty()) {
                groupGroups.add(new GroupGroups(key, stringify(memberOf, g -> groupStringifier.toString(g))));
            }
            for (ComponentAccess<C, A> access : accessManager.getGroupToComponentMappings(group)) {
                groupComponents.add(new GroupComponent(key,
                        componentStringifier.toString(access.component()),
                        accessLevelStringifier.toString(access.accessLevel())));
            }
            accessManager.getGroupToEntityMappings(group).forEach((type, entities) ->
                    entities.forEach(entity -> groupEntities.add(new GroupEntity(key, type, entity))));
        }

        List<EntityTypeEntities> entityTypes = new ArrayList<>();
        for (String entityType : accessManager.getEntityTypes()) {
            entityTypes.add(new EntityTypeEntities(entityType, new ArrayList<>(accessManager.getEntities(entityType))));
        }

        return new AccessManagerDocument(users, groups, userGroups, groupGroups, userComponents, groupComponents,
                entityTypes, userEntities, groupEntities);
    }

    private static <T> List<String> stringify(Collection<T> values, Function<T, String> stringifier) {
        List<String> out = new ArrayList<>(values.size());
        for (T value : values) {
            out.add(stringifier.apply(value));
        }
        return out;
    }

    private static <T> T parse(UniqueStringifier<T> stringifier, String value, String label) {
        if (value == null) {
            throw new AccessManagerSerializationException("Missing " + label + " in access manager document");
        }
        try {
            return stringifier.fromString(value);
        } catch (IllegalArgumentException e) {
            throw new AccessManagerSerializationException(
                    String.format("Could not convert '%s' to a %s", value, label), e);
        }
    }

    private static <T> List<T> listOf(List<T> values) {
        return Optional.ofNullable(values).orElse(List.of());
    }
}
