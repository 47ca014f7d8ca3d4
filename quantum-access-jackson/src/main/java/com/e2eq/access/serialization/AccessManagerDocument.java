package com.e2eq.access.serialization;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * JSON form of the complete state of an access manager, with every key already stringified.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AccessManagerDocument(
        List<String> users,
        List<String> groups,
        List<UserGroups> userToGroupMappings,
        List<GroupGroups> groupToGroupMappings,
        List<UserComponent> userToComponentMappings,
        List<GroupComponent> groupToComponentMappings,
        List<EntityTypeEntities> entityTypes,
        List<UserEntity> userToEntityMappings,
        List<GroupEntity> groupToEntityMappings
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record UserGroups(String user, List<String> groups) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record GroupGroups(String group, List<String> groups) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record UserComponent(String user, String component, String accessLevel) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record GroupComponent(String group, String component, String accessLevel) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record EntityTypeEntities(String entityType, List<String> entities) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record UserEntity(String user, String entityType, String entity) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record GroupEntity(String group, String entityType, String entity) {}
}
