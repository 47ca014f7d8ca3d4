package com.e2eq.access.core;

import com.e2eq.access.exceptions.CircularReferenceException;
import com.e2eq.access.exceptions.DuplicateElementException;
import com.e2eq.access.exceptions.ElementKind;
import com.e2eq.access.exceptions.ElementNotFoundException;
import com.e2eq.access.exceptions.InvalidReferenceException;

import java.util.*;

/**
 * Directed graph of users and groups, where an edge means "source is a member of target".
 * <p>
 * Nodes are indexed by the caller supplied keys and each node holds the set of groups it directly belongs to.
 * Users only ever appear as edge sources. The graph is not thread safe; {@link AccessManager} serialises
 * access to it.
 * </p>
 *
 * @param <U> the type of users
 * @param <G> the type of groups
 */
public final class MembershipGraph<U, G> {

    private final Set<U> users = new LinkedHashSet<>();
    private final Set<G> groups = new LinkedHashSet<>();
    private final Map<U, Set<G>> userToGroupEdges = new HashMap<>();
    private final Map<G, Set<G>> groupToGroupEdges = new HashMap<>();

    public void addUser(U user) {
        Objects.requireNonNull(user, "user");
        if (!users.add(user)) {
            throw new DuplicateElementException(ElementKind.USER, String.valueOf(user));
        }
    }

    public boolean containsUser(U user) {
        return users.contains(user);
    }

    public Set<U> users() {
        return Collections.unmodifiableSet(users);
    }

    /**
     * Removes a user together with its outgoing edges.
     *
     * @return the number of edges removed
     */
    public int removeUser(U user) {
        requireUser(user, "user");
        Set<G> edges = userToGroupEdges.remove(user);
        users.remove(user);
        return edges == null ? 0 : edges.size();
    }

    public void addGroup(G group) {
        Objects.requireNonNull(group, "group");
        if (!groups.add(group)) {
            throw new DuplicateElementException(ElementKind.GROUP, String.valueOf(group));
        }
    }

    public boolean containsGroup(G group) {
        return groups.contains(group);
    }

    public Set<G> groups() {
        return Collections.unmodifiableSet(groups);
    }

    /**
     * Removes a group and every edge which has it as source or target. Incoming edges are found by scanning
     * every adjacency set in the graph.
     *
     * @return the number of edges removed
     */
    public int removeGroup(G group) {
        requireGroup(group, "group");
        int removed = 0;
        Set<G> outgoing = groupToGroupEdges.remove(group);
        if (outgoing != null) {
            removed += outgoing.size();
        }
        removed += removeTarget(userToGroupEdges, group);
        removed += removeTarget(groupToGroupEdges, group);
        groups.remove(group);
        return removed;
    }

    public void addUserToGroupEdge(U user, G group) {
        if (!containsUser(user)) {
            throw new InvalidReferenceException(ElementKind.USER_TO_GROUP_MAPPING, ElementKind.USER, String.valueOf(user), "user");
        }
        if (!containsGroup(group)) {
            throw new InvalidReferenceException(ElementKind.USER_TO_GROUP_MAPPING, ElementKind.GROUP, String.valueOf(group), "group");
        }
        Set<G> edges = userToGroupEdges.computeIfAbsent(user, k -> new LinkedHashSet<>());
        if (!edges.add(group)) {
            throw new DuplicateElementException(ElementKind.USER_TO_GROUP_MAPPING, user + " -> " + group,
                    String.format("A mapping between user '%s' and group '%s' already exists.", user, group));
        }
    }

    public boolean containsUserToGroupEdge(U user, G group) {
        Set<G> edges = userToGroupEdges.get(user);
        return edges != null && edges.contains(group);
    }

    public void removeUserToGroupEdge(U user, G group) {
        requireUser(user, "user");
        requireGroup(group, "group");
        Set<G> edges = userToGroupEdges.get(user);
        if (edges == null || !edges.remove(group)) {
            throw new ElementNotFoundException(ElementKind.USER_TO_GROUP_MAPPING, user + " -> " + group, null);
        }
        if (edges.isEmpty()) {
            userToGroupEdges.remove(user);
        }
    }

    /**
     * Adds an edge making {@code fromGroup} a member of {@code toGroup}. Self-loops are always rejected; longer
     * cycles are the caller's decision, see {@link #isReachable(Object, Object)}.
     */
    public void addGroupToGroupEdge(G fromGroup, G toGroup) {
        if (!containsGroup(fromGroup)) {
            throw new InvalidReferenceException(ElementKind.GROUP_TO_GROUP_MAPPING, ElementKind.GROUP, String.valueOf(fromGroup), "fromGroup");
        }
        if (!containsGroup(toGroup)) {
            throw new InvalidReferenceException(ElementKind.GROUP_TO_GROUP_MAPPING, ElementKind.GROUP, String.valueOf(toGroup), "toGroup");
        }
        if (fromGroup.equals(toGroup)) {
            throw new CircularReferenceException(String.valueOf(fromGroup), String.valueOf(toGroup));
        }
        if (containsGroupToGroupEdge(fromGroup, toGroup)) {
            throw new DuplicateElementException(ElementKind.GROUP_TO_GROUP_MAPPING, fromGroup + " -> " + toGroup,
                    String.format("A mapping between group '%s' and group '%s' already exists.", fromGroup, toGroup));
        }
        groupToGroupEdges.computeIfAbsent(fromGroup, k -> new LinkedHashSet<>()).add(toGroup);
    }

    public boolean containsGroupToGroupEdge(G fromGroup, G toGroup) {
        Set<G> edges = groupToGroupEdges.get(fromGroup);
        return edges != null && edges.contains(toGroup);
    }

    public void removeGroupToGroupEdge(G fromGroup, G toGroup) {
        requireGroup(fromGroup, "fromGroup");
        requireGroup(toGroup, "toGroup");
        Set<G> edges = groupToGroupEdges.get(fromGroup);
        if (edges == null || !edges.remove(toGroup)) {
            throw new ElementNotFoundException(ElementKind.GROUP_TO_GROUP_MAPPING, fromGroup + " -> " + toGroup, null);
        }
        if (edges.isEmpty()) {
            groupToGroupEdges.remove(fromGroup);
        }
    }

    /**
     * Returns the groups the user is directly a member of.
     */
    public Set<G> outgoingGroupsOfUser(U user) {
        requireUser(user, "user");
        return Collections.unmodifiableSet(userToGroupEdges.getOrDefault(user, Set.of()));
    }

    /**
     * Returns the groups the group is directly a member of.
     */
    public Set<G> outgoingGroupsOfGroup(G group) {
        requireGroup(group, "group");
        return Collections.unmodifiableSet(groupToGroupEdges.getOrDefault(group, Set.of()));
    }

    /**
     * Walks every group reachable from the user, invoking the action once per group.
     *
     * @return true if the walk visited every reachable group, false if the action stopped it
     */
    public boolean traverseFromUser(U user, GroupTraversalAction<G> action) {
        requireUser(user, "user");
        return traverse(userToGroupEdges.getOrDefault(user, Set.of()), action);
    }

    /**
     * Walks the group itself and every group reachable from it, invoking the action once per group.
     *
     * @return true if the walk visited every reachable group, false if the action stopped it
     */
    public boolean traverseFromGroup(G group, GroupTraversalAction<G> action) {
        requireGroup(group, "group");
        return traverse(List.of(group), action);
    }

    /**
     * Returns true if {@code target} is {@code start} or one of its ancestor groups.
     */
    public boolean isReachable(G start, G target) {
        return !traverseFromGroup(start, group -> !group.equals(target));
    }

    public void requireUser(U user, String parameterName) {
        if (!containsUser(user)) {
            throw new ElementNotFoundException(ElementKind.USER, String.valueOf(user), parameterName);
        }
    }

    public void requireGroup(G group, String parameterName) {
        if (!containsGroup(group)) {
            throw new ElementNotFoundException(ElementKind.GROUP, String.valueOf(group), parameterName);
        }
    }

    public int userToGroupEdgeCount() {
        return userToGroupEdges.values().stream().mapToInt(Set::size).sum();
    }

    public int groupToGroupEdgeCount() {
        return groupToGroupEdges.values().stream().mapToInt(Set::size).sum();
    }

    // Iterative depth first walk; the visited set bounds the walk even when the graph holds a cycle
    private boolean traverse(Collection<G> seeds, GroupTraversalAction<G> action) {
        Set<G> visited = new HashSet<>();
        Deque<G> stack = new ArrayDeque<>();
        for (G seed : seeds) {
            stack.push(seed);
        }

        while (!stack.isEmpty()) {
            G current = stack.pop();
            if (!visited.add(current)) continue;
            if (!action.visit(current)) {
                return false;
            }
            for (G next : groupToGroupEdges.getOrDefault(current, Set.of())) {
                if (!visited.contains(next)) {
                    stack.push(next);
                }
            }
        }
        return true;
    }

    private static <K, T> int removeTarget(Map<K, Set<T>> edges, T target) {
        int removed = 0;
        Iterator<Map.Entry<K, Set<T>>> it = edges.entrySet().iterator();
        while (it.hasNext()) {
            Set<T> targets = it.next().getValue();
            if (targets.remove(target)) {
                removed++;
            }
            if (targets.isEmpty()) {
                it.remove();
            }
        }
        return removed;
    }
}
