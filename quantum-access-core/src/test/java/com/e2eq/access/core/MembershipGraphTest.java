package com.e2eq.access.core;

import com.e2eq.access.exceptions.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class MembershipGraphTest {

    private MembershipGraph<String, String> graph;

    @BeforeEach
    void setUp() {
        graph = new MembershipGraph<>();
    }

    @Test
    void testAddUserTwiceFails() {
        graph.addUser("user1");
        DuplicateElementException ex = assertThrows(DuplicateElementException.class, () -> graph.addUser("user1"));
        assertEquals(ElementKind.USER, ex.getElementKind());
        assertEquals("User 'user1' already exists.", ex.getMessage());
    }

    @Test
    void testAddGroupTwiceFails() {
        graph.addGroup("group1");
        DuplicateElementException ex = assertThrows(DuplicateElementException.class, () -> graph.addGroup("group1"));
        assertEquals(ElementKind.GROUP, ex.getElementKind());
    }

    @Test
    void testNullNodesRejected() {
        assertThrows(NullPointerException.class, () -> graph.addUser(null));
        assertThrows(NullPointerException.class, () -> graph.addGroup(null));
    }

    @Test
    void testUserToGroupEdgeMissingEndpoint() {
        graph.addUser("user1");
        graph.addGroup("group1");

        InvalidReferenceException missingUser = assertThrows(InvalidReferenceException.class,
                () -> graph.addUserToGroupEdge("user2", "group1"));
        assertEquals("user", missingUser.getParameterName());
        assertEquals(ElementKind.USER, missingUser.getElementKind());
        assertEquals(ElementKind.USER_TO_GROUP_MAPPING, missingUser.getReferencingKind());

        InvalidReferenceException missingGroup = assertThrows(InvalidReferenceException.class,
                () -> graph.addUserToGroupEdge("user1", "group2"));
        assertEquals("group", missingGroup.getParameterName());
        assertEquals(ElementKind.GROUP, missingGroup.getElementKind());
    }

    @Test
    void testInvalidReferenceIsANotFound() {
        graph.addGroup("group1");
        assertThrows(ElementNotFoundException.class, () -> graph.addGroupToGroupEdge("group1", "group2"));
    }

    @Test
    void testGroupToGroupEdgeIdentifiesMissingEndpoint() {
        graph.addGroup("group1");

        InvalidReferenceException from = assertThrows(InvalidReferenceException.class,
                () -> graph.addGroupToGroupEdge("group2", "group1"));
        assertEquals("fromGroup", from.getParameterName());

        InvalidReferenceException to = assertThrows(InvalidReferenceException.class,
                () -> graph.addGroupToGroupEdge("group1", "group2"));
        assertEquals("toGroup", to.getParameterName());
    }

    @Test
    void testDuplicateEdgesRejected() {
        graph.addUser("user1");
        graph.addGroup("group1");
        graph.addGroup("group2");
        graph.addUserToGroupEdge("user1", "group1");
        graph.addGroupToGroupEdge("group1", "group2");

        DuplicateElementException userEdge = assertThrows(DuplicateElementException.class,
                () -> graph.addUserToGroupEdge("user1", "group1"));
        assertEquals("A mapping between user 'user1' and group 'group1' already exists.", userEdge.getMessage());
        DuplicateElementException groupEdge = assertThrows(DuplicateElementException.class,
                () -> graph.addGroupToGroupEdge("group1", "group2"));
        assertEquals(ElementKind.GROUP_TO_GROUP_MAPPING, groupEdge.getElementKind());
    }

    @Test
    void testSelfLoopRejected() {
        graph.addGroup("group1");
        CircularReferenceException ex = assertThrows(CircularReferenceException.class,
                () -> graph.addGroupToGroupEdge("group1", "group1"));
        assertEquals("Group 'group1' cannot be mapped to itself.", ex.getMessage());
        assertTrue(graph.outgoingGroupsOfGroup("group1").isEmpty());
    }

    @Test
    void testOutgoingGroups() {
        graph.addUser("user1");
        graph.addGroup("group1");
        graph.addGroup("group2");
        graph.addGroup("group3");
        graph.addUserToGroupEdge("user1", "group1");
        graph.addUserToGroupEdge("user1", "group2");
        graph.addGroupToGroupEdge("group1", "group3");

        assertEquals(Set.of("group1", "group2"), graph.outgoingGroupsOfUser("user1"));
        assertEquals(Set.of("group3"), graph.outgoingGroupsOfGroup("group1"));
        assertTrue(graph.outgoingGroupsOfGroup("group3").isEmpty());
        assertThrows(ElementNotFoundException.class, () -> graph.outgoingGroupsOfUser("user2"));
    }

    @Test
    void testRemoveEdges() {
        graph.addUser("user1");
        graph.addGroup("group1");
        graph.addGroup("group2");
        graph.addUserToGroupEdge("user1", "group1");
        graph.addGroupToGroupEdge("group1", "group2");

        graph.removeUserToGroupEdge("user1", "group1");
        graph.removeGroupToGroupEdge("group1", "group2");

        assertFalse(graph.containsUserToGroupEdge("user1", "group1"));
        assertFalse(graph.containsGroupToGroupEdge("group1", "group2"));
        ElementNotFoundException again = assertThrows(ElementNotFoundException.class,
                () -> graph.removeUserToGroupEdge("user1", "group1"));
        assertEquals(ElementKind.USER_TO_GROUP_MAPPING, again.getElementKind());
        assertThrows(ElementNotFoundException.class, () -> graph.removeGroupToGroupEdge("group1", "group2"));
    }

    @Test
    void testRemoveGroupRemovesIncidentEdges() {
        graph.addUser("user1");
        graph.addGroup("group1");
        graph.addGroup("group2");
        graph.addGroup("group3");
        graph.addUserToGroupEdge("user1", "group2");
        graph.addGroupToGroupEdge("group1", "group2");
        graph.addGroupToGroupEdge("group2", "group3");

        assertEquals(3, graph.removeGroup("group2"));

        assertFalse(graph.containsGroup("group2"));
        assertTrue(graph.outgoingGroupsOfUser("user1").isEmpty());
        assertTrue(graph.outgoingGroupsOfGroup("group1").isEmpty());
        assertEquals(0, graph.userToGroupEdgeCount());
        assertEquals(0, graph.groupToGroupEdgeCount());
    }

    @Test
    void testRemoveNodeWithoutEdges() {
        graph.addUser("user1");
        graph.addGroup("group1");
        assertEquals(0, graph.removeUser("user1"));
        assertEquals(0, graph.removeGroup("group1"));
        assertThrows(ElementNotFoundException.class, () -> graph.removeUser("user1"));
        assertThrows(ElementNotFoundException.class, () -> graph.removeGroup("group1"));
    }

    @Test
    void testTraversalVisitsDiamondAncestorOnce() {
        //       top
        //      /   \
        //   left   right
        //      \   /
        //      bottom <- user1
        graph.addUser("user1");
        for (String g : List.of("bottom", "left", "right", "top")) graph.addGroup(g);
        graph.addUserToGroupEdge("user1", "bottom");
        graph.addGroupToGroupEdge("bottom", "left");
        graph.addGroupToGroupEdge("bottom", "right");
        graph.addGroupToGroupEdge("left", "top");
        graph.addGroupToGroupEdge("right", "top");

        List<String> visited = new ArrayList<>();
        assertTrue(graph.traverseFromUser("user1", visited::add));

        assertEquals(4, visited.size());
        assertEquals(Set.of("bottom", "left", "right", "top"), new HashSet<>(visited));
    }

    @Test
    void testTraversalTerminatesOnCycle() {
        for (String g : List.of("a", "b", "c")) graph.addGroup(g);
        graph.addGroupToGroupEdge("a", "b");
        graph.addGroupToGroupEdge("b", "c");
        graph.addGroupToGroupEdge("c", "a");

        List<String> visited = new ArrayList<>();
        assertTrue(graph.traverseFromGroup("b", visited::add));
        assertEquals(Set.of("a", "b", "c"), new HashSet<>(visited));
        assertEquals(3, visited.size());
    }

    @Test
    void testTraversalStopsWhenActionReturnsFalse() {
        for (String g : List.of("a", "b", "c")) graph.addGroup(g);
        graph.addGroupToGroupEdge("a", "b");
        graph.addGroupToGroupEdge("b", "c");

        List<String> visited = new ArrayList<>();
        assertFalse(graph.traverseFromGroup("a", g -> {
            visited.add(g);
            return !g.equals("b");
        }));
        assertEquals(List.of("a", "b"), visited);
    }

    @Test
    void testIsReachable() {
        for (String g : List.of("a", "b", "c", "d")) graph.addGroup(g);
        graph.addGroupToGroupEdge("a", "b");
        graph.addGroupToGroupEdge("b", "c");

        assertTrue(graph.isReachable("a", "c"));
        assertTrue(graph.isReachable("a", "a"));
        assertFalse(graph.isReachable("c", "a"));
        assertFalse(graph.isReachable("a", "d"));
    }
}
