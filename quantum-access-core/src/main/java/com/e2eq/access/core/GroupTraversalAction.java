package com.e2eq.access.core;

/**
 * Action invoked on each group reached while walking the membership graph.
 *
 * @param <G> the type of groups
 */
@FunctionalInterface
public interface GroupTraversalAction<G> {

    /**
     * @param group the group being visited
     * @return true to keep traversing, false to stop the walk
     */
    boolean visit(G group);
}
