package com.e2eq.access.core;

/**
 * Behavioural options for an {@link AccessManager}.
 *
 * @param rejectCircularGroupMappings reject a group to group mapping which would close a cycle. When false,
 *                                    cycles are admitted and queries rely on their visited set to terminate.
 * @param fairLocking                 use a fair reader/writer lock, so a waiting mutation is not starved by a
 *                                    steady stream of queries
 */
public record AccessManagerOptions(boolean rejectCircularGroupMappings, boolean fairLocking) {

    public static final boolean DEFAULT_REJECT_CIRCULAR_GROUP_MAPPINGS = true;
    public static final boolean DEFAULT_FAIR_LOCKING = false;

    public static AccessManagerOptions defaults() {
        return new AccessManagerOptions(DEFAULT_REJECT_CIRCULAR_GROUP_MAPPINGS, DEFAULT_FAIR_LOCKING);
    }

    public AccessManagerOptions withRejectCircularGroupMappings(boolean reject) {
        return new AccessManagerOptions(reject, fairLocking);
    }

    public AccessManagerOptions withFairLocking(boolean fair) {
        return new AccessManagerOptions(rejectCircularGroupMappings, fair);
    }
}
