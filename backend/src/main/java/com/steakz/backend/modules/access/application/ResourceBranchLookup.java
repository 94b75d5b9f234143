package com.steakz.backend.modules.access.application;

/**
 * Loads the owning branch of an id-keyed resource. Invoked only after the role and category
 * checks have passed; implementations throw a not-found problem for unknown ids.
 */
@FunctionalInterface
public interface ResourceBranchLookup {

    Long loadBranchId();
}
