package io.branchlite.repo;

/**
 * Rebuilds live database state after HEAD moves. Implemented by the storage engine.
 */
@FunctionalInterface
public interface StateReconstructor {

    StateReconstructor NONE = (branch, commit) -> { };

    void reconstruct(String branch, String commit);
}
