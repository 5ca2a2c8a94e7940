package org.observatory.datapipeline.api.resources;

/**
 * Base interface for all resources: components giving services access to storage or buffers
 * (the action queue, the ledger, the snapshot store, the rejection log).
 */
public interface IResource {

    /**
     * The operational state of a resource.
     */
    enum ResourceState {
        /**
         * The resource is functioning normally.
         */
        ACTIVE,
        /**
         * The resource is temporarily busy or blocked (e.g., queue full).
         */
        WAITING,
        /**
         * The resource has failed and refuses further work.
         */
        FAILED
    }

    /**
     * @return the unique name of the resource instance
     */
    String getResourceName();

    ResourceState getState();
}
