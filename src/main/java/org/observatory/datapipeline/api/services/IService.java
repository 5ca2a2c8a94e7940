package org.observatory.datapipeline.api.services;

import org.observatory.datapipeline.api.resources.OperationalError;

import java.util.List;

/**
 * Lifecycle contract of a long-running component that owns a thread.
 */
public interface IService {

    /**
     * The operational state of a service.
     */
    enum State {
        /**
         * The service is not running and must be started to become active.
         */
        STOPPED,
        /**
         * The service is actively working.
         */
        RUNNING,
        /**
         * The service is temporarily suspended but can resume its work.
         */
        PAUSED,
        /**
         * The service has encountered a fatal error and cannot continue.
         */
        ERROR
    }

    void start();

    void stop();

    void pause();

    void resume();

    State getCurrentState();

    /**
     * Restarts the service. This is typically implemented as a stop() followed by a start().
     */
    void restart();

    List<OperationalError> getErrors();

    void clearErrors();
}
