package com.omniguard.api.crisis;

/**
 * Delivery channel to crisis resources (hotline routing, on-call responders).
 */
public interface CrisisResourcesClient {

    void notify(CrisisNotification notification);
}
