package com.xammer.spectre.service;

/**
 * AWS clients and the inspector built on them for a single run. Closing the session closes the clients.
 */
public class AuditSession implements AutoCloseable {

    private final AwsClientProvider clientProvider;
    private final BucketInspector inspector;

    public AuditSession(AwsClientProvider clientProvider, BucketInspector inspector) {
        this.clientProvider = clientProvider;
        this.inspector = inspector;
    }

    public BucketInspector getInspector() {
        return inspector;
    }

    public String getDefaultRegion() {
        return clientProvider.getDefaultRegion();
    }

    public String getProfile() {
        return clientProvider.getProfile();
    }

    @Override
    public void close() {
        clientProvider.close();
    }
}
