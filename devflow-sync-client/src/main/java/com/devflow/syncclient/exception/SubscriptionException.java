package com.devflow.syncclient.exception;

import com.devflow.syncclient.connection.Subscription;

public class SubscriptionException extends SyncException {

    private final Subscription subscription;

    public SubscriptionException(String message, Subscription subscription) {
        super(message);
        this.subscription = subscription;
    }

    public Subscription getSubscription() {
        return subscription;
    }
}
