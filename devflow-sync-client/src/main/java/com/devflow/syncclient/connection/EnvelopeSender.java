package com.devflow.syncclient.connection;

import com.devflow.syncclient.exception.NotConnectedException;

@FunctionalInterface
public interface EnvelopeSender {

    void send(Envelope envelope) throws NotConnectedException;
}
