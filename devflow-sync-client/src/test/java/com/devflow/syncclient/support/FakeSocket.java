package com.devflow.syncclient.support;

import com.devflow.syncclient.transport.SocketListener;
import com.devflow.syncclient.transport.SyncSocket;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.UncheckedIOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * In-memory socket driven by the test: open it, feed it frames, close it with
 * any code, and inspect what the client sent.
 */
public class FakeSocket implements SyncSocket {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final URI uri;
    private final SocketListener listener;
    private final List<String> sent = new ArrayList<>();

    private boolean connectCalled;
    private boolean open;
    private boolean closed;
    private Integer clientCloseCode;

    FakeSocket(URI uri, SocketListener listener) {
        this.uri = uri;
        this.listener = listener;
    }

    @Override
    public void connect() {
        connectCalled = true;
    }

    @Override
    public void send(String text) {
        if (!open) {
            throw new IllegalStateException("Socket not open");
        }
        sent.add(text);
    }

    @Override
    public void close(int code, String reason) {
        if (closed) {
            return;
        }
        clientCloseCode = code;
        open = false;
        closed = true;
        listener.onClose(code, reason, false);
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    // ========== Server side ==========

    public FakeSocket open() {
        open = true;
        listener.onOpen();
        return this;
    }

    public FakeSocket receive(String frame) {
        listener.onMessage(frame);
        return this;
    }

    public FakeSocket receive(String type, String dataJson) {
        return receive("{\"type\":\"" + type + "\",\"data\":" + dataJson + "}");
    }

    public void closeWith(int code, String reason) {
        open = false;
        closed = true;
        listener.onClose(code, reason, true);
    }

    public void fail(Exception error) {
        listener.onError(error);
        closeWith(1006, error.getMessage());
    }

    // ========== Inspection ==========

    public URI getUri() {
        return uri;
    }

    public boolean isConnectCalled() {
        return connectCalled;
    }

    public Integer getClientCloseCode() {
        return clientCloseCode;
    }

    public List<String> sentFrames() {
        return List.copyOf(sent);
    }

    public List<JsonNode> sentMessages() {
        return sent.stream().map(FakeSocket::parse).collect(Collectors.toList());
    }

    public List<JsonNode> sentOfType(String type) {
        return sentMessages().stream()
            .filter(m -> type.equals(m.path("type").asText()))
            .collect(Collectors.toList());
    }

    public void clearSent() {
        sent.clear();
    }

    private static JsonNode parse(String frame) {
        try {
            return MAPPER.readTree(frame);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
