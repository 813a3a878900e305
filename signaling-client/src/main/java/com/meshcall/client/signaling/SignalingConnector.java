package com.meshcall.client.signaling;

import java.net.URI;
import java.util.concurrent.CompletableFuture;

@FunctionalInterface
public interface SignalingConnector {

    CompletableFuture<SignalingChannel> connect(URI serverUri, SignalingChannelListener listener);
}
