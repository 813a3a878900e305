package com.meshcall.client.negotiation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.meshcall.client.media.LocalMedia;
import com.meshcall.client.signaling.SignalSender;
import com.meshcall.client.transport.PeerTransportFactory;
import com.meshcall.client.transport.RtcConfiguration;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;

/**
 * 한 통화의 모든 피어 협상이 공유하는 자원.
 */
public class NegotiationContext {

    private final PeerTransportFactory transportFactory;
    private final RtcConfiguration rtcConfiguration;
    private final LocalMedia localMedia;
    private final SignalSender signalSender;
    private final NegotiationPolicy policy;
    private final ScheduledExecutorService scheduler;
    private final ObjectMapper objectMapper;

    public NegotiationContext(PeerTransportFactory transportFactory,
                              RtcConfiguration rtcConfiguration,
                              LocalMedia localMedia,
                              SignalSender signalSender,
                              NegotiationPolicy policy,
                              ScheduledExecutorService scheduler,
                              ObjectMapper objectMapper) {
        this.transportFactory = Objects.requireNonNull(transportFactory, "transportFactory must not be null");
        this.rtcConfiguration = Objects.requireNonNull(rtcConfiguration, "rtcConfiguration must not be null");
        this.localMedia = Objects.requireNonNull(localMedia, "localMedia must not be null");
        this.signalSender = Objects.requireNonNull(signalSender, "signalSender must not be null");
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    public PeerTransportFactory getTransportFactory() {
        return transportFactory;
    }

    public RtcConfiguration getRtcConfiguration() {
        return rtcConfiguration;
    }

    public LocalMedia getLocalMedia() {
        return localMedia;
    }

    public SignalSender getSignalSender() {
        return signalSender;
    }

    public NegotiationPolicy getPolicy() {
        return policy;
    }

    public ScheduledExecutorService getScheduler() {
        return scheduler;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }
}
