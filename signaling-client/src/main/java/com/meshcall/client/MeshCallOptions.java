package com.meshcall.client;

import com.meshcall.client.media.MediaConstraints;
import com.meshcall.client.negotiation.NegotiationPolicy;
import com.meshcall.client.negotiation.OfferPolicy;
import com.meshcall.client.transport.RtcConfiguration;
import java.time.Duration;

public class MeshCallOptions {

    private MediaConstraints mediaConstraints = MediaConstraints.defaults();
    private RtcConfiguration rtcConfiguration = RtcConfiguration.defaults();
    private NegotiationPolicy negotiationPolicy = NegotiationPolicy.defaults();
    private OfferPolicy offerPolicy = OfferPolicy.ID_ORDERED;
    private Duration connectTimeout = Duration.ofSeconds(10);

    public static MeshCallOptions defaults() {
        return new MeshCallOptions();
    }

    public MediaConstraints getMediaConstraints() {
        return mediaConstraints;
    }

    public void setMediaConstraints(MediaConstraints mediaConstraints) {
        this.mediaConstraints = mediaConstraints;
    }

    public RtcConfiguration getRtcConfiguration() {
        return rtcConfiguration;
    }

    public void setRtcConfiguration(RtcConfiguration rtcConfiguration) {
        this.rtcConfiguration = rtcConfiguration;
    }

    public NegotiationPolicy getNegotiationPolicy() {
        return negotiationPolicy;
    }

    public void setNegotiationPolicy(NegotiationPolicy negotiationPolicy) {
        this.negotiationPolicy = negotiationPolicy;
    }

    public OfferPolicy getOfferPolicy() {
        return offerPolicy;
    }

    public void setOfferPolicy(OfferPolicy offerPolicy) {
        this.offerPolicy = offerPolicy;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }
}
