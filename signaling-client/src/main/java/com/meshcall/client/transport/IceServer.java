package com.meshcall.client.transport;

import java.util.List;

public class IceServer {

    private final List<String> urls;
    private final String username;
    private final String credential;

    public IceServer(List<String> urls, String username, String credential) {
        if (urls == null || urls.isEmpty()) {
            throw new IllegalArgumentException("ICE server requires at least one url");
        }
        this.urls = List.copyOf(urls);
        this.username = username;
        this.credential = credential;
    }

    public static IceServer stun(String url) {
        return new IceServer(List.of(url), null, null);
    }

    public List<String> getUrls() {
        return urls;
    }

    public String getUsername() {
        return username;
    }

    public String getCredential() {
        return credential;
    }
}
