package io.syncstore.storage.model;

public record UserIpRecord(String accessToken, String ip, String userAgent, long lastSeen) {
}
