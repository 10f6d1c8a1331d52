package io.syncstore.storage.model;

/**
 * Identity of a client for "last seen" rate limiting.
 */
public record ClientIpKey(String userId, String accessToken, String ip) {
}
