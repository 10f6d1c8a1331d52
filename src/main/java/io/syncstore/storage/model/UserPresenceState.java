package io.syncstore.storage.model;

/**
 * Presence row of a user that was not offline when the store started.
 */
public record UserPresenceState(String userId,
                                PresenceState state,
                                long lastActiveTs,
                                long lastFederationUpdateTs,
                                long lastUserSyncTs,
                                String statusMsg,
                                boolean currentlyActive) {
}
