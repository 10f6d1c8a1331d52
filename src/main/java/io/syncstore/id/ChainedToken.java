package io.syncstore.id;

/**
 * @param position       position in the derived stream
 * @param parentPosition parent stream token the derived position was allocated against
 */
public record ChainedToken(long position, long parentPosition) {
}
