package com.memberguard.backend.integrations;

/**
 * The premium group as the external system of record for access.
 * Every call is a single best-effort attempt; nothing is retried within a run.
 */
public interface GroupMembershipProvider {

    /**
     * @throws GroupMembershipException when the platform could not answer, so callers
     *                                  skip the candidate instead of acting on a guess
     */
    boolean isMember(long userId) throws GroupMembershipException;

    /**
     * Invite usable by one person, expiring after ttlSeconds.
     *
     * @return the invite link, or null when it could not be created
     */
    String createSingleUseInvite(long userId, int ttlSeconds);

    /**
     * Removes the user from the group without barring a later rejoin.
     *
     * @return true when the platform confirmed the removal
     */
    boolean removeMember(long userId);
}
