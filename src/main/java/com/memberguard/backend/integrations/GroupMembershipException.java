package com.memberguard.backend.integrations;

public class GroupMembershipException extends Exception {

    public GroupMembershipException(String message) {
        super(message);
    }

    public GroupMembershipException(String message, Throwable cause) {
        super(message, cause);
    }
}
