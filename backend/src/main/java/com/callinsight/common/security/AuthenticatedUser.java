package com.callinsight.common.security;

public record AuthenticatedUser(
        String subject,
        String role
) {
}
