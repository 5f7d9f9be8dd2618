package com.callinsight.common.security;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SecurityUtilsTest {

    @AfterEach
    void clearContext() {
        SecurityContextHolder.clearContext();
    }

    @Test
    void currentSubjectReturnsTheAuthenticatedOperator() {
        SecurityContextHolder.getContext().setAuthentication(new UsernamePasswordAuthenticationToken(
                new AuthenticatedUser("operator@example.com", "OPERATOR"),
                null,
                List.of(new SimpleGrantedAuthority("ROLE_OPERATOR"))
        ));

        assertThat(SecurityUtils.currentSubject()).isEqualTo("operator@example.com");
    }

    @Test
    void currentSubjectIsAnonymousWithoutAnOperator() {
        assertThat(SecurityUtils.currentSubject()).isEqualTo("anonymous");

        SecurityContextHolder.getContext().setAuthentication(
                new UsernamePasswordAuthenticationToken("webhook", null, List.of()));

        assertThat(SecurityUtils.currentSubject()).isEqualTo("anonymous");
    }
}
