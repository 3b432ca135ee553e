package com.bastion.authgateway.api;

import jakarta.validation.constraints.NotBlank;

/**
 * Login form. The client hashes the password; the server compares hashes only.
 *
 * @param login login name or user id
 * @param passwordHash password hash
 */
public record LoginRequest(@NotBlank String login, @NotBlank String passwordHash) {

    @Override
    public String toString() {
        return "LoginRequest[login=" + login + ", passwordHash=[REDACTED]]";
    }
}
