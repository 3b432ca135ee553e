package com.bastion.authgateway.api;

import jakarta.validation.constraints.NotBlank;

public record ChangePasswordRequest(@NotBlank String newPasswordHash) {

    @Override
    public String toString() {
        return "ChangePasswordRequest[newPasswordHash=[REDACTED]]";
    }
}
