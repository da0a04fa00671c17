package com.coshare.api.account;

import jakarta.validation.constraints.NotNull;

public record CreateAccountRequest(
    @NotNull String seed
) {}
