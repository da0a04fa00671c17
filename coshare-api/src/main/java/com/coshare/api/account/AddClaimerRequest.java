package com.coshare.api.account;

import jakarta.validation.constraints.NotBlank;

public record AddClaimerRequest(
    @NotBlank String claimer
) {}
