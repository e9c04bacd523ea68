package com.leasehold.service.api;

import jakarta.validation.constraints.NotBlank;

public record MintRequest(@NotBlank String owner) {}
