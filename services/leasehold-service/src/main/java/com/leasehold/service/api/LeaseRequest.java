package com.leasehold.service.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;

public record LeaseRequest(@NotBlank String renter, @NotNull Instant expiry) {}
