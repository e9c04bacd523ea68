package com.leasehold.service.api;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigInteger;

/** Amount in wei for deposits and withdrawals. */
public record AmountRequest(@NotNull @Positive BigInteger amount) {}
