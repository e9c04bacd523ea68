package com.leasehold.policy.plugin;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Immutable set of normalized addresses.
 */
public record AddressWhitelist(Set<String> entries) {

    public AddressWhitelist {
        entries = Set.copyOf(entries);
    }

    public static AddressWhitelist empty() {
        return new AddressWhitelist(Set.of());
    }

    public boolean contains(String address) {
        return entries.contains(address);
    }

    AddressWhitelist with(String address) {
        Set<String> next = new LinkedHashSet<>(entries);
        next.add(address);
        return new AddressWhitelist(next);
    }

    AddressWhitelist without(String address) {
        Set<String> next = new LinkedHashSet<>(entries);
        next.remove(address);
        return new AddressWhitelist(next);
    }
}
