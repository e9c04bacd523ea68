package com.leasehold.policy.engine;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered, duplicate-free list of policy types bound to one entity.
 */
record PolicyList(List<String> policyTypes) {

    static final PolicyList EMPTY = new PolicyList(List.of());

    PolicyList {
        policyTypes = List.copyOf(policyTypes);
    }

    boolean contains(String policyType) {
        return policyTypes.contains(policyType);
    }

    int size() {
        return policyTypes.size();
    }

    PolicyList append(String policyType) {
        List<String> next = new ArrayList<>(policyTypes);
        next.add(policyType);
        return new PolicyList(next);
    }

    /** Moves the last entry into the removed slot and truncates. */
    PolicyList swapRemove(String policyType) {
        int index = policyTypes.indexOf(policyType);
        if (index < 0) {
            return this;
        }
        List<String> next = new ArrayList<>(policyTypes);
        int last = next.size() - 1;
        next.set(index, next.get(last));
        next.remove(last);
        return new PolicyList(next);
    }
}
