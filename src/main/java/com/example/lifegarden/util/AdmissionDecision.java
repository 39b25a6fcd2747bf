package com.example.lifegarden.util;

import java.util.Set;

/**
 * Admitted and rejected plant ids keep the order in which they were requested.
 */
public record AdmissionDecision(Set<Long> admitted,
                                Set<Long> rejected,
                                int remainingCapacity) {
}
