// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.retry;

import java.util.List;
import software.amazon.retry.validation.ParameterValidator;

/**
 * Classifies failures thrown by a retried operation.
 *
 * <p>A failure the matcher accepts is transient: it is recorded and the operation is tried again. Any other failure is
 * fatal and is rethrown to the caller immediately.
 */
@FunctionalInterface
public interface FailureMatcher {

    /**
     * @param failure the exception thrown by the operation
     * @return true if the operation may be retried after this failure
     */
    boolean isRetryable(Throwable failure);

    /** @return a matcher treating every failure as retryable */
    static FailureMatcher any() {
        return failure -> true;
    }

    /**
     * Matches failures that are instances of one of the given types, including subclasses.
     *
     * @param types the retryable exception types
     * @return the matcher
     */
    @SafeVarargs
    static FailureMatcher anyOf(Class<? extends Throwable>... types) {
        ParameterValidator.validateNotNull(types, "types");
        var retryable = List.of(types);
        return failure -> retryable.stream().anyMatch(type -> type.isInstance(failure));
    }

    /** @return a matcher accepting failures both this and {@code other} accept */
    default FailureMatcher and(FailureMatcher other) {
        ParameterValidator.validateNotNull(other, "other");
        return failure -> isRetryable(failure) && other.isRetryable(failure);
    }

    /** @return a matcher accepting exactly the failures this one rejects */
    default FailureMatcher negate() {
        return failure -> !isRetryable(failure);
    }
}
