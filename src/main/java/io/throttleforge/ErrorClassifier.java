package io.throttleforge;

/**
 * Maps an operation failure to an {@link ErrorKind}.
 * Implementations must be stateless and thread-safe.
 */
public interface ErrorClassifier {

    ErrorKind classify(Throwable failure);
}
