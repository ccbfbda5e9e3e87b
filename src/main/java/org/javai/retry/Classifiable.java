package org.javai.retry;

import java.util.Optional;

/**
 * Optional capability for exceptions that carry a classification code, such as an
 * error code returned by a remote service. {@link Failures#code(Throwable)} prefers
 * this over reflective lookup.
 */
public interface Classifiable {

    Optional<String> code();
}
