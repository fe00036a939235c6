/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package lattice.tracing.propagation;

/**
 * Raised when span metadata cannot be written to or read from a carrier: the carrier format is
 * unsupported, a numeric field is malformed, or the shadow tracer failed.
 */
public class PropagationException extends Exception {
  private static final long serialVersionUID = 1L;

  public PropagationException(String message) {
    super(message);
  }

  public PropagationException(String message, Throwable cause) {
    super(message, cause);
  }
}
