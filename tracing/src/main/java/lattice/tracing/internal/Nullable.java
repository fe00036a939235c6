/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package lattice.tracing.internal;

import java.lang.annotation.RetentionPolicy;

/** Marks a field, parameter or return value that can be null. Avoids a jsr305 dependency. */
@java.lang.annotation.Documented
@java.lang.annotation.Retention(RetentionPolicy.SOURCE)
public @interface Nullable {
}
