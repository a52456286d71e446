/**
 * cbombench core package: tool adapters, run orchestration, asset normalization and
 * cross-tool comparison.
 *
 * <p>
 * This package is null-marked, meaning all reference types are non-null by default unless
 * explicitly annotated with @Nullable.
 */
@NullMarked
package org.cbombench;

import org.jspecify.annotations.NullMarked;
