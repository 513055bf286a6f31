/**
 * Types shared by every OpenAIKit module: the cooperative {@link io.openaikit.common.CancellationToken}
 * and technical error messages.
 */
@NullMarked
package io.openaikit.common;

import org.jspecify.annotations.NullMarked;
