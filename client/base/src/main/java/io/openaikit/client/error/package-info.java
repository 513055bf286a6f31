@NullMarked
package io.openaikit.client.error;

import org.jspecify.annotations.NullMarked;
