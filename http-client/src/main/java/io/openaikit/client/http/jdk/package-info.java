@NullMarked
package io.openaikit.client.http.jdk;

import org.jspecify.annotations.NullMarked;
