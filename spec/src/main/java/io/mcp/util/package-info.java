@NullMarked
package io.mcp.util;

import org.jspecify.annotations.NullMarked;
