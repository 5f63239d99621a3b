@NullMarked
package io.mcp.client.config;

import org.jspecify.annotations.NullMarked;
