@NullMarked
package io.mcp.client.tasks;

import org.jspecify.annotations.NullMarked;
