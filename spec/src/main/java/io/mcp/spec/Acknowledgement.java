package io.mcp.spec;

import java.util.Map;

import io.mcp.util.Assert;
import io.mcp.util.Utils;
import org.jspecify.annotations.Nullable;

/**
 * Server acknowledgement of a state-changing call that has no entity to return, such as
 * cancelling a task, deleting a webhook or uninstalling a plugin.
 *
 * @param details whatever the server put in the payload, possibly empty
 */
public record Acknowledgement(Map<String, Object> details) {

    public Acknowledgement {
        Assert.checkNotNullParam("details", details);
        details = Utils.copyOfNullable(details);
    }

    public static Acknowledgement empty() {
        return new Acknowledgement(Map.of());
    }

    public @Nullable Object get(String key) {
        return details.get(key);
    }

    /**
     * @return the server's human readable message, if any
     */
    public @Nullable String message() {
        Object message = details.get("message");
        return message == null ? null : message.toString();
    }
}
