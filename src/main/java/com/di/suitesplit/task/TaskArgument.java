package com.di.suitesplit.task;

import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * One runner argument, e.g. {@code --suite=foo.yml} or a bare test path (null value).
 */
@Value
public class TaskArgument {
    String key;
    String value;

    public static TaskArgument of(String key, Object value) {
        return new TaskArgument(key, value == null ? null : String.valueOf(value));
    }

    public static TaskArgument flag(String key) {
        return new TaskArgument(key, null);
    }

    /**
     * Splits a free-form argument string on whitespace; {@code --a=b} becomes key/value,
     * anything else a bare key.
     */
    public static List<TaskArgument> parse(String args) {
        List<TaskArgument> out = new ArrayList<>();
        if (args == null || args.isBlank()) return out;
        for (String token : args.trim().split("\\s+")) {
            int eq = token.indexOf('=');
            if (token.startsWith("--") && eq > 2) {
                out.add(new TaskArgument(token.substring(0, eq), token.substring(eq + 1)));
            } else {
                out.add(flag(token));
            }
        }
        return out;
    }

    public String render() {
        return value == null ? key : key + "=" + value;
    }
}
