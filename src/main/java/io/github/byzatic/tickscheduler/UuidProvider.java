package io.github.byzatic.tickscheduler;


import org.jetbrains.annotations.NotNull;

import java.util.UUID;

/**
 * Utility class for generating job identifiers.
 */
public final class UuidProvider {

    private UuidProvider() {
    }

    /**
     * Generates a random UUID string prefixed with {@code prefix}, e.g. {@code runDaily-6f1c...}.
     *
     * @param prefix readable prefix, usually the name of the method that created the job
     * @return a new identifier
     */
    public static @NotNull String generatePrefixedId(@NotNull String prefix) {
        return prefix + "-" + UUID.randomUUID();
    }
}
