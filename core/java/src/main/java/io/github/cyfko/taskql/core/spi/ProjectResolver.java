package io.github.cyfko.taskql.core.spi;

import io.github.cyfko.taskql.core.utils.ListTokens;

/**
 * Maps a project reference written in a task to the canonical name of the project.
 * <p>
 * Two spellings of the same project, such as {@code [[Projects/Apollo]]} and
 * {@code Apollo}, must resolve to the same name so that {@code projects contains} and
 * project grouping treat them as one project.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@FunctionalInterface
public interface ProjectResolver {

    /**
     * @param reference  project reference as written
     * @param sourcePath path of the task holding the reference, null for condition values
     * @return canonical project name, or null when the reference is empty
     */
    String canonicalize(String reference, String sourcePath);

    /**
     * Resolver working on the link text alone: surrounding quotes and {@code [[ ]]} are
     * removed, then the last path segment of the link target is kept (aliases are ignored).
     *
     * @return the default resolver
     */
    static ProjectResolver linkText() {
        return (reference, sourcePath) -> {
            if (reference == null) return null;
            String value = reference.trim();
            if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
                value = value.substring(1, value.length() - 1).trim();
            }
            if (value.isEmpty()) return null;
            if (value.startsWith("[[") && value.endsWith("]]")) {
                String target = ListTokens.linkTarget(value.substring(2, value.length() - 2));
                return target.isEmpty() ? null : target;
            }
            return value;
        };
    }
}
