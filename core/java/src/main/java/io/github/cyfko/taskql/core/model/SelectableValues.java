package io.github.cyfko.taskql.core.model;

import java.util.List;

/**
 * Distinct values offered by a query builder's pickers.
 *
 * @param statuses             statuses seen in the index
 * @param priorities           priorities seen in the index
 * @param contexts             contexts seen in the index
 * @param projects             projects seen in the index
 * @param tags                 tags seen in the index
 * @param folders              parent folders of indexed task paths, sorted
 * @param userFieldDefinitions declared user fields
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record SelectableValues(
        List<String> statuses,
        List<String> priorities,
        List<String> contexts,
        List<String> projects,
        List<String> tags,
        List<String> folders,
        List<UserFieldDefinition> userFieldDefinitions
) {

    public SelectableValues {
        statuses = List.copyOf(statuses);
        priorities = List.copyOf(priorities);
        contexts = List.copyOf(contexts);
        projects = List.copyOf(projects);
        tags = List.copyOf(tags);
        folders = List.copyOf(folders);
        userFieldDefinitions = List.copyOf(userFieldDefinitions);
    }
}
