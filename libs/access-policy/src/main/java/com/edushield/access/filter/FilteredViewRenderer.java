package com.edushield.access.filter;

import com.edushield.access.ResourceDescriptor;
import com.edushield.access.ResourceRegistry;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.StringJoiner;
import java.util.TreeSet;

/**
 * Flattens a {@link FilteredView} into the plain-text context handed to the language model.
 * <p>
 * Sections follow the view's order (persons, financial, grades, classes, documents, then
 * unknown ids). Within a row, fields appear in the descriptor's declared order followed by
 * any extra keys sorted by name, so identical input always renders identically.
 */
public final class FilteredViewRenderer {

    private final ResourceRegistry registry;

    public FilteredViewRenderer(ResourceRegistry registry) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        this.registry = registry;
    }

    /**
     * Renders the view as text.
     */
    public String render(FilteredView view) {
        List<String> sections = new ArrayList<>();
        for (ResourceView resource : view.resources()) {
            sections.add(renderSection(resource));
        }
        return String.join("\n\n", sections);
    }

    private String renderSection(ResourceView resource) {
        StringBuilder section = new StringBuilder();
        section.append("=== ").append(title(resource)).append(" ===");
        if (resource.denied()) {
            section.append("\n  ").append(resource.note());
            return section.toString();
        }
        if (resource.note() != null) {
            section.append("\n  Note: ").append(resource.note());
        }
        if (resource.rows().isEmpty()) {
            section.append("\n  (no records)");
            return section.toString();
        }
        List<String> declared = registry.find(resource.resourceId())
                .map(ResourceDescriptor::fields)
                .orElse(List.of());
        for (Map<String, Object> row : resource.rows()) {
            section.append("\n  ").append(renderRow(row, declared));
        }
        return section.toString();
    }

    private static String title(ResourceView resource) {
        if (resource.category() != null) {
            return resource.category().sectionTitle();
        }
        return resource.resourceId().toUpperCase(Locale.ROOT);
    }

    private static String renderRow(Map<String, Object> row, List<String> declared) {
        StringJoiner line = new StringJoiner(", ");
        for (String field : declared) {
            if (row.containsKey(field)) {
                line.add(field + ": " + renderValue(row.get(field)));
            }
        }
        for (String field : new TreeSet<>(row.keySet())) {
            if (!declared.contains(field)) {
                line.add(field + ": " + renderValue(row.get(field)));
            }
        }
        return line.toString();
    }

    private static String renderValue(Object value) {
        if (value == null) {
            return "N/A";
        }
        if (value instanceof Collection<?> items) {
            StringJoiner joined = new StringJoiner(", ", "[", "]");
            for (Object item : items) {
                joined.add(String.valueOf(item));
            }
            return joined.toString();
        }
        return String.valueOf(value);
    }
}
