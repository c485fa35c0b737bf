package hydro.swmm.mapping.parse;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable, insertion-ordered view of the sections of a model description file.
 * Each row is the list of whitespace-delimited tokens of one data line.
 */
public final class SectionTable {

    private final Map<String, List<List<String>>> sections;

    private SectionTable(Map<String, List<List<String>>> sections) {
        this.sections = sections;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static SectionTable empty() {
        return new SectionTable(Map.of());
    }

    public boolean contains(String name) {
        return sections.containsKey(name);
    }

    /**
     * Returns the rows of a section, or an empty list when the section is absent.
     */
    public List<List<String>> rows(String name) {
        return sections.getOrDefault(name, List.of());
    }

    public boolean hasRows(String name) {
        return !rows(name).isEmpty();
    }

    public Set<String> sectionNames() {
        return sections.keySet();
    }

    public int size() {
        return sections.size();
    }

    public boolean isEmpty() {
        return sections.isEmpty();
    }

    /**
     * First token of every row in the given section, in declaration order.
     */
    public List<String> names(String section) {
        List<String> names = new ArrayList<>();
        for (List<String> row : rows(section)) {
            if (!row.isEmpty()) {
                names.add(row.get(0));
            }
        }
        return names;
    }

    @Override
    public String toString() {
        return "SectionTable" + sections.keySet();
    }

    /**
     * Mutable accumulator used while a file is being parsed.
     */
    public static final class Builder {

        private final Map<String, List<List<String>>> sections = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder openSection(String name) {
            Objects.requireNonNull(name, "name");
            if (name.isBlank() || name.indexOf('[') >= 0 || name.indexOf(']') >= 0) {
                throw new IllegalArgumentException("Invalid section name: '" + name + "'");
            }
            sections.computeIfAbsent(name, key -> new ArrayList<>());
            return this;
        }

        public Builder addRow(String section, List<String> fields) {
            List<List<String>> rows = sections.get(section);
            if (rows == null) {
                throw new IllegalStateException("Section not opened: " + section);
            }
            if (!fields.isEmpty()) {
                rows.add(List.copyOf(fields));
            }
            return this;
        }

        public SectionTable build() {
            Map<String, List<List<String>>> copy = new LinkedHashMap<>();
            sections.forEach((name, rows) -> copy.put(name, List.copyOf(rows)));
            return new SectionTable(Collections.unmodifiableMap(copy));
        }
    }
}
