package itemcrawler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

// One scraped item: its display name, its schema and the raw infobox attributes.
public record ItemRecord(String name, Archetype archetype, Map<String, String> attributes) {

    public ItemRecord {
        Objects.requireNonNull(archetype, "archetype");
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Item name must not be blank");
        }
        attributes = attributes == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    // Attribute value or "" when the page did not list it. Labels match regardless of case.
    public String attribute(String field) {
        String value = ItemClassifier.lookupIgnoreCase(attributes, field);
        return value == null ? "" : value;
    }

    // Project the record onto its archetype's columns: name first, then each field in schema order.
    public List<String> toRow() {
        List<String> fields = archetype.fields();
        List<String> row = new ArrayList<>(fields.size());
        row.add(name);
        for (String field : fields.subList(1, fields.size())) {
            row.add(attribute(field));
        }
        return row;
    }
}
