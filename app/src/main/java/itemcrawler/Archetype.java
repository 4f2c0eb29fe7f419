package itemcrawler;

import java.util.List;

// The two output schemas an item can be classified into.
// Field order is the column order of the exported CSV files.
public enum Archetype {
    WEAPON("weapons", List.of(
            "Name", "Type", "Damage", "Delay", "Classes", "Races",
            "Skill", "Effect", "WT", "Size", "Magic Item",
            "Lore Item", "No Drop", "30d Avg", "90d Avg", "All Time Avg")),

    EQUIPMENT("equipment", List.of(
            "Name", "Type", "AC", "Stats", "Classes", "Races",
            "Effect", "WT", "Size", "Magic Item", "Lore Item",
            "No Drop", "30d Avg", "90d Avg", "All Time Avg"));

    private final String directory;
    private final List<String> fields;

    Archetype(String directory, List<String> fields) {
        this.directory = directory;
        this.fields = fields;
    }

    // Sub-directory of the output folder holding this archetype's bucket files.
    public String directory() {
        return directory;
    }

    // Header row, Name first.
    public List<String> fields() {
        return fields;
    }
}
