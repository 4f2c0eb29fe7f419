package itemcrawler;

import java.util.List;
import java.util.Locale;
import java.util.Map;

// Decides whether a parsed infobox describes a weapon or a piece of equipment.
// Any weapon token contained in the case-folded Type value makes it a weapon. Lossy: "Bowl" is a weapon too.
public class ItemClassifier {

    static final String TYPE_FIELD = "Type";

    private static final List<String> WEAPON_TOKENS =
            List.of("1h", "2h", "bow", "throwing", "piercing", "blunt", "slashing");

    public ItemRecord classify(String name, Map<String, String> attributes) {
        return new ItemRecord(name, archetypeOf(attributes), attributes);
    }

    public Archetype archetypeOf(Map<String, String> attributes) {
        String type = lookupIgnoreCase(attributes, TYPE_FIELD);
        if (type == null) return Archetype.EQUIPMENT;

        String folded = type.toLowerCase(Locale.ROOT);
        for (String token : WEAPON_TOKENS) {
            if (folded.contains(token)) return Archetype.WEAPON;
        }
        return Archetype.EQUIPMENT;
    }

    // Value for a label regardless of how the wiki capitalised it; exact match preferred.
    static String lookupIgnoreCase(Map<String, String> attributes, String key) {
        if (attributes == null) return null;
        String exact = attributes.get(key);
        if (exact != null) return exact;
        for (Map.Entry<String, String> e : attributes.entrySet()) {
            if (e.getKey().equalsIgnoreCase(key)) return e.getValue();
        }
        return null;
    }
}
