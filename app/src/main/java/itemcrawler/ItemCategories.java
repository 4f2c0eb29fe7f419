package itemcrawler;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

// Compiled-in category tables: what to crawl and where each item ends up.
public final class ItemCategories {

    public static final String MISC = "misc";

    // Weapon Type tokens -> bucket. Scanned in insertion order, first contained token wins.
    // Damage types come before handedness so "1H Slashing" lands in Slashing.
    public static final Map<String, String> WEAPONS;

    // Equipment Slot values (case-folded) -> bucket.
    public static final Map<String, String> EQUIPMENT;

    // Category pages crawled on a full run, in order.
    public static final List<String> CRAWL_CATEGORIES = List.of(
            // Equipment
            "Arms", "Back", "Chest", "Ear", "Face", "Feet", "Fingers", "Hands", "Head",
            "Legs", "Neck", "Shoulders", "Waist", "Wrist",
            // Weapons
            "Ammo", "Primary", "Range", "Secondary"
    );

    static {
        Map<String, String> weapons = new LinkedHashMap<>();
        weapons.put("piercing", "Piercing");
        weapons.put("blunt", "Blunt");
        weapons.put("slashing", "Slashing");
        weapons.put("bow", "Bows");
        weapons.put("throwing", "Throwing");
        weapons.put("1h", "1H_Weapons");
        weapons.put("2h", "2H_Weapons");
        WEAPONS = Collections.unmodifiableMap(weapons);

        Map<String, String> equipment = new LinkedHashMap<>();
        equipment.put("arms", "Arms");
        equipment.put("back", "Back");
        equipment.put("chest", "Chest");
        equipment.put("ear", "Ears");
        equipment.put("face", "Face");
        equipment.put("feet", "Feet");
        equipment.put("fingers", "Fingers");
        equipment.put("hands", "Hands");
        equipment.put("head", "Head");
        equipment.put("legs", "Legs");
        equipment.put("neck", "Neck");
        equipment.put("shield", "Shields");
        equipment.put("shoulders", "Shoulders");
        equipment.put("waist", "Waist");
        equipment.put("wrist", "Wrist");
        EQUIPMENT = Collections.unmodifiableMap(equipment);
    }

    private ItemCategories() {
    }

    // Bucket for a weapon's Type text, "misc" when no token is contained.
    public static String weaponBucket(String type) {
        String key = type == null ? "" : type.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, String> e : WEAPONS.entrySet()) {
            if (key.contains(e.getKey())) return e.getValue();
        }
        return MISC;
    }

    // Bucket for an equipment Slot value, "misc" when the slot is not a single known one.
    public static String equipmentBucket(String slot) {
        String key = slot == null ? "" : slot.trim().toLowerCase(Locale.ROOT);
        return EQUIPMENT.getOrDefault(key, MISC);
    }

    public static boolean isKnownCategory(String category) {
        return CRAWL_CATEGORIES.contains(category);
    }

    // Listing URL for a category, e.g. https://wiki.project1999.com/Category:Arms
    public static String categoryUrl(String baseUrl, String category) {
        return UrlUtil.stripTrailingSlash(baseUrl) + "/Category:" + category;
    }
}
