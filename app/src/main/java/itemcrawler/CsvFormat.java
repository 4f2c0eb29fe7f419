package itemcrawler;

import java.util.ArrayList;
import java.util.List;

// Minimal CSV: comma separated, fields quoted only when they need it, "" escapes a quote.
final class CsvFormat {

    private CsvFormat() {
    }

    static String line(List<String> fields) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < fields.size(); i++) {
            if (i > 0) sb.append(',');
            sb.append(field(fields.get(i)));
        }
        return sb.toString();
    }

    static String field(String value) {
        String s = value == null ? "" : value;
        if (s.indexOf(',') < 0 && s.indexOf('"') < 0 && s.indexOf('\n') < 0 && s.indexOf('\r') < 0) {
            return s;
        }
        return "\"" + s.replace("\"", "\"\"") + "\"";
    }

    // Parses a whole document; quoted fields may span lines.
    static List<List<String>> parse(String text) {
        List<List<String>> rows = new ArrayList<>();
        List<String> row = new ArrayList<>();
        StringBuilder cur = new StringBuilder();
        boolean quoted = false;
        boolean pending = false;   // something seen on the current row

        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quoted) {
                if (c == '"') {
                    if (i + 1 < text.length() && text.charAt(i + 1) == '"') {
                        cur.append('"');
                        i++;
                    } else {
                        quoted = false;
                    }
                } else {
                    cur.append(c);
                }
                continue;
            }

            switch (c) {
                case '"' -> {
                    quoted = true;
                    pending = true;
                }
                case ',' -> {
                    row.add(cur.toString());
                    cur.setLength(0);
                    pending = true;
                }
                case '\r' -> { }
                case '\n' -> {
                    row.add(cur.toString());
                    rows.add(row);
                    row = new ArrayList<>();
                    cur.setLength(0);
                    pending = false;
                }
                default -> {
                    cur.append(c);
                    pending = true;
                }
            }
        }
        if (pending || cur.length() > 0) {
            row.add(cur.toString());
            rows.add(row);
        }
        return rows;
    }
}
