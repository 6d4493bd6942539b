package com.platform.prioritizer.domain;

import java.util.Comparator;

/**
 * Entity ids arrive from the database as numbers or text and are carried as strings.
 * Ordering is numeric when both ids are integers, lexicographic otherwise. Ids with the
 * same numeric value but different text ({@code 007} and {@code 7}) stay distinct, so the
 * order is consistent with {@link String#equals}.
 */
public final class EntityIds {

    public static final Comparator<String> ORDER = EntityIds::compare;

    private EntityIds() {}

    public static String of(Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof Double d && d == Math.rint(d) && !d.isInfinite()) {
            return Long.toString(d.longValue());
        }
        return raw.toString();
    }

    static int compare(String a, String b) {
        Long la = asLong(a);
        Long lb = asLong(b);
        if (la != null && lb != null) {
            int byValue = Long.compare(la, lb);
            return byValue != 0 ? byValue : a.compareTo(b);
        }
        if (la != null) return -1;
        if (lb != null) return 1;
        return a.compareTo(b);
    }

    private static Long asLong(String s) {
        if (s.isEmpty() || s.length() > 18) {
            return null;
        }
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (!(Character.isDigit(c) || (i == 0 && c == '-' && s.length() > 1))) {
                return null;
            }
        }
        return Long.parseLong(s);
    }
}
