package org.dxworks.formframe.analyzer.infopath;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Helpers for the simplified XPath-like binding paths InfoPath puts on controls
 * ({@code my:trips/my:trip/my:destination}).
 *
 * <h3>Collection heuristic ({@link #isCollectionPattern}):</h3>
 * The last two meaningful segments form a collection/item pair when
 * <ol>
 *   <li>the parent is the child plus {@code s} ({@code trips/trip})</li>
 *   <li>the parent is the child plus {@code es} ({@code addresses/address})</li>
 *   <li>the parent ends with {@code ies} where the child ends with {@code y} ({@code categories/category})</li>
 *   <li>the parent starts with the child and ends with a collection suffix ({@code tripList/trip})</li>
 *   <li>the parent and the child have the same name</li>
 * </ol>
 * The suffix tables are English-specific and tuned on real forms; treat them as heuristics.
 */
public final class BindingPaths {

    private static final String[] COLLECTION_SUFFIXES = {"list", "collection", "array", "set", "items", "entries"};

    private BindingPaths() {
        // utility class
    }

    /**
     * Meaningful segments of the path, with predicates and namespace prefixes removed.
     * Steps such as {@code .}, {@code ..}, {@code *} and node tests are dropped.
     */
    public static List<String> segments(String path) {
        List<String> result = new ArrayList<>();
        if (path == null || path.isBlank()) return result;
        String withoutPredicates = path.replaceAll("\\[[^\\]]*\\]", "");
        for (String raw : withoutPredicates.split("/")) {
            String segment = stripPrefix(raw.trim());
            if (segment.isEmpty() || segment.equals(".") || segment.equals("..") || segment.equals("*")
                    || segment.endsWith("()") || segment.startsWith("@")) {
                continue;
            }
            result.add(segment);
        }
        return result;
    }

    public static String stripPrefix(String qualifiedName) {
        if (qualifiedName == null) return "";
        int colon = qualifiedName.lastIndexOf(':');
        return colon >= 0 ? qualifiedName.substring(colon + 1) : qualifiedName;
    }

    /**
     * Last meaningful segment of the path, or an empty string.
     */
    public static String leaf(String path) {
        List<String> segments = segments(path);
        return segments.isEmpty() ? "" : segments.get(segments.size() - 1);
    }

    public static boolean isCollectionPattern(String select) {
        if (select == null || !select.contains("/")) return false;
        List<String> segments = segments(select);
        if (segments.size() < 2) return false;
        String parent = segments.get(segments.size() - 2);
        String child = segments.get(segments.size() - 1);
        return isCollectionChildPattern(parent, child);
    }

    static boolean isCollectionChildPattern(String parent, String child) {
        if (parent == null || child == null || parent.isEmpty() || child.isEmpty()) return false;

        String p = parent.toLowerCase(Locale.ROOT);
        String c = child.toLowerCase(Locale.ROOT);

        if (p.equals(c + "s")) return true;
        if (p.equals(c + "es")) return true;
        if (p.endsWith("ies") && c.endsWith("y")
                && p.substring(0, p.length() - 3).equals(c.substring(0, c.length() - 1))) {
            return true;
        }
        for (String suffix : COLLECTION_SUFFIXES) {
            if (p.endsWith(suffix) && p.startsWith(c)) {
                return true;
            }
        }
        return p.equals(c);
    }

    /**
     * Readable name of the collection a path iterates: the parent segment of a
     * {@code parent/child} pair, or the only segment. Empty when nothing usable remains.
     */
    public static String collectionName(String path) {
        List<String> segments = segments(path);
        if (segments.isEmpty()) return "";
        String relevant = segments.size() >= 2 ? segments.get(segments.size() - 2) : segments.get(0);
        return toReadable(relevant);
    }

    /**
     * {@code expenseItems} becomes {@code Expense Items}.
     */
    public static String toReadable(String name) {
        if (name == null || name.isEmpty()) return "";
        String result = Character.toUpperCase(name.charAt(0)) + name.substring(1);
        return result.replaceAll("([a-z])([A-Z])", "$1 $2");
    }
}
