package org.dxworks.formframe;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

public class ViewFileDetector {

    /**
     * Directory first, then the number in the view name, so {@code view2.xsl} comes before {@code view10.xsl}.
     */
    static final Comparator<Path> VIEW_ORDER = Comparator
            .comparing((Path p) -> String.valueOf(p.getParent()))
            .thenComparingInt(ViewFileDetector::viewNumber)
            .thenComparing(p -> p.getFileName().toString());

    /**
     * InfoPath view documents are named {@code view1.xsl}, {@code view2.xsl}, ...
     */
    public static boolean isViewFile(Path filePath) {
        Path fileName = filePath.getFileName();
        if (fileName == null) return false;
        String name = fileName.toString().toLowerCase(Locale.ROOT);
        return name.startsWith("view") && name.endsWith(".xsl");
    }

    /**
     * Number between {@code view} and {@code .xsl}, or {@link Integer#MAX_VALUE} when there is none.
     */
    static int viewNumber(Path filePath) {
        String name = filePath.getFileName().toString();
        String digits = name.substring(4, name.length() - 4);
        if (digits.isEmpty() || !digits.chars().allMatch(Character::isDigit)) {
            return Integer.MAX_VALUE;
        }
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            return Integer.MAX_VALUE;
        }
    }

    /**
     * View files grouped by the directory holding them; each directory is one form.
     * A single view file given directly is a form of its own.
     */
    public static Map<Path, List<Path>> collectForms(Path input) throws IOException {
        Map<Path, List<Path>> forms = new LinkedHashMap<>();
        if (Files.isDirectory(input)) {
            List<Path> views;
            try (Stream<Path> stream = Files.walk(input)) {
                views = stream.filter(Files::isRegularFile)
                        .filter(ViewFileDetector::isViewFile)
                        .sorted(VIEW_ORDER)
                        .collect(Collectors.toList());
            }
            for (Path view : views) {
                forms.computeIfAbsent(view.getParent(), k -> new ArrayList<>()).add(view);
            }
        } else if (Files.isRegularFile(input) && isViewFile(input)) {
            List<Path> single = new ArrayList<>();
            single.add(input);
            forms.put(input, single);
        }
        return forms;
    }
}
