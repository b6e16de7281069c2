package org.flatline;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Black or white list of classes and methods.
 * <p>
 * Each line names a class ({@code com/example/Foo}) or a method
 * ({@code com/example/Foo#bar!(I)I}). {@code *} matches within one name segment,
 * {@code **} matches anything. Blank lines and lines starting with {@code #} are ignored.
 */
public class ClassMethodList {

    private final List<Pattern> patterns;

    private ClassMethodList(List<Pattern> patterns) {
        this.patterns = patterns;
    }

    public static ClassMethodList parse(List<String> lines) {
        List<Pattern> patterns = new ArrayList<>();
        if (lines != null) {
            for (String line : lines) {
                String entry = line.trim();
                if (entry.isEmpty() || entry.startsWith("#")) {
                    continue;
                }
                patterns.add(compile(entry));
            }
        }
        return new ClassMethodList(patterns);
    }

    static Pattern compile(String glob) {
        StringBuilder regex = new StringBuilder();
        for (int i = 0; i < glob.length(); i++) {
            char c = glob.charAt(i);
            if (c == '*') {
                if (i + 1 < glob.length() && glob.charAt(i + 1) == '*') {
                    regex.append(".*");
                    i++;
                } else {
                    regex.append("[^/#!]*");
                }
            } else {
                regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return Pattern.compile(regex.toString());
    }

    public boolean contains(String name) {
        for (Pattern pattern : patterns) {
            if (pattern.matcher(name).matches()) {
                return true;
            }
        }
        return false;
    }

    public boolean isEmpty() {
        return patterns.isEmpty();
    }
}
