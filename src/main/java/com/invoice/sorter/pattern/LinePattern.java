package com.invoice.sorter.pattern;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A named, pre-compiled predicate over a single trimmed line.
 *
 * FULL patterns must match the whole line, FIND patterns may match anywhere in it.
 * A null line never matches.
 */
@Getter
@EqualsAndHashCode
public final class LinePattern {

    public enum MatchMode { FULL, FIND }

    private final String name;
    private final String regex;
    private final MatchMode mode;

    @EqualsAndHashCode.Exclude
    private final Pattern compiled;

    public LinePattern(String name, String regex, MatchMode mode, int flags) {
        this.name = name;
        this.regex = regex;
        this.mode = mode;
        this.compiled = Pattern.compile(regex, flags);
    }

    public LinePattern(String name, String regex, MatchMode mode) {
        this(name, regex, mode, 0);
    }

    public boolean matches(String line) {
        if (line == null) return false;
        Matcher m = compiled.matcher(line.strip());
        return mode == MatchMode.FULL ? m.matches() : m.find();
    }

    @Override
    public String toString() {
        return name;
    }
}
