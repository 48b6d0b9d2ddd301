package im.arun.clausetree.scan;

import im.arun.clausetree.model.LevelType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.ToIntFunction;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regex-backed scanner for the four canonical enumerator families.
 * <p>
 * Parenthesized forms ({@code (a)}, {@code (iv)}, {@code (B)}, {@code (12)})
 * may appear anywhere and are anchored only when they open a line or follow a
 * hard boundary. Period forms ({@code a.}, {@code iv.}, {@code B.}, {@code 12.})
 * are recognised only at line start and are therefore always anchored; their
 * position is the label character, not the leading whitespace.
 */
public class RegexEnumeratorScanner implements EnumeratorScanner {
    private static final Logger logger = LoggerFactory.getLogger(RegexEnumeratorScanner.class);

    static final int ANCHOR_LOOKBACK = 20;
    static final int MAX_NUMERIC = 50;

    private static final Map<String, Integer> ROMAN_VALUES = Map.ofEntries(
        Map.entry("i", 1), Map.entry("ii", 2), Map.entry("iii", 3), Map.entry("iv", 4),
        Map.entry("v", 5), Map.entry("vi", 6), Map.entry("vii", 7), Map.entry("viii", 8),
        Map.entry("ix", 9), Map.entry("x", 10), Map.entry("xi", 11), Map.entry("xii", 12),
        Map.entry("xiii", 13), Map.entry("xiv", 14), Map.entry("xv", 15), Map.entry("xvi", 16),
        Map.entry("xvii", 17), Map.entry("xviii", 18), Map.entry("xix", 19), Map.entry("xx", 20),
        Map.entry("xxi", 21), Map.entry("xxii", 22), Map.entry("xxiii", 23), Map.entry("xxiv", 24),
        Map.entry("xxv", 25));

    private static final int LINE_FLAGS = Pattern.MULTILINE | Pattern.UNIX_LINES;

    private static final Pattern ALPHA_PAREN = Pattern.compile("\\(\\s*([a-z]{1,2})\\s*\\)");
    private static final Pattern ROMAN_PAREN = Pattern.compile("\\(\\s*((?:x{0,3})(?:ix|iv|v?i{0,3}))\\s*\\)");
    private static final Pattern CAPS_PAREN = Pattern.compile("\\(\\s*([A-Z]{1,2})\\s*\\)");
    private static final Pattern NUMERIC_PAREN = Pattern.compile("\\(\\s*(\\d{1,2})\\s*\\)");

    private static final Pattern ALPHA_PERIOD = Pattern.compile("^(\\s*([a-z]{1,2}))\\.\\s+", LINE_FLAGS);
    private static final Pattern ROMAN_PERIOD = Pattern.compile("^(\\s*([ivxlc]+))\\.\\s+",
        LINE_FLAGS | Pattern.CASE_INSENSITIVE);
    private static final Pattern CAPS_PERIOD = Pattern.compile("^(\\s*([A-Z]{1,2}))\\.\\s+", LINE_FLAGS);
    private static final Pattern NUMERIC_PERIOD = Pattern.compile("^(\\s*(\\d{1,2}))\\.\\s+", LINE_FLAGS);

    // ";\n", ":\n", "; ", ": " or ".\n" shortly before the enumerator
    private static final Pattern HARD_BOUNDARY = Pattern.compile("[;:]\\s*\\n|[;:]\\s+|\\.\\s*\\n");

    @Override
    public List<EnumeratorMatch> scan(String text, LineIndex lineIndex) {
        String source = text == null ? "" : text;
        LineIndex lines = lineIndex != null ? lineIndex : new LineIndex(source);
        List<EnumeratorMatch> matches = new ArrayList<>();

        scanParenthesized(source, lines, ALPHA_PAREN, LevelType.ALPHA, RegexEnumeratorScanner::alphaOrdinal, matches);
        scanParenthesized(source, lines, ROMAN_PAREN, LevelType.ROMAN, RegexEnumeratorScanner::romanOrdinal, matches);
        scanParenthesized(source, lines, CAPS_PAREN, LevelType.CAPS, RegexEnumeratorScanner::capsOrdinal, matches);
        scanParenthesized(source, lines, NUMERIC_PAREN, LevelType.NUMERIC, RegexEnumeratorScanner::numericOrdinal, matches);

        scanPeriod(source, ALPHA_PERIOD, LevelType.ALPHA, RegexEnumeratorScanner::alphaOrdinal, matches);
        scanPeriod(source, ROMAN_PERIOD, LevelType.ROMAN, RegexEnumeratorScanner::romanOrdinal, matches);
        scanPeriod(source, CAPS_PERIOD, LevelType.CAPS, RegexEnumeratorScanner::capsOrdinal, matches);
        scanPeriod(source, NUMERIC_PERIOD, LevelType.NUMERIC, RegexEnumeratorScanner::numericOrdinal, matches);

        matches.sort(Comparator.comparingInt(EnumeratorMatch::getPosition)
            .thenComparingInt(EnumeratorMatch::getMatchEnd)
            .thenComparing(EnumeratorMatch::getLevelType));
        logger.debug("Scanned {} chars, found {} enumerator hypotheses", source.length(), matches.size());
        return matches;
    }

    private void scanParenthesized(String text, LineIndex lines, Pattern pattern, LevelType type,
                                   ToIntFunction<String> ordinalOf, List<EnumeratorMatch> out) {
        Matcher m = pattern.matcher(text);
        while (m.find()) {
            int ordinal = ordinalOf.applyAsInt(m.group(1));
            if (ordinal > 0) {
                out.add(new EnumeratorMatch(m.group(), ordinal, type, m.start(), m.end(),
                    isAnchored(m.start(), text, lines)));
            }
        }
    }

    private void scanPeriod(String text, Pattern pattern, LevelType type,
                            ToIntFunction<String> ordinalOf, List<EnumeratorMatch> out) {
        Matcher m = pattern.matcher(text);
        while (m.find()) {
            String label = m.group(2);
            int ordinal = ordinalOf.applyAsInt(label);
            if (ordinal > 0) {
                out.add(new EnumeratorMatch(label + ".", ordinal, type, m.start(2), m.end(), true));
            }
        }
    }

    /**
     * Position 0, first non-whitespace on a line, or a hard boundary within the lookback window.
     */
    static boolean isAnchored(int position, String text, LineIndex lines) {
        if (position == 0 || lines.isLineStart(position)) {
            return true;
        }
        String preceding = text.substring(Math.max(0, position - ANCHOR_LOOKBACK), position);
        return HARD_BOUNDARY.matcher(preceding).find();
    }

    /**
     * a=1 .. z=26, then doubled letters aa=27 .. zz=52; anything else is -1.
     */
    static int alphaOrdinal(String label) {
        return letterOrdinal(label.toLowerCase(Locale.ROOT), 'a');
    }

    static int capsOrdinal(String label) {
        return letterOrdinal(label.toUpperCase(Locale.ROOT), 'A');
    }

    private static int letterOrdinal(String label, char base) {
        if (label.length() == 1) {
            return label.charAt(0) - base + 1;
        }
        if (label.length() == 2 && label.charAt(0) == label.charAt(1)) {
            return 26 + label.charAt(0) - base + 1;
        }
        return -1;
    }

    static int romanOrdinal(String label) {
        return ROMAN_VALUES.getOrDefault(label.strip().toLowerCase(Locale.ROOT), -1);
    }

    static int numericOrdinal(String label) {
        try {
            int value = Integer.parseInt(label);
            return value >= 1 && value <= MAX_NUMERIC ? value : -1;
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
