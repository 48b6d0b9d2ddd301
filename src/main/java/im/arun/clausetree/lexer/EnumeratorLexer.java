package im.arun.clausetree.lexer;

import im.arun.clausetree.config.ClauseTreeConfig;
import im.arun.clausetree.model.LevelType;
import im.arun.clausetree.model.LexerToken;
import im.arun.clausetree.model.NormalizedText;
import im.arun.clausetree.normalize.TextNormalizer;
import im.arun.clausetree.scan.EnumeratorMatch;
import im.arun.clausetree.scan.EnumeratorScanner;
import im.arun.clausetree.scan.LineIndex;
import im.arun.clausetree.scan.RegexEnumeratorScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Turns scanner matches into a sorted token stream.
 * Matches that share an identical {@code (start, end, raw_label)} boundary are
 * merged into one token carrying every level type they were read as.
 */
public class EnumeratorLexer {
    private static final Logger logger = LoggerFactory.getLogger(EnumeratorLexer.class);

    public static final String XREF_KEYWORD_PRE = "xref_keyword_pre";
    public static final String XREF_KEYWORD_POST = "xref_keyword_post";
    public static final String XREF_PREPOSITION_PRE = "xref_preposition_pre";

    public static final String LAYOUT_ANCHORED_BOUNDARY = "anchored_boundary";
    public static final String LAYOUT_LINE_CHAR_COUNT = "line_char_count";
    public static final String LAYOUT_LINE_START_MATCH = "line_start_match";

    private static final Pattern XREF_KEYWORD = Pattern.compile(
        "\\b(?:section|sections|article|articles|clause|clauses|paragraph|paragraphs)\\b",
        Pattern.CASE_INSENSITIVE);
    private static final Pattern XREF_PREPOSITION = Pattern.compile(
        "\\b(?:pursuant to|subject to|in accordance with|defined in|under)\\b",
        Pattern.CASE_INSENSITIVE);

    private final TextNormalizer normalizer;
    private final EnumeratorScanner scanner;
    private final int xrefWindowChars;

    public EnumeratorLexer() {
        this(new ClauseTreeConfig());
    }

    public EnumeratorLexer(ClauseTreeConfig config) {
        this(new TextNormalizer(), new RegexEnumeratorScanner(), config.getXrefWindowChars());
    }

    public EnumeratorLexer(TextNormalizer normalizer, EnumeratorScanner scanner, int xrefWindowChars) {
        if (xrefWindowChars < 0) {
            throw new IllegalArgumentException("xref window must be >= 0");
        }
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.scanner = Objects.requireNonNull(scanner, "scanner");
        this.xrefWindowChars = xrefWindowChars;
    }

    public LexResult lex(String rawText) {
        return lex(normalizer.normalize(rawText));
    }

    public LexResult lex(NormalizedText normalized) {
        String text = normalized.getNormalizedText();
        LineIndex lines = new LineIndex(text);
        List<EnumeratorMatch> matches = scanner.scan(text, lines);

        Map<BoundaryKey, TokenAccumulator> grouped = new LinkedHashMap<>();
        for (EnumeratorMatch match : matches) {
            if (match.getLevelType() == null) {
                continue;
            }
            BoundaryKey key = new BoundaryKey(match.getPosition(), match.getMatchEnd(), match.getRawLabel());
            TokenAccumulator acc = grouped.computeIfAbsent(key, k -> new TokenAccumulator(match));
            acc.types.add(match.getLevelType());
            acc.ordinals.put(match.getLevelType(), match.getOrdinal());
        }

        List<BoundaryKey> keys = new ArrayList<>(grouped.keySet());
        keys.sort(BoundaryKey.ORDER);

        List<LexerToken> tokens = new ArrayList<>(keys.size());
        int index = 1;
        for (BoundaryKey key : keys) {
            tokens.add(toToken(index++, key, grouped.get(key), text, lines));
        }

        logger.debug("Lexed {} matches into {} tokens", matches.size(), tokens.size());
        return new LexResult(normalized, tokens);
    }

    private LexerToken toToken(int index, BoundaryKey key, TokenAccumulator acc, String text, LineIndex lines) {
        int start = key.start;
        int lineIdx = lines.lineOf(start);
        int lineStart = lines.lineStart(lineIdx);
        boolean atLineStart = lines.isLineStart(start);

        Map<String, Object> layout = new LinkedHashMap<>();
        layout.put(LAYOUT_ANCHORED_BOUNDARY, acc.first.isAnchored());
        layout.put(LAYOUT_LINE_CHAR_COUNT, lines.lineEnd(lineIdx) - lineStart);
        layout.put(LAYOUT_LINE_START_MATCH, atLineStart);

        return LexerToken.builder()
            .tokenId(String.format("tok_%05d_%d", index, start))
            .rawLabel(key.rawLabel)
            .normalizedLabel(normalizeLabel(key.rawLabel))
            .positionStart(start)
            .positionEnd(key.end)
            .lineIndex(lineIdx)
            .columnIndex(Math.max(0, start - lineStart))
            .lineStart(atLineStart)
            .indentationScore(round(lines.indentation(start), 4))
            .candidateTypes(new ArrayList<>(acc.types))
            .ordinalByType(acc.ordinals)
            .xrefContextFeatures(xrefFeatures(text, start, key.end))
            .layoutFeatures(layout)
            .build();
    }

    Map<String, Boolean> xrefFeatures(String text, int start, int end) {
        String lookback = text.substring(Math.max(0, start - xrefWindowChars), start);
        String lookahead = text.substring(end, Math.min(text.length(), end + xrefWindowChars));
        Map<String, Boolean> features = new LinkedHashMap<>();
        features.put(XREF_KEYWORD_PRE, XREF_KEYWORD.matcher(lookback).find());
        features.put(XREF_KEYWORD_POST, XREF_KEYWORD.matcher(lookahead).find());
        features.put(XREF_PREPOSITION_PRE, XREF_PREPOSITION.matcher(lookback).find());
        return features;
    }

    /**
     * {@code "(iv)"} and {@code "iv."} both normalize to {@code "iv"}.
     */
    static String normalizeLabel(String rawLabel) {
        String label = rawLabel.strip();
        if (label.endsWith(".")) {
            label = label.substring(0, label.length() - 1);
        }
        if (label.startsWith("(") && label.endsWith(")") && label.length() >= 2) {
            label = label.substring(1, label.length() - 1);
        }
        return label.strip();
    }

    static double round(double value, int places) {
        double scale = Math.pow(10, places);
        return Math.round(value * scale) / scale;
    }

    private static final class TokenAccumulator {
        final EnumeratorMatch first;
        final EnumSet<LevelType> types = EnumSet.noneOf(LevelType.class);
        final Map<LevelType, Integer> ordinals = new EnumMap<>(LevelType.class);

        TokenAccumulator(EnumeratorMatch first) {
            this.first = first;
        }
    }

    private static final class BoundaryKey {
        static final Comparator<BoundaryKey> ORDER = Comparator
            .comparingInt((BoundaryKey k) -> k.start)
            .thenComparingInt(k -> k.end)
            .thenComparing(k -> k.rawLabel);

        final int start;
        final int end;
        final String rawLabel;

        BoundaryKey(int start, int end, String rawLabel) {
            this.start = start;
            this.end = end;
            this.rawLabel = rawLabel;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof BoundaryKey)) {
                return false;
            }
            BoundaryKey other = (BoundaryKey) o;
            return start == other.start && end == other.end && rawLabel.equals(other.rawLabel);
        }

        @Override
        public int hashCode() {
            return Objects.hash(start, end, rawLabel);
        }
    }
}
