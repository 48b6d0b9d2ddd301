package im.arun.clausetree.normalize;

import im.arun.clausetree.model.NormalizedText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Single-pass text normalizer that records reversible offset maps.
 * <ol>
 *   <li>CRLF and lone CR become LF.</li>
 *   <li>Non-breaking space becomes a plain space.</li>
 *   <li>Zero-width characters are removed.</li>
 * </ol>
 * Every other character passes through unchanged, so normalizing already
 * normalized text is a no-op.
 */
public class TextNormalizer {
    private static final Logger logger = LoggerFactory.getLogger(TextNormalizer.class);

    public static final String FLAG_CRLF = "crlf_normalized";
    public static final String FLAG_CR = "cr_normalized";
    public static final String FLAG_NBSP = "nbsp_normalized";
    public static final String FLAG_ZERO_WIDTH = "zero_width_removed";

    public NormalizedText normalize(String text) {
        String raw = text == null ? "" : text;
        int length = raw.length();

        StringBuilder normalized = new StringBuilder(length);
        int[] rawToNorm = new int[length + 1];
        int[] normToRaw = new int[length + 1];
        normToRaw[0] = 0;

        Map<String, Boolean> flags = new LinkedHashMap<>();
        flags.put(FLAG_CRLF, false);
        flags.put(FLAG_CR, false);
        flags.put(FLAG_NBSP, false);
        flags.put(FLAG_ZERO_WIDTH, false);

        int normIdx = 0;
        int i = 0;
        while (i < length) {
            char ch = raw.charAt(i);
            int next = i + 1;
            char emitted;
            boolean emits = true;

            if (ch == '\r' && next < length && raw.charAt(next) == '\n') {
                emitted = '\n';
                next = i + 2;
                flags.put(FLAG_CRLF, true);
            } else if (ch == '\r') {
                emitted = '\n';
                flags.put(FLAG_CR, true);
            } else if (ch == '\u00A0') {
                emitted = ' ';
                flags.put(FLAG_NBSP, true);
            } else if (isZeroWidth(ch)) {
                emitted = 0;
                emits = false;
                flags.put(FLAG_ZERO_WIDTH, true);
            } else {
                emitted = ch;
            }

            for (int rawPos = i; rawPos < next; rawPos++) {
                rawToNorm[rawPos] = normIdx;
            }

            if (emits) {
                normalized.append(emitted);
                normIdx++;
                normToRaw[normIdx] = next;
            }

            i = next;
        }
        rawToNorm[length] = normIdx;

        if (logger.isDebugEnabled() && normIdx != length) {
            logger.debug("Normalized {} raw chars to {} chars, flags={}", length, normIdx, flags);
        }

        return new NormalizedText(
            raw,
            normalized.toString(),
            rawToNorm,
            Arrays.copyOf(normToRaw, normIdx + 1),
            flags);
    }

    private static boolean isZeroWidth(char ch) {
        return ch == '\u200B' || ch == '\u200C' || ch == '\u200D' || ch == '\uFEFF';
    }
}
