package im.arun.clausetree.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Caller-owned LRU cache of parse results keyed by a SHA-256 content hash.
 * Nothing in the library holds one implicitly; pass an instance to
 * {@link ClauseTreeService#parse(String, String, int, ParseCache)} to reuse
 * results for repeated identical sections.
 */
public class ParseCache {
    private static final Logger logger = LoggerFactory.getLogger(ParseCache.class);

    private final int maxEntries;
    private final Map<String, ParseResult> entries;
    private long hits;
    private long misses;

    public ParseCache(int maxEntries) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be >= 1");
        }
        this.maxEntries = maxEntries;
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, ParseResult> eldest) {
                return size() > ParseCache.this.maxEntries;
            }
        };
    }

    /**
     * Hex SHA-256 over section key, global offset and text.
     */
    public static String buildKey(String sectionKey, int globalOffset, String text) {
        String raw = (sectionKey != null ? sectionKey : "") + "|"
            + globalOffset + "|"
            + (text != null ? text : "");
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(raw.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public synchronized ParseResult getOrCompute(String key, Supplier<ParseResult> loader) {
        ParseResult cached = entries.get(key);
        if (cached != null) {
            hits++;
            logger.debug("Parse cache hit for {}", key);
            return cached;
        }
        misses++;
        ParseResult computed = loader.get();
        entries.put(key, computed);
        return computed;
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized long getHits() {
        return hits;
    }

    public synchronized long getMisses() {
        return misses;
    }

    public synchronized void clear() {
        entries.clear();
    }
}
