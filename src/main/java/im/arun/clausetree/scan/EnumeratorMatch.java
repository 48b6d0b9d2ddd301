package im.arun.clausetree.scan;

import im.arun.clausetree.model.LevelType;
import lombok.Value;

/**
 * A single enumerator hypothesis found in text: {@code (a)}, {@code (iv)}, {@code 12.}.
 * The same span may be reported once per level type it can be read as.
 */
@Value
public class EnumeratorMatch {
    String rawLabel;
    int ordinal;
    LevelType levelType;
    int position;
    int matchEnd;
    boolean anchored;
}
