package im.arun.clausetree.scan;

import java.util.List;

/**
 * Finds enumerator hypotheses in normalized text. Implementations must not
 * resolve alpha/roman ambiguity: a label such as {@code (i)} is reported once
 * per level type it can be read as.
 */
public interface EnumeratorScanner {

    List<EnumeratorMatch> scan(String text, LineIndex lineIndex);

    default List<EnumeratorMatch> scan(String text) {
        return scan(text, new LineIndex(text));
    }
}
