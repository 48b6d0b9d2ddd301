package im.arun.clausetree.lexer;

import im.arun.clausetree.model.LexerToken;
import im.arun.clausetree.model.NormalizedText;
import lombok.Value;

import java.util.List;

@Value
public class LexResult {
    NormalizedText normalizedText;
    List<LexerToken> tokens;

    public LexResult(NormalizedText normalizedText, List<LexerToken> tokens) {
        this.normalizedText = normalizedText;
        this.tokens = List.copyOf(tokens);
    }
}
