package im.arun.clausetree.service;

import im.arun.clausetree.model.CandidateGraph;
import im.arun.clausetree.model.LexerToken;
import im.arun.clausetree.model.LinkContractPayload;
import im.arun.clausetree.model.NormalizedText;
import im.arun.clausetree.model.SolverSolution;
import lombok.Value;

import java.util.List;

/**
 * Every intermediate product of one section parse.
 */
@Value
public class ParseResult {
    NormalizedText normalizedText;
    List<LexerToken> tokens;
    CandidateGraph graph;
    SolverSolution solution;
    LinkContractPayload payload;
}
