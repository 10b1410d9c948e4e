package io.stylusport.anchor.parser;

import java.util.BitSet;
import java.util.Locale;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.Parser;
import org.antlr.v4.runtime.atn.ATNConfigSet;
import org.antlr.v4.runtime.dfa.DFA;
import org.antlr.v4.runtime.misc.Interval;

/**
 * Records prediction diagnostics as {@code <kind> in <rule> (decision N) at '<input>'}. Only installed when
 * parser tracing is on. A {@code const fn} also matches the catch-all item rule and the parser takes the first
 * alternative, so these are recorded and never fail the parse.
 */
final class AmbiguityTraceListener extends BaseErrorListener {

    @Override
    public void reportAmbiguity(
            Parser recognizer,
            DFA dfa,
            int startIndex,
            int stopIndex,
            boolean exact,
            BitSet ambigAlts,
            ATNConfigSet configs) {
        if (!exact) {
            return;
        }
        BitSet alternatives = ambigAlts != null ? ambigAlts : configs.getAlts();
        record("ambiguity", recognizer, dfa, startIndex, stopIndex, ", alternatives " + alternatives);
    }

    @Override
    public void reportAttemptingFullContext(
            Parser recognizer,
            DFA dfa,
            int startIndex,
            int stopIndex,
            BitSet conflictingAlts,
            ATNConfigSet configs) {
        record("full-context", recognizer, dfa, startIndex, stopIndex, "");
    }

    @Override
    public void reportContextSensitivity(
            Parser recognizer,
            DFA dfa,
            int startIndex,
            int stopIndex,
            int prediction,
            ATNConfigSet configs) {
        record("context-sensitivity", recognizer, dfa, startIndex, stopIndex, ", predicted " + prediction);
    }

    private static void record(String kind, Parser parser, DFA dfa, int startIndex, int stopIndex, String detail) {
        String rule = parser.getRuleNames()[dfa.atnStartState.ruleIndex];
        String input = parser.getTokenStream().getText(Interval.of(startIndex, stopIndex));
        DebugFlags.captureDiagnostic(String.format(
                Locale.ROOT, "%s in %s (decision %d) at '%s'%s", kind, rule, dfa.decision, input, detail));
    }
}
