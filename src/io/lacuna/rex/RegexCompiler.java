package io.lacuna.rex;

import io.lacuna.bifurcan.IList;
import io.lacuna.bifurcan.ISet;
import io.lacuna.bifurcan.LinearSet;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Compiles patterns made of letters, digits, {@code ( ) | *} and juxtaposition into a {@link Dfa}.
 * <p>
 * Compilers are immutable, and each call to {@link #compile(String)} allocates its own states, so a single
 * compiler may be shared between threads.
 */
public class RegexCompiler {

  private static final Logger logger = Logger.getLogger("io.lacuna.rex");
  private static final Level level = Level.FINE;

  private static final RegexCompiler DEFAULT = new RegexCompiler(null);

  private final ISet<Character> alphabet;

  private RegexCompiler(ISet<Character> alphabet) {
    this.alphabet = alphabet;
  }

  /**
   * @return a compiler which determinizes over the literals of each pattern
   */
  public static RegexCompiler create() {
    return DEFAULT;
  }

  /**
   * @return a compiler which determinizes over {@code alphabet} instead of the literals of each pattern
   */
  public RegexCompiler withAlphabet(ISet<Character> alphabet) {
    return new RegexCompiler(LinearSet.from(alphabet).forked());
  }

  public Dfa compile(String regex) {
    IList<Token> tokens = Tokenizer.tokenize(regex);
    Nfa nfa = NfaBuilder.build(Postfix.convert(regex, tokens));
    Dfa dfa = SubsetConstruction.determinize(nfa, alphabet == null ? Tokenizer.alphabet(tokens) : alphabet);

    if (logger.isLoggable(level)) {
      logger.log(level, "compiled '" + regex + "': " + nfa.size() + " nfa states, " + dfa.size() + " dfa states");
    }
    return dfa;
  }

  /**
   * @return the nondeterministic automaton for {@code regex}, before determinization
   */
  public Nfa compileNfa(String regex) {
    return NfaBuilder.build(Postfix.convert(regex));
  }
}
