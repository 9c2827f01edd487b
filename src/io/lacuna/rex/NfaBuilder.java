package io.lacuna.rex;

import io.lacuna.bifurcan.IList;
import io.lacuna.bifurcan.LinearList;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thompson's construction over a postfix token sequence. Each builder owns the arena its states are allocated
 * from, so ids are unique within one build and independent of any other build.
 */
public class NfaBuilder {

  private static final Logger logger = Logger.getLogger("io.lacuna.rex");
  private static final Level level = Level.FINE;

  private final LinearList<NfaState> states = new LinearList<>();
  private final LinearList<Fragment> fragments = new LinearList<>();

  /**
   * A partially built automaton with exactly one start and one accept state.
   */
  static final class Fragment {
    final int start, accept;

    Fragment(int start, int accept) {
      this.start = start;
      this.accept = accept;
    }
  }

  private NfaBuilder() {
  }

  public static Nfa build(IList<Token> postfix) {
    NfaBuilder builder = new NfaBuilder();
    postfix.forEach(builder::apply);
    return builder.finish();
  }

  /// combinators

  private void apply(Token t) {
    switch (t.kind) {
      case LITERAL:
        match(t.symbol);
        break;
      case CONCAT:
        concat(t);
        break;
      case UNION:
        union(t);
        break;
      case STAR:
        kleene(t);
        break;
      default:
        throw new ConstructionException("unexpected " + t.kind + " at index " + t.index + " in postfix sequence");
    }
  }

  private void match(char signal) {
    NfaState a = newState();
    NfaState b = newState();
    a.addTransition(signal, b.id);
    fragments.addLast(new Fragment(a.id, b.id));
  }

  private void concat(Token t) {
    Fragment right = pop(t);
    Fragment left = pop(t);
    state(left.accept).addEpsilon(right.start);
    fragments.addLast(new Fragment(left.start, right.accept));
  }

  private void union(Token t) {
    Fragment b = pop(t);
    Fragment a = pop(t);
    NfaState start = newState();
    NfaState accept = newState();
    start.addEpsilon(a.start);
    start.addEpsilon(b.start);
    state(a.accept).addEpsilon(accept.id);
    state(b.accept).addEpsilon(accept.id);
    fragments.addLast(new Fragment(start.id, accept.id));
  }

  private void kleene(Token t) {
    Fragment f = pop(t);
    NfaState start = newState();
    NfaState accept = newState();
    start.addEpsilon(f.start);
    start.addEpsilon(accept.id);
    state(f.accept).addEpsilon(f.start);
    state(f.accept).addEpsilon(accept.id);
    fragments.addLast(new Fragment(start.id, accept.id));
  }

  ///

  private NfaState newState() {
    NfaState s = new NfaState((int) states.size());
    states.addLast(s);
    return s;
  }

  private NfaState state(int id) {
    return states.nth(id);
  }

  private Fragment pop(Token operator) {
    if (fragments.size() == 0) {
      throw new ConstructionException(
              "operator '" + operator.symbol + "' at index " + operator.index + " has too few operands");
    }
    return fragments.popLast();
  }

  private Nfa finish() {
    if (fragments.size() != 1) {
      throw new ConstructionException("expected one fragment after construction, found " + fragments.size());
    }

    Fragment f = fragments.popLast();
    states.forEach(NfaState::freeze);
    Nfa nfa = new Nfa(states.forked(), f.start, f.accept);
    if (logger.isLoggable(level)) {
      logger.log(level, "built " + nfa);
    }
    return nfa;
  }
}
