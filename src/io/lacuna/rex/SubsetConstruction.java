package io.lacuna.rex;

import io.lacuna.bifurcan.ISet;
import io.lacuna.bifurcan.LinearList;
import io.lacuna.bifurcan.LinearMap;

import java.util.BitSet;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Determinizes an {@link Nfa} by treating each reachable, epsilon-closed set of its states as a single state.
 */
public class SubsetConstruction {

  private static final Logger logger = Logger.getLogger("io.lacuna.rex");
  private static final Level level = Level.FINE;

  private SubsetConstruction() {
  }

  public static Dfa determinize(Nfa nfa, ISet<Character> alphabet) {

    LinearList<DfaState> states = new LinearList<>();
    LinearMap<BitSet, DfaState> cache = new LinearMap<>();
    LinearList<DfaState> queue = new LinearList<>();

    queue.addLast(register(nfa, nfa.epsilonClosure(nfa.subset(nfa.start)), states, cache));

    while (queue.size() > 0) {
      DfaState state = queue.popLast();

      for (Character signal : alphabet) {
        BitSet next = nfa.epsilonClosure(nfa.move(state.key(), signal));
        if (next.isEmpty()) {
          continue;
        }

        Optional<DfaState> existing = cache.get(next);
        DfaState target;
        if (existing.isPresent()) {
          target = existing.get();
        } else {
          target = register(nfa, next, states, cache);
          queue.addLast(target);
        }
        state.addTransition(signal, target);
      }
    }

    if (logger.isLoggable(level)) {
      logger.log(level, "determinized " + nfa + " into " + states.size() + " states");
    }

    return new Dfa(alphabet, states, cache);
  }

  private static DfaState register(Nfa nfa, BitSet subset, LinearList<DfaState> states, LinearMap<BitSet, DfaState> cache) {
    DfaState state = new DfaState((int) states.size(), subset, subset.get(nfa.accept));
    states.addLast(state);
    cache.put(subset, state);
    return state;
  }
}
