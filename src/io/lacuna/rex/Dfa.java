package io.lacuna.rex;

import io.lacuna.bifurcan.IList;
import io.lacuna.bifurcan.IMap;
import io.lacuna.bifurcan.ISet;
import io.lacuna.bifurcan.LinearSet;

import java.util.BitSet;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * A deterministic automaton. States are numbered in the order they were discovered, with the start state first, and
 * can also be found by the set of NFA states they stand for.
 */
public class Dfa {

  private final ISet<Character> alphabet;
  private final IList<DfaState> states;
  private final IMap<BitSet, DfaState> bySubset;

  Dfa(ISet<Character> alphabet, IList<DfaState> states, IMap<BitSet, DfaState> bySubset) {
    states.forEach(DfaState::freeze);
    this.alphabet = LinearSet.from(alphabet).forked();
    this.states = states.forked();
    this.bySubset = bySubset.forked();
  }

  public DfaState start() {
    return states.nth(0);
  }

  public IList<DfaState> states() {
    return states;
  }

  public DfaState state(int id) {
    return states.nth(id);
  }

  public Optional<DfaState> state(BitSet subset) {
    return bySubset.get(subset);
  }

  public int size() {
    return (int) states.size();
  }

  public ISet<Character> alphabet() {
    return alphabet;
  }

  /**
   * @return true if consuming all of {@code input} from the start state ends in an accepting state
   */
  public boolean accepts(CharSequence input) {
    DfaState current = start();
    for (int i = 0; i < input.length(); i++) {
      OptionalInt next = current.next(input.charAt(i));
      if (!next.isPresent()) {
        return false;
      }
      current = state(next.getAsInt());
    }
    return current.isAccepting();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    states.forEach(s -> sb.append(s).append('\n'));
    return sb.toString();
  }
}
