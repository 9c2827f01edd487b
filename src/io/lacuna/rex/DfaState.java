package io.lacuna.rex;

import io.lacuna.bifurcan.IMap;
import io.lacuna.bifurcan.LinearMap;

import java.util.BitSet;
import java.util.OptionalInt;

/**
 * A deterministic state, standing for the set of {@link Nfa} states in {@link #subset()}.
 */
public class DfaState {

  public final int id;
  private final BitSet subset;
  private final boolean accepting;
  private IMap<Character, Integer> transitions = new LinearMap<>();

  DfaState(int id, BitSet subset, boolean accepting) {
    this.id = id;
    this.subset = subset;
    this.accepting = accepting;
  }

  void addTransition(char signal, DfaState state) {
    if (transitions.contains(signal)) {
      throw new IllegalStateException("state " + id + " already has a transition on '" + signal + "'");
    }
    transitions.put(signal, state.id);
  }

  void freeze() {
    transitions = transitions.forked();
  }

  public int id() {
    return id;
  }

  public boolean isAccepting() {
    return accepting;
  }

  /**
   * @return a copy of the ids of the NFA states this state stands for
   */
  public BitSet subset() {
    return (BitSet) subset.clone();
  }

  /**
   * @return the successor id for each signal that has a transition
   */
  public IMap<Character, Integer> transitions() {
    return transitions;
  }

  public OptionalInt next(char signal) {
    return transitions.get(signal).map(OptionalInt::of).orElse(OptionalInt.empty());
  }

  // the canonical key, not a copy
  BitSet key() {
    return subset;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("dfa-state(" + id + ")[")
            .append("accept=").append(accepting)
            .append(", nfa-states=").append(subset)
            .append(", transitions={");
    transitions.forEach(e -> sb.append(e.key()).append(": ").append(e.value()).append(", "));
    if (transitions.size() > 0) {
      sb.delete(sb.length() - 2, sb.length());
    }
    sb.append("}]");
    return sb.toString();
  }
}
