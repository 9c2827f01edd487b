package io.lacuna.rex;

import io.lacuna.bifurcan.IList;
import io.lacuna.bifurcan.IMap;
import io.lacuna.bifurcan.ISet;
import io.lacuna.bifurcan.LinearList;
import io.lacuna.bifurcan.LinearMap;
import io.lacuna.bifurcan.Lists;

/**
 * A node in an {@link Nfa}. Successors are referenced by their id within the owning automaton, so cycles introduced
 * by the star construction never form object cycles.
 */
public class NfaState {

  public final int id;

  private IMap<Character, IList<Integer>> transitions = new LinearMap<>();
  private IList<Integer> epsilonTransitions = null;

  NfaState(int id) {
    this.id = id;
  }

  void addTransition(char signal, int state) {
    IList<Integer> targets = transitions.get(signal).orElse(null);
    if (targets == null) {
      targets = new LinearList<>();
      transitions.put(signal, targets);
    }
    targets.addLast(state);
  }

  void addEpsilon(int state) {
    if (epsilonTransitions == null) {
      epsilonTransitions = new LinearList<>();
    }
    epsilonTransitions.addLast(state);
  }

  // called once the owning build is finished, after which the state can't change
  void freeze() {
    transitions = Utils.mapVals(transitions, IList::forked).forked();
    if (epsilonTransitions != null) {
      epsilonTransitions = epsilonTransitions.forked();
    }
  }

  public ISet<Character> signals() {
    return transitions.keys();
  }

  public IList<Integer> transitions(char signal) {
    return transitions.get(signal).orElse(Lists.EMPTY);
  }

  public IList<Integer> epsilonTransitions() {
    return epsilonTransitions == null ? Lists.EMPTY : epsilonTransitions;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("state(" + id + ")[");
    for (Character signal : transitions.keys()) {
      sb.append(signal).append(" -> ").append(Utils.join(transitions(signal))).append(", ");
    }
    if (epsilonTransitions != null) {
      sb.append("ε -> ").append(Utils.join(epsilonTransitions)).append(", ");
    }
    if (sb.charAt(sb.length() - 1) == ' ') {
      sb.delete(sb.length() - 2, sb.length());
    }
    sb.append("]");
    return sb.toString();
  }
}
