package io.lacuna.rex;

import io.lacuna.bifurcan.IList;
import io.lacuna.bifurcan.LinearList;

import java.util.BitSet;

/**
 * A nondeterministic automaton with a single start and a single accept state. States live in an arena and are
 * addressed by their index, which is also their id.
 */
public class Nfa {

  private final IList<NfaState> states;
  public final int start, accept;

  Nfa(IList<NfaState> states, int start, int accept) {
    this.states = states;
    this.start = start;
    this.accept = accept;
  }

  public int size() {
    return (int) states.size();
  }

  public NfaState state(int id) {
    return states.nth(id);
  }

  public IList<NfaState> states() {
    return states;
  }

  /// closure primitives

  /**
   * @return every state reachable from {@code states} by zero or more epsilon transitions
   */
  public BitSet epsilonClosure(BitSet states) {
    BitSet closure = (BitSet) states.clone();
    LinearList<Integer> stack = new LinearList<>();
    states.stream().forEach(stack::addLast);

    while (stack.size() > 0) {
      for (int next : state(stack.popLast()).epsilonTransitions()) {
        if (!closure.get(next)) {
          closure.set(next);
          stack.addLast(next);
        }
      }
    }

    return closure;
  }

  /**
   * @return every state reachable from {@code states} by exactly one transition on {@code signal}
   */
  public BitSet move(BitSet states, char signal) {
    BitSet result = new BitSet(size());
    states.stream().forEach(s -> state(s).transitions(signal).forEach(result::set));
    return result;
  }

  public BitSet subset(int... ids) {
    BitSet subset = new BitSet(size());
    for (int id : ids) {
      subset.set(id);
    }
    return subset;
  }

  ///

  /**
   * @return a listing of every state reachable from the start state
   */
  public String describe() {
    StringBuilder sb = new StringBuilder()
            .append("start: ").append(start).append('\n')
            .append("accept: ").append(accept).append('\n');

    BitSet visited = new BitSet(size());
    LinearList<Integer> stack = LinearList.of(start);
    while (stack.size() > 0) {
      int id = stack.popLast();
      if (visited.get(id)) {
        continue;
      }
      visited.set(id);

      NfaState s = state(id);
      sb.append(s).append('\n');
      for (Character signal : s.signals()) {
        s.transitions(signal).forEach(stack::addLast);
      }
      s.epsilonTransitions().forEach(stack::addLast);
    }

    return sb.toString();
  }

  @Override
  public String toString() {
    return "nfa(" + size() + " states, start=" + start + ", accept=" + accept + ")";
  }
}
