package io.lacuna.rex;

import junit.framework.TestCase;

import java.util.BitSet;

public class NfaTestCase extends TestCase {

  private static Nfa build(String regex) {
    return NfaBuilder.build(Postfix.convert(regex));
  }

  public void testEpsilonClosureContainsItsInput() {
    Nfa nfa = build("ab");
    BitSet s = nfa.subset(0);
    assertEquals(s, nfa.epsilonClosure(s));
    assertEquals(nfa.subset(1, 2), nfa.epsilonClosure(nfa.subset(1)));
  }

  public void testEpsilonClosureTerminatesOnCycles() {
    // a* : 2 -> {0, 3}, 1 -> {0, 3}
    Nfa nfa = build("a*");
    assertEquals(nfa.subset(0, 2, 3), nfa.epsilonClosure(nfa.subset(2)));
    assertEquals(nfa.subset(0, 1, 3), nfa.epsilonClosure(nfa.subset(1)));

    Nfa nested = build("(a*)*");
    BitSet closure = nested.epsilonClosure(nested.subset(nested.start));
    assertTrue(closure.get(nested.accept));
    assertTrue(closure.get(0));
  }

  public void testEpsilonClosureOfEmptySet() {
    Nfa nfa = build("a*");
    assertTrue(nfa.epsilonClosure(new BitSet()).isEmpty());
  }

  public void testEpsilonClosureDoesNotMutateInput() {
    Nfa nfa = build("a*");
    BitSet s = nfa.subset(2);
    nfa.epsilonClosure(s);
    assertEquals(nfa.subset(2), s);
  }

  public void testMove() {
    Nfa nfa = build("a|b");
    BitSet start = nfa.epsilonClosure(nfa.subset(nfa.start));
    assertEquals(nfa.subset(1), nfa.move(start, 'a'));
    assertEquals(nfa.subset(3), nfa.move(start, 'b'));
    assertTrue(nfa.move(start, 'c').isEmpty());
  }

  public void testMoveIgnoresEpsilonTransitions() {
    Nfa nfa = build("a*");
    assertTrue(nfa.move(nfa.subset(nfa.start), 'a').isEmpty());
    assertEquals(nfa.subset(1), nfa.move(nfa.epsilonClosure(nfa.subset(nfa.start)), 'a'));
  }

  public void testStatesAreFrozen() {
    Nfa nfa = build("a*");
    nfa.states().addLast(nfa.state(0));
    assertEquals(4, nfa.size());

    nfa.state(0).transitions('a').addLast(3);
    assertEquals(1, nfa.state(0).transitions('a').size());

    nfa.state(2).epsilonTransitions().addLast(1);
    assertEquals(nfa.subset(0, 2, 3), nfa.epsilonClosure(nfa.subset(2)));
  }

  public void testDescribe() {
    Nfa nfa = build("a*");
    String description = nfa.describe();
    assertTrue(description, description.startsWith("start: 2\naccept: 3\n"));
    assertTrue(description, description.contains("state(0)[a -> [1]]"));
    assertTrue(description, description.contains("state(1)[ε -> [0, 3]]"));
    assertTrue(description, description.contains("state(3)[]"));
  }
}
