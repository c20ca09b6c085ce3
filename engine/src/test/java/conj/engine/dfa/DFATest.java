package conj.engine.dfa;

import org.junit.Assert;
import org.junit.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

public class DFATest {

  /** One or more 1 bytes */
  static ConcreteDFA onesPlus() {
    ConcreteDFA.Builder builder = ConcreteDFA.builder();
    int start = builder.addState(false);
    int ones = builder.addState(true);
    return builder.transition(start, 1, ones).transition(ones, 1, ones).build();
  }

  /** Any string of at most two bytes, each 0 to 2 */
  static ConcreteDFA shortStrings() {
    ConcreteDFA.Builder builder = ConcreteDFA.builder();
    int empty = builder.addState(true);
    int one = builder.addState(true);
    int two = builder.addState(true);
    return builder.transition(empty, 0, 2, one).transition(one, 0, 2, two).build();
  }

  @Test
  public void testMatches() {
    ConcreteDFA dfa = onesPlus();
    Assert.assertTrue(dfa.matches(new byte[] { 1 }));
    Assert.assertTrue(dfa.matches(new byte[] { 1, 1, 1 }));
    Assert.assertFalse(dfa.matches(new byte[0]));
    Assert.assertFalse(dfa.matches(new byte[] { 1, 2 }));
  }

  @Test
  public void testDeadStates() {
    ConcreteDFA dfa = onesPlus();
    Assert.assertTrue(dfa.isDead(ConcreteDFA.DEAD));
    Assert.assertFalse(dfa.isDead(dfa.start()));
    Assert.assertEquals(1, dfa.transitions(dfa.start()).size());
  }

  @Test
  public void testLengthsAndCounts() {
    ConcreteDFA ones = onesPlus();
    Assert.assertEquals(DFA.INFINITE, ones.maxLength(ones.start()));
    Assert.assertEquals(BigInteger.ONE, ones.countStrings(ones.start(), 3));
    Assert.assertEquals(BigInteger.ZERO, ones.countStrings(ones.start(), 0));
    ConcreteDFA strings = shortStrings();
    Assert.assertEquals(2, strings.maxLength(strings.start()));
    Assert.assertEquals(BigInteger.valueOf(9), strings.countStrings(strings.start(), 2));
    Assert.assertEquals(BigInteger.ZERO, strings.countStrings(strings.start(), 3));
  }

  @Test
  public void testAllMatchingRegions() {
    Set<List<Integer>> regions = new HashSet<>();
    for (int[] region : onesPlus().allMatchingRegions(new byte[] { 5, 1, 1 })) {
      regions.add(Arrays.asList(region[0], region[1]));
    }
    Set<List<Integer>> expected = new HashSet<>(Arrays.asList(
        Arrays.asList(1, 2), Arrays.asList(2, 3), Arrays.asList(1, 3)));
    Assert.assertEquals(expected, regions);
  }

  @Test
  public void testAllMatchingStringsOfLength() {
    List<byte[]> strings = shortStrings().allMatchingStringsOfLength(2);
    Assert.assertEquals(9, strings.size());
    Assert.assertArrayEquals(new byte[] { 0, 0 }, strings.get(0));
    Assert.assertArrayEquals(new byte[] { 0, 1 }, strings.get(1));
    Assert.assertArrayEquals(new byte[] { 1, 0 }, strings.get(3));
    Assert.assertArrayEquals(new byte[] { 2, 2 }, strings.get(8));
    Assert.assertTrue(onesPlus().allMatchingStringsOfLength(0).isEmpty());
  }

  @Test
  public void testAllMatchingStringsInShortlexOrder() {
    List<byte[]> all = new ArrayList<>();
    Iterator<byte[]> iter = shortStrings().allMatchingStrings();
    while (iter.hasNext()) all.add(iter.next());
    Assert.assertEquals(13, all.size());
    Assert.assertArrayEquals(new byte[0], all.get(0));
    Assert.assertArrayEquals(new byte[] { 2 }, all.get(3));
    Assert.assertArrayEquals(new byte[] { 0, 0 }, all.get(4));
  }

  @Test
  public void testEquivalence() {
    // Same language with a redundant state
    ConcreteDFA.Builder builder = ConcreteDFA.builder();
    int start = builder.addState(false);
    int first = builder.addState(true);
    int rest = builder.addState(true);
    ConcreteDFA redundant = builder.transition(start, 1, first).transition(first, 1, rest).transition(rest, 1, rest)
        .build();
    Assert.assertTrue(onesPlus().equivalent(redundant));
    Assert.assertTrue(redundant.equivalent(onesPlus()));

    ConcreteDFA.Builder starBuilder = ConcreteDFA.builder();
    int star = starBuilder.addState(true);
    ConcreteDFA onesStar = starBuilder.transition(star, 1, star).build();
    Assert.assertFalse(onesPlus().equivalent(onesStar));
  }

  @Test
  public void testCanonicalise() {
    Assert.assertEquals(onesPlus(), onesPlus().canonicalise());
    // Start state renumbered to zero
    ConcreteDFA.Builder builder = ConcreteDFA.builder();
    int ones = builder.addState(true);
    int start = builder.addState(false);
    ConcreteDFA shuffled = builder.transition(start, 1, ones).transition(ones, 1, ones).start(start).build();
    Assert.assertNotEquals(onesPlus(), shuffled);
    Assert.assertEquals(onesPlus(), shuffled.canonicalise());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testInvalidRange() {
    ConcreteDFA.Builder builder = ConcreteDFA.builder();
    int state = builder.addState(true);
    builder.transition(state, 10, 256, state);
  }

  @Test
  public void testToString() {
    Assert.assertEquals("ConcreteDFA(start=0, accepting={1}, 0: [1->1], 1: [1->1])", onesPlus().toString());
  }
}
