package conj.engine.dfa;

import conj.engine.ConjectureException;
import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;

public class LStarTest {

  private static boolean startsWithSeven(byte[] s) { return s.length > 0 && s[0] == 7; }

  @Test
  public void testLearnsFirstByteLanguage() {
    LStar learner = new LStar(LStarTest::startsWithSeven);
    List<byte[]> examples = Arrays.asList(new byte[] { 7 }, new byte[] { 0, 7 }, new byte[] { 8 });
    learner.learnAll(examples);
    for (byte[] s : examples) Assert.assertEquals(startsWithSeven(s), learner.dfa().matches(s));

    ConcreteDFA.Builder builder = ConcreteDFA.builder();
    int start = builder.addState(false);
    int seen = builder.addState(true);
    ConcreteDFA expected = builder.transition(start, 7, seen).transition(seen, 0, 255, seen).build();
    Assert.assertTrue(learner.dfa().equivalent(expected));
    Assert.assertTrue(learner.dfa().matches(new byte[] { 7, 3, (byte) 200 }));
    Assert.assertFalse(learner.dfa().matches(new byte[] { (byte) 200 }));
  }

  @Test
  public void testLearningIsStable() {
    LStar learner = new LStar(LStarTest::startsWithSeven);
    learner.learn(new byte[] { 7 });
    int generation = learner.generation();
    learner.learn(new byte[] { 7 });
    Assert.assertEquals(generation, learner.generation());
    Assert.assertEquals(Arrays.asList(0, 7), learner.normalizer().values());
  }

  @Test
  public void testCanonicalCopySurvivesLearning() {
    LStar learner = new LStar(LStarTest::startsWithSeven);
    LStar.LearnedDFA stale = learner.dfa();
    ConcreteDFA copy = stale.canonicalise();
    learner.learn(new byte[] { 7 });
    Assert.assertFalse(copy.matches(new byte[] { 7 }));
    try {
      stale.start();
      Assert.fail();
    } catch (ConjectureException.InvalidState e) {
      Assert.assertTrue(e.getMessage().contains("canonicalise"));
    }
  }

  @Test
  public void testMembershipIsCached() {
    int[] calls = new int[1];
    LStar learner = new LStar(s -> {
      calls[0]++;
      return startsWithSeven(s);
    });
    int before = calls[0];
    Assert.assertTrue(learner.member(new byte[] { 7 }));
    Assert.assertTrue(learner.member(new byte[] { 7 }));
    Assert.assertEquals(before + 1, calls[0]);
  }
}
