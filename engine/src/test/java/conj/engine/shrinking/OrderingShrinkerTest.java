package conj.engine.shrinking;

import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

public class OrderingShrinkerTest {

  @Test
  public void testSorts() {
    List<Integer> result = OrderingShrinker.shrink(Arrays.asList(5, 3, 4, 1, 2), ls -> true,
        Comparator.naturalOrder(), new Random(0));
    Assert.assertEquals(Arrays.asList(1, 2, 3, 4, 5), result);
  }

  @Test
  public void testSortsWhatItCan() {
    // The first element has to stay put
    List<Integer> result = OrderingShrinker.shrink(Arrays.asList(9, 3, 1, 2), ls -> ls.get(0) == 9,
        Comparator.naturalOrder(), new Random(0));
    Assert.assertEquals(Arrays.asList(9, 1, 2, 3), result);
  }

  @Test
  public void testNothingToDo() {
    List<Integer> initial = Arrays.asList(2, 1);
    Assert.assertEquals(initial, OrderingShrinker.shrink(initial, ls -> ls.get(0) == 2,
        Comparator.naturalOrder(), new Random(0)));
  }
}
