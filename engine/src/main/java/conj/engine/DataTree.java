package conj.engine;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Prefix tree over every tape the runner has executed. Nodes are integer ids, each branching on the next byte. A node
 * that produced a result holds it as a leaf. A node is dead once nothing new can be found below it: it is a leaf, or
 * every byte value allowed there leads to a dead node.
 *
 * Bytes that were forced, or masked by a partial bit draw, are recorded so that equivalent tapes walk the same path.
 */
public class DataTree {
  private final Map<Integer, Map<Integer, Integer>> children = new HashMap<>();
  private final Map<Integer, ConjectureResult> leaves = new HashMap<>();
  private final BitSet dead = new BitSet();
  /** The only byte possible at a node */
  private final Map<Integer, Integer> forced = new HashMap<>();
  /** The mask applied at a node */
  private final Map<Integer, Integer> masks = new HashMap<>();
  /** Size of the block starting at a node, a lower bound on how many bytes must follow */
  private final Map<Integer, Integer> blockSizes = new HashMap<>();
  private int nodeCount = 1;

  /** Forget everything */
  public void reset() {
    children.clear();
    leaves.clear();
    dead.clear();
    forced.clear();
    masks.clear();
    blockSizes.clear();
    nodeCount = 1;
  }

  /** True once every path from the root is dead */
  public boolean isExhausted() { return dead.get(0); }

  public int nodeCount() { return nodeCount; }

  /**
   * Add a result to the tree. Every node at or past the cap is marked dead because the runner only ever writes zeros
   * there. A non-overrun result becomes a leaf, then deadness is propagated back towards the root.
   */
  public void record(ConjectureResult result, int cap) {
    byte[] buffer = result.buffer();
    List<Integer> indices = new ArrayList<>(buffer.length);
    int node = 0;
    for (int i = 0; i < buffer.length; i++) {
      indices.add(node);
      int b = buffer[i] & 0xFF;
      if (result.isForced(i)) forced.put(node, b);
      Integer mask = result.maskedIndices.get(i);
      if (mask != null) masks.put(node, mask);
      Map<Integer, Integer> kids = children.computeIfAbsent(node, k -> new HashMap<>());
      Integer next = kids.get(b);
      if (next == null) {
        next = nodeCount++;
        kids.put(b, next);
      }
      node = next;
      if (dead.get(node)) break;
    }

    for (Block block : result.blocks) {
      if (block.start >= indices.size()) break;
      blockSizes.put(indices.get(block.start), block.length());
    }

    for (int i = cap; i < indices.size(); i++) dead.set(indices.get(i));

    if (result.status != Status.OVERRUN && !dead.get(node)) {
      dead.set(node);
      leaves.put(node, result);
      children.remove(node);
      for (int i = indices.size() - 1; i >= 0; i--) {
        int j = indices.get(i);
        int maxSize = masks.getOrDefault(j, 0xFF) + 1;
        Map<Integer, Integer> kids = children.getOrDefault(j, new HashMap<>());
        if (kids.size() < maxSize && !forced.containsKey(j)) break;
        boolean allDead = true;
        for (int child : kids.values()) {
          if (!dead.get(child)) {
            allDead = false;
            break;
          }
        }
        if (!allDead) break;
        dead.set(j);
      }
    }
  }

  /**
   * Find the known result for the tape without running it. Returns the leaf reached by the tape, a shared overrun
   * result if the tape is certain to run out (it ends inside a known block or at a node known to read further), or
   * null if the tree can not tell.
   */
  public ConjectureResult lookup(byte[] buffer) {
    ConjectureResult rootLeaf = leaves.get(0);
    if (rootLeaf != null) return rootLeaf;
    int node = 0;
    for (int k = 0; k < buffer.length; k++) {
      Integer size = blockSizes.get(node);
      if (size != null && k + size > buffer.length) return ConjectureResult.OVERRUN;
      int c = adjust(node, buffer[k] & 0xFF);
      Map<Integer, Integer> kids = children.get(node);
      Integer next = kids == null ? null : kids.get(c);
      if (next == null) return null;
      node = next;
      ConjectureResult leaf = leaves.get(node);
      if (leaf != null) return leaf;
    }
    Map<Integer, Integer> kids = children.get(node);
    if (kids != null && !kids.isEmpty()) return ConjectureResult.OVERRUN;
    return null;
  }

  /** Applies the forced byte or mask at the node to the byte */
  private int adjust(int node, int b) {
    Integer f = forced.get(node);
    if (f != null) b = f;
    Integer mask = masks.get(node);
    if (mask != null) b &= mask;
    return b;
  }

  /**
   * Generate a prefix that leads off the explored part of the tree. At each node a random allowed byte is tried, and
   * if it leads to a dead node a random live one is picked instead. The prefix ends with the first byte that has no
   * node yet.
   */
  public byte[] generateNovelPrefix(Random random, int cap) {
    if (isExhausted()) throw new IllegalStateException("Tree is exhausted");
    List<Byte> prefix = new ArrayList<>();
    int node = 0;
    while (true) {
      if (prefix.size() >= cap) throw new IllegalStateException("Novel prefix reached the cap");
      int upperBound = masks.getOrDefault(node, 0xFF) + 1;
      Map<Integer, Integer> kids = children.getOrDefault(node, new HashMap<>());
      Integer forcedByte = forced.get(node);
      if (forcedByte != null) {
        prefix.add((byte) (int) forcedByte);
        Integer next = kids.get(forcedByte);
        if (next == null) break;
        node = next;
        continue;
      }
      int c = random.nextInt(upperBound);
      Integer next = kids.get(c);
      if (next != null && dead.get(next)) {
        List<Integer> choices = new ArrayList<>();
        for (int b = 0; b < upperBound; b++) {
          Integer child = kids.get(b);
          if (child == null || !dead.get(child)) choices.add(b);
        }
        if (choices.isEmpty()) throw new IllegalStateException("Live node " + node + " has no live children");
        c = choices.get(random.nextInt(choices.size()));
        next = kids.get(c);
      }
      prefix.add((byte) c);
      if (next == null) break;
      node = next;
    }
    byte[] result = new byte[prefix.size()];
    for (int i = 0; i < result.length; i++) result[i] = prefix.get(i);
    return result;
  }
}
