/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.wick.algebra;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Puts a term into canonical form.
 *
 * <p>Two terms are equivalent if one can be turned into the other by
 * <ul>
 *   <li>permuting operators inside a normal-ordered product (with a sign for
 *   each transposition of fermion operators),
 *   <li>exchanging adjacent products that commute,
 *   <li>permuting tensors,
 *   <li>permuting the upper (or lower) indices of a symmetric or
 *   antisymmetric tensor (with a sign if antisymmetric), and
 *   <li>renaming summation indices bijectively within each space.
 * </ul>
 *
 * <p>Each of these transformations writes the term as a sequence of integers
 * (its "code"), with indices labeled in order of first appearance. The
 * canonical form is the term whose code is lexicographically smallest; a
 * branch-and-bound search abandons a partial walk as soon as its code exceeds
 * the best found so far. Operators come before tensors in the walk, so the
 * indices of the operators of a canonical term are numbered from 0 in each
 * space.
 *
 * <p>If two walks give the same code with opposite signs, the term equals its
 * own negation, and is zero.
 */
public class Canonicalizer {
  private Canonicalizer() {}

  /** Returns the canonical form of a term, and the sign relating it to the
   * original term; sign 0 means that the term vanishes. */
  public static Canonical canonicalize(SymbolicTerm term) {
    if (term == SymbolicTerm.ONE) {
      return new Canonical(1, term);
    }
    int sign = 1;
    final List<OperatorProduct> products = new ArrayList<>();
    for (OperatorProduct product : term.products) {
      final OperatorProduct.Ordered ordered = product.normalOrder();
      if (ordered.sign == 0) {
        return new Canonical(0, term);
      }
      sign *= ordered.sign;
      products.add(ordered.product);
    }
    final List<Tensor> tensors = new ArrayList<>();
    for (Tensor tensor : term.tensors) {
      final Tensor sorted = sortSlots(tensor);
      if (tensor.symmetry == Tensor.Symmetry.ANTISYMMETRIC) {
        sign *= slotSign(tensor.upper) * slotSign(tensor.lower);
      }
      tensors.add(sorted);
    }
    final Search search = new Search(products, tensors);
    search.run();
    if (search.zero) {
      return new Canonical(0, term);
    }
    return new Canonical(sign * search.bestSign, search.bestTerm);
  }

  /** Sorts the indices of a permutable tensor by space, keeping the original
   * order within a space. */
  private static Tensor sortSlots(Tensor tensor) {
    if (!tensor.symmetry.permutable()) {
      return tensor;
    }
    return new Tensor(tensor.label, sortBySpace(tensor.upper),
        sortBySpace(tensor.lower), tensor.symmetry);
  }

  private static List<Index> sortBySpace(List<Index> indices) {
    final List<Index> list = new ArrayList<>(indices);
    list.sort((i1, i2) ->
        Integer.compare(i1.space.position, i2.space.position));
    return list;
  }

  /** Returns the sign of the permutation that sorts a list of indices by
   * space. */
  private static int slotSign(List<Index> indices) {
    int inversions = 0;
    for (int i = 0; i < indices.size(); i++) {
      for (int j = i + 1; j < indices.size(); j++) {
        if (indices.get(i).space.position > indices.get(j).space.position) {
          ++inversions;
        }
      }
    }
    return inversions % 2 == 0 ? 1 : -1;
  }

  /** Result of canonicalization. */
  public static final class Canonical {
    /** -1, 0 or 1; 0 if the term vanishes. */
    public final int sign;
    public final SymbolicTerm term;

    Canonical(int sign, SymbolicTerm term) {
      this.sign = sign;
      this.term = term;
    }
  }

  /** State of a canonical-labeling search over one term. */
  private static class Search {
    // Comparison of the current prefix with the best code. A positive state
    // means "less", and is the value of "version" when it was computed;
    // once a new best is found, such a state means "equal", because the new
    // best was reached through the same prefix.
    private static final int EQUAL = 0;
    private static final int GREATER = -1;

    // Indices, numbered by first occurrence.
    final List<Index> indexList = new ArrayList<>();
    final int[] labelOf;
    final int[] nextLabel;

    // Operator products.
    final int groupCount;
    final int[][] opType;
    final int[][] opSpace;
    final int[][] opId;
    final boolean[][] opFermion;
    final int[][] opBlockStart;
    final int[][] opBlockEnd;
    final boolean[][] commute;
    final boolean[] oddGroup;

    // Tensors, sorted by key.
    final List<Tensor> tensors;
    final int[][] tensorKey;
    final int[][] upperId;
    final int[][] lowerId;
    final int[][] upperBlockStart;
    final int[][] upperBlockEnd;
    final int[][] lowerBlockStart;
    final int[][] lowerBlockEnd;
    final List<String> labels;

    // Current walk.
    final int[] code;
    final boolean[] groupUsed;
    final int[] groupOrder;
    final boolean[][] opUsed;
    final int[][] opOrder;
    final boolean[] tensorUsed;
    final int[] tensorOrder;
    final boolean[][] upperUsed;
    final int[][] upperOrder;
    final boolean[][] lowerUsed;
    final int[][] lowerOrder;

    // Best walk.
    int[] best;
    int version;
    int bestSign;
    SymbolicTerm bestTerm;
    boolean zero;

    Search(List<OperatorProduct> products, List<Tensor> tensorList) {
      final Map<Index, Integer> ids = new HashMap<>();
      int maxPosition = 0;
      int length = 0;
      for (OperatorProduct product : products) {
        length += 1 + 3 * product.size();
        for (SqOperator op : product.operators) {
          id(ids, op.index);
          maxPosition = Math.max(maxPosition, op.index.space.position);
        }
      }
      for (Tensor tensor : tensorList) {
        length += 5 + 2 * tensor.rank();
        for (Index index : tensor.upper) {
          id(ids, index);
          maxPosition = Math.max(maxPosition, index.space.position);
        }
        for (Index index : tensor.lower) {
          id(ids, index);
          maxPosition = Math.max(maxPosition, index.space.position);
        }
      }
      labelOf = new int[indexList.size()];
      Arrays.fill(labelOf, -1);
      nextLabel = new int[maxPosition + 1];
      code = new int[length];

      groupCount = products.size();
      opType = new int[groupCount][];
      opSpace = new int[groupCount][];
      opId = new int[groupCount][];
      opFermion = new boolean[groupCount][];
      opBlockStart = new int[groupCount][];
      opBlockEnd = new int[groupCount][];
      opUsed = new boolean[groupCount][];
      opOrder = new int[groupCount][];
      oddGroup = new boolean[groupCount];
      for (int g = 0; g < groupCount; g++) {
        final OperatorProduct product = products.get(g);
        final int n = product.size();
        opType[g] = new int[n];
        opSpace[g] = new int[n];
        opId[g] = new int[n];
        opFermion[g] = new boolean[n];
        opUsed[g] = new boolean[n];
        opOrder[g] = new int[n];
        for (int i = 0; i < n; i++) {
          final SqOperator op = product.get(i);
          opType[g][i] = op.type.ordinal();
          opSpace[g][i] = op.index.space.position;
          opId[g][i] = ids.get(op.index);
          opFermion[g][i] = op.isFermion();
        }
        opBlockStart[g] = new int[n];
        opBlockEnd[g] = new int[n];
        final int[] types = opType[g];
        final int[] spaces = opSpace[g];
        blocks(n, (i, j) -> types[i] == types[j] && spaces[i] == spaces[j],
            opBlockStart[g], opBlockEnd[g]);
        oddGroup[g] = product.fermionCount() % 2 == 1;
      }
      commute = new boolean[groupCount][groupCount];
      for (int g = 0; g < groupCount; g++) {
        for (int h = 0; h < groupCount; h++) {
          commute[g][h] = products.get(g).commutesWith(products.get(h));
        }
      }
      groupUsed = new boolean[groupCount];
      groupOrder = new int[groupCount];

      // Sort tensors by a key that is invariant under relabeling.
      labels = ImmutableList.copyOf(labelSet(tensorList));
      final List<Tensor> sorted = new ArrayList<>(tensorList);
      sorted.sort((t1, t2) -> compare(key(t1), key(t2)));
      tensors = sorted;
      final int t = tensors.size();
      tensorKey = new int[t][];
      upperId = new int[t][];
      lowerId = new int[t][];
      upperBlockStart = new int[t][];
      upperBlockEnd = new int[t][];
      lowerBlockStart = new int[t][];
      lowerBlockEnd = new int[t][];
      upperUsed = new boolean[t][];
      upperOrder = new int[t][];
      lowerUsed = new boolean[t][];
      lowerOrder = new int[t][];
      for (int k = 0; k < t; k++) {
        final Tensor tensor = tensors.get(k);
        tensorKey[k] = key(tensor);
        upperId[k] = ids(ids, tensor.upper);
        lowerId[k] = ids(ids, tensor.lower);
        upperBlockStart[k] = new int[tensor.upper.size()];
        upperBlockEnd[k] = new int[tensor.upper.size()];
        lowerBlockStart[k] = new int[tensor.lower.size()];
        lowerBlockEnd[k] = new int[tensor.lower.size()];
        slotBlocks(tensor, tensor.upper, upperBlockStart[k],
            upperBlockEnd[k]);
        slotBlocks(tensor, tensor.lower, lowerBlockStart[k],
            lowerBlockEnd[k]);
        upperUsed[k] = new boolean[tensor.upper.size()];
        upperOrder[k] = new int[tensor.upper.size()];
        lowerUsed[k] = new boolean[tensor.lower.size()];
        lowerOrder[k] = new int[tensor.lower.size()];
      }
      tensorUsed = new boolean[t];
      tensorOrder = new int[t];
    }

    private void id(Map<Index, Integer> ids, Index index) {
      if (!ids.containsKey(index)) {
        ids.put(index, indexList.size());
        indexList.add(index);
      }
    }

    private static int[] ids(Map<Index, Integer> ids, List<Index> indices) {
      final int[] a = new int[indices.size()];
      for (int i = 0; i < a.length; i++) {
        a[i] = ids.get(indices.get(i));
      }
      return a;
    }

    private static TreeSet<String> labelSet(List<Tensor> tensors) {
      final TreeSet<String> set = new TreeSet<>();
      tensors.forEach(t -> set.add(t.label));
      return set;
    }

    /** Key of a tensor: label, symmetry, arity, and the spaces of its
     * slots. */
    private int[] key(Tensor tensor) {
      final int[] key = new int[4 + tensor.rank()];
      key[0] = labels.indexOf(tensor.label);
      key[1] = tensor.symmetry.ordinal();
      key[2] = tensor.upper.size();
      key[3] = tensor.lower.size();
      int i = 4;
      for (Index index : tensor.upper) {
        key[i++] = index.space.position;
      }
      for (Index index : tensor.lower) {
        key[i++] = index.space.position;
      }
      return key;
    }

    private static int compare(int[] a, int[] b) {
      for (int i = 0; i < Math.min(a.length, b.length); i++) {
        if (a[i] != b[i]) {
          return Integer.compare(a[i], b[i]);
        }
      }
      return Integer.compare(a.length, b.length);
    }

    /** Computes runs of equivalent consecutive slots. */
    private static void blocks(int n, SlotEquivalence eq, int[] start,
        int[] end) {
      int s = 0;
      for (int i = 1; i <= n; i++) {
        if (i == n || !eq.same(s, i)) {
          for (int j = s; j < i; j++) {
            start[j] = s;
            end[j] = i;
          }
          s = i;
        }
      }
    }

    private static void slotBlocks(Tensor tensor, List<Index> indices,
        int[] start, int[] end) {
      if (tensor.symmetry.permutable()) {
        blocks(indices.size(),
            (i, j) -> indices.get(i).space.equals(indices.get(j).space),
            start, end);
      } else {
        for (int i = 0; i < indices.size(); i++) {
          start[i] = i;
          end[i] = i + 1;
        }
      }
    }

    void run() {
      groups(0, 0, EQUAL, 1);
    }

    /** Writes a value into the code and returns the new comparison state. */
    private int emit(int pos, int value, int state) {
      code[pos] = value;
      final int less = version + 1;
      if (best == null || state == less) {
        return less;
      }
      return value < best[pos] ? less : value > best[pos] ? GREATER : EQUAL;
    }

    /** Returns the label of an index, assigning the next free label of its
     * space if it has none. */
    private int label(int id) {
      if (labelOf[id] < 0) {
        labelOf[id] = nextLabel[indexList.get(id).space.position]++;
      }
      return labelOf[id];
    }

    /** Removes the label of an index if it was assigned at or after a
     * given label count. */
    private void unlabel(int id, int previousNext) {
      final int position = indexList.get(id).space.position;
      if (labelOf[id] >= 0 && labelOf[id] >= previousNext) {
        labelOf[id] = -1;
        nextLabel[position] = previousNext;
      }
    }

    private void groups(int done, int pos, int state, int sign) {
      if (done == groupCount) {
        tensors(0, pos, state, sign);
        return;
      }
      for (int g = 0; g < groupCount; g++) {
        if (groupUsed[g]) {
          continue;
        }
        boolean ok = true;
        int s = sign;
        for (int h = 0; h < g; h++) {
          if (!groupUsed[h]) {
            if (!commute[h][g]) {
              ok = false;
              break;
            }
            if (oddGroup[h] && oddGroup[g]) {
              s = -s;
            }
          }
        }
        if (!ok) {
          continue;
        }
        final int st = emit(pos, opType[g].length, state);
        if (st == GREATER) {
          continue;
        }
        groupUsed[g] = true;
        groupOrder[done] = g;
        ops(done, g, 0, pos + 1, st, s);
        groupUsed[g] = false;
      }
    }

    private void ops(int done, int g, int slot, int pos, int state,
        int sign) {
      if (slot == opType[g].length) {
        groups(done + 1, pos, state, sign);
        return;
      }
      final int start = opBlockStart[g][slot];
      final int end = opBlockEnd[g][slot];
      for (int j = start; j < end; j++) {
        if (opUsed[g][j]) {
          continue;
        }
        int s = sign;
        if (opFermion[g][j]) {
          for (int i = start; i < j; i++) {
            if (!opUsed[g][i] && opFermion[g][i]) {
              s = -s;
            }
          }
        }
        int st = emit(pos, opType[g][j], state);
        st = st == GREATER ? st : emit(pos + 1, opSpace[g][j], st);
        if (st == GREATER) {
          continue;
        }
        final int id = opId[g][j];
        final int previousNext = nextLabel[indexList.get(id).space.position];
        st = emit(pos + 2, label(id), st);
        if (st != GREATER) {
          opUsed[g][j] = true;
          opOrder[g][slot] = j;
          ops(done, g, slot + 1, pos + 3, st, s);
          opUsed[g][j] = false;
        }
        unlabel(id, previousNext);
      }
    }

    private void tensors(int k, int pos, int state, int sign) {
      if (k == tensors.size()) {
        leaf(sign);
        return;
      }
      for (int t = 0; t < tensors.size(); t++) {
        if (tensorUsed[t] || compare(tensorKey[t], tensorKey[k]) != 0) {
          continue;
        }
        final Tensor tensor = tensors.get(t);
        int st = emit(pos, tensorKey[t][0], state);
        st = st == GREATER ? st : emit(pos + 1, tensorKey[t][1], st);
        st = st == GREATER ? st : emit(pos + 2, tensor.upper.size(), st);
        st = st == GREATER ? st : emit(pos + 3, tensor.lower.size(), st);
        st = st == GREATER ? st : emit(pos + 4, -1, st);
        if (st == GREATER) {
          continue;
        }
        tensorUsed[t] = true;
        tensorOrder[k] = t;
        slots(k, t, true, 0, pos + 5, st, sign);
        tensorUsed[t] = false;
      }
    }

    private void slots(int k, int t, boolean upper, int slot, int pos,
        int state, int sign) {
      final int[] id = upper ? upperId[t] : lowerId[t];
      if (slot == id.length) {
        if (upper) {
          slots(k, t, false, 0, pos, state, sign);
        } else {
          tensors(k + 1, pos, state, sign);
        }
        return;
      }
      final boolean[] used = upper ? upperUsed[t] : lowerUsed[t];
      final int[] order = upper ? upperOrder[t] : lowerOrder[t];
      final int start = (upper ? upperBlockStart[t] : lowerBlockStart[t])[slot];
      final int end = (upper ? upperBlockEnd[t] : lowerBlockEnd[t])[slot];
      final boolean antisymmetric =
          tensors.get(t).symmetry == Tensor.Symmetry.ANTISYMMETRIC;
      for (int j = start; j < end; j++) {
        if (used[j]) {
          continue;
        }
        int s = sign;
        if (antisymmetric) {
          for (int i = start; i < j; i++) {
            if (!used[i]) {
              s = -s;
            }
          }
        }
        final int position = indexList.get(id[j]).space.position;
        int st = emit(pos, position, state);
        if (st == GREATER) {
          continue;
        }
        final int previousNext = nextLabel[position];
        st = emit(pos + 1, label(id[j]), st);
        if (st != GREATER) {
          used[j] = true;
          order[slot] = j;
          slots(k, t, upper, slot + 1, pos + 2, st, s);
          used[j] = false;
        }
        unlabel(id[j], previousNext);
      }
    }

    private void leaf(int sign) {
      final int c = best == null ? -1 : Arrays.compare(code, best);
      if (c < 0) {
        best = code.clone();
        ++version;
        bestSign = sign;
        bestTerm = build();
        zero = false;
      } else if (c == 0 && sign != bestSign) {
        zero = true;
      }
    }

    /** Builds the term described by the current walk. */
    private SymbolicTerm build() {
      final ImmutableList.Builder<OperatorProduct> products =
          ImmutableList.builder();
      for (int done = 0; done < groupCount; done++) {
        final int g = groupOrder[done];
        final List<SqOperator> ops = new ArrayList<>();
        for (int slot = 0; slot < opType[g].length; slot++) {
          final int j = opOrder[g][slot];
          ops.add(
              new SqOperator(SqOperator.Type.values()[opType[g][j]],
                  labeled(opId[g][j])));
        }
        products.add(OperatorProduct.of(ops));
      }
      final ImmutableList.Builder<Tensor> tensorList = ImmutableList.builder();
      for (int k = 0; k < tensors.size(); k++) {
        final int t = tensorOrder[k];
        final Tensor tensor = tensors.get(t);
        tensorList.add(
            new Tensor(tensor.label, labeled(upperId[t], upperOrder[t]),
                labeled(lowerId[t], lowerOrder[t]), tensor.symmetry));
      }
      return SymbolicTerm.of(tensorList.build(), products.build());
    }

    private Index labeled(int id) {
      final Index index = indexList.get(id);
      return index.withOrdinal(labelOf[id]);
    }

    private List<Index> labeled(int[] id, int[] order) {
      final List<Index> list = new ArrayList<>();
      for (int slot = 0; slot < id.length; slot++) {
        list.add(labeled(id[order[slot]]));
      }
      return list;
    }
  }

  /** Decides whether two slots belong to the same block. */
  private interface SlotEquivalence {
    boolean same(int i, int j);
  }
}

// End Canonicalizer.java
