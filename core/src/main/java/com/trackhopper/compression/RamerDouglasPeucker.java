/*
 *  Licensed to GraphHopper GmbH under one or more contributor
 *  license agreements. See the NOTICE file distributed with this work for
 *  additional information regarding copyright ownership.
 *
 *  GraphHopper GmbH licenses this file to you under the Apache License,
 *  Version 2.0 (the "License"); you may not use this file except in
 *  compliance with the License. You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */
package com.trackhopper.compression;

import com.carrotsearch.hppc.IntArrayDeque;
import com.carrotsearch.hppc.IntArrayList;
import com.trackhopper.util.DistanceCalcEarth;
import com.trackhopper.util.Sample;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.RecursiveTask;

/**
 * Simplifies a track of samples and returns the indices of the samples to keep.
 * http://en.wikipedia.org/wiki/Ramer%E2%80%93Douglas%E2%80%93Peucker_algorithm
 * <p>
 * The samples are never modified, the algorithm works on index ranges of the original list. Every
 * discarded sample is within the maximum distance of the chord between the kept samples
 * surrounding it. The sequential implementation uses an explicit stack, as the recursive version
 * runs into a stack overflow for long zig-zag tracks. If a pool is set, independent sub-ranges
 * larger than the parallel threshold are simplified in parallel, the result is the same.
 * <p>
 * Calling simplify is thread safe.
 */
public class RamerDouglasPeucker {
    private static final int MAX_FORK_DEPTH = 32;
    private final DistanceCalcEarth calc;
    private double maxDistance = 1;
    private ForkJoinPool pool;
    private int parallelThreshold = Integer.MAX_VALUE;

    public RamerDouglasPeucker() {
        this(DistanceCalcEarth.DIST_EARTH);
    }

    public RamerDouglasPeucker(DistanceCalcEarth calc) {
        this.calc = calc;
    }

    /**
     * maximum distance of discrepancy (from the simplified track) in meter
     */
    public RamerDouglasPeucker setMaxDistance(double dist) {
        if (!(dist > 0))
            throw new IllegalArgumentException("maximum distance must be positive but was " + dist);

        this.maxDistance = dist;
        return this;
    }

    public double getMaxDistance() {
        return maxDistance;
    }

    /**
     * Enables parallel simplification of all ranges spanning more than the specified number of
     * samples.
     */
    public RamerDouglasPeucker setForkJoinPool(ForkJoinPool pool, int parallelThreshold) {
        if (parallelThreshold < 1)
            throw new IllegalArgumentException("parallel threshold must be positive but was " + parallelThreshold);

        this.pool = pool;
        this.parallelThreshold = parallelThreshold;
        return this;
    }

    /**
     * Simplifies the <code>samples</code>, from index 0 to size-1.
     *
     * @return the ascending indices of the kept samples, empty for an empty list
     */
    public IntArrayList simplify(List<Sample> samples) {
        if (samples.isEmpty())
            return new IntArrayList(0);
        return simplify(samples, 0, samples.size() - 1);
    }

    /**
     * Simplifies a part of the <code>samples</code>. The <code>fromIndex</code> and <code>lastIndex</code>
     * are guaranteed to be kept.
     *
     * @return the ascending indices of the kept samples within [fromIndex, lastIndex]
     */
    public IntArrayList simplify(List<Sample> samples, int fromIndex, int lastIndex) {
        checkRange(samples, fromIndex, lastIndex);
        if (pool != null && lastIndex - fromIndex > parallelThreshold)
            return parallelSimplify(samples, fromIndex, lastIndex);

        return subSimplify(samples, fromIndex, lastIndex);
    }

    private IntArrayList subSimplify(List<Sample> samples, int fromIndex, int lastIndex) {
        if (lastIndex - fromIndex < 2)
            return range(fromIndex, lastIndex);

        BitSet keep = new BitSet(lastIndex + 1);
        keep.set(fromIndex);
        keep.set(lastIndex);
        IntArrayDeque stack = new IntArrayDeque();
        stack.addLast(fromIndex);
        stack.addLast(lastIndex);
        while (!stack.isEmpty()) {
            int end = stack.removeLast();
            int start = stack.removeLast();
            if (end - start < 2)
                continue;

            int splitIndex = findSplitIndex(samples, start, end);
            if (splitIndex < 0)
                continue;

            keep.set(splitIndex);
            stack.addLast(splitIndex);
            stack.addLast(end);
            stack.addLast(start);
            stack.addLast(splitIndex);
        }
        return toList(keep, fromIndex);
    }

    private IntArrayList parallelSimplify(List<Sample> samples, int fromIndex, int lastIndex) {
        IntArrayList splitIndices = pool.invoke(new SimplifyTask(samples, fromIndex, lastIndex, 0));
        BitSet keep = new BitSet(lastIndex + 1);
        keep.set(fromIndex);
        keep.set(lastIndex);
        for (int i = 0; i < splitIndices.size(); i++) {
            keep.set(splitIndices.get(i));
        }
        return toList(keep, fromIndex);
    }

    /**
     * The textbook recursive variant. Produces the same result as the stack based one but needs a
     * stack frame per nesting level.
     */
    IntArrayList simplifyRecursive(List<Sample> samples, int fromIndex, int lastIndex) {
        checkRange(samples, fromIndex, lastIndex);
        if (lastIndex - fromIndex < 2)
            return range(fromIndex, lastIndex);

        int splitIndex = findSplitIndex(samples, fromIndex, lastIndex);
        if (splitIndex < 0)
            return IntArrayList.from(fromIndex, lastIndex);

        IntArrayList result = simplifyRecursive(samples, fromIndex, splitIndex);
        appendWithoutFirst(result, simplifyRecursive(samples, splitIndex, lastIndex));
        return result;
    }

    /**
     * @return the first index in (fromIndex, lastIndex) with the maximum distance to the chord
     * fromIndex-lastIndex if this distance exceeds the maximum distance, otherwise -1
     */
    int findSplitIndex(List<Sample> samples, int fromIndex, int lastIndex) {
        Sample first = samples.get(fromIndex);
        Sample last = samples.get(lastIndex);
        int indexWithMaxDist = -1;
        double maxDist = 0;
        for (int i = fromIndex + 1; i < lastIndex; i++) {
            double dist = calc.calcPerpendicularDist(samples.get(i), first, last);
            if (dist > maxDist) {
                indexWithMaxDist = i;
                maxDist = dist;
            }
        }
        return maxDist > maxDistance ? indexWithMaxDist : -1;
    }

    private static void checkRange(List<Sample> samples, int fromIndex, int lastIndex) {
        if (fromIndex < 0 || lastIndex >= samples.size() || fromIndex > lastIndex)
            throw new IllegalArgumentException("Invalid range [" + fromIndex + "," + lastIndex + "] for " + samples.size() + " samples");
    }

    private static IntArrayList toList(BitSet keep, int fromIndex) {
        IntArrayList result = new IntArrayList(keep.cardinality());
        for (int i = keep.nextSetBit(fromIndex); i >= 0; i = keep.nextSetBit(i + 1)) {
            result.add(i);
        }
        return result;
    }

    private static IntArrayList range(int fromIndex, int lastIndex) {
        IntArrayList list = new IntArrayList(lastIndex - fromIndex + 1);
        for (int i = fromIndex; i <= lastIndex; i++) {
            list.add(i);
        }
        return list;
    }

    // the first entry of the right part is the split index which ends the left part
    private static void appendWithoutFirst(IntArrayList left, IntArrayList right) {
        for (int i = 1; i < right.size(); i++) {
            left.add(right.get(i));
        }
    }

    /**
     * Collects the split indices of a range with its own stack, like the sequential variant. The
     * right part of a split is handed to another task only if both parts are larger than the
     * parallel threshold, and never deeper than MAX_FORK_DEPTH, so the nesting of tasks that are
     * joined on the same thread stays bounded.
     */
    private class SimplifyTask extends RecursiveTask<IntArrayList> {
        private final List<Sample> samples;
        private final int fromIndex;
        private final int lastIndex;
        private final int depth;

        SimplifyTask(List<Sample> samples, int fromIndex, int lastIndex, int depth) {
            this.samples = samples;
            this.fromIndex = fromIndex;
            this.lastIndex = lastIndex;
            this.depth = depth;
        }

        @Override
        protected IntArrayList compute() {
            IntArrayList splitIndices = new IntArrayList();
            List<SimplifyTask> forked = new ArrayList<>();
            IntArrayDeque stack = new IntArrayDeque();
            stack.addLast(fromIndex);
            stack.addLast(lastIndex);
            while (!stack.isEmpty()) {
                int end = stack.removeLast();
                int start = stack.removeLast();
                if (end - start < 2)
                    continue;

                int splitIndex = findSplitIndex(samples, start, end);
                if (splitIndex < 0)
                    continue;

                splitIndices.add(splitIndex);
                if (depth < MAX_FORK_DEPTH && splitIndex - start > parallelThreshold && end - splitIndex > parallelThreshold) {
                    SimplifyTask right = new SimplifyTask(samples, splitIndex, end, depth + 1);
                    right.fork();
                    forked.add(right);
                } else {
                    stack.addLast(splitIndex);
                    stack.addLast(end);
                }
                stack.addLast(start);
                stack.addLast(splitIndex);
            }

            for (SimplifyTask task : forked) {
                splitIndices.addAll(task.join());
            }
            return splitIndices;
        }
    }
}
