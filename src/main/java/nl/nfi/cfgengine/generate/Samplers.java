package nl.nfi.cfgengine.generate;

import java.util.ArrayDeque;
import java.util.List;
import java.util.Queue;
import java.util.Random;
import java.util.function.Function;
import java.util.function.IntToDoubleFunction;
import java.util.function.ToDoubleFunction;
import java.util.function.ToIntFunction;

// Vose's alias method: O(n) setup, O(1) per draw
// weights do not need to be normalized
public final class Samplers {

    private Samplers() {
    }

    static ToIntFunction<Random> buildIndexSampler(final int n, final IntToDoubleFunction weights) {
        if (n <= 0) {
            throw new IllegalArgumentException("Cannot sample from an empty range");
        }
        if (n == 1) {
            return random -> 0;
        }

        double total = 0.0;
        for (int element = 0; element < n; element++) {
            total += weights.applyAsDouble(element);
        }

        final double[] u = new double[n];
        final int[] k = new int[n];

        final Queue<Integer> small = new ArrayDeque<>();
        final Queue<Integer> large = new ArrayDeque<>();

        for (int element = 0; element < n; element++) {
            u[element] = weights.applyAsDouble(element) / total * n;
            k[element] = element;

            if (u[element] < 1.0) {
                small.add(element);
            } else {
                large.add(element);
            }
        }

        while (!(small.isEmpty() || large.isEmpty())) {
            final int l = small.poll();
            final int g = large.poll();

            k[l] = g;
            u[g] = u[g] + u[l] - 1.0;

            if (u[g] < 1.0) {
                small.add(g);
            } else {
                large.add(g);
            }
        }

        // leftovers only differ from 1.0 by rounding
        while (!large.isEmpty()) {
            u[large.poll()] = 1.0;
        }
        while (!small.isEmpty()) {
            u[small.poll()] = 1.0;
        }

        return random -> {
            final int i = random.nextInt(n);
            if (random.nextDouble() < u[i]) {
                return i;
            }
            return k[i];
        };
    }

    static <T> Function<Random, T> buildSampler(final List<T> elements, final ToDoubleFunction<T> weight) {
        final ToIntFunction<Random> indexSampler = buildIndexSampler(elements.size(), index -> weight.applyAsDouble(elements.get(index)));
        return random -> elements.get(indexSampler.applyAsInt(random));
    }
}
