/*
 * This file is part of BoolNet.
 * Copyright (c) 2026 The BoolNet Authors.
 *
 * BoolNet is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * BoolNet is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with BoolNet. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.boolnet;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Random;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Samples networks in which every update function depends on a fixed number of variables until the
 * simulated dynamics meet an attractor target.
 *
 * <p>Each function is a random truth table over its dependencies with a bounded number of true rows,
 * written as a canonical sum of products over the dependencies. The search is bounded by the attempt
 * budget and reports exhaustion as a {@link GenerationResult} instead of failing.</p>
 */
public final class BoundedDependencyGenerator {
    private static final Logger logger = Logger.getLogger(BoundedDependencyGenerator.class.getName());

    private final BoundedDependencyConfiguration configuration;

    public BoundedDependencyGenerator(BoundedDependencyConfiguration configuration) {
        this.configuration = configuration;
    }

    public BoundedDependencyConfiguration configuration() {
        return configuration;
    }

    public GenerationResult generate() {
        return generate(new Random(configuration.seed()));
    }

    public GenerationResult generate(Random random) {
        ImmutableList<Integer> lastSizes = ImmutableList.of();
        for (int attempt = 1; attempt <= configuration.maxAttempts(); attempt++) {
            BooleanNetwork network = sample(random);
            TransitionSet transitions = network.transitions();
            lastSizes = transitions.analyse().attractorSizes();
            logger.log(Level.FINER, "Attempt {0} has attractors {1}", new Object[] {attempt, lastSizes});
            if (meetsTarget(lastSizes)) {
                logger.log(Level.FINE, "Accepted network after {0} attempts", attempt);
                return GenerationResult.accepted(network, transitions, attempt, lastSizes);
            }
        }
        logger.log(Level.INFO, "No network meeting the attractor target found in {0} attempts",
                configuration.maxAttempts());
        return GenerationResult.exhausted(configuration.maxAttempts(), lastSizes);
    }

    /** Samples one network without checking its dynamics. */
    public BooleanNetwork sample(Random random) {
        ImmutableList.Builder<BooleanFunction> functions = ImmutableList.builder();
        for (int variable = 0; variable < configuration.variableCount(); variable++) {
            functions.add(sampleFunction(variable, random));
        }
        return BooleanNetwork.of(functions.build());
    }

    private BooleanFunction sampleFunction(int variable, Random random) {
        int variableCount = configuration.variableCount();
        int dependencyCount = configuration.dependencyCount();

        List<Integer> candidates = new ArrayList<>(variableCount);
        for (int i = 0; i < variableCount; i++) {
            if (i != variable || configuration.allowSelfDependency()) {
                candidates.add(i);
            }
        }
        Collections.shuffle(candidates, random);
        List<Integer> dependencies = new ArrayList<>(candidates.subList(0, dependencyCount));
        Collections.sort(dependencies);

        int min = configuration.minTrueOutputs();
        int trueRows = min + random.nextInt(configuration.effectiveMaxTrueOutputs() - min + 1);
        List<Integer> rows = new ArrayList<>(1 << dependencyCount);
        for (int row = 0; row < 1 << dependencyCount; row++) {
            rows.add(row);
        }
        Collections.shuffle(rows, random);
        List<Integer> selected = new ArrayList<>(rows.subList(0, trueRows));
        Collections.sort(selected);

        int dependencyMask = 0;
        for (int dependency : dependencies) {
            dependencyMask |= State.mask(variableCount, dependency);
        }
        int open = ((1 << variableCount) - 1) & ~dependencyMask;

        List<Implicant> terms = new ArrayList<>(trueRows);
        for (int row : selected) {
            // The first dependency is the most significant bit of the row.
            int value = 0;
            for (int j = 0; j < dependencyCount; j++) {
                if ((row & (1 << (dependencyCount - 1 - j))) != 0) {
                    value |= State.mask(variableCount, dependencies.get(j));
                }
            }
            terms.add(Implicant.of(variableCount, value, open));
        }
        return BooleanFunction.of(variable, SumOfProducts.of(variableCount, terms));
    }

    private boolean meetsTarget(List<Integer> sizes) {
        if (configuration.attractorCount().isPresent() && sizes.size() != configuration.attractorCount().getAsInt()) {
            return false;
        }
        if (configuration.attractorSizes().isEmpty()) {
            return true;
        }
        List<Integer> expected = new ArrayList<>(configuration.attractorSizes());
        expected.sort(Comparator.reverseOrder());
        return expected.equals(sizes);
    }
}
