/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml.compiler;

/**
 * Rough size and shape of a model, gathered while transforming it.
 */
public final class ComplexityMetrics {
    private final int nestingLevel;
    private final int variableCount;
    private final int operationCount;
    private final int functionCount;
    private final int conditionalCount;

    public ComplexityMetrics(final int nestingLevel, final int variableCount, final int operationCount,
                             final int functionCount, final int conditionalCount) {
        this.nestingLevel = nestingLevel;
        this.variableCount = variableCount;
        this.operationCount = operationCount;
        this.functionCount = functionCount;
        this.conditionalCount = conditionalCount;
    }

    public int nestingLevel() {
        return nestingLevel;
    }

    public int variableCount() {
        return variableCount;
    }

    public int operationCount() {
        return operationCount;
    }

    public int functionCount() {
        return functionCount;
    }

    public int conditionalCount() {
        return conditionalCount;
    }

    public int totalComplexity() {
        return nestingLevel + variableCount + operationCount * 2 + functionCount * 3 + conditionalCount * 4;
    }

    public Level level() {
        final int total = totalComplexity();
        if (total <= 5) {
            return Level.LOW;
        } else if (total <= 15) {
            return Level.MEDIUM;
        } else if (total <= 30) {
            return Level.HIGH;
        }
        return Level.VERY_HIGH;
    }

    @Override
    public String toString() {
        return "ComplexityMetrics{" +
                "nestingLevel=" + nestingLevel +
                ", variableCount=" + variableCount +
                ", operationCount=" + operationCount +
                ", functionCount=" + functionCount +
                ", conditionalCount=" + conditionalCount +
                ", total=" + totalComplexity() +
                '}';
    }

    public enum Level {
        LOW,
        MEDIUM,
        HIGH,
        VERY_HIGH
    }
}
