/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml.examples;

import com.vmware.oml.CompiledModel;
import com.vmware.oml.Result;
import com.vmware.oml.binding.DataTables;
import com.vmware.oml.compiler.ModelCompiler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Quick start: decides how many units of each product to make. Costs, demands and machine hours
 * per product come from resources/products.csv and the model from resources/production.oml.
 */
final class ProductionPlanning {
    private static final Logger LOG = LoggerFactory.getLogger(ProductionPlanning.class);
    private final CompiledModel model;

    /**
     * @param capacity machine hours available, overriding the model's default
     */
    ProductionPlanning(final int capacity) {
        final Map<String, Object> data = Map.of("products", DataTables.fromCsv(Resources.read("/products.csv")),
                                                "capacity", capacity);
        model = new ModelCompiler.Builder().build().compile("production", Resources.read("/production.oml"), data);
    }

    Result solve() {
        final Result result = model.solve();
        if (result.isOptimal()) {
            LOG.info("Total cost: {}", result.objective().orElseThrow());
            LOG.info("Production plan: {}", result.valuesOf("qty"));
        } else {
            LOG.info("Status: {}", result.status());
        }
        return result;
    }
}
