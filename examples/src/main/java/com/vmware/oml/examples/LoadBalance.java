/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml.examples;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.vmware.oml.CompiledModel;
import com.vmware.oml.ModelException;
import com.vmware.oml.ResultStatus;
import com.vmware.oml.SolverException;
import com.vmware.oml.compiler.ModelCompiler;
import org.jooq.DSLContext;
import org.jooq.Record;
import org.jooq.Result;
import org.jooq.SQLDialect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static java.sql.DriverManager.getConnection;
import static org.jooq.impl.DSL.field;
import static org.jooq.impl.DSL.table;
import static org.jooq.impl.DSL.using;


/**
 * A simple class to highlight what OML models can do with database state. Creating an instance sets up
 * an in-memory database according to resources/schema.sql, with one table for physical machines and
 * one for virtual machines. The base model in resources/load_balance.oml places every virtual machine
 * on one physical machine, and callers add their own declarations, constraints and objectives on top.
 *
 * The class is currently driven by tests written in LoadBalanceTest.
 */
class LoadBalance {
    private static final Logger LOG = LoggerFactory.getLogger(LoadBalance.class);
    private static final String PHYSICAL_MACHINES_TABLE = "PHYSICAL_MACHINE";
    private static final String VIRTUAL_MACHINES_TABLE = "VIRTUAL_MACHINE";
    private static final String VM_SUBSET_TABLE = "VM_SUBSET";
    private final DSLContext conn;
    private final String source;
    private final ModelCompiler compiler = new ModelCompiler.Builder().build();

    LoadBalance(final List<String> statements) {
        conn = setup();
        source = Resources.read("/load_balance.oml") + "\n" + String.join("\n", statements) + "\n";
    }

    /**
     * Add a physical machine to the inventory.
     *
     * @param nodeName machine name
     * @param cpuCapacity CPU capacity
     * @param memoryCapacity Memory capacity
     */
    void addPhysicalMachine(final String nodeName, final int cpuCapacity, final int memoryCapacity) {
        conn.insertInto(table(PHYSICAL_MACHINES_TABLE))
                .values(nodeName, cpuCapacity, memoryCapacity).execute();
    }

    /**
     * Add a virtual machine to the inventory.
     *
     * @param vmName name
     * @param cpu CPU demand
     * @param memory Memory demand
     */
    void addVirtualMachine(final String vmName, final int cpu, final int memory) {
        conn.insertInto(table(VIRTUAL_MACHINES_TABLE))
                .values(vmName, cpu, memory, null).execute();
    }

    /**
     * Invoke to solve for the current contents of the database.
     *
     * @return The virtual machine table after the solver's placement is written to it.
     * @throws SolverException if the model has no feasible placement
     */
    Result<? extends Record> run() {
        // Pull the latest state from the DB. Sets are bound to the first table with a matching column,
        // so the virtual machine table has to come before the subset table.
        final Map<String, Object> data = new LinkedHashMap<>();
        data.put("physical_machine", conn.selectFrom(table(PHYSICAL_MACHINES_TABLE)).fetch());
        data.put("virtual_machine", conn.selectFrom(table(VIRTUAL_MACHINES_TABLE)).fetch());
        data.put("vm_subset", conn.selectFrom(table(VM_SUBSET_TABLE)).fetch());

        final CompiledModel model = compiler.compile("load_balance", source, data);
        final com.vmware.oml.Result result = model.solve();
        if (result.status() != ResultStatus.OPTIMAL) {
            LOG.warn("No placement found: {}", result.message().orElse(result.status().toString()));
            throw new SolverException(result.status().toString());
        }
        for (final Map.Entry<ImmutableList<Object>, Double> assignment: result.valuesOf("assign").entrySet()) {
            if (assignment.getValue() > 0.5) {
                conn.update(table(VIRTUAL_MACHINES_TABLE))
                        .set(field("PHYSICAL_MACHINE"), assignment.getKey().get(1))
                        .where(field("VM").eq(assignment.getKey().get(0)))
                        .execute();
            }
        }
        LOG.info("Placed virtual machines in {}s using {}", result.elapsedSeconds(), result.solver());
        return conn.selectFrom(table(VIRTUAL_MACHINES_TABLE)).fetch();
    }

    /*
     * Sets up an in-memory H2 database.
     */
    private DSLContext setup() {
        try {
            // Create a fresh database
            final Connection conn = getConnection("jdbc:h2:mem:");
            final DSLContext using = using(conn, SQLDialect.H2);
            using.execute("create schema curr");
            using.execute("set schema curr");
            final String schemaAsString = Resources.read("/schema.sql")
                    .lines()
                    .filter(line -> !line.startsWith("--")) // remove SQL comments
                    .collect(Collectors.joining("\n"));
            final List<String> semiColonSeparated = Splitter.on(";")
                    .trimResults()
                    .omitEmptyStrings()
                    .splitToList(schemaAsString);
            semiColonSeparated.forEach(using::execute);
            return using;
        } catch (final SQLException e) {
            throw new ModelException("Could not set up the database", e);
        }
    }
}
