/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml.examples;

import com.vmware.oml.CompiledModel;
import com.vmware.oml.Oml;
import com.vmware.oml.Result;
import org.jooq.DSLContext;
import org.jooq.impl.DSL;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class QuickStartTest {

    @Test
    public void quickStart() {
        // Create an in-memory database and get a JOOQ connection to it
        final DSLContext conn = DSL.using("jdbc:h2:mem:");

        // A table representing some machines
        conn.execute("create table machines(id integer)");

        // A table representing tasks, that need to be assigned to machines
        conn.execute("create table tasks(task_id integer)");

        // Add four machines
        conn.execute("insert into machines values(1)");
        conn.execute("insert into machines values(3)");
        conn.execute("insert into machines values(5)");
        conn.execute("insert into machines values(8)");

        // Add two tasks
        conn.execute("insert into tasks values(1)");
        conn.execute("insert into tasks values(2)");

        // Time to write a model! Just for fun, let's assign tasks to different machines such that
        // the machine IDs sum up to 6. Sets are filled from the table columns with the same name.
        final String model = "set id\n" +
                "set task_id\n" +
                "var assign[task_id, id] : bin\n" +
                "subject to:\n" +
                "  once[t]: sum(assign[t, m] for m in id) == 1 for t in task_id\n" +
                "  spread[m]: sum(assign[t, m] for t in task_id) <= 1 for m in id\n" +
                "  total: sum(m * assign[t, m] for t in task_id, m in id) == 6\n";

        // Compile the model against the current contents of both tables
        final CompiledModel compiled = Oml.compile(model, Map.of("machines", conn.selectFrom("machines").fetch(),
                                                                 "tasks", conn.selectFrom("tasks").fetch()));

        // Solve. The tasks can only go to machines 1 and 5, in either order
        final Result result = compiled.solve();
        assertTrue(result.isOptimal());
        final List<Object> machines = result.valuesOf("assign").entrySet().stream()
                .filter(e -> e.getValue() > 0.5)
                .map(e -> e.getKey().get(1))
                .collect(Collectors.toList());
        assertEquals(2, machines.size());
        assertEquals(Set.of(1L, 5L), Set.copyOf(machines));
    }
}
