/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml.examples;

import com.vmware.oml.SolverException;
import org.jooq.Record;
import org.jooq.Result;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class LoadBalanceTest {
    private static final int NUM_PHYSICAL_MACHINES = 5;
    private static final int NUM_VIRTUAL_MACHINES = 10;

    private static final String CAPACITY_CONSTRAINT =
            "subject to:\n" +
            "  cpu_limit[p]: sum(cpu[v] * assign[v, p] for v in vm) <= cpu_capacity[p] for p in pm\n" +
            "  memory_limit[p]: sum(memory[v] * assign[v, p] for v in vm) <= memory_capacity[p] for p in pm\n";

    /*
     * A simple constraint that forces all assignments to go the same node
     */
    @Test
    public void testSimpleConstraint() {
        final String allVmsGoToPm3 = "subject to:\n" +
                                     "  pinned[v]: assign[v, \"pm3\"] == 1 for v in vm\n";
        final LoadBalance lb = new LoadBalance(List.of(allVmsGoToPm3));
        addInventory(lb);
        final Result<? extends Record> results = lb.run();
        assertEquals(NUM_VIRTUAL_MACHINES, results.size());
        results.forEach(e -> assertEquals("pm3", e.get("PHYSICAL_MACHINE")));
    }

    /*
     * We now add a capacity constraint to make sure that no physical machine is assigned more VMs
     * than it has capacity for. Given the constants we've chosen in addInventory(), there should be
     * at least two physical machines that receive VMs.
     */
    @Test
    public void testCapacityConstraints() {
        final LoadBalance lb = new LoadBalance(List.of(CAPACITY_CONSTRAINT));
        addInventory(lb);
        final Result<? extends Record> results = lb.run();
        results.forEach(e -> assertNotNull(e.get("PHYSICAL_MACHINE")));
        assertTrue(physicalMachines(results).size() >= 2);
    }

    /*
     * Add a load balancing objective. Minimizing the busiest machine's CPU load spreads VMs across
     * all physical machines.
     */
    @Test
    public void testDistributeLoad() {
        final String peakLoad = "var peak >= 0\n" +
                                "min: peak\n" +
                                "subject to:\n" +
                                "  load[p]: sum(cpu[v] * assign[v, p] for v in vm) <= peak for p in pm\n";
        final LoadBalance lb = new LoadBalance(List.of(CAPACITY_CONSTRAINT, peakLoad));
        addInventory(lb);
        final Result<? extends Record> results = lb.run();
        assertEquals(NUM_PHYSICAL_MACHINES, physicalMachines(results).size());
    }

    /*
     * An example where we also refer to data from another table
     */
    @Test
    public void testSubsetTable() {
        final String someVmsGoToPm3 = "set vm_subset\n" +
                                      "subject to:\n" +
                                      "  pinned[v]: assign[v, \"pm3\"] == 1 for v in vm_subset\n";
        final LoadBalance lb = new LoadBalance(List.of(someVmsGoToPm3));
        addInventory(lb);
        final Result<? extends Record> result = lb.run();
        result.stream().filter(e -> e.get("VM").equals("vm1") || e.get("VM").equals("vm2"))
              .forEach(e -> assertEquals("pm3", e.get("PHYSICAL_MACHINE")));
    }

    /*
     * Forcing too many VMs onto pm3 violates the capacity constraint, so there is no placement
     */
    @Test
    public void testInfeasible() {
        final String someVmsAvoidPm3 = "set vm_subset\n" +
                "subject to:\n" +
                "  avoid[v]: assign[v, \"pm3\"] == 0 for v in vm_subset\n" +
                "  rest[v]: assign[v, \"pm3\"] == 1 for v in vm diff vm_subset\n";
        final LoadBalance lb = new LoadBalance(List.of(someVmsAvoidPm3, CAPACITY_CONSTRAINT));
        addInventory(lb);
        final SolverException exception = assertThrows(SolverException.class, lb::run);
        assertEquals("Infeasible", exception.reason());
    }

    private static Set<String> physicalMachines(final Result<? extends Record> results) {
        return results.stream()
                      .map(e -> e.get("PHYSICAL_MACHINE", String.class))
                      .collect(Collectors.toSet());
    }

    private void addInventory(final LoadBalance lb) {
        // Add physical machines with CPU and Memory capacity as 50 units.
        for (int i = 0; i < NUM_PHYSICAL_MACHINES; i++) {
            lb.addPhysicalMachine("pm" + i, 50, 50);
        }

        // Add some VMs with CPU and Memory demand as 10 units.
        for (int i = 0; i < NUM_VIRTUAL_MACHINES; i++) {
            lb.addVirtualMachine("vm" + i, 10, 10);
        }
    }
}
