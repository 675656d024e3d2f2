/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml.ast;

/**
 * Base class of the model syntax tree. Trees are immutable and acyclic, so a tree can be shared
 * between threads once built.
 */
public abstract class Node {

    abstract <T, C> T acceptVisitor(AstVisitor<T, C> visitor, C context);
}
