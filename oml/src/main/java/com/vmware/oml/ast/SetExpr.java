/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml.ast;

/**
 * An expression that denotes an ordered collection of index values.
 */
public abstract class SetExpr extends Expr {
}
