/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

/**
 * Construction of solver-independent problems from models, and the programs that describe them.
 */
@ParametersAreNonnullByDefault
package com.vmware.oml.backend;

import javax.annotation.ParametersAreNonnullByDefault;
