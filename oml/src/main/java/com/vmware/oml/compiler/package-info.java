/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

/**
 * Front end of the compiler: parse tree to syntax tree, validation, and the compilation pipeline.
 */
@ParametersAreNonnullByDefault
package com.vmware.oml.compiler;

import javax.annotation.ParametersAreNonnullByDefault;
