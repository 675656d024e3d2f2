/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

/**
 * Immutable syntax tree of a model and the visitors that walk it.
 */
@ParametersAreNonnullByDefault
package com.vmware.oml.ast;

import javax.annotation.ParametersAreNonnullByDefault;
