/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

/**
 * OR-Tools implementation of the solver backend.
 */
@ParametersAreNonnullByDefault
package com.vmware.oml.backend.ortools;

import javax.annotation.ParametersAreNonnullByDefault;
