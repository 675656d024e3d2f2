/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

/**
 * Binding of external data (CSV files, database tables, in-memory collections) to the sets and
 * parameters of a model.
 */
@ParametersAreNonnullByDefault
package com.vmware.oml.binding;

import javax.annotation.ParametersAreNonnullByDefault;
