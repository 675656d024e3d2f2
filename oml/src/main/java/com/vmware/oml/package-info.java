/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

/**
 * Compiling and solving optimization models written in OML.
 */
@ParametersAreNonnullByDefault
package com.vmware.oml;

import javax.annotation.ParametersAreNonnullByDefault;
