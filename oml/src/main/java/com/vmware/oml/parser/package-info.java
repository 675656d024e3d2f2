/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

/**
 * Lexer and parser for the modeling language, generated from Oml.g4, and their error reporting.
 */
@ParametersAreNonnullByDefault
package com.vmware.oml.parser;

import javax.annotation.ParametersAreNonnullByDefault;
