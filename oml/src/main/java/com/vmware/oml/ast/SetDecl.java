/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml.ast;

import javax.annotation.Nullable;
import java.util.Optional;

public final class SetDecl extends Statement {
    private final String name;
    @Nullable private final SetExpr value;

    public SetDecl(final String name, @Nullable final SetExpr value) {
        this.name = name;
        this.value = value;
    }

    public String getName() {
        return name;
    }

    /**
     * The declared contents, used when no external data provides the set.
     */
    public Optional<SetExpr> getValue() {
        return Optional.ofNullable(value);
    }

    @Override
    public String toString() {
        return "SetDecl{" +
                "name='" + name + '\'' +
                ", value=" + value +
                '}';
    }

    @Override
    <T, C> T acceptVisitor(final AstVisitor<T, C> visitor, final C context) {
        return visitor.visitSetDecl(this, context);
    }
}
