/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml.parser;

import com.vmware.oml.SyntaxException;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;

/**
 * Entry point into the generated lexer and parser. Errors are collected from both stages and
 * reported together through a {@link SyntaxException}.
 */
public final class OmlParsers {
    private static final Logger LOG = LoggerFactory.getLogger(OmlParsers.class);

    private OmlParsers() {
    }

    public static OmlParser.ModelContext parse(final String source) {
        final SyntaxErrorListener errors = new SyntaxErrorListener();
        final OmlLexer lexer = new OmlLexer(CharStreams.fromString(source));
        lexer.removeErrorListeners();
        lexer.addErrorListener(errors);
        final OmlParser parser = new OmlParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(errors);
        final OmlParser.ModelContext model = parser.model();
        if (!errors.errors().isEmpty()) {
            LOG.error("Model has {} syntax error(s), first: {}", errors.errors().size(), errors.errors().get(0));
            throw new SyntaxException(errors.errors());
        }
        return model;
    }

    static final class SyntaxErrorListener extends BaseErrorListener {
        private final List<SyntaxError> errors = new ArrayList<>();

        @Override
        public void syntaxError(final Recognizer<?, ?> recognizer, @Nullable final Object offendingSymbol,
                                final int line, final int charPositionInLine, final String msg,
                                @Nullable final RecognitionException e) {
            final String text;
            if (offendingSymbol instanceof Token) {
                final Token token = (Token) offendingSymbol;
                text = token.getType() == Token.EOF ? "<EOF>" : token.getText();
            } else {
                // lexer errors have no token, the message reads "token recognition error at: 'x'"
                final int start = msg.indexOf(": '");
                text = start >= 0 && msg.endsWith("'") ? msg.substring(start + 3, msg.length() - 1) : "";
            }
            errors.add(new SyntaxError(line, charPositionInLine, text, msg));
        }

        List<SyntaxError> errors() {
            return errors;
        }
    }
}
