package com.arrowc;

import com.arrowc.codegen.CodeGenerator;

/**
 * Settings for {@link ArrowCompiler}.
 *
 * @param indent text placed before each return statement
 */
public record CompilerOptions(String indent) {

    public CompilerOptions {
        if (indent == null) {
            indent = CodeGenerator.DEFAULT_INDENT;
        }
    }

    public static CompilerOptions defaults() {
        return new CompilerOptions(CodeGenerator.DEFAULT_INDENT);
    }
}
