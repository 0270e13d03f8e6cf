package com.arrowc;

import com.arrowc.ast.Program;
import com.arrowc.codegen.CodeGenerator;
import com.arrowc.target.TargetNode;
import com.arrowc.target.TargetProgram;
import com.arrowc.transform.Transformer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Compiles arrow functions into regular function definitions.
 *
 * <p>Runs the four stages in order: {@link Lexer}, {@link Parser}, {@link Transformer} and
 * {@link CodeGenerator}. The first failure aborts compilation and is rethrown as is.</p>
 *
 * <p>Usage:</p>
 * <pre>{@code
 * String js = new ArrowCompiler().compile("(x, y) => x + y");
 * // function (x, y) {
 * // 	return x + y
 * // }
 * }</pre>
 *
 * <p>Instances hold no mutable state and can be shared between threads.</p>
 */
public class ArrowCompiler {
    private static final Logger log = LoggerFactory.getLogger(ArrowCompiler.class);

    private final CompilerOptions options;

    public ArrowCompiler() {
        this(CompilerOptions.defaults());
    }

    public ArrowCompiler(CompilerOptions options) {
        this.options = options;
    }

    public CompilerOptions getOptions() {
        return options;
    }

    public String compile(String source) {
        try {
            List<Token> tokens = tokenize(source);
            Program program = parse(tokens);
            TargetProgram target = transform(program);
            return generate(target);
        } catch (ParseException e) {
            log.debug("Compilation failed: {}", e.getMessage());
            throw e;
        }
    }

    public List<Token> tokenize(String source) {
        List<Token> tokens = new Lexer(source).tokenize();
        log.debug("Lexed {} characters into {} tokens", source.length(), tokens.size());
        return tokens;
    }

    public Program parse(List<Token> tokens) {
        Program program = new Parser(tokens).parse();
        log.debug("Parsed {} top-level entries", program.body().size());
        return program;
    }

    public TargetProgram transform(Program program) {
        TargetProgram target = new Transformer().transform(program);
        log.debug("Lowered {} function(s)", target.body().size());
        return target;
    }

    public String generate(TargetNode node) {
        return new CodeGenerator(options.indent()).generate(node);
    }

    public static String compileSource(String source) {
        return new ArrowCompiler().compile(source);
    }
}
