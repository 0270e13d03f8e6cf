package com.arrowc.cli;

import com.arrowc.ArrowCompiler;
import com.arrowc.CompilerOptions;
import com.arrowc.ParseException;
import com.arrowc.Token;
import com.arrowc.ast.Program;
import com.arrowc.jackson.JacksonAstJsonProvider;
import com.arrowc.json.AstJsonException;
import com.arrowc.json.AstJsonProvider;
import com.arrowc.json.AstJsonSerializer;
import com.arrowc.target.TargetProgram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Command line front end for the arrow function compiler.
 *
 * Usage:
 *   java -cp ... com.arrowc.cli.ArrowcMain [options] [files...]
 *
 * Sources are taken from {@code -e} arguments, then files, or standard input when neither
 * is given. Each source is compiled on its own.
 *
 * Options:
 *   --emit=code|tokens|ast|target  What to print (default: code)
 *   --input=source|target-json     What the inputs contain (default: source)
 *   --indent=tab|N                 Indent of return statements (default: tab)
 *   --pretty                       Pretty-print JSON output
 *   -e EXPR                        Compile EXPR
 */
public class ArrowcMain {
    private static final Logger log = LoggerFactory.getLogger(ArrowcMain.class);

    static final int EXIT_OK = 0;
    static final int EXIT_COMPILE_ERROR = 1;
    static final int EXIT_USAGE = 2;

    enum Emit { CODE, TOKENS, AST, TARGET }

    enum Input { SOURCE, TARGET_JSON }

    private final Config config;
    private final ArrowCompiler compiler;
    private final AstJsonProvider json;

    public ArrowcMain(Config config) {
        this.config = config;
        this.compiler = new ArrowCompiler(new CompilerOptions(config.indent));
        this.json = AstJsonProvider.isProviderAvailable()
            ? AstJsonProvider.getProvider("Jackson")
            : new JacksonAstJsonProvider();
    }

    public static void main(String[] args) {
        System.exit(run(args, System.in, System.out, System.err));
    }

    static int run(String[] args, InputStream in, PrintStream out, PrintStream err) {
        Config config = Config.parse(args, err);
        if (config == null) {
            printUsage(err);
            return EXIT_USAGE;
        }
        if (config.help) {
            printUsage(out);
            return EXIT_OK;
        }
        return new ArrowcMain(config).run(in, out, err);
    }

    int run(InputStream in, PrintStream out, PrintStream err) {
        List<String> sources;
        try {
            sources = readSources(in);
        } catch (IOException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_USAGE;
        }

        for (String source : sources) {
            try {
                out.print(process(source.strip()));
            } catch (ParseException e) {
                err.println(e.getMessage());
                return EXIT_COMPILE_ERROR;
            } catch (AstJsonException e) {
                err.println("Error: " + e.getMessage()
                    + (e.getCause() != null ? ": " + e.getCause().getMessage() : ""));
                return EXIT_COMPILE_ERROR;
            }
        }
        return EXIT_OK;
    }

    private String process(String source) {
        AstJsonSerializer serializer = json.getSerializer();

        if (config.input == Input.TARGET_JSON) {
            TargetProgram target = json.getDeserializer().deserializeTargetProgram(source);
            log.debug("Loaded {} function(s) from JSON", target.body().size());
            if (config.emit == Emit.TARGET) {
                return jsonLine(config.pretty ? serializer.serializePretty(target) : serializer.serialize(target));
            }
            return compiler.generate(target);
        }

        List<Token> tokens = compiler.tokenize(source);
        if (config.emit == Emit.TOKENS) {
            return jsonLine(config.pretty ? serializer.serializeTokensPretty(tokens) : serializer.serializeTokens(tokens));
        }
        Program program = compiler.parse(tokens);
        if (config.emit == Emit.AST) {
            return jsonLine(config.pretty ? serializer.serializePretty(program) : serializer.serialize(program));
        }
        TargetProgram target = compiler.transform(program);
        if (config.emit == Emit.TARGET) {
            return jsonLine(config.pretty ? serializer.serializePretty(target) : serializer.serialize(target));
        }
        return compiler.generate(target);
    }

    private static String jsonLine(String json) {
        return json + System.lineSeparator();
    }

    private List<String> readSources(InputStream in) throws IOException {
        List<String> sources = new ArrayList<>(config.expressions);
        for (Path file : config.files) {
            log.debug("Reading {}", file);
            sources.add(Files.readString(file, StandardCharsets.UTF_8));
        }
        if (sources.isEmpty()) {
            sources.add(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        }
        return sources;
    }

    private static void printUsage(PrintStream out) {
        out.println("Usage: arrowc [options] [files...]");
        out.println();
        out.println("Options:");
        out.println("  --emit=code|tokens|ast|target  What to print (default: code)");
        out.println("  --input=source|target-json     What the inputs contain (default: source)");
        out.println("  --indent=tab|N                 Indent return statements with a tab or N spaces (default: tab)");
        out.println("  --pretty                       Pretty-print JSON output");
        out.println("  -e EXPR                        Compile EXPR (repeatable)");
        out.println("  --help                         Show this help");
        out.println();
        out.println("Examples:");
        out.println("  arrowc -e '(x, y) => x + y'");
        out.println("  arrowc --emit=target --pretty functions.txt");
        out.println("  arrowc --input=target-json target.json");
    }

    public static class Config {
        Emit emit = Emit.CODE;
        Input input = Input.SOURCE;
        String indent = "\t";
        boolean pretty = false;
        boolean help = false;
        List<String> expressions = new ArrayList<>();
        List<Path> files = new ArrayList<>();

        public static Config parse(String[] args, PrintStream err) {
            Config config = new Config();

            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                if (arg.equals("--help") || arg.equals("-h")) {
                    config.help = true;
                } else if (arg.startsWith("--emit=")) {
                    String emit = arg.substring(7).toUpperCase(Locale.ROOT);
                    try {
                        config.emit = Emit.valueOf(emit);
                    } catch (IllegalArgumentException e) {
                        err.println("Invalid emit mode: " + arg.substring(7));
                        return null;
                    }
                } else if (arg.startsWith("--input=")) {
                    String input = arg.substring(8).toUpperCase(Locale.ROOT).replace('-', '_');
                    try {
                        config.input = Input.valueOf(input);
                    } catch (IllegalArgumentException e) {
                        err.println("Invalid input kind: " + arg.substring(8));
                        return null;
                    }
                } else if (arg.startsWith("--indent=")) {
                    String indent = arg.substring(9);
                    if (indent.equals("tab")) {
                        config.indent = "\t";
                    } else {
                        try {
                            int spaces = Integer.parseInt(indent);
                            if (spaces < 0) {
                                err.println("Invalid indent: " + indent);
                                return null;
                            }
                            config.indent = " ".repeat(spaces);
                        } catch (NumberFormatException e) {
                            err.println("Invalid indent: " + indent);
                            return null;
                        }
                    }
                } else if (arg.equals("--pretty")) {
                    config.pretty = true;
                } else if (arg.equals("-e")) {
                    if (i + 1 >= args.length) {
                        err.println("Option -e needs an expression");
                        return null;
                    }
                    config.expressions.add(args[++i]);
                } else if (!arg.startsWith("-")) {
                    config.files.add(Path.of(arg));
                } else {
                    err.println("Unknown option: " + arg);
                    return null;
                }
            }

            if (config.input == Input.TARGET_JSON && (config.emit == Emit.TOKENS || config.emit == Emit.AST)) {
                err.println("--emit=" + config.emit.name().toLowerCase(Locale.ROOT) + " needs source input");
                return null;
            }
            return config;
        }
    }
}
