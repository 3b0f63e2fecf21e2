package org.csu.pytrans.cli;

import org.csu.pytrans.cli.tool.TokenFormatter;
import org.csu.pytrans.cli.tool.TreeFormatter;
import org.csu.pytrans.common.exception.PipelineStateException;
import org.csu.pytrans.common.exception.SemanticException;
import org.csu.pytrans.common.exception.SourceLoadException;
import org.csu.pytrans.compiler.lexer.Token;
import org.csu.pytrans.compiler.parser.SyntaxNode;
import org.csu.pytrans.compiler.semantic.ValidationResult;
import org.csu.pytrans.engine.PipelineSession;
import org.csu.pytrans.engine.SourceLoader;
import org.csu.pytrans.engine.TranslationProcessor;
import org.csu.pytrans.engine.TranslatorOptions;

import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Scanner;

/**
 * 控制台入口。
 *
 * 不带位置参数时进入菜单模式，一步一步执行各个阶段；
 * 带 {@code <source> [<output>]} 时一次跑完整条流水线（批处理模式）。
 * 退出码：0 成功，1 语义检查失败（代码仍会生成），2 参数或文件错误。
 */
public class InteractiveShell {

    static final int EXIT_OK = 0;
    static final int EXIT_SEMANTIC_ERROR = 1;
    static final int EXIT_USAGE_OR_IO = 2;

    private static final String USAGE =
            "Usage: InteractiveShell [<source.py> [<output.cpp>]] [--brace-mode=single|per-function] [--dialect=generic|cpp] [--verbose]";

    private final PipelineSession session;
    private final Scanner scanner;
    private final PrintStream out;
    private final PrintStream err;

    public InteractiveShell(PipelineSession session, Scanner scanner, PrintStream out, PrintStream err) {
        this.session = session;
        this.scanner = scanner;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        int status = launch(args, new SourceLoader(), System.in, System.out, System.err);
        if (status != EXIT_OK) {
            System.exit(status);
        }
    }

    static int launch(String[] args, SourceLoader loader, InputStream in, PrintStream out, PrintStream err) {
        TranslatorOptions options = TranslatorOptions.defaults();
        List<String> positional = new ArrayList<>();
        for (String arg : args) {
            if (arg.startsWith("--")) {
                try {
                    options = options.withFlag(arg);
                } catch (IllegalArgumentException e) {
                    err.println("ERROR: " + e.getMessage());
                    err.println(USAGE);
                    return EXIT_USAGE_OR_IO;
                }
            } else {
                positional.add(arg);
            }
        }

        TranslationProcessor processor = new TranslationProcessor(options);
        if (positional.isEmpty()) {
            PipelineSession session = new PipelineSession(processor, loader);
            new InteractiveShell(session, new Scanner(in), out, err).run();
            return EXIT_OK;
        }
        if (positional.size() > 2) {
            err.println(USAGE);
            return EXIT_USAGE_OR_IO;
        }
        return runBatch(processor, loader, positional, out, err);
    }

    private static int runBatch(TranslationProcessor processor, SourceLoader loader, List<String> positional,
                                PrintStream out, PrintStream err) {
        try {
            Path sourcePath = Path.of(positional.get(0));
            String source = loader.loadSource(sourcePath);
            SyntaxNode tree = processor.build(processor.tokenize(source));
            int status = EXIT_OK;
            try {
                processor.analyze(tree);
            } catch (SemanticException e) {
                // 语义错误只影响退出码，代码照常生成
                err.println("Error: " + e.getMessage());
                status = EXIT_SEMANTIC_ERROR;
            }
            String code = processor.emit(tree);
            if (positional.size() == 2) {
                Path target = Path.of(positional.get(1));
                loader.writeOutput(target, code);
                out.println("Code written to " + target);
            } else {
                out.print(code);
            }
            return status;
        } catch (SourceLoadException | InvalidPathException e) {
            err.println("ERROR: " + e.getMessage());
            return EXIT_USAGE_OR_IO;
        }
    }

    /**
     * 菜单循环，输入结束或选择退出时返回。
     */
    public void run() {
        boolean exit = false;
        while (!exit) {
            printMenu();
            if (!scanner.hasNextLine()) {
                break;
            }
            String option = scanner.nextLine().trim();
            try {
                switch (option) {
                    case "1":
                        handleLoad();
                        break;
                    case "2":
                        handleTokenize();
                        break;
                    case "3":
                        handleParse();
                        break;
                    case "4":
                        handleCheckSemantics();
                        break;
                    case "5":
                        handleGenerate();
                        break;
                    case "6":
                        exit = true;
                        break;
                    case "7":
                        handleSave();
                        break;
                    default:
                        err.println("Invalid option.");
                        break;
                }
            } catch (PipelineStateException | SourceLoadException | InvalidPathException e) {
                err.println("ERROR: " + e.getMessage());
            }
        }
        out.println("Bye!");
    }

    private void printMenu() {
        out.println("Menu:");
        out.println("1. Load Python file");
        out.println("2. Tokenize");
        out.println("3. Parse");
        out.println("4. Check Semantics");
        out.println("5. Generate C++ Code");
        out.println("6. Exit");
        out.println("7. Save generated code");
        out.print("Choose an option: ");
    }

    private void handleLoad() {
        String filename = prompt("Enter filename: ");
        if (filename == null) {
            err.println("ERROR: No filename given.");
            return;
        }
        session.load(Path.of(filename));
        out.println("File loaded.");
    }

    private void handleTokenize() {
        List<Token> tokens = session.tokenize();
        out.print(TokenFormatter.format(tokens));
        out.println();
    }

    private void handleParse() {
        SyntaxNode tree = session.parse();
        out.print(TreeFormatter.format(tree));
    }

    private void handleCheckSemantics() {
        ValidationResult result = session.checkSemantics();
        if (result.passed()) {
            out.println("Semantic check passed.");
        } else {
            err.println("Error: " + result.reason());
        }
    }

    private void handleGenerate() {
        String code = session.generate();
        out.println("Generated C++ Code:");
        out.println(code);
    }

    private void handleSave() {
        session.ensureGenerated();
        String filename = prompt("Enter output filename: ");
        if (filename == null) {
            err.println("ERROR: No filename given.");
            return;
        }
        session.save(Path.of(filename));
        out.println("Code written to " + filename);
    }

    private String prompt(String message) {
        out.print(message);
        if (!scanner.hasNextLine()) {
            return null;
        }
        String line = scanner.nextLine().trim();
        return line.isEmpty() ? null : line;
    }
}
