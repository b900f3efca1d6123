package org.csu.cpy.cli;

import org.csu.cpy.common.exception.TranspileException;
import org.csu.cpy.config.TranspilerConfig;
import org.csu.cpy.engine.Transpiler;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Scanner;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 命令行外壳
 *
 * 用法: TranspilerShell [--indent=N] [--debug] [file]
 * 给出文件时翻译该文件并退出；否则进入交互模式:
 * 逐行输入 C++ 代码，单独一行 go; 执行翻译，clear; 清空缓冲区，
 * source &lt;path&gt;; 翻译文件，exit; 退出。
 * source 后面紧跟 = 或 ++ 的行是对变量 source 的赋值，照常进入缓冲区。
 */
public class TranspilerShell {

    private static final String PROMPT = "cpy> ";
    private static final String CONTINUATION = "  -> ";
    private static final Pattern SOURCE_COMMAND = Pattern.compile("(?i)source\\s+([^=+\\s].*?)\\s*;?");

    private final Transpiler transpiler;
    private final Scanner in;
    private final PrintStream out;
    private final PrintStream err;

    public TranspilerShell(Transpiler transpiler, Scanner in, PrintStream out, PrintStream err) {
        this.transpiler = transpiler;
        this.in = in;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        int indentWidth = TranspilerConfig.DEFAULT_INDENT_WIDTH;
        boolean debug = false;
        String file = null;
        for (String arg : args) {
            if (arg.startsWith("--indent=")) {
                try {
                    indentWidth = Integer.parseInt(arg.substring("--indent=".length()));
                } catch (NumberFormatException e) {
                    System.err.println("ERROR: Invalid indent width: " + arg);
                    System.exit(2);
                }
            } else if (arg.equals("--debug")) {
                debug = true;
            } else {
                file = arg;
            }
        }

        TranspilerConfig config;
        try {
            config = new TranspilerConfig(indentWidth, debug);
        } catch (IllegalArgumentException e) {
            System.err.println("ERROR: " + e.getMessage());
            System.exit(2);
            return;
        }

        TranspilerShell shell = new TranspilerShell(new Transpiler(config),
                new Scanner(System.in, StandardCharsets.UTF_8), System.out, System.err);
        if (file != null) {
            boolean ok = shell.translateFile(Paths.get(file));
            System.exit(ok ? 0 : 1);
        }
        shell.run();
    }

    /**
     * 交互循环，读到 exit; 或输入结束时返回
     */
    public void run() {
        out.println("C++ to Python translator. Type 'go;' to translate, 'exit;' to quit.");
        StringBuilder sourceBuilder = new StringBuilder();
        while (true) {
            out.print(sourceBuilder.length() == 0 ? PROMPT : CONTINUATION);
            if (!in.hasNextLine()) {
                // 输入流结束，翻译尚未提交的内容
                if (!sourceBuilder.toString().isBlank()) {
                    out.println();
                    out.print(transpiler.transpile(sourceBuilder.toString()));
                }
                break;
            }
            String line = in.nextLine();
            String command = line.trim();

            if (command.equalsIgnoreCase("exit;")) {
                break;
            }
            if (command.equalsIgnoreCase("clear;")) {
                sourceBuilder.setLength(0);
                continue;
            }
            if (command.equalsIgnoreCase("go;")) {
                out.print(transpiler.transpile(sourceBuilder.toString()));
                out.println();
                sourceBuilder.setLength(0);
                continue;
            }
            Matcher sourceCommand = SOURCE_COMMAND.matcher(command);
            if (sourceCommand.matches()) {
                translateFile(Paths.get(sourceCommand.group(1)));
                continue;
            }
            sourceBuilder.append(line).append("\n");
        }
        out.println("Bye!");
    }

    /**
     * 翻译一个源文件并打印结果，错误信息写到 err
     * @return 翻译成功时返回 true
     */
    public boolean translateFile(Path path) {
        if (!Files.isRegularFile(path)) {
            err.println("ERROR: File not found: " + path.toAbsolutePath());
            return false;
        }
        String source;
        try {
            source = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("ERROR: Could not read " + path + ": " + e.getMessage());
            return false;
        }
        try {
            out.print(transpiler.transpileOrThrow(source));
            return true;
        } catch (TranspileException e) {
            err.println(path.getFileName() + ": " + e.getMessage());
            return false;
        }
    }
}
