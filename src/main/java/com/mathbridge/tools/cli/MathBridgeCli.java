// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.mathbridge.tools.cli;

import com.amazon.ion.IonReader;
import com.amazon.ion.IonWriter;
import com.amazon.ion.system.IonReaderBuilder;
import com.mathbridge.MathBridge;
import com.mathbridge.MathBridgeException;
import com.mathbridge.kernel.KernelException;
import com.mathbridge.mathjson.MathJsonCodec;
import com.mathbridge.mathjson.MathJsonExpr;
import com.mathbridge.system.MathBridgeBuilder;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.HelpCommand;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.FileDescriptor;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

@Command(
        name = MathBridgeCli.NAME,
        version = MathBridgeCli.VERSION,
        subcommands = {HelpCommand.class},
        mixinStandardHelpOptions = true
)
class MathBridgeCli {

    public static final String NAME = "mbridge";
    public static final String VERSION = "2026-10-19";

    public static void main(String[] args) {
        System.exit(newCommandLine().execute(args));
    }

    static CommandLine newCommandLine() {
        return new CommandLine(new MathBridgeCli())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .setUsageHelpAutoWidth(true);
    }

    @Option(names={"-f", "--format", "--output-format"}, defaultValue = "json",
            description = "MathJSON output format, from the set (json | pretty | ion).",
            paramLabel = "<format>",
            scope = CommandLine.ScopeType.INHERIT)
    OutputFormat outputFormat;

    @Option(names={"-o", "--output"}, paramLabel = "FILE", description = "Output file",
            scope = CommandLine.ScopeType.INHERIT)
    File outputFile;

    @Option(names={"--text-big-integers"},
            description = "Rebuild big integers by evaluating their decimal text.",
            scope = CommandLine.ScopeType.INHERIT)
    boolean textBigIntegers;

    @Command(name = "to-mathjson",
            description = "convert kernel EXPR(s) to MathJSON",
            mixinStandardHelpOptions = true)
    int toMathJson(@Parameters(paramLabel = "EXPR", arity = "1..*") String... exprs) {
        MathBridge bridge = newBridge();
        try (OutputStream out = getOutputStream(outputFile);
             IonWriter writer = outputFormat.createIonWriter(out)) {
            for (String expr : exprs) {
                MathJsonCodec.write(bridge.toMathJson(bridge.evaluate(expr)), writer);
            }
            writer.finish();
        } catch (KernelException e) {
            System.err.println(e.getMessage());
            return CommandLine.ExitCode.USAGE;
        } catch (MathBridgeException | IOException e) {
            System.err.println(e.getMessage());
            return CommandLine.ExitCode.SOFTWARE;
        }
        return CommandLine.ExitCode.OK;
    }

    @Command(name = "from-mathjson",
            description = "convert the MathJSON values in FILE(s), or standard input, to kernel text",
            mixinStandardHelpOptions = true)
    int fromMathJson(@Parameters(paramLabel = "FILE", arity = "0..*") File... files) {
        MathBridge bridge = newBridge();
        try (PrintWriter out = newPrintWriter(getOutputStream(outputFile))) {
            for (MathJsonExpr expr : readInputs(files)) {
                out.println(bridge.render(bridge.toNative(expr)));
            }
        } catch (MathBridgeException | IOException e) {
            System.err.println(e.getMessage());
            return CommandLine.ExitCode.SOFTWARE;
        }
        return CommandLine.ExitCode.OK;
    }

    @Command(name = "symbolic",
            description = "convert kernel EXPR(s) to symbolic terms, keeping preservable functions",
            mixinStandardHelpOptions = true)
    int symbolic(@Parameters(paramLabel = "EXPR", arity = "1..*") String... exprs) {
        MathBridge bridge = newBridge();
        try (PrintWriter out = newPrintWriter(getOutputStream(outputFile))) {
            for (String expr : exprs) {
                out.println(bridge.toSymbolic(bridge.evaluate(expr)));
            }
        } catch (KernelException e) {
            System.err.println(e.getMessage());
            return CommandLine.ExitCode.USAGE;
        } catch (MathBridgeException | IOException e) {
            System.err.println(e.getMessage());
            return CommandLine.ExitCode.SOFTWARE;
        }
        return CommandLine.ExitCode.OK;
    }

    private MathBridge newBridge() {
        return MathBridgeBuilder.standard()
                .withBigIntegerTranscoding(!textBigIntegers)
                .build();
    }

    private static List<MathJsonExpr> readInputs(File... files) throws IOException {
        List<MathJsonExpr> exprs = new ArrayList<>();
        if (files == null || files.length == 0) {
            exprs.addAll(read(new FileInputStream(FileDescriptor.in)));
            return exprs;
        }
        for (File file : files) {
            try (InputStream in = new FileInputStream(file)) {
                exprs.addAll(read(in));
            }
        }
        return exprs;
    }

    private static List<MathJsonExpr> read(InputStream in) throws IOException {
        try (IonReader reader = IonReaderBuilder.standard().build(in)) {
            return MathJsonCodec.readAll(reader);
        }
    }

    private static PrintWriter newPrintWriter(OutputStream out) {
        Writer w = new OutputStreamWriter(out, StandardCharsets.UTF_8);
        return new PrintWriter(w);
    }

    private static OutputStream getOutputStream(File outputFile) throws IOException {
        // stdout stays open for the caller, or the requested file output
        return outputFile == null ? new NoCloseOutputStream(System.out) : new FileOutputStream(outputFile);
    }
}
