package com.catmepim.converter.sheetjs;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.config.Configurator;
import org.apache.poi.openxml4j.util.ZipSecureFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.catmepim.converter.sheetjs.codegen.CompiledSheet;
import com.catmepim.converter.sheetjs.config.ConverterConfig;
import com.catmepim.converter.sheetjs.core.WorkbookCompilationResult;
import com.catmepim.converter.sheetjs.core.WorkbookCompiler;
import com.catmepim.converter.sheetjs.core.writers.ISheetCodeWriter;
import com.catmepim.converter.sheetjs.core.writers.SheetCodeWriterFactory;
import com.catmepim.converter.sheetjs.exception.ConversionException;
import com.catmepim.converter.sheetjs.exception.FileUnreadableException;
import com.catmepim.converter.sheetjs.exception.InvalidRangeException;
import com.catmepim.converter.sheetjs.source.CellSource;
import com.catmepim.converter.sheetjs.source.PoiWorkbookCellSource;

import picocli.CommandLine;

/**
 * Main class of the sheet-to-JS converter.
 * <p>
 * Parses command line arguments, opens the workbook, compiles the requested sheets and writes the
 * generated code in the selected format. Generated code goes to standard output (or the output
 * file); log messages and error descriptions go to standard error.
 * <p>
 * Exit status: {@value #EXIT_OK} when every requested sheet compiled, {@value #EXIT_FAILURE} when a
 * sheet failed, the workbook was unreadable or an unexpected error occurred, and picocli's
 * invalid-input code (2) for bad arguments or an invalid cell range.
 *
 * @invariant The configuration (ConverterConfig) is immutable after validation.
 *      The workbook and output file are closed in finally.
 */
public class SheetToJsConverter {

    private static final Logger logger = LoggerFactory.getLogger(SheetToJsConverter.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    private final WorkbookCompiler workbookCompiler;

    public SheetToJsConverter() {
        this(new WorkbookCompiler());
    }

    SheetToJsConverter(WorkbookCompiler workbookCompiler) {
        this.workbookCompiler = workbookCompiler;
    }

    /**
     * Main entry point for the application.
     *
     * @param args Command line arguments.
     * @throws IllegalArgumentException if args is null.
     */
    public static void main(String[] args) {
        if (args == null) {
            throw new IllegalArgumentException("args must not be null");
        }
        int exitCode = new SheetToJsConverter().execute(args, System.out, System.err);
        if (exitCode != EXIT_OK) {
            System.exit(exitCode);
        }
    }

    /**
     * Runs one conversion.
     *
     * @param args command line arguments
     * @param out receives the generated code when no output file is configured
     * @param err receives usage text and error descriptions
     * @return the process exit status
     * @post no output is written for a sheet that failed to compile
     */
    public int execute(String[] args, PrintStream out, PrintStream err) {
        long startTime = System.nanoTime();
        ConverterConfig config = new ConverterConfig();
        CommandLine cmd = new CommandLine(config);
        cmd.setCaseInsensitiveEnumValuesAllowed(true);

        try {
            cmd.parseArgs(args);

            if (cmd.isUsageHelpRequested()) {
                cmd.usage(out);
                return EXIT_OK;
            }
            if (cmd.isVersionHelpRequested()) {
                cmd.printVersionHelp(out);
                return EXIT_OK;
            }

            try {
                config.validate();
            } catch (InvalidRangeException ex) {
                logger.error("Invalid cell range: {}", ex.getMessage());
                err.println("Error: " + ex.getMessage());
                return cmd.getCommandSpec().exitCodeOnInvalidInput();
            } catch (IllegalArgumentException ex) {
                logger.error("Configuration validation failed: {}", ex.getMessage());
                err.println("Error: " + ex.getMessage());
                return cmd.getCommandSpec().exitCodeOnInvalidInput();
            }
            if (config.verbose) {
                Configurator.setRootLevel(Level.DEBUG);
            }
            logger.info("Input file: {}", config.inputFile);
            logger.info("Sheets: {}", config.sheetNames == null ? "<all>" : config.sheetNames);
            logger.info("Cell range: {}", config.getBound().map(Object::toString).orElse("<whole sheet>"));
            logger.info("Output format: {}", config.format);

            ZipSecureFile.setMinInflateRatio(config.minInflateRatio);
            logger.debug("ZipSecureFile.minInflateRatio set to: {}", config.minInflateRatio);

            WorkbookCompilationResult result;
            try (CellSource source = PoiWorkbookCellSource.open(config.inputFile)) {
                result = workbookCompiler.compile(source, config.sheetNames,
                        config.getBound().orElse(null), config.includeTestCode);
            }

            writeOutput(config, result, out);

            for (Map.Entry<String, ConversionException> failure : result.getFailures().entrySet()) {
                err.println("Error processing sheet " + failure.getKey() + ": " + failure.getValue().getMessage());
            }
            return result.hasFailures() ? EXIT_FAILURE : EXIT_OK;

        } catch (CommandLine.MissingParameterException ex) {
            logger.error("Missing required parameter(s): {}", ex.getMessage());
            err.println(ex.getMessage());
            cmd.usage(err);
            return cmd.getCommandSpec().exitCodeOnInvalidInput();
        } catch (CommandLine.ParameterException ex) {
            logger.error("Invalid parameter(s): {}", ex.getMessage());
            err.println(ex.getMessage());
            cmd.usage(err);
            return cmd.getCommandSpec().exitCodeOnInvalidInput();
        } catch (FileUnreadableException ex) {
            err.println("Error: " + ex.getMessage());
            return EXIT_FAILURE;
        } catch (Exception ex) {
            logger.error("An unexpected error occurred during conversion: {}", ex.getMessage(), ex);
            err.println("Error: " + ex.getMessage());
            return EXIT_FAILURE;
        } finally {
            long durationMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startTime);
            logger.info("Sheet to JS Converter finished in {} ms.", durationMillis);
        }
    }

    private void writeOutput(ConverterConfig config, WorkbookCompilationResult result, PrintStream out)
            throws IOException {
        if (config.outputPath == null) {
            writeSheets(config, result, out);
            out.flush();
            return;
        }
        Path outputPath = config.outputPath;
        if (Files.exists(outputPath) && !config.overwrite) {
            throw new IOException("Output file " + outputPath + " already exists and overwrite is false.");
        }
        Path parent = outputPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (OutputStream file = new BufferedOutputStream(Files.newOutputStream(outputPath))) {
            writeSheets(config, result, file);
        }
        logger.info("Output written to {}", outputPath);
    }

    private void writeSheets(ConverterConfig config, WorkbookCompilationResult result, OutputStream target)
            throws IOException {
        try (ISheetCodeWriter writer = SheetCodeWriterFactory.create(config, target)) {
            writer.open();
            for (CompiledSheet sheet : result.getCompiledSheets()) {
                writer.write(sheet);
            }
            writer.flush();
            logger.info("Sheets written: {}", writer.getSheetsWrittenCount());
        }
    }
}
