package com.catmepim.converter.sheetjs.config;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import com.catmepim.converter.sheetjs.exception.InvalidRangeException;
import com.catmepim.converter.sheetjs.model.CellRange;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Configuration holder and command definition for {@code sheet-to-js}.
 * Uses picocli annotations to define command line arguments.
 *
 * @invariant inputFile != null && format != null && minInflateRatio >= 0
 *           && configuration is not mutated after validation
 */
@Command(name = "sheet-to-js",
         mixinStandardHelpOptions = true,
         version = "Sheet to JS Converter 1.0.0",
         description = "Compiles the formula cells of spreadsheet sheets into self-contained JavaScript functions.")
public class ConverterConfig {

    @Option(names = {"-i", "--input"}, required = true, description = "Path to the input XLSX file.")
    public Path inputFile;

    @Option(names = {"-s", "--sheet"}, split = ",",
            description = "Comma-separated list of sheet names to process. Defaults to all sheets.")
    public List<String> sheetNames;

    @Option(names = {"--min-cell"}, description = "Top-left cell of the region to compile, e.g. A1.")
    public String minCell;

    @Option(names = {"--max-cell"}, description = "Bottom-right cell of the region to compile, e.g. F40.")
    public String maxCell;

    @Option(names = {"-t", "--include-test-code"},
            description = "Also emit the input object and a console.log call invoking the function.")
    public boolean includeTestCode = false;

    @Option(names = {"-f", "--format"}, description = "Output format: ${COMPLETION-CANDIDATES}. Defaults to JS.")
    public OutputFormat format = OutputFormat.JS;

    @Option(names = {"-o", "--output"}, description = "Output file. Defaults to standard output.")
    public Path outputPath;

    @Option(names = {"--overwrite"}, description = "Overwrite the output file if it already exists.")
    public boolean overwrite = false;

    @Option(names = {"--pretty-print"}, description = "Indent JSON output.")
    public boolean prettyPrint = false;

    @Option(names = {"--min-inflate-ratio"},
            description = "Minimum XML inflation ratio for zip bomb protection (set to 0 to disable). Default: 0.01")
    public double minInflateRatio = 0.01; // POI default

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose logging.")
    public boolean verbose = false;

    private CellRange bound;

    public ConverterConfig() {}

    /**
     * Performs validation after picocli populates fields and resolves the cell bound.
     *
     * @throws IllegalArgumentException if a numeric option or the sheet list is invalid
     * @throws InvalidRangeException if min/max cell are malformed or min lies after max
     * @post {@link #getBound()} reflects {@code minCell}/{@code maxCell}
     */
    public void validate() {
        if (minInflateRatio < 0) {
            throw new IllegalArgumentException("Minimum inflate ratio cannot be negative: " + minInflateRatio);
        }
        if (sheetNames != null) {
            for (String sheetName : sheetNames) {
                if (sheetName == null || sheetName.isBlank()) {
                    throw new IllegalArgumentException("Sheet names must not be blank: " + sheetNames);
                }
            }
            sheetNames = sheetNames.stream().map(String::strip).collect(Collectors.toList());
        }
        bound = CellRange.fromBounds(minCell, maxCell).orElse(null);
    }

    /**
     * @return the region to compile, or empty for whole sheets
     * @pre {@link #validate()} has been called
     */
    public Optional<CellRange> getBound() {
        return Optional.ofNullable(bound);
    }

    public enum OutputFormat {
        JS, JSON, CSV
    }
}
