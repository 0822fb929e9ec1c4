package org.pragmatica.monostyle.cli;

import org.pragmatica.monostyle.lint.FieldCasing;
import org.pragmatica.monostyle.lint.StyleConfig;

import java.util.ArrayList;
import java.util.List;

import picocli.CommandLine;
import picocli.CommandLine.Option;

/**
 * Options shared by {@code check} and {@code format}, mapped onto {@link StyleConfig}.
 */
public class StyleOptions {

    @Option(names = "--max-line-length",
            description = "Maximum line width, tabs expanded (default: ${DEFAULT-VALUE})",
            defaultValue = "80")
    int maxLineLength;

    @Option(names = "--disable",
            paramLabel = "<rule>",
            split = ",",
            description = "Rule ids to disable, e.g. MONO-CMT-02")
    List<String> disabledRules = new ArrayList<>();

    @Option(names = "--field-casing",
            description = "Instance field casing: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})",
            defaultValue = "SEPARATOR")
    FieldCasing fieldCasing;

    @Option(names = "--exempt-type",
            paramLabel = "<type>",
            description = "Type exempted from field naming checks; repeatable")
    List<String> exemptTypes = new ArrayList<>();

    @Option(names = "--indent",
            description = "Indentation unit: 'tab' or a number of spaces (default: tab)",
            converter = IndentConverter.class,
            defaultValue = "tab")
    String indentUnit;

    @Option(names = "--tab-width",
            description = "Columns per tab when measuring lines (default: ${DEFAULT-VALUE})",
            defaultValue = "8")
    int tabWidth;

    @Option(names = "--json",
            description = "Print the report as JSON")
    boolean json;

    @Option(names = "--no-fail-on-warning",
            description = "Exit with success when only warnings remain")
    boolean noFailOnWarning;

    @Option(names = "--threads",
            description = "Worker threads, at least 1 (default: number of processors)",
            converter = ThreadCountConverter.class)
    int threads = Runtime.getRuntime()
                         .availableProcessors();

    StyleConfig toConfig() {
        var config = StyleConfig.defaultConfig()
                                .withMaxLineLength(maxLineLength)
                                .withFieldCasing(fieldCasing)
                                .withIndentUnit(indentUnit)
                                .withTabWidth(tabWidth)
                                .withFailOnWarning(!noFailOnWarning);
        for (var rule : disabledRules) {
            config = config.withDisabledRule(rule.trim());
        }
        for (var type : exemptTypes) {
            config = config.withExemptType(type);
        }
        return config;
    }

    /// Converts `tab` or a space count to the indentation text.
    static class IndentConverter implements CommandLine.ITypeConverter<String> {
        @Override
        public String convert(String value) {
            if ("tab".equalsIgnoreCase(value)) {
                return "\t";
            }
            try {
                int spaces = Integer.parseInt(value);
                if (spaces < 1 || spaces > 16) {
                    throw new CommandLine.TypeConversionException("Indent width must be between 1 and 16: " + value);
                }
                return " ".repeat(spaces);
            } catch (NumberFormatException e) {
                throw new CommandLine.TypeConversionException("Expected 'tab' or a number of spaces: " + value);
            }
        }
    }

    /// Parses a positive worker thread count.
    static class ThreadCountConverter implements CommandLine.ITypeConverter<Integer> {
        @Override
        public Integer convert(String value) {
            try {
                int threads = Integer.parseInt(value);
                if (threads < 1) {
                    throw new CommandLine.TypeConversionException("Thread count must be at least 1: " + value);
                }
                return threads;
            } catch (NumberFormatException e) {
                throw new CommandLine.TypeConversionException("Expected a number of threads: " + value);
            }
        }
    }
}
