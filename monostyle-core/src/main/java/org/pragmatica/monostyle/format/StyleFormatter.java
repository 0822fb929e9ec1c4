package org.pragmatica.monostyle.format;

import org.pragmatica.monostyle.lint.Diagnostic;
import org.pragmatica.monostyle.lint.DiagnosticSeverity;
import org.pragmatica.monostyle.lint.RuleEngine;
import org.pragmatica.monostyle.lint.StyleConfig;
import org.pragmatica.monostyle.parser.ParseResult;
import org.pragmatica.monostyle.parser.StructuralParser;
import org.pragmatica.monostyle.shared.SourceFile;
import org.pragmatica.monostyle.token.Tokenizer;

import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks and rewrites C# source according to the Mono style rules.
 *
 * <p>Formatting repeats analyze and merge until a pass applies nothing or {@code maxFixPasses} is
 * reached, so that fixes skipped for a conflict get another chance against the updated text.
 * The cancellation token is checked between stages; a cancelled run returns the original text.
 */
public class StyleFormatter {
    private static final Logger log = LoggerFactory.getLogger(StyleFormatter.class);

    private final StyleConfig config;
    private final RuleEngine engine;

    private StyleFormatter(StyleConfig config) {
        this.config = config;
        this.engine = RuleEngine.ruleEngine(config);
    }

    /**
     * Factory method for creating a formatter with default config.
     */
    public static StyleFormatter styleFormatter() {
        return new StyleFormatter(StyleConfig.defaultConfig());
    }

    /**
     * Factory method for creating a formatter with custom config.
     */
    public static StyleFormatter styleFormatter(StyleConfig config) {
        return new StyleFormatter(config);
    }

    public StyleConfig config() {
        return config;
    }

    /**
     * Diagnostics for the source without changing it.
     */
    public List<Diagnostic> check(SourceFile source) {
        return engine.evaluate(parse(source.content()), source.fileName());
    }

    /**
     * Diagnostics for the source, or empty when cancelled between tokenizing, parsing and rule evaluation.
     */
    public Optional<List<Diagnostic>> check(SourceFile source, CancellationToken cancellation) {
        if (cancellation.isCancelled()) {
            return Optional.empty();
        }
        var tokens = Tokenizer.tokenize(source.content());
        if (cancellation.isCancelled()) {
            return Optional.empty();
        }
        var parse = StructuralParser.parse(tokens);
        if (cancellation.isCancelled()) {
            return Optional.empty();
        }
        return Optional.of(engine.evaluate(parse, source.fileName()));
    }

    public FormatResult format(SourceFile source) {
        return format(source, CancellationToken.none());
    }

    public FormatResult format(SourceFile source, CancellationToken cancellation) {
        var fileName = source.fileName();
        var text = source.content();
        var parse = parse(text);
        if (cancellation.isCancelled()) {
            return FormatResult.cancelled(source);
        }
        var diagnostics = engine.evaluate(parse, fileName);
        int applied = 0;
        MergeResult last = null;
        boolean rejected = false;
        for (int pass = 1; config.autoFix() && pass <= config.maxFixPasses(); pass++) {
            if (cancellation.isCancelled()) {
                return cancelled(source);
            }
            var merge = EditMerger.apply(text, diagnostics, config.fixPrecedence(), parse.errorRegionStarts());
            last = merge;
            if (!merge.changed()) {
                break;
            }
            var nextParse = parse(merge.text());
            if (nextParse.problems()
                         .size() > parse.problems()
                                        .size()) {
                log.warn("{}: pass {} would introduce structural problems, keeping previous text", fileName, pass);
                rejected = true;
                break;
            }
            log.debug("{}: pass {} applied {} fixes, skipped {}", fileName, pass, merge.applied()
                                                                                     .size(), merge.skipped()
                                                                                                   .size());
            applied += merge.applied()
                            .size();
            text = merge.text();
            parse = nextParse;
            if (cancellation.isCancelled()) {
                return cancelled(source);
            }
            diagnostics = engine.evaluate(parse, fileName);
            last = null;
        }
        if (config.autoFix() && last == null) {
            // Pass limit reached: classify what is left against the final text.
            last = EditMerger.apply(text, diagnostics, config.fixPrecedence(), parse.errorRegionStarts());
        }
        return new FormatResult(source.withContent(text), applied, diagnostics, summary(applied, last, rejected, diagnostics), false);
    }

    /**
     * True when formatting would leave the source unchanged.
     */
    public boolean isFormatted(SourceFile source) {
        return !format(source).changed(source);
    }

    private static FormatResult cancelled(SourceFile source) {
        log.warn("{}: formatting cancelled, original text kept", source.fileName());
        return FormatResult.cancelled(source);
    }

    private static FixSummary summary(int applied, MergeResult last, boolean rejected, List<Diagnostic> remaining) {
        int conflicting = 0;
        int structural = 0;
        if (last != null) {
            conflicting = (int) last.skippedFor(SkipReason.CONFLICTING_EDIT);
            structural = (int) last.skippedFor(SkipReason.STRUCTURAL_REGION);
            if (rejected) {
                structural += last.applied()
                                  .size();
            }
        }
        int advisory = (int) remaining.stream()
                                      .filter(diagnostic -> diagnostic.severity() == DiagnosticSeverity.ADVISORY)
                                      .count();
        return new FixSummary(applied, conflicting, structural, advisory);
    }

    static ParseResult parse(String text) {
        return StructuralParser.parse(Tokenizer.tokenize(text));
    }
}
