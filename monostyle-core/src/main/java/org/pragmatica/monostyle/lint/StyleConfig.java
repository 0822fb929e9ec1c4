package org.pragmatica.monostyle.lint;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Configuration for style checking and fixing.
 *
 * @param enabledRules            rules to run; empty means every rule
 * @param disabledRules           rules never to run
 * @param ruleSeverities          per-rule severity overrides
 * @param applicationPrefixes     application directive prefixes; empty means the first segment of the file namespace
 * @param fixPrecedence           category order used when fixes conflict
 * @param paraphraseThreshold     word-overlap ratio above which a comment is reported as a paraphrase
 */
public record StyleConfig(Set<String> enabledRules,
                          Set<String> disabledRules,
                          Map<String, DiagnosticSeverity> ruleSeverities,
                          int maxLineLength,
                          FieldCasing fieldCasing,
                          boolean autoFix,
                          Set<String> exemptTypes,
                          Set<String> compatibilityAttributes,
                          String indentUnit,
                          int tabWidth,
                          List<String> platformPrefixes,
                          List<String> applicationPrefixes,
                          List<RuleCategory> fixPrecedence,
                          double paraphraseThreshold,
                          boolean failOnWarning,
                          int maxFixPasses) {

    public StyleConfig {
        enabledRules = Set.copyOf(enabledRules);
        disabledRules = Set.copyOf(disabledRules);
        ruleSeverities = Map.copyOf(ruleSeverities);
        exemptTypes = Set.copyOf(exemptTypes);
        compatibilityAttributes = Set.copyOf(compatibilityAttributes);
        platformPrefixes = List.copyOf(platformPrefixes);
        applicationPrefixes = List.copyOf(applicationPrefixes);
        fixPrecedence = List.copyOf(fixPrecedence);
        if (maxLineLength < 1) {
            throw new IllegalArgumentException("maxLineLength must be positive: " + maxLineLength);
        }
        if (tabWidth < 1) {
            throw new IllegalArgumentException("tabWidth must be positive: " + tabWidth);
        }
        if (maxFixPasses < 1) {
            throw new IllegalArgumentException("maxFixPasses must be positive: " + maxFixPasses);
        }
    }

    /**
     * Default configuration following the Mono coding guidelines.
     */
    public static final StyleConfig DEFAULT = new StyleConfig(
            Set.of(),
            Set.of(),
            Map.of(),
            80,
            FieldCasing.SEPARATOR,
            true,
            Set.of(),
            Set.of("StructLayout"),
            "\t",
            8,
            List.of("MonoTouch", "MonoMac", "Xamarin", "Android", "Java", "UIKit", "Foundation", "AppKit",
                    "ObjCRuntime", "CoreGraphics"),
            List.of(),
            RuleCategory.DEFAULT_PRECEDENCE,
            0.75,
            true,
            10
    );

    /**
     * Factory method for default config.
     */
    public static StyleConfig defaultConfig() {
        return DEFAULT;
    }

    /**
     * Structural and internal diagnostics cannot be switched off.
     */
    public boolean isRuleEnabled(String ruleId) {
        if (ruleId.startsWith("MONO-STR") || ruleId.startsWith("MONO-INT")) {
            return true;
        }
        if (disabledRules.contains(ruleId)) {
            return false;
        }
        return enabledRules.isEmpty() || enabledRules.contains(ruleId);
    }

    public DiagnosticSeverity severityFor(String ruleId, DiagnosticSeverity defaultSeverity) {
        return ruleSeverities.getOrDefault(ruleId, defaultSeverity);
    }

    /**
     * Builder-style method to restrict checking to the given rules.
     */
    public StyleConfig withEnabledRules(Set<String> rules) {
        return new StyleConfig(rules, disabledRules, ruleSeverities, maxLineLength, fieldCasing, autoFix,
                               exemptTypes, compatibilityAttributes, indentUnit, tabWidth, platformPrefixes,
                               applicationPrefixes, fixPrecedence, paraphraseThreshold, failOnWarning, maxFixPasses);
    }

    /**
     * Builder-style method to disable a rule.
     */
    public StyleConfig withDisabledRule(String ruleId) {
        var newDisabled = new HashSet<>(disabledRules);
        newDisabled.add(ruleId);
        return new StyleConfig(enabledRules, newDisabled, ruleSeverities, maxLineLength, fieldCasing, autoFix,
                               exemptTypes, compatibilityAttributes, indentUnit, tabWidth, platformPrefixes,
                               applicationPrefixes, fixPrecedence, paraphraseThreshold, failOnWarning, maxFixPasses);
    }

    /**
     * Builder-style method to set rule severity.
     */
    public StyleConfig withRuleSeverity(String ruleId, DiagnosticSeverity severity) {
        var newSeverities = new HashMap<>(ruleSeverities);
        newSeverities.put(ruleId, severity);
        return new StyleConfig(enabledRules, disabledRules, newSeverities, maxLineLength, fieldCasing, autoFix,
                               exemptTypes, compatibilityAttributes, indentUnit, tabWidth, platformPrefixes,
                               applicationPrefixes, fixPrecedence, paraphraseThreshold, failOnWarning, maxFixPasses);
    }

    public StyleConfig withMaxLineLength(int length) {
        return new StyleConfig(enabledRules, disabledRules, ruleSeverities, length, fieldCasing, autoFix,
                               exemptTypes, compatibilityAttributes, indentUnit, tabWidth, platformPrefixes,
                               applicationPrefixes, fixPrecedence, paraphraseThreshold, failOnWarning, maxFixPasses);
    }

    public StyleConfig withFieldCasing(FieldCasing casing) {
        return new StyleConfig(enabledRules, disabledRules, ruleSeverities, maxLineLength, casing, autoFix,
                               exemptTypes, compatibilityAttributes, indentUnit, tabWidth, platformPrefixes,
                               applicationPrefixes, fixPrecedence, paraphraseThreshold, failOnWarning, maxFixPasses);
    }

    public StyleConfig withAutoFix(boolean enabled) {
        return new StyleConfig(enabledRules, disabledRules, ruleSeverities, maxLineLength, fieldCasing, enabled,
                               exemptTypes, compatibilityAttributes, indentUnit, tabWidth, platformPrefixes,
                               applicationPrefixes, fixPrecedence, paraphraseThreshold, failOnWarning, maxFixPasses);
    }

    /**
     * Builder-style method to exempt a type (simple name) from field naming checks.
     */
    public StyleConfig withExemptType(String typeName) {
        var newExempt = new HashSet<>(exemptTypes);
        newExempt.add(typeName);
        return new StyleConfig(enabledRules, disabledRules, ruleSeverities, maxLineLength, fieldCasing, autoFix,
                               newExempt, compatibilityAttributes, indentUnit, tabWidth, platformPrefixes,
                               applicationPrefixes, fixPrecedence, paraphraseThreshold, failOnWarning, maxFixPasses);
    }

    public StyleConfig withIndentUnit(String unit) {
        return new StyleConfig(enabledRules, disabledRules, ruleSeverities, maxLineLength, fieldCasing, autoFix,
                               exemptTypes, compatibilityAttributes, unit, tabWidth, platformPrefixes,
                               applicationPrefixes, fixPrecedence, paraphraseThreshold, failOnWarning, maxFixPasses);
    }

    public StyleConfig withTabWidth(int width) {
        return new StyleConfig(enabledRules, disabledRules, ruleSeverities, maxLineLength, fieldCasing, autoFix,
                               exemptTypes, compatibilityAttributes, indentUnit, width, platformPrefixes,
                               applicationPrefixes, fixPrecedence, paraphraseThreshold, failOnWarning, maxFixPasses);
    }

    public StyleConfig withApplicationPrefix(String prefix) {
        var newPrefixes = new ArrayList<>(applicationPrefixes);
        newPrefixes.add(prefix);
        return new StyleConfig(enabledRules, disabledRules, ruleSeverities, maxLineLength, fieldCasing, autoFix,
                               exemptTypes, compatibilityAttributes, indentUnit, tabWidth, platformPrefixes,
                               newPrefixes, fixPrecedence, paraphraseThreshold, failOnWarning, maxFixPasses);
    }

    public StyleConfig withPlatformPrefixes(List<String> prefixes) {
        return new StyleConfig(enabledRules, disabledRules, ruleSeverities, maxLineLength, fieldCasing, autoFix,
                               exemptTypes, compatibilityAttributes, indentUnit, tabWidth, prefixes,
                               applicationPrefixes, fixPrecedence, paraphraseThreshold, failOnWarning, maxFixPasses);
    }

    public StyleConfig withFixPrecedence(List<RuleCategory> precedence) {
        return new StyleConfig(enabledRules, disabledRules, ruleSeverities, maxLineLength, fieldCasing, autoFix,
                               exemptTypes, compatibilityAttributes, indentUnit, tabWidth, platformPrefixes,
                               applicationPrefixes, precedence, paraphraseThreshold, failOnWarning, maxFixPasses);
    }

    /**
     * Builder-style method to set fail on warning.
     */
    public StyleConfig withFailOnWarning(boolean fail) {
        return new StyleConfig(enabledRules, disabledRules, ruleSeverities, maxLineLength, fieldCasing, autoFix,
                               exemptTypes, compatibilityAttributes, indentUnit, tabWidth, platformPrefixes,
                               applicationPrefixes, fixPrecedence, paraphraseThreshold, fail, maxFixPasses);
    }

    public StyleConfig withMaxFixPasses(int passes) {
        return new StyleConfig(enabledRules, disabledRules, ruleSeverities, maxLineLength, fieldCasing, autoFix,
                               exemptTypes, compatibilityAttributes, indentUnit, tabWidth, platformPrefixes,
                               applicationPrefixes, fixPrecedence, paraphraseThreshold, failOnWarning, passes);
    }
}
