/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.config;

import com.intuitivedesigns.cleankernel.assemble.RetryPolicy;
import com.intuitivedesigns.cleankernel.extract.ExtractorKind;
import com.intuitivedesigns.cleankernel.extract.FieldMapping;
import com.intuitivedesigns.cleankernel.model.ReasonCode;
import com.intuitivedesigns.cleankernel.model.TargetField;
import com.intuitivedesigns.cleankernel.normalize.FieldRuleChain;
import com.intuitivedesigns.cleankernel.normalize.RuleRegistry;
import com.intuitivedesigns.cleankernel.normalize.RuleTable;
import com.intuitivedesigns.cleankernel.normalize.ValidationRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Builds a {@link CleansingConfig} from flat properties.
 *
 * <pre>
 * cleansing.version=2024.1
 * field.full_name.sources=Full Name:TEXT, Name
 * rules.full_name=TRIM, COLLAPSE_WHITESPACE, TITLE_CASE
 * rules.full_name.validate=PERSON_NAME
 * rules.full_name.reason=INVALID_NAME
 * correction.region.N\ YC=New York
 * cross.rules=DATE_ORDER(date_of_event,end_date)
 * required.fields=full_name, date_of_event
 * identity.fields=full_name, postcode
 * retry.max.attempts=3
 * retry.backoff.base.ms=100
 * retry.backoff.max.ms=2000
 * destination.commit.timeout.ms=5000
 * </pre>
 *
 * A source without {@code :KIND} uses the default extractor for the field's type. Every
 * problem is reported as a {@link ConfigurationException} before any row is read.
 */
public final class CleansingConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(CleansingConfigLoader.class);

    public static final String KEY_VERSION = "cleansing.version";
    public static final String PREFIX_FIELD = "field.";
    public static final String SUFFIX_SOURCES = ".sources";
    public static final String PREFIX_RULES = "rules.";
    public static final String PREFIX_CORRECTION = "correction.";
    public static final String KEY_CROSS_RULES = "cross.rules";
    public static final String KEY_REQUIRED = "required.fields";
    public static final String KEY_IDENTITY = "identity.fields";
    public static final String KEY_RETRY_ATTEMPTS = "retry.max.attempts";
    public static final String KEY_RETRY_BASE = "retry.backoff.base.ms";
    public static final String KEY_RETRY_MAX = "retry.backoff.max.ms";
    public static final String KEY_COMMIT_TIMEOUT = "destination.commit.timeout.ms";

    private CleansingConfigLoader() {}

    public static CleansingConfig load(PipelineConfig config) {
        final String version = config.getString(KEY_VERSION, null);
        if (version == null || version.isEmpty()) {
            throw new ConfigurationException("Missing required configuration key: " + KEY_VERSION);
        }

        final RuleRegistry registry = new RuleRegistry(correctionTables(config));
        final RuleTable.Builder rules = RuleTable.builder(version);
        ruleChains(config, registry).values().forEach(rules::chain);
        for (String expr : config.getList(KEY_CROSS_RULES)) {
            rules.crossField(registry.crossField(expr));
        }

        final CleansingConfig result = CleansingConfig.builder()
                .mapping(mapping(config))
                .rules(rules.build())
                .required(fields(config, KEY_REQUIRED))
                .identity(fields(config, KEY_IDENTITY))
                .retryPolicy(retryPolicy(config))
                .build();

        log.info("Loaded cleansing configuration version={} fields={} required={} identity={}",
                result.version(), result.mapping().fields(), result.requiredFields(), result.identityFields());
        return result;
    }

    private static FieldMapping mapping(PipelineConfig config) {
        final FieldMapping.Builder mapping = FieldMapping.builder();
        for (Map.Entry<String, String> e : config.withPrefix(PREFIX_FIELD).entrySet()) {
            final String key = e.getKey();
            if (!key.endsWith(SUFFIX_SOURCES)) {
                throw new ConfigurationException("Unknown field setting '" + PREFIX_FIELD + key + "'");
            }
            final TargetField field = field(key.substring(0, key.length() - SUFFIX_SOURCES.length()));
            final List<String> sources = config.getList(PREFIX_FIELD + key);
            if (sources.isEmpty()) {
                throw new ConfigurationException("No sources listed for field '" + field + "'");
            }
            for (String source : sources) {
                final int colon = source.lastIndexOf(':');
                final Optional<ExtractorKind> kind = (colon > 0)
                        ? ExtractorKind.byName(source.substring(colon + 1))
                        : Optional.empty();
                if (kind.isPresent()) {
                    mapping.map(field, source.substring(0, colon).trim(), kind.get());
                } else if (colon > 0 && source.substring(colon + 1).trim().matches("[A-Z_]+")) {
                    throw new ConfigurationException("Unknown extractor '" + source.substring(colon + 1).trim()
                            + "' for field '" + field + "'");
                } else {
                    mapping.map(field, source);
                }
            }
        }
        return mapping.build();
    }

    private static Map<TargetField, FieldRuleChain> ruleChains(PipelineConfig config, RuleRegistry registry) {
        final Map<TargetField, String> transforms = new EnumMap<>(TargetField.class);
        final Map<TargetField, String> validations = new EnumMap<>(TargetField.class);
        final Map<TargetField, String> reasons = new EnumMap<>(TargetField.class);

        for (Map.Entry<String, String> e : config.withPrefix(PREFIX_RULES).entrySet()) {
            final String key = e.getKey();
            final int dot = key.indexOf('.');
            final TargetField field = field(dot < 0 ? key : key.substring(0, dot));
            final String setting = (dot < 0) ? "" : key.substring(dot + 1);
            switch (setting) {
                case "" -> transforms.put(field, PREFIX_RULES + key);
                case "validate" -> validations.put(field, e.getValue());
                case "reason" -> reasons.put(field, e.getValue());
                default -> throw new ConfigurationException("Unknown rule setting '" + PREFIX_RULES + key + "'");
            }
        }

        final Map<TargetField, FieldRuleChain> chains = new EnumMap<>(TargetField.class);
        for (TargetField field : TargetField.values()) {
            if (!transforms.containsKey(field) && !validations.containsKey(field) && !reasons.containsKey(field)) {
                continue;
            }
            final FieldRuleChain.Builder chain = FieldRuleChain.builder(field);
            boolean validated = false;
            if (transforms.containsKey(field)) {
                // Validations may appear inline; anything after one is refused by the builder
                for (String expr : config.getList(transforms.get(field))) {
                    if (registry.isValidation(expr)) {
                        chain.validate(registry.validation(expr));
                        validated = true;
                    } else {
                        chain.transform(registry.transform(expr));
                    }
                }
            }
            if (validations.containsKey(field)) {
                if (validated) {
                    throw new ConfigurationException("Field '" + field + "' has an inline validation and "
                            + PREFIX_RULES + field + ".validate");
                }
                chain.validate(registry.validation(validations.get(field)));
            }
            FieldRuleChain built = chain.build();
            if (reasons.containsKey(field)) {
                built = withReason(field, built, reason(reasons.get(field), field));
            }
            chains.put(field, built);
        }
        return chains;
    }

    private static FieldRuleChain withReason(TargetField field, FieldRuleChain chain, ReasonCode reason) {
        final FieldRuleChain.Builder b = FieldRuleChain.builder(field);
        chain.transforms().forEach(b::transform);
        final ValidationRule validation = chain.validation().withReason(reason);
        return b.validate(validation).build();
    }

    private static Map<String, Map<String, String>> correctionTables(PipelineConfig config) {
        final Map<String, Map<String, String>> tables = new TreeMap<>();
        for (Map.Entry<String, String> e : config.withPrefix(PREFIX_CORRECTION).entrySet()) {
            final String key = e.getKey();
            final int dot = key.indexOf('.');
            if (dot <= 0 || dot == key.length() - 1) {
                throw new ConfigurationException("Correction entry must be " + PREFIX_CORRECTION
                        + "<table>.<from>=<to>: '" + PREFIX_CORRECTION + key + "'");
            }
            tables.computeIfAbsent(key.substring(0, dot).toLowerCase(Locale.ROOT), t -> new TreeMap<>())
                    .put(key.substring(dot + 1).trim(), e.getValue());
        }
        return tables;
    }

    private static List<TargetField> fields(PipelineConfig config, String key) {
        final List<TargetField> out = new ArrayList<>();
        for (String name : config.getList(key)) {
            out.add(field(name));
        }
        return out;
    }

    private static TargetField field(String wireName) {
        return TargetField.fromWireName(wireName.trim())
                .orElseThrow(() -> new ConfigurationException("Unknown target field '" + wireName.trim() + "'"));
    }

    private static ReasonCode reason(String name, TargetField field) {
        try {
            return ReasonCode.of(name);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Bad reason code for field '" + field + "': " + e.getMessage(), e);
        }
    }

    private static RetryPolicy retryPolicy(PipelineConfig config) {
        final RetryPolicy d = RetryPolicy.defaults();
        try {
            return new RetryPolicy(
                    strictInt(config, KEY_RETRY_ATTEMPTS, d.maxAttempts()),
                    Duration.ofMillis(strictLong(config, KEY_RETRY_BASE, d.backoffBase().toMillis())),
                    Duration.ofMillis(strictLong(config, KEY_RETRY_MAX, d.backoffMax().toMillis())),
                    Duration.ofMillis(strictLong(config, KEY_COMMIT_TIMEOUT, d.commitTimeout().toMillis())));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid retry configuration: " + e.getMessage(), e);
        }
    }

    private static int strictInt(PipelineConfig config, String key, int defaultValue) {
        final long value = strictLong(config, key, defaultValue);
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw new ConfigurationException("Value of '" + key + "' is out of range: " + value);
        }
        return (int) value;
    }

    private static long strictLong(PipelineConfig config, String key, long defaultValue) {
        final String raw = config.getString(key, null);
        if (raw == null || raw.isEmpty()) return defaultValue;
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Value of '" + key + "' is not a number: '" + raw + "'", e);
        }
    }
}
