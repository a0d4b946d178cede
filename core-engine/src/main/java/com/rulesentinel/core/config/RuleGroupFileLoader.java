package com.rulesentinel.core.config;

import com.rulesentinel.core.model.RuleDefinition;
import com.rulesentinel.core.model.RuleGroupConfig;
import com.rulesentinel.core.model.RuleGroupsConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.TypeDescription;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads and writes rule files.
 *
 * <p>
 * Parsing is strict: unknown fields and duplicate keys are errors. Every
 * {@code parse*}/{@code load} method validates the result before returning.
 * </p>
 *
 * @since 1.0.0
 */
public final class RuleGroupFileLoader {

    private static final Logger LOG = LoggerFactory.getLogger(RuleGroupFileLoader.class);

    private RuleGroupFileLoader() {
        // utility class
    }

    /**
     * Load and validate a rule file.
     *
     * @param file rule file; must not be {@code null}
     * @return parsed and validated document
     * @throws RuleConfigException if reading, parsing or validation fails
     */
    public static RuleGroupsConfig load(Path file) {
        Objects.requireNonNull(file, "Rule file path must not be null");
        byte[] content;
        try {
            content = Files.readAllBytes(file);
        } catch (IOException e) {
            throw new RuleConfigException(file, "failed to read rule file", e);
        }
        return parse(file, content);
    }

    /**
     * Parse and validate rule file content.
     *
     * @param source  file the content came from, used in error messages
     * @param content raw YAML bytes
     * @return parsed and validated document; empty if the content is empty
     * @throws RuleConfigException if parsing or validation fails
     */
    public static RuleGroupsConfig parse(Path source, byte[] content) {
        Objects.requireNonNull(content, "Rule file content must not be null");
        RuleGroupsConfig config;
        try {
            config = newYaml().load(new String(content, StandardCharsets.UTF_8));
        } catch (YAMLException | ClassCastException e) {
            throw new RuleConfigException(source, "failed to parse rule groups: " + e.getMessage(), e);
        }
        if (config == null) {
            LOG.debug("Rule file {} is empty", source);
            return new RuleGroupsConfig();
        }
        try {
            config.validate();
        } catch (IllegalStateException e) {
            throw new RuleConfigException(source, e.getMessage(), e);
        }
        return config;
    }

    /**
     * Serialize a document in block style without the strategy field.
     *
     * @param config document to write
     * @return YAML text
     */
    public static String dump(RuleGroupsConfig config) {
        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setIndent(2);
        return new Yaml(options).dump(config.toYamlMap());
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static Yaml newYaml() {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Constructor constructor = new Constructor(RuleGroupsConfig.class, options);

        TypeDescription groupsDescription = new TypeDescription(RuleGroupsConfig.class);
        groupsDescription.addPropertyParameters("groups", RuleGroupConfig.class);
        constructor.addTypeDescription(groupsDescription);

        TypeDescription groupDescription = new TypeDescription(RuleGroupConfig.class);
        groupDescription.addPropertyParameters("rules", RuleDefinition.class);
        groupDescription.substituteProperty("partial_response_strategy", String.class,
                "getPartialResponseStrategy", "setPartialResponseStrategy");
        constructor.addTypeDescription(groupDescription);

        TypeDescription ruleDescription = new TypeDescription(RuleDefinition.class);
        ruleDescription.substituteProperty("for", String.class, "getForDuration", "setForDuration");
        constructor.addTypeDescription(ruleDescription);

        return new Yaml(constructor);
    }
}
