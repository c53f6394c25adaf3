package com.latexdoc.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads {@link TemplateConfig} from YAML.
 *
 * <p>Uses Jackson to deserialize the template. If the file is missing, unreadable or
 * invalid, a warning or error is logged and {@link TemplateConfig#defaults()} is returned.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * TemplateConfig template = TemplateLoader.load(Paths.get("report-template.yaml"));
 * Document doc = template.toDocument();
 * doc.push(new Chapter("Results"));
 * }</pre>
 */
public class TemplateLoader {

    private static final Logger log = LoggerFactory.getLogger(TemplateLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private TemplateLoader() {
        // Utility class
    }

    /**
     * Loads a template from a YAML file.
     *
     * @param templatePath path to the YAML template
     * @return loaded template or defaults if unavailable
     */
    public static TemplateConfig load(Path templatePath) {
        if (!Files.exists(templatePath)) {
            log.warn("Template file not found: {}. Using defaults (empty article).", templatePath);
            return TemplateConfig.defaults();
        }

        if (!Files.isRegularFile(templatePath) || !Files.isReadable(templatePath)) {
            log.warn("Template file is not readable: {}. Using defaults.", templatePath);
            return TemplateConfig.defaults();
        }

        try {
            log.debug("Loading template from: {}", templatePath);
            TemplateConfig template = YAML_MAPPER.readValue(templatePath.toFile(), TemplateConfig.class);
            if (template == null) {
                log.warn("Template file is empty: {}. Using defaults.", templatePath);
                return TemplateConfig.defaults();
            }
            log.info("Loaded template from: {} (class: {})", templatePath, template.documentClass());
            return template;
        } catch (IOException e) {
            log.error("Failed to parse template file: {}. Using defaults. Error: {}",
                templatePath, e.getMessage());
            return TemplateConfig.defaults();
        }
    }

    /**
     * Parses a template from YAML text.
     *
     * @param yaml template source
     * @return parsed template or defaults if the text is empty or invalid
     */
    public static TemplateConfig loadFromString(String yaml) {
        if (yaml == null || yaml.isBlank()) {
            log.warn("Template text is empty. Using defaults.");
            return TemplateConfig.defaults();
        }

        try {
            TemplateConfig template = YAML_MAPPER.readValue(yaml, TemplateConfig.class);
            if (template == null) {
                log.warn("Template text holds an empty document. Using defaults.");
                return TemplateConfig.defaults();
            }
            return template;
        } catch (IOException e) {
            log.error("Failed to parse template text. Using defaults. Error: {}", e.getMessage());
            return TemplateConfig.defaults();
        }
    }
}
