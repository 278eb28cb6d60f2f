package com.purchasingpower.synthflow.service.prompt;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.github.mustachejava.DefaultMustacheFactory;
import com.github.mustachejava.Mustache;
import com.github.mustachejava.MustacheFactory;
import com.purchasingpower.synthflow.model.prompt.PromptTemplate;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Prompt Library Service
 *
 * Loads prompts from YAML files and renders them with variables.
 *
 * Usage:
 * String prompt = promptLibrary.render("constraint-feedback", Map.of(
 *     "attempt", 2,
 *     "feedback", feedbackEntries
 * ));
 */
@Slf4j
@Service
public class PromptLibraryService {

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final MustacheFactory mustacheFactory = new DefaultMustacheFactory();
    private final Map<String, PromptTemplate> templates = new ConcurrentHashMap<>();
    private final Map<String, Mustache> compiled = new ConcurrentHashMap<>();

    @PostConstruct
    public void loadPrompts() {
        try {
            PathMatchingResourcePatternResolver resolver = new PathMatchingResourcePatternResolver();
            Resource[] resources = resolver.getResources("classpath:prompts/*.yaml");

            for (Resource resource : resources) {
                PromptTemplate template = yamlMapper.readValue(resource.getInputStream(), PromptTemplate.class);
                templates.put(template.getName(), template);
                log.info("Loaded prompt template: {} (version: {})", template.getName(), template.getVersion());
            }

            log.info("Loaded {} prompt templates", templates.size());

        } catch (IOException e) {
            log.error("Failed to load prompt templates", e);
            throw new IllegalStateException("Prompt library initialization failed", e);
        }
    }

    /**
     * Render a prompt with variables
     */
    public String render(String templateName, Map<String, Object> variables) {
        PromptTemplate template = templates.get(templateName);

        if (template == null) {
            throw new IllegalArgumentException("Prompt template not found: " + templateName);
        }

        Mustache mustache = compiled.computeIfAbsent(templateName, name -> mustacheFactory.compile(
                new StringReader(join(template)), name));

        StringWriter writer = new StringWriter();
        mustache.execute(writer, variables);
        return writer.toString();
    }

    public PromptTemplate getTemplate(String name) {
        return templates.get(name);
    }

    private static String join(PromptTemplate template) {
        String system = template.getSystemPrompt() == null ? "" : template.getSystemPrompt();
        String user = template.getUserPrompt() == null ? "" : template.getUserPrompt();
        return system.isEmpty() ? user : system + "\n\n" + user;
    }
}
