package com.embedded.testgen.context;

import java.io.IOException;
import java.io.StringWriter;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.embedded.testgen.exception.ContextBuildException;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Renders a {@link GenerationContext} into the prompt text sent to a backend.
 */
public class PromptRenderer {

    public static final String DEFAULT_TEMPLATE = "unity-test-prompt.ftl";

    private final Configuration freemarkerConfig;
    private final String templateName;

    public PromptRenderer() {
        this(DEFAULT_TEMPLATE);
    }

    public PromptRenderer(String templateName) {
        this.freemarkerConfig = createFreemarkerConfig();
        this.templateName = templateName;
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    public String render(GenerationContext context) {
        Map<String, Object> model = new HashMap<>();
        model.put("sourceName", context.getSourceName());
        model.put("testFileName", context.getTestFileName());
        model.put("sourceText", context.getSourceText());
        model.put("stubs", context.getNeedsStub());
        model.put("hints", context.getEmbeddedPatterns().stream().map(PromptRenderer::hint).toList());
        model.put("feedback", context.getFeedback().render());

        try {
            Template template = freemarkerConfig.getTemplate(templateName);
            StringWriter out = new StringWriter();
            template.process(model, out);
            return out.toString();
        } catch (IOException | TemplateException e) {
            throw new ContextBuildException("Failed to render prompt for " + context.getSourceName()
                    + " from template " + templateName, e);
        }
    }

    private static Map<String, Object> hint(EmbeddedPattern pattern) {
        return Map.of("title", pattern.getTitle(), "guidance", List.copyOf(pattern.getGuidance()));
    }
}
