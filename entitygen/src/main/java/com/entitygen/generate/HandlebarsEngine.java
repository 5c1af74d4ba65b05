package com.entitygen.generate;

import com.github.jknack.handlebars.EscapingStrategy;
import com.github.jknack.handlebars.Handlebars;
import com.github.jknack.handlebars.Helper;
import com.github.jknack.handlebars.Template;
import com.github.jknack.handlebars.io.ClassPathTemplateLoader;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

/**
 * Handlebars set up for emitting Java source: no HTML escaping, standalone
 * block tags do not leave blank lines behind.
 * Not thread-safe; one engine serves one generation run.
 */
public class HandlebarsEngine {
    private final Handlebars handlebars;
    private final Map<String, Template> compiled = new HashMap<>();

    public HandlebarsEngine() {
        ClassPathTemplateLoader loader = new ClassPathTemplateLoader();
        loader.setPrefix("/templates");
        loader.setSuffix(".hbs");
        this.handlebars = new Handlebars(loader)
                .with(EscapingStrategy.NOOP)
                .prettyPrint(true);
        registerHelpers();
    }

    private void registerHelpers() {
        handlebars.registerHelper("javaString", (Helper<Object>) (value, options) -> {
            if (value == null) return "";
            return escapeJava(value.toString());
        });
    }

    /**
     * Escapes text for use inside a Java string literal.
     */
    public static String escapeJava(String value) {
        StringBuilder result = new StringBuilder(value.length());
        for (char c : value.toCharArray()) {
            switch (c) {
                case '\\' -> result.append("\\\\");
                case '"' -> result.append("\\\"");
                case '\n' -> result.append("\\n");
                case '\r' -> result.append("\\r");
                case '\t' -> result.append("\\t");
                default -> result.append(c);
            }
        }
        return result.toString();
    }

    public Template compile(String templateName) throws IOException {
        Template template = compiled.get(templateName);
        if (template == null) {
            template = handlebars.compile(templateName);
            compiled.put(templateName, template);
        }
        return template;
    }

    public String render(String templateName, Object context) throws IOException {
        return compile(templateName).apply(context);
    }
}
