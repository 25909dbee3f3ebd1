package com.catalog.indexer.output;

import com.catalog.indexer.pipeline.PipelineResult;
import com.catalog.indexer.util.FileWriteUtil;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders the Markdown run report from {@code /templates/run_report.md.ftl}.
 */
public class RunReportRenderer {

    static final String TEMPLATE = "run_report.md.ftl";

    private final Configuration freemarkerConfig;

    public RunReportRenderer() {
        this.freemarkerConfig = createFreemarkerConfig();
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

    public String render(PipelineResult result) throws IOException {
        Map<String, Object> model = new HashMap<>();
        model.put("result", result);
        model.put("summaries", result.getDateSummaries());
        model.put("warnings", result.getDiagnostics() != null ? result.getDiagnostics().getWarnings() : List.of());
        model.put("infos", result.getDiagnostics() != null ? result.getDiagnostics().getInfos() : List.of());

        Template template = freemarkerConfig.getTemplate(TEMPLATE);
        StringWriter out = new StringWriter();
        try {
            template.process(model, out);
        } catch (TemplateException e) {
            throw new IOException("Failed to render " + TEMPLATE + ": " + e.getMessage(), e);
        }
        return out.toString();
    }

    public void write(PipelineResult result, Path file) throws IOException {
        FileWriteUtil.safeWriteString(file, render(result));
    }
}
