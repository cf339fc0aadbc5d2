package com.protorpc.generator.codegen.generator;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.protorpc.codec.Codec;
import com.protorpc.generator.codegen.GenerationException;
import com.protorpc.generator.codegen.GenerationOptions;
import com.protorpc.generator.codegen.model.Method;
import com.protorpc.generator.codegen.model.Service;
import com.protorpc.generator.codegen.util.NamingUtil;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Emits gRPC client and server bindings for services.
 *
 * Client and server text is accumulated separately by {@link #generate(Service)} and
 * rendered by {@link #flush(StringBuilder)}, client first. Flushing empties both
 * accumulators, so callers flush once per output file before generating the next
 * service.
 */
public class ServiceGenerator {
    private static final Logger log = LoggerFactory.getLogger(ServiceGenerator.class);

    private static final String CLIENT_TEMPLATE = "client.ftl";
    private static final String SERVER_TEMPLATE = "server.ftl";

    private final GenerationOptions options;
    private final Configuration freemarkerConfig;

    private final StringBuilder clients = new StringBuilder();
    private final StringBuilder servers = new StringBuilder();

    /** Package declared by the pending output; set by the first service after a flush. */
    private String pendingPackage;

    public ServiceGenerator(GenerationOptions options) {
        this.options = Objects.requireNonNull(options, "options");
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

    /**
     * Appends the enabled halves for one service to the accumulators.
     */
    public void generate(Service service) {
        Objects.requireNonNull(service, "service");
        if (pendingPackage == null) {
            pendingPackage = options.getTargetPackage() != null
                    ? options.getTargetPackage()
                    : service.getPackageName();
        }

        Map<String, Object> data = templateData(service);

        if (options.isBuildServer()) {
            servers.append(render(SERVER_TEMPLATE, data));
        }

        // Clients for services without methods would have nothing to call.
        if (options.isBuildClient() && !service.getMethods().isEmpty()) {
            clients.append(render(CLIENT_TEMPLATE, data));
        }

        log.debug("Generated bindings for {} ({} method(s))", service.getFullName(), service.getMethods().size());
    }

    /**
     * Renders accumulated fragments into {@code buf} and resets the accumulators.
     * Appends nothing when both accumulators are empty.
     */
    public void flush(StringBuilder buf) {
        if (clients.length() > 0 || servers.length() > 0) {
            buf.append(header(pendingPackage));
        }

        if (options.isBuildClient() && clients.length() > 0) {
            buf.append(clients);
        }
        if (options.isBuildServer() && servers.length() > 0) {
            if (clients.length() > 0) {
                buf.append('\n');
            }
            buf.append(servers);
        }

        clients.setLength(0);
        servers.setLength(0);
        pendingPackage = null;
    }

    public boolean hasPendingClients() {
        return clients.length() > 0;
    }

    public boolean hasPendingServers() {
        return servers.length() > 0;
    }

    private static String header(String packageName) {
        StringBuilder sb = new StringBuilder("// Generated by protorpc-codegen. Do not edit.\n");
        if (packageName != null && !packageName.isEmpty()) {
            sb.append("package ").append(packageName).append(";\n");
        }
        return sb.append('\n').toString();
    }

    private Map<String, Object> templateData(Service service) {
        List<Map<String, Object>> methods = new ArrayList<>();
        for (Method method : service.getMethods()) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("name", NamingUtil.escapeKeyword(method.getName()));
            m.put("routeName", method.getRouteName());
            m.put("descriptor", NamingUtil.toScreamingSnakeCase(method.getRouteName()) + "_METHOD");
            m.put("inputType", method.getInputType());
            m.put("outputType", method.getOutputType());
            m.put("codecPath", method.getCodecPath());
            m.put("mode", method.getStreamingMode().name());
            m.put("methodType", method.getStreamingMode().getMethodType().name());
            methods.add(m);
        }

        Map<String, Object> data = new HashMap<>();
        data.put("serviceName", service.getName());
        data.put("serviceFullName", service.getFullName());
        data.put("className", NamingUtil.typeCase(service.getName()));
        data.put("codecPackage", Codec.class.getPackageName());
        data.put("buildTransport", options.isBuildTransport());
        data.put("methods", methods);
        return data;
    }

    private String render(String templateName, Map<String, Object> data) {
        try {
            Template template = freemarkerConfig.getTemplate(templateName);
            StringWriter out = new StringWriter();
            template.process(data, out);
            return out.toString();
        } catch (IOException | TemplateException e) {
            throw new GenerationException("Failed to render " + templateName + " for " + data.get("serviceFullName"), e);
        }
    }
}
