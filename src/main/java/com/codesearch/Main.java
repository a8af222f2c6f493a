package com.codesearch;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codesearch.runtime.AppConfig;
import com.codesearch.runtime.CodeSearchRuntime;
import com.codesearch.runtime.ConfigLoader;
import com.codesearch.runtime.ConfigurationException;
import com.codesearch.tools.CodeSearchTools;
import com.codesearch.tools.ToolResult;
import com.codesearch.transport.HttpToolServer;
import com.codesearch.transport.StdioServer;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "code-search",
        mixinStandardHelpOptions = true,
        version = "code-search 0.1.0",
        description = "Indexes source trees into a vector store and serves semantic code search tools.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_OPERATION_FAILED = 1;
    static final int EXIT_USAGE_ERROR = 2;
    static final int EXIT_CONFIGURATION_ERROR = 3;

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "application.yml")
    Path configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", defaultValue = "stdio")
    Mode mode;

    @Option(names = "--project-path", description = "Directory to index (index mode)")
    Path projectPath;

    @Option(names = "--project-name", description = "Project name used to derive the project id (index mode)")
    String projectName;

    @Option(names = "--include", split = ",", description = "Include patterns, comma separated (index mode)")
    List<String> includePatterns;

    @Option(names = "--exclude", split = ",", description = "Exclude patterns, comma separated (index mode)")
    List<String> excludePatterns;

    @Option(names = "--query", description = "Query text (search mode)")
    String query;

    @Option(names = "--limit", description = "Maximum number of results", defaultValue = "10")
    int limit;

    @Option(names = "--project", description = "Restrict search to one project id")
    String projectFilter;

    @Option(names = "--file-type", description = "Restrict search to one file type, e.g. py")
    String fileType;

    @Option(names = "--file-path", description = "Relative path of an indexed file (file mode)")
    String filePath;

    @Option(names = "--port", description = "Override the HTTP port (http mode)")
    Integer port;

    enum Mode {
        stdio,
        http,
        index,
        search,
        list,
        file,
        info
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        AppConfig config;
        try {
            config = loadConfig();
        } catch (ConfigurationException e) {
            log.error("Configuration error: {}", e.getMessage());
            return EXIT_CONFIGURATION_ERROR;
        }
        if (port != null) {
            config.getServer().setPort(port);
        }

        String usageError = validateArguments();
        if (usageError != null) {
            log.error(usageError);
            return EXIT_USAGE_ERROR;
        }

        CodeSearchRuntime runtime;
        try {
            runtime = createRuntime(config);
        } catch (ConfigurationException e) {
            log.error("Configuration error: {}", e.getMessage());
            return EXIT_CONFIGURATION_ERROR;
        }

        try (runtime) {
            log.info("Starting code-search in {} mode", mode);
            switch (mode) {
                case stdio:
                    new StdioServer(runtime.mcpBridge(), System.in, System.out).run();
                    return EXIT_OK;
                case http:
                    try (HttpToolServer server = new HttpToolServer(
                            runtime.tools(),
                            runtime.mcpBridge(),
                            runtime.mapper(),
                            config.getServer().getHost(),
                            config.getServer().getPort(),
                            runtime.healthDetails())) {
                        server.start();
                        server.join();
                    }
                    return EXIT_OK;
                default:
                    return runTool(runtime.tools(), System.out);
            }
        }
    }

    AppConfig loadConfig() {
        return new ConfigLoader().load(configPath);
    }

    CodeSearchRuntime createRuntime(AppConfig config) {
        return new CodeSearchRuntime(config);
    }

    String validateArguments() {
        switch (mode) {
            case index:
                if (projectPath == null || projectName == null || projectName.isBlank()) {
                    return "--project-path and --project-name are required in index mode";
                }
                return null;
            case search:
                if ((query == null || query.isBlank()) && (fileType == null || fileType.isBlank())) {
                    return "--query or --file-type is required in search mode";
                }
                return null;
            case file:
                if (filePath == null || filePath.isBlank()) {
                    return "--file-path is required in file mode";
                }
                return null;
            default:
                return null;
        }
    }

    int runTool(CodeSearchTools tools, PrintStream out) {
        ToolResult result;
        Map<String, Object> arguments = new LinkedHashMap<>();
        switch (mode) {
            case index:
                arguments.put("project_path", projectPath.toAbsolutePath().normalize().toString());
                arguments.put("project_name", projectName);
                if (includePatterns != null) {
                    arguments.put("include_patterns", includePatterns);
                }
                if (excludePatterns != null) {
                    arguments.put("exclude_patterns", excludePatterns);
                }
                result = tools.call(CodeSearchTools.INDEX_LOCAL_PROJECT, arguments);
                break;
            case search:
                if (fileType != null && !fileType.isBlank()) {
                    arguments.put("file_type", fileType);
                    arguments.put("query", query);
                    arguments.put("n_results", limit);
                    result = tools.call(CodeSearchTools.SEARCH_BY_FILE_TYPE, arguments);
                } else {
                    arguments.put("query", query);
                    arguments.put("limit", limit);
                    arguments.put("project_filter", projectFilter);
                    result = tools.call(CodeSearchTools.SEARCH_CODEBASE, arguments);
                }
                break;
            case list:
                result = tools.call(CodeSearchTools.LIST_INDEXED_PROJECTS, arguments);
                break;
            case file:
                arguments.put("file_path", filePath);
                result = tools.call(CodeSearchTools.GET_FILE_CONTENT, arguments);
                break;
            case info:
                result = tools.call(CodeSearchTools.GET_EMBEDDING_PROVIDER_INFO, arguments);
                break;
            default:
                throw new IllegalStateException("Not a one-shot mode: " + mode);
        }
        out.println(result.text());
        return result.error() ? EXIT_OPERATION_FAILED : EXIT_OK;
    }
}
