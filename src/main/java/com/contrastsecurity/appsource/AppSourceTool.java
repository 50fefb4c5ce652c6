package com.contrastsecurity.appsource;

import com.contrastsecurity.appsource.api.UpstreamClient;
import com.contrastsecurity.appsource.config.ConfigLoader;
import com.contrastsecurity.appsource.config.HttpSettings;
import com.contrastsecurity.appsource.config.ProviderConfig;
import com.contrastsecurity.appsource.config.UpdateConfig;
import com.contrastsecurity.appsource.ipa.IpaInspector;
import com.contrastsecurity.appsource.ipa.Sha256ContentHasher;
import com.contrastsecurity.appsource.model.App;
import com.contrastsecurity.appsource.model.AppVersion;
import com.contrastsecurity.appsource.model.Catalog;
import com.contrastsecurity.appsource.model.NewsArticle;
import com.contrastsecurity.appsource.provider.ProviderContext;
import com.contrastsecurity.appsource.service.AddResult;
import com.contrastsecurity.appsource.service.CatalogManager;
import com.contrastsecurity.appsource.service.Diagnostic;
import com.contrastsecurity.appsource.service.UpdateSummary;
import com.contrastsecurity.appsource.util.CatalogJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;

/**
 * Command line entry point.
 */
public class AppSourceTool {
    private static final Logger logger = LoggerFactory.getLogger(AppSourceTool.class);

    private static UpstreamClient upstreamClient;

    public static void main(String[] args) {
        // Register shutdown hook for clean termination
        Runtime.getRuntime().addShutdownHook(new Thread(AppSourceTool::cleanupResources));

        if (args.length < 1) {
            printUsage();
            return;
        }

        String subcommand = args[0].toLowerCase();

        try {
            switch (subcommand) {
                case "create":
                    handleCreate(args);
                    break;
                case "add":
                    handleAdd(args);
                    break;
                case "update":
                    handleUpdate(args);
                    break;
                case "hashes":
                    handleHashes(args);
                    break;
                case "validate":
                    handleValidate(args);
                    break;
                case "--help":
                case "-h":
                case "help":
                    printUsage();
                    break;
                default:
                    System.err.println("Unknown subcommand: " + subcommand);
                    System.err.println("Run 'appsource help' for usage information");
                    return;
            }
        } catch (Exception e) {
            logger.error("Error executing {}: {}", subcommand, e.getMessage(), e);
            System.err.println("Error: " + e.getMessage());
        } finally {
            cleanupResources();
        }
    }

    /**
     * Options shared by the subcommands that write a catalog.
     */
    private static final class Options {
        final List<String> positional = new ArrayList<>();
        String output;
        String name;
        String identifier;
        String downloadUrl;
        boolean minify;
        boolean standard;
        boolean noEnrich;
        boolean all;
        boolean force;

        static Options parse(String[] args) {
            Options options = new Options();
            for (int i = 1; i < args.length; i++) {
                String arg = args[i];
                if (arg.startsWith("--output=")) {
                    options.output = arg.substring(9);
                } else if (arg.startsWith("--name=")) {
                    options.name = arg.substring(7);
                } else if (arg.startsWith("--identifier=")) {
                    options.identifier = arg.substring(13);
                } else if (arg.startsWith("--download-url=")) {
                    options.downloadUrl = arg.substring(15);
                } else if (arg.equals("--minify")) {
                    options.minify = true;
                } else if (arg.equals("--standard")) {
                    options.standard = true;
                } else if (arg.equals("--no-enrich")) {
                    options.noEnrich = true;
                } else if (arg.equals("--all")) {
                    options.all = true;
                } else if (arg.equals("--force")) {
                    options.force = true;
                } else if (arg.equals("--verbose") || arg.equals("-v")) {
                    setLoggingLevel(Level.DEBUG);
                } else if (arg.startsWith("--loglevel=")) {
                    setLogLevel(arg.substring(11).toUpperCase());
                } else if (arg.startsWith("--")) {
                    System.err.println("Unknown argument: " + arg + ". Ignoring.");
                } else {
                    options.positional.add(arg);
                }
            }
            return options;
        }

        Path outputOr(Path defaultPath) {
            return output != null ? Paths.get(output) : defaultPath;
        }
    }

    /**
     * Handle 'create' subcommand
     */
    private static void handleCreate(String[] args) throws Exception {
        Options options = Options.parse(args);
        if (options.positional.isEmpty() || options.name == null || options.identifier == null) {
            System.err.println("Usage: appsource create <catalog.json> --name=<name> --identifier=<identifier>");
            return;
        }
        Path path = Paths.get(options.positional.get(0));
        Catalog catalog = Catalog.create(options.name, options.identifier);
        CatalogJson.write(catalog, path, !options.minify, !options.standard);
        System.out.println("Created " + path);
    }

    /**
     * Handle 'add' subcommand
     */
    private static void handleAdd(String[] args) throws Exception {
        Options options = Options.parse(args);
        if (options.positional.size() < 2) {
            System.err.println("Usage: appsource add <catalog.json> <package.ipa|url> [--download-url=<url>]");
            return;
        }
        Path catalogPath = Paths.get(options.positional.get(0));
        String packageArg = options.positional.get(1);
        CatalogManager manager = CatalogManager.load(catalogPath, createContext(new HttpSettings()));

        boolean remote = packageArg.startsWith("http://") || packageArg.startsWith("https://");
        String downloadUrl = options.downloadUrl != null ? options.downloadUrl : (remote ? packageArg : "");
        App app = manager.buildAppFromPackage(downloadUrl, remote ? null : Paths.get(packageArg));
        AddResult result = manager.addApp(app);
        if (!result.isAdded()) {
            System.err.println("Not added: " + result.getReason());
            return;
        }
        manager.save(options.outputOr(catalogPath), !options.minify, !options.standard);
        System.out.println("Added " + app.getAppID() + ". Edit the placeholder name, developer, description and icon.");
    }

    /**
     * Handle 'update' subcommand
     */
    private static void handleUpdate(String[] args) throws Exception {
        Options options = Options.parse(args);
        if (options.positional.size() < 2) {
            System.err.println("Usage: appsource update <catalog.json> <config.json> [options]");
            return;
        }
        Path catalogPath = Paths.get(options.positional.get(0));
        UpdateConfig config = ConfigLoader.load(Paths.get(options.positional.get(1)));
        if (options.noEnrich) {
            for (ProviderConfig source : config.getSources()) {
                source.setEnrich(false);
            }
        }

        CatalogManager manager = CatalogManager.load(catalogPath, createContext(config.getHttp()));
        UpdateSummary summary = manager.runUpdate(config.getSources());
        manager.applyManualOverrides(config.getOverrides());
        if (config.isUpdateHashes() && !options.noEnrich) {
            manager.backfillHashesAndPermissions(true, false);
        }
        manager.save(options.outputOr(catalogPath), !options.minify, !options.standard);

        System.out.println(summary);
        for (String failed : summary.getFailedSources()) {
            System.out.println("  failed: " + failed);
        }
    }

    /**
     * Handle 'hashes' subcommand
     */
    private static void handleHashes(String[] args) throws Exception {
        Options options = Options.parse(args);
        if (options.positional.isEmpty()) {
            System.err.println("Usage: appsource hashes <catalog.json> [--all] [--force]");
            return;
        }
        Path catalogPath = Paths.get(options.positional.get(0));
        CatalogManager manager = CatalogManager.load(catalogPath, createContext(new HttpSettings()));
        List<Diagnostic> warnings = manager.backfillHashesAndPermissions(!options.all, options.force)
                .atLevel(Diagnostic.Level.WARN);
        manager.save(options.outputOr(catalogPath), !options.minify, !options.standard);
        System.out.println("Hashes updated" + (warnings.isEmpty() ? "" : ", " + warnings.size() + " warning(s)"));
    }

    /**
     * Handle 'validate' subcommand
     */
    private static void handleValidate(String[] args) throws Exception {
        Options options = Options.parse(args);
        if (options.positional.isEmpty()) {
            System.err.println("Usage: appsource validate <catalog.json>");
            return;
        }
        Catalog catalog = CatalogJson.load(Paths.get(options.positional.get(0)));
        int problems = 0;
        if (!catalog.missingKeys().isEmpty()) {
            System.out.println("Catalog is missing " + catalog.missingKeys());
            problems++;
        }
        for (App app : catalog.getApps()) {
            if (!app.isValid()) {
                System.out.println("App " + app.getIdentityKey() + " is invalid, missing " + app.missingKeys());
                problems++;
            }
            if (app.getVersions() != null) {
                for (AppVersion version : app.getVersions()) {
                    if (!version.isValid()) {
                        System.out.println("  version " + version.getVersion() + " is missing " + version.missingKeys());
                    }
                }
            }
        }
        if (catalog.getNews() != null) {
            for (NewsArticle article : catalog.getNews()) {
                if (!article.isValid()) {
                    System.out.println("News article " + article.getIdentifier() + " is missing " + article.missingKeys());
                    problems++;
                }
            }
        }
        System.out.println(problems == 0
                ? "Catalog is valid: " + catalog.getApps().size() + " app(s)"
                : problems + " problem(s) found");
    }

    private static ProviderContext createContext(HttpSettings settings) {
        upstreamClient = new UpstreamClient(settings);
        return new ProviderContext(upstreamClient, upstreamClient, new IpaInspector(),
                new Sha256ContentHasher(), upstreamClient);
    }

    /**
     * Print usage information
     */
    private static void printUsage() {
        System.out.println("Usage: appsource <subcommand> [args...] [options]");
        System.out.println();
        System.out.println("Subcommands:");
        System.out.println("  create <catalog>            Create an empty catalog");
        System.out.println("  add <catalog> <ipa|url>     Add an app built from a package file");
        System.out.println("  update <catalog> <config>   Merge the configured sources into the catalog");
        System.out.println("  hashes <catalog>            Compute missing sha256 hashes and permissions");
        System.out.println("  validate <catalog>          Report missing required fields");
        System.out.println("  help                        Show this help message");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --name=<name>               Catalog name (create)");
        System.out.println("  --identifier=<id>           Catalog identifier (create)");
        System.out.println("  --download-url=<url>        Public download url of the package (add)");
        System.out.println("  --output=<file>             Write to another file instead of the catalog");
        System.out.println("  --minify                    Write without whitespace");
        System.out.println("  --standard                  Write only the known catalog fields");
        System.out.println("  --no-enrich                 Do not download packages to backfill hashes (update)");
        System.out.println("  --all                       Process every version, not only the latest (hashes)");
        System.out.println("  --force                     Recompute existing hashes (hashes)");
        System.out.println("  --verbose, -v               Verbose logging");
        System.out.println("  --loglevel=<level>          Log level (TRACE, DEBUG, INFO, WARN, ERROR)");
        System.out.println();
        System.out.println("Examples:");
        System.out.println("  appsource create apps.json --name=\"My Apps\" --identifier=com.example.source");
        System.out.println("  appsource add apps.json https://example.com/MyApp.ipa");
        System.out.println("  appsource update apps.json sources.json --minify");
    }

    private static void setLogLevel(String level) {
        ch.qos.logback.classic.Logger root = (ch.qos.logback.classic.Logger)
            org.slf4j.LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        Level logbackLevel;

        switch (level) {
            case "TRACE":
                logbackLevel = Level.TRACE;
                break;
            case "DEBUG":
                logbackLevel = Level.DEBUG;
                break;
            case "INFO":
                logbackLevel = Level.INFO;
                break;
            case "WARN":
                logbackLevel = Level.WARN;
                break;
            case "ERROR":
                logbackLevel = Level.ERROR;
                break;
            default:
                System.err.println("Unknown log level: " + level + ". Using WARN.");
                logbackLevel = Level.WARN;
        }

        root.setLevel(logbackLevel);
        LoggerContext loggerContext = (LoggerContext) LoggerFactory.getILoggerFactory();
        loggerContext.getLogger("com.contrastsecurity.appsource").setLevel(logbackLevel);
        logger.info("Log level set to: {}", level);
    }

    private static void setLoggingLevel(Level level) {
        LoggerContext loggerContext = (LoggerContext) LoggerFactory.getILoggerFactory();
        loggerContext.getLogger("com.contrastsecurity.appsource").setLevel(level);
    }

    private static synchronized void cleanupResources() {
        if (upstreamClient != null) {
            upstreamClient.close();
            upstreamClient = null;
        }
    }
}
