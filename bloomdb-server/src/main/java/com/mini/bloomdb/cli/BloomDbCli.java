package com.mini.bloomdb.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.mini.bloomdb.client.SearchClient;
import com.mini.bloomdb.exception.BloomDbException;
import com.mini.bloomdb.exception.ConfigurationException;
import com.mini.bloomdb.fs.FileNamePattern;
import com.mini.bloomdb.index.DirectoryIndexer;
import com.mini.bloomdb.index.IndexOptions;
import com.mini.bloomdb.index.IndexingSummary;
import com.mini.bloomdb.query.Rule;
import com.mini.bloomdb.server.SearchServer;
import com.mini.bloomdb.server.ServerOptions;
import com.mini.bloomdb.server.exception.ProtocolException;
import com.mini.bloomdb.server.protocol.RuleJsonCodec;
import com.mini.bloomdb.server.protocol.SearchRequest;
import com.mini.bloomdb.server.protocol.SearchResult;
import com.mini.bloomdb.utils.SerializationUtils;
import net.sourceforge.argparse4j.ArgumentParsers;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.ArgumentParserException;
import net.sourceforge.argparse4j.inf.Namespace;
import net.sourceforge.argparse4j.inf.Subparser;
import net.sourceforge.argparse4j.inf.Subparsers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

/**
 * bloomdb 命令行工具
 * <p>
 * index --input /data/csv --output /data/index --pattern *.csv --error-rate 0.05
 * </p>
 * <p>
 * serve --index-root /data/index --port 8888
 * </p>
 * <p>
 * search --index-source . --pattern *.csv --query '{"column":"account_status","value":"Active"}'
 * </p>
 * <p>
 * ping --host 127.0.0.1 --port 8888
 * </p>
 * 每个命令都可以用 --config 指定 properties 配置文件，命令行参数优先。
 */
public class BloomDbCli {
    
    private static final Logger logger = LoggerFactory.getLogger(BloomDbCli.class);
    
    static final String CLIENT_TIMEOUT_MS = "client.timeout-ms";
    
    private final PrintStream out;
    private final PrintStream err;
    
    public BloomDbCli(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }
    
    public static void main(String[] args) {
        int exitCode = new BloomDbCli(System.out, System.err).run(args);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }
    
    /**
     * @return 进程退出码
     */
    public int run(String[] args) {
        ArgumentParser parser = buildParser();
        Namespace ns;
        try {
            ns = parser.parseArgs(args);
        } catch (ArgumentParserException e) {
            parser.handleError(e);
            return 2;
        }
        
        String command = ns.getString("command");
        if (command == null) {
            parser.printUsage(new PrintWriter(err, true));
            return 2;
        }
        try {
            Map<String, String> config = loadConfig(ns.getString("config"));
            switch (command) {
                case "index":
                    return index(ns, config);
                case "serve":
                    return serve(ns, config);
                case "search":
                    return search(ns, config);
                case "ping":
                    return ping(ns, config);
                default:
                    err.println("Unknown command: " + command);
                    return 2;
            }
        } catch (ConfigurationException e) {
            err.println("Invalid configuration: " + e.getMessage());
            return 2;
        } catch (BloomDbException e) {
            logger.error("Command {} failed", command, e);
            err.println(e.getMessage());
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            err.println("Interrupted");
            return 1;
        }
    }
    
    private ArgumentParser buildParser() {
        ArgumentParser parser = ArgumentParsers.newFor("bloomdb").build()
                .defaultHelp(true)
                .description("Build per-column file indexes and search them for candidate files");
        Subparsers subparsers = parser.addSubparsers().dest("command");
        
        Subparser index = subparsers.addParser("index")
                .defaultHelp(true)
                .help("build an index for every data file in a directory");
        index.addArgument("--input").required(true)
                .help("directory containing the data files");
        index.addArgument("--output").required(true)
                .help("directory to write the .bidx index files into");
        index.addArgument("--pattern").setDefault(DirectoryIndexer.DEFAULT_PATTERN.getGlob())
                .help("file name pattern of the data files");
        index.addArgument("--error-rate").type(Double.class)
                .help("target false positive rate of membership indexes");
        index.addArgument("--range-filter-threshold").type(Integer.class)
                .help("distinct value count at which a column gets a range index");
        index.addArgument("--parallelism").type(Integer.class)
                .help("number of files indexed concurrently");
        addConfigArgument(index);
        
        Subparser serve = subparsers.addParser("serve")
                .defaultHelp(true)
                .help("serve search requests over the index files under a root location");
        serve.addArgument("--index-root")
                .help("root location of the index files");
        serve.addArgument("--host").help("address to bind");
        serve.addArgument("--port").type(Integer.class).help("port to listen on");
        addConfigArgument(serve);
        
        Subparser search = subparsers.addParser("search")
                .defaultHelp(true)
                .help("send a search request to a running server");
        search.addArgument("--host").help("server address");
        search.addArgument("--port").type(Integer.class).help("server port");
        search.addArgument("--index-source").setDefault(".")
                .help("index location relative to the server's index root");
        search.addArgument("--pattern").setDefault("*")
                .help("source file name pattern");
        search.addArgument("--query").required(true)
                .help("rule tree as JSON");
        search.addArgument("--timeout-ms").type(Long.class)
                .help("connect and response timeout");
        addConfigArgument(search);
        
        Subparser ping = subparsers.addParser("ping")
                .defaultHelp(true)
                .help("check that a server is alive");
        ping.addArgument("--host").help("server address");
        ping.addArgument("--port").type(Integer.class).help("server port");
        ping.addArgument("--timeout-ms").type(Long.class)
                .help("connect and response timeout");
        addConfigArgument(ping);
        
        return parser;
    }
    
    private static void addConfigArgument(Subparser subparser) {
        subparser.addArgument("--config").help("properties file with default options");
    }
    
    private int index(Namespace ns, Map<String, String> config) {
        putIfPresent(config, IndexOptions.ERROR_RATE, ns.get("error_rate"));
        putIfPresent(config, IndexOptions.RANGE_FILTER_THRESHOLD, ns.get("range_filter_threshold"));
        putIfPresent(config, IndexOptions.PARALLELISM, ns.get("parallelism"));
        IndexOptions options = IndexOptions.fromMap(config);
        
        FileNamePattern pattern;
        try {
            pattern = new FileNamePattern(ns.getString("pattern"));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid pattern: " + e.getMessage(), e);
        }
        
        IndexingSummary summary;
        try (DirectoryIndexer indexer = new DirectoryIndexer(options)) {
            summary = indexer.indexDirectory(ns.getString("input"), ns.getString("output"), pattern);
        }
        
        for (IndexingSummary.IndexedFile file : summary.getIndexedFiles()) {
            out.println(file.getIndexLocation());
            file.getBuildResult().getFailures().forEach((column, e) -> 
                err.println("  unindexed column " + column + ": " + e.getMessage()));
        }
        summary.getFailures().forEach((source, e) -> err.println("failed " + source + ": " + e.getMessage()));
        return summary.isSuccessful() ? 0 : 1;
    }
    
    private int serve(Namespace ns, Map<String, String> config) throws InterruptedException {
        putIfPresent(config, ServerOptions.INDEX_ROOT, ns.getString("index_root"));
        putIfPresent(config, ServerOptions.HOST, ns.getString("host"));
        putIfPresent(config, ServerOptions.PORT, ns.get("port"));
        ServerOptions options = ServerOptions.fromMap(config);
        
        SearchServer server = new SearchServer(options);
        Runtime.getRuntime().addShutdownHook(new Thread(server::close, "search-server-shutdown"));
        server.start();
        server.awaitTermination();
        return 0;
    }
    
    private int search(Namespace ns, Map<String, String> config) {
        Rule query;
        try {
            query = RuleJsonCodec.fromJson(SerializationUtils.readTree(ns.getString("query")));
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Malformed query: " + e.getOriginalMessage(), e);
        }
        SearchRequest request = new SearchRequest(ns.getString("index_source"), ns.getString("pattern"), query);
        
        SearchResult result;
        try (SearchClient client = newClient(ns, config)) {
            result = client.send(request);
        }
        for (String file : result.getFiles()) {
            out.println(file);
        }
        for (SearchResult.LoadFailure failure : result.getFailures()) {
            err.println("failed to load " + failure.getLocation() + ": " + failure.getMessage());
        }
        return 0;
    }
    
    private int ping(Namespace ns, Map<String, String> config) {
        try (SearchClient client = newClient(ns, config)) {
            client.ping();
        }
        out.println("alive");
        return 0;
    }
    
    private static SearchClient newClient(Namespace ns, Map<String, String> config) {
        putIfPresent(config, ServerOptions.HOST, ns.getString("host"));
        putIfPresent(config, ServerOptions.PORT, ns.get("port"));
        putIfPresent(config, CLIENT_TIMEOUT_MS, ns.get("timeout_ms"));
        
        String host = config.getOrDefault(ServerOptions.HOST, ServerOptions.DEFAULT_HOST);
        int port = parseInt(ServerOptions.PORT, config.getOrDefault(
            ServerOptions.PORT, String.valueOf(ServerOptions.DEFAULT_PORT)));
        long timeoutMillis = parseLong(CLIENT_TIMEOUT_MS, config.getOrDefault(
            CLIENT_TIMEOUT_MS, String.valueOf(SearchClient.DEFAULT_TIMEOUT_MS)));
        return new SearchClient(host, port, timeoutMillis);
    }
    
    /**
     * 读取 properties 配置文件
     */
    static Map<String, String> loadConfig(String configFile) {
        Map<String, String> config = new HashMap<>();
        if (configFile == null) {
            return config;
        }
        Properties properties = new Properties();
        try (InputStream in = Files.newInputStream(Paths.get(configFile))) {
            properties.load(in);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read config file " + configFile, e);
        }
        for (String key : properties.stringPropertyNames()) {
            config.put(key, properties.getProperty(key));
        }
        return config;
    }
    
    private static void putIfPresent(Map<String, String> config, String key, Object value) {
        if (value != null) {
            config.put(key, value.toString());
        }
    }
    
    private static long parseLong(String key, String value) {
        try {
            long parsed = Long.parseLong(value.trim());
            if (parsed <= 0) {
                throw new ConfigurationException(key + " must be positive, got " + value);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key + " is not an integer: " + value, e);
        }
    }
    
    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key + " is not an integer: " + value, e);
        }
    }
}
