package com.codeheadsystems.iracing.cli;

import com.codeheadsystems.iracing.client.IRacingDataClient;
import com.codeheadsystems.iracing.client.config.ChunkPolicy;
import com.codeheadsystems.iracing.client.config.IRacingClientConfig;
import com.codeheadsystems.iracing.client.model.ApiResult;
import com.codeheadsystems.iracing.client.model.Credentials;
import com.codeheadsystems.iracing.model.ChunkDescriptor;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * Command-line client for checking the data client against the live iRacing API.
 *
 * <pre>
 * Usage:
 *   java -jar iracing-cli.jar get|chunks &lt;endpoint&gt; [name=value ...] [options]
 *
 * Commands:
 *   get      GET the endpoint (following a link response) and print the JSON.
 *   chunks   GET the endpoint, then download the chunked dataset its chunk_info describes
 *            and print the records.
 *
 * Options:
 *   --properties &lt;file&gt;   iracing.* client properties      (default: built-in defaults)
 *   --base-url &lt;url&gt;      Data API base URL                 (overrides the properties)
 *   --all-chunks          Download every chunk, not just the first
 *
 * Environment:
 *   IRACING_USERNAME, IRACING_PASSWORD, IRACING_CLIENT_ID, IRACING_CLIENT_SECRET
 *
 * Examples:
 *   java -jar iracing-cli.jar get /data/member/info
 *   java -jar iracing-cli.jar get /data/member/get cust_ids=123456 include_licenses=true
 *   java -jar iracing-cli.jar chunks /data/results/search_series season_year=2026 season_quarter=3 --all-chunks
 * </pre>
 *
 * <p>Exit status is 0 on success, 1 for usage or setup errors and 2 when the API call fails.
 */
public class DataCli {

  static final String ENV_USERNAME = "IRACING_USERNAME";
  static final String ENV_PASSWORD = "IRACING_PASSWORD";
  static final String ENV_CLIENT_ID = "IRACING_CLIENT_ID";
  static final String ENV_CLIENT_SECRET = "IRACING_CLIENT_SECRET";

  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  /**
   * Parsed command line.
   *
   * @param command        get or chunks
   * @param endpoint       the data endpoint
   * @param queryParams    query parameters from name=value arguments
   * @param propertiesFile optional properties file
   * @param baseUrl        optional base URL override
   * @param allChunks      whether to download every chunk
   */
  record Arguments(String command,
                   String endpoint,
                   Map<String, String> queryParams,
                   Path propertiesFile,
                   String baseUrl,
                   boolean allChunks) {

    static Arguments parse(String[] args) {
      Path propertiesFile = null;
      String baseUrl = null;
      boolean allChunks = false;
      List<String> positional = new ArrayList<>();

      for (int i = 0; i < args.length; i++) {
        switch (args[i]) {
          case "--properties" -> propertiesFile = Path.of(value(args, ++i, "--properties"));
          case "--base-url"   -> baseUrl        = value(args, ++i, "--base-url");
          case "--all-chunks" -> allChunks      = true;
          default             -> positional.add(args[i]);
        }
      }
      if (positional.size() < 2) {
        throw new IllegalArgumentException("Expected a command and an endpoint");
      }
      Map<String, String> queryParams = new LinkedHashMap<>();
      for (String param : positional.subList(2, positional.size())) {
        int eq = param.indexOf('=');
        if (eq <= 0) {
          throw new IllegalArgumentException("Query parameter must be name=value: " + param);
        }
        queryParams.put(param.substring(0, eq), param.substring(eq + 1));
      }
      return new Arguments(positional.get(0), positional.get(1), queryParams, propertiesFile, baseUrl, allChunks);
    }

    private static String value(String[] args, int index, String option) {
      if (index >= args.length) {
        throw new IllegalArgumentException(option + " needs a value");
      }
      return args[index];
    }
  }

  /**
   * Main entry point.
   *
   * @param args command-line arguments
   */
  public static void main(String[] args) {
    final Arguments arguments;
    final IRacingClientConfig config;
    final Credentials credentials;
    try {
      arguments = Arguments.parse(args);
      config = config(arguments);
      credentials = credentials(System.getenv());
    } catch (IllegalArgumentException | IOException e) {
      System.err.println("Error: " + e.getMessage());
      printUsage();
      System.exit(1);
      return;
    }

    System.out.println("Base URL : " + config.baseUrl());
    System.out.println("Identity : " + credentials.identity());
    System.out.println("Endpoint : " + arguments.endpoint() + " " + arguments.queryParams());
    System.out.println();

    int status;
    try (IRacingDataClient client = IRacingDataClient.create(config, credentials)) {
      status = switch (arguments.command()) {
        case "get"    -> runGet(client, arguments);
        case "chunks" -> runChunks(client, arguments);
        default -> {
          System.err.println("Unknown command: " + arguments.command());
          printUsage();
          yield 1;
        }
      };
    } catch (Exception e) {
      System.err.println("Error: " + e.getMessage());
      status = 1;
    }
    System.exit(status);
  }

  static IRacingClientConfig config(Arguments arguments) throws IOException {
    Properties properties = new Properties();
    if (arguments.propertiesFile() != null) {
      try (Reader reader = Files.newBufferedReader(arguments.propertiesFile(), StandardCharsets.UTF_8)) {
        properties.load(reader);
      }
    }
    if (arguments.baseUrl() != null) {
      properties.setProperty("iracing.baseUrl", arguments.baseUrl());
    }
    IRacingClientConfig config = IRacingClientConfig.fromProperties(properties);
    return arguments.allChunks() ? config.withChunkPolicy(ChunkPolicy.ALL) : config;
  }

  static Credentials credentials(Map<String, String> environment) {
    return new Credentials(
        required(environment, ENV_USERNAME),
        required(environment, ENV_PASSWORD),
        required(environment, ENV_CLIENT_ID),
        required(environment, ENV_CLIENT_SECRET));
  }

  private static String required(Map<String, String> environment, String name) {
    String value = environment.get(name);
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Environment variable " + name + " is not set");
    }
    return value;
  }

  private static int runGet(IRacingDataClient client, Arguments arguments) throws IOException {
    ApiResult<JsonNode> result = client.get(arguments.endpoint(), arguments.queryParams());
    if (!result.isSuccess()) {
      System.err.println("Request failed: " + result.failure());
      return 2;
    }
    print(result.value());
    return 0;
  }

  private static int runChunks(IRacingDataClient client, Arguments arguments) throws IOException {
    ApiResult<JsonNode> result = client.get(arguments.endpoint(), arguments.queryParams());
    if (!result.isSuccess()) {
      System.err.println("Request failed: " + result.failure());
      return 2;
    }
    JsonNode chunkInfo = result.value().findValue("chunk_info");
    if (chunkInfo == null || chunkInfo.isNull()) {
      System.err.println("Response has no chunk_info; use the get command instead");
      return 2;
    }
    ChunkDescriptor descriptor = ChunkDescriptor.fromChunkInfo(chunkInfo);
    System.out.println("Chunks   : " + descriptor.chunkFileNames().size() + " (rows: " + descriptor.rows() + ")");
    ApiResult<List<JsonNode>> records = client.downloadChunks(descriptor);
    if (!records.isSuccess()) {
      System.err.println("Chunk download failed: " + records.failure());
      return 2;
    }
    System.out.println("Records  : " + records.value().size());
    print(OBJECT_MAPPER.valueToTree(records.value()));
    return 0;
  }

  private static void print(JsonNode node) throws IOException {
    System.out.println(OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(node));
  }

  private static void printUsage() {
    System.err.println("Usage: DataCli <command> <endpoint> [name=value ...] [options]");
    System.err.println();
    System.err.println("Commands:");
    System.err.println("  get      GET the endpoint and print the JSON");
    System.err.println("  chunks   GET the endpoint and download the chunked dataset it describes");
    System.err.println();
    System.err.println("Options:");
    System.err.println("  --properties <file>  iracing.* client properties");
    System.err.println("  --base-url <url>     Data API base URL (default: " + IRacingClientConfig.DEFAULT_BASE_URL + ")");
    System.err.println("  --all-chunks         Download every chunk, not just the first");
    System.err.println();
    System.err.println("Environment:");
    System.err.println("  " + ENV_USERNAME + ", " + ENV_PASSWORD + ", " + ENV_CLIENT_ID + ", " + ENV_CLIENT_SECRET);
  }
}
