package com.quantori.nqp.core.service;

import static com.quantori.nqp.core.query.QueryParameterMaps.DATASETS;
import static com.quantori.nqp.core.query.QueryParameterMaps.LICENSE;
import static com.quantori.nqp.core.query.QueryParameterMaps.RESOURCES;

import com.quantori.nqp.api.RowIterator;
import com.quantori.nqp.api.StorageConfiguration;
import com.quantori.nqp.api.model.CompiledQuery;
import com.quantori.nqp.api.model.EntityType;
import com.quantori.nqp.api.model.LicenseCatalog;
import com.quantori.nqp.api.model.LicenseTier;
import com.quantori.nqp.api.model.QueryType;
import com.quantori.nqp.api.model.Row;
import com.quantori.nqp.core.configuration.NetworkQueryProperties;
import com.quantori.nqp.core.format.OutputFormat;
import com.quantori.nqp.core.format.ResultFormatter;
import com.quantori.nqp.core.format.ResultStream;
import com.quantori.nqp.core.format.RowCursor;
import com.quantori.nqp.core.license.LicenseFilter;
import com.quantori.nqp.core.normalize.ArgumentNormalizer;
import com.quantori.nqp.core.normalize.InvalidArgumentException;
import com.quantori.nqp.core.normalize.QueryArguments;
import com.quantori.nqp.core.query.ArgumentSpec;
import com.quantori.nqp.core.query.QueryCompiler;
import com.quantori.nqp.core.query.QueryParameterMaps;
import com.quantori.nqp.core.query.QueryParameters;
import com.quantori.nqp.core.query.QueryParametersValidator;
import com.quantori.nqp.core.registry.QueryInfo;
import com.quantori.nqp.core.registry.ResourceEntry;
import com.quantori.nqp.core.registry.ResourceRegistry;
import com.quantori.nqp.core.registry.ResourceRegistryBuilder;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Serves data and meta requests: normalize, compile, execute, filter by license and format, lazily.
 *
 * <p>The resource registry is replaced atomically by {@link #reload()}, requests in flight keep the snapshot they
 * started with.
 */
@Slf4j
public class NetworkQueryService {

  static final List<String> BOOLEAN_VALUES = List.of("0", "1", "false", "no", "true", "yes");

  private final StorageConfiguration storageConfiguration;
  private final NetworkQueryProperties properties;
  private final QueryParameterMaps parameterMaps;
  private final ArgumentNormalizer normalizer;
  private final QueryCompiler compiler;
  private final ResourceRegistryBuilder registryBuilder;
  private final AtomicReference<ResourceRegistry> registry = new AtomicReference<>(ResourceRegistry.empty());

  public NetworkQueryService(StorageConfiguration storageConfiguration, LicenseCatalog licenseCatalog,
                             NetworkQueryProperties properties) {
    this.storageConfiguration = storageConfiguration;
    this.properties = properties;
    this.parameterMaps = QueryParameterMaps.defaults();
    QueryParametersValidator.validate(parameterMaps, storageConfiguration.getSchemaCatalog());
    this.normalizer = new ArgumentNormalizer(parameterMaps, storageConfiguration.getSchemaCatalog(),
        properties.isAnnotationsFullDownload());
    this.compiler = new QueryCompiler(parameterMaps, storageConfiguration.getSchemaCatalog());
    this.registryBuilder = new ResourceRegistryBuilder(storageConfiguration.getSchemaCatalog(),
        storageConfiguration.getResourceDiscovery(), licenseCatalog, parameterMaps);
    reload();
    log.info("Network query service started on {} storage", storageConfiguration.storageType());
  }

  /**
   * Rebuilds the resource registry and publishes it.
   *
   * @return the new registry
   */
  public synchronized ResourceRegistry reload() {
    ResourceRegistry rebuilt = registryBuilder.build();
    registry.set(rebuilt);
    return rebuilt;
  }

  public ResourceRegistry getRegistry() {
    return registry.get();
  }

  /**
   * Serves one request.
   *
   * @param operation query name or meta operation, meta operations take path segments, e.g.
   *                  {@code databases/interactions/omnipath}
   * @param arguments request arguments, repeated arguments keep all values
   * @return the response, a client error if the request cannot be served
   */
  public QueryResponse request(String operation, Map<String, List<String>> arguments) {
    String[] path = StringUtils.split(StringUtils.defaultString(operation), '/');
    try {
      if (path.length == 0) {
        throw new InvalidArgumentException(List.of("Unknown query: ``"));
      }
      var meta = MetaOperation.fromName(path[0]);
      if (meta.isPresent()) {
        return meta(meta.get(), Arrays.asList(path).subList(1, path.length), arguments);
      }
      QueryType queryType = QueryType.fromName(path[0])
          .orElseThrow(() -> new InvalidArgumentException(List.of("Unknown query: `" + path[0] + "`")));
      return query(queryType, arguments);
    } catch (InvalidArgumentException e) {
      log.debug("Client error on {}: {}", operation, e.getProblems());
      return QueryResponse.clientError(e.getMessage());
    }
  }

  /**
   * Normalized arguments of a data query with the default license applied, exposed for introspection.
   */
  public QueryArguments normalize(QueryType queryType, Map<String, List<String>> arguments) {
    return normalize(registry.get(), queryType, arguments);
  }

  QueryArguments normalize(ResourceRegistry snapshot, QueryType queryType, Map<String, List<String>> arguments) {
    QueryArguments normalized = normalizer.normalize(queryType, arguments,
        Map.of(RESOURCES, snapshot.resources(queryType.getEntityType())));
    return normalized.has(LICENSE) ? normalized : normalized.with(LICENSE, properties.getDefaultLicense());
  }

  private QueryResponse query(QueryType queryType, Map<String, List<String>> arguments) {
    ResourceRegistry snapshot = registry.get();
    QueryArguments normalized = normalize(snapshot, queryType, arguments);
    OutputFormat format = format(normalized);
    CompiledQuery query = compiler.compile(normalized);
    var response = QueryResponse.builder()
        .status(QueryResponse.Status.OK)
        .format(format)
        .columns(query.getColumns())
        .query(query);
    if (format == OutputFormat.QUERY) {
      return response.body(ResultStream.empty()).build();
    }

    QueryParameters parameters = parameterMaps.get(queryType);
    LicenseTier tier = normalized.license().orElseThrow();
    LicenseFilter licenseFilter = LicenseFilter.create(snapshot, tier, parameters.getLicensePolicy(),
        query.getSelectedColumns());
    RowIterator rowIterator = storageConfiguration.getQueryExecutor().execute(query);
    RowCursor cursor = new RowCursor(rowIterator);
    ResultStream<Row> rows = cursor.with(licenseFilter.filter(cursor));
    return response.body(body(format, query.getColumns(), rows, normalized.header())).build();
  }

  private QueryResponse meta(MetaOperation operation, List<String> path, Map<String, List<String>> arguments) {
    QueryArguments normalized = normalizer.normalize(null, operation.arguments(), Map.of(), arguments);
    OutputFormat format = format(normalized);
    if (format != OutputFormat.TSV && format != OutputFormat.JSON) {
      throw new InvalidArgumentException(List.of(String.format("Format `%s` is not available for `%s`",
          format.name().toLowerCase(Locale.ROOT), operation.getOperationName())));
    }
    ResourceRegistry snapshot = registry.get();
    return switch (operation) {
      case QUERIES -> queries(snapshot, path, format);
      case DATASETS -> single(format, DATASETS, new ArrayList<>(snapshot.datasets()));
      case DATABASES -> databases(snapshot, path, format);
      case RESOURCES -> resources(snapshot, normalized);
    };
  }

  private QueryResponse queries(ResourceRegistry snapshot, List<String> path, OutputFormat format) {
    if (path.isEmpty()) {
      List<String> names = Arrays.stream(QueryType.values()).map(QueryType::getQueryName).sorted().toList();
      return single(format, "queries", names);
    }
    QueryType queryType = QueryType.fromName(path.get(0))
        .orElseThrow(() -> new InvalidArgumentException(List.of("Unknown query: `" + path.get(0) + "`")));
    Map<String, Set<String>> vocabularies = Map.of(RESOURCES, snapshot.resources(queryType.getEntityType()));
    var valid = new LinkedHashMap<String, List<String>>();
    normalizer.argumentSpecs(queryType, vocabularies).stream()
        .sorted(Comparator.comparing(ArgumentSpec::name))
        .forEach(spec -> valid.put(spec.name(), spec.kind() == ArgumentSpec.Kind.BOOLEAN ? BOOLEAN_VALUES
            : spec.values().stream().sorted().toList()));
    List<String> columns = List.of("argument", "values");
    if (format == OutputFormat.JSON) {
      return text(format, columns, List.of(ResultFormatter.toJson(valid)));
    }
    var lines = new ArrayList<String>();
    lines.add(ResultFormatter.tsvLine(columns));
    valid.forEach((argument, values) -> lines.add(ResultFormatter.tsvLine(List.of(argument, values))));
    return text(format, columns, lines);
  }

  private QueryResponse databases(ResourceRegistry snapshot, List<String> path, OutputFormat format) {
    if (path.isEmpty()) {
      return text(format, List.of("databases"), List.of(ResultFormatter.toJson(snapshot.resourcesByDataset())));
    }
    QueryType queryType = QueryType.fromName(path.get(0))
        .orElseThrow(() -> new InvalidArgumentException(List.of("Unknown query: `" + path.get(0) + "`")));
    if (queryType != QueryType.INTERACTIONS) {
      return single(format, "databases", List.of("*"));
    }
    Map<String, Set<String>> byDataset = snapshot.resourcesByDataset();
    List<String> datasets = path.size() > 1
        ? Arrays.asList(StringUtils.split(path.get(1), ','))
        : new ArrayList<>(byDataset.keySet());
    Set<String> resources = datasets.stream()
        .flatMap(dataset -> byDataset.getOrDefault(dataset, Set.of()).stream())
        .collect(Collectors.toCollection(TreeSet::new));
    return single(format, "databases", new ArrayList<>(resources));
  }

  private QueryResponse resources(ResourceRegistry snapshot, QueryArguments arguments) {
    LicenseTier tier = arguments.license()
        .or(() -> LicenseTier.fromName(properties.getDefaultLicense()))
        .orElseThrow();
    Set<EntityType> entityTypes = arguments.list(DATASETS).stream()
        .map(QueryType::fromName)
        .flatMap(Optional::stream)
        .map(QueryType::getEntityType)
        .collect(Collectors.toSet());
    var result = new LinkedHashMap<String, Object>();
    for (ResourceEntry entry : snapshot.entries()) {
      if (!snapshot.isEnabled(entry.getName(), tier)
          || (!entityTypes.isEmpty() && entityTypes.stream().noneMatch(entry.getQueries()::containsKey))) {
        continue;
      }
      result.put(entry.getName(), describe(entry));
    }
    return text(OutputFormat.JSON, List.of(RESOURCES), List.of(ResultFormatter.toJson(result)));
  }

  private static Map<String, Object> describe(ResourceEntry entry) {
    var license = new LinkedHashMap<String, Object>();
    license.put("name", entry.getLicense().getName());
    license.put("full_name", entry.getLicense().getFullName());
    license.put("purpose", entry.getLicense().getPurpose().name().toLowerCase(Locale.ROOT));
    var queries = new LinkedHashMap<String, Object>();
    entry.getQueries().forEach((entityType, info) -> queries.put(entityType.getTableName(), describe(info)));
    var description = new LinkedHashMap<String, Object>();
    description.put("license", license);
    description.put("queries", queries);
    if (!entry.getComponents().isEmpty()) {
      description.put("components", new TreeSet<>(entry.getComponents()));
    }
    return description;
  }

  private static Map<String, Object> describe(QueryInfo info) {
    var description = new LinkedHashMap<String, Object>();
    if (!info.datasets().isEmpty()) {
      description.put("datasets", info.datasets());
    }
    if (!info.genericCategories().isEmpty()) {
      description.put("generic_categories", info.genericCategories());
    }
    return description;
  }

  private OutputFormat format(QueryArguments arguments) {
    return arguments.format()
        .or(() -> OutputFormat.fromName(properties.getDefaultFormat()))
        .orElse(OutputFormat.TSV);
  }

  private static ResultStream<?> body(OutputFormat format, List<String> columns, ResultStream<Row> rows,
                                      boolean header) {
    return switch (format) {
      case RAW -> ResultFormatter.records(columns, rows);
      case TSV -> ResultFormatter.tsv(columns, rows, header);
      case JSON -> ResultFormatter.json(columns, rows);
      case QUERY -> throw new IllegalStateException("Nothing to execute for format " + format);
    };
  }

  private static QueryResponse single(OutputFormat format, String column, List<String> values) {
    String unit = format == OutputFormat.JSON ? ResultFormatter.toJson(values) : String.join(";", values);
    return text(format, List.of(column), List.of(unit));
  }

  private static QueryResponse text(OutputFormat format, List<String> columns, List<String> units) {
    return QueryResponse.builder()
        .status(QueryResponse.Status.OK)
        .format(format)
        .columns(columns)
        .body(ResultStream.of(units))
        .build();
  }
}
