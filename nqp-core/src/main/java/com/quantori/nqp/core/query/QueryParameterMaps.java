package com.quantori.nqp.core.query;

import com.quantori.nqp.api.model.ConjunctionCriteria;
import com.quantori.nqp.api.model.LicenseTier;
import com.quantori.nqp.api.model.QueryType;
import com.quantori.nqp.core.format.OutputFormat;
import com.quantori.nqp.core.license.LicensePolicy;
import java.util.Arrays;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Query parameter maps of all query types.
 */
public class QueryParameterMaps {

  public static final String FORMAT = "format";
  public static final String HEADER = "header";
  public static final String LIMIT = "limit";
  public static final String LICENSE = "license";
  public static final String PASSWORD = "password";
  public static final String FIELDS = "fields";
  public static final String RESOURCES = "resources";
  public static final String DATASETS = "datasets";

  static final List<String> ENTITY_TYPES = List.of(
      "protein", "complex", "mirna", "lncrna", "small_molecule", "drug", "metabolite", "lipid");
  static final List<String> ORGANISMS = List.of("9606", "10090", "10116");
  static final List<String> INTERACTION_DATASETS = List.of(
      "omnipath", "dorothea", "collectri", "tf_target", "tf_mirna", "lncrna_mrna", "kinaseextra", "ligrecextra",
      "pathwayextra", "mirnatarget", "small_molecule");
  static final List<String> DOROTHEA_LEVELS = List.of("A", "B", "C", "D", "E");
  static final Map<String, String> DOROTHEA_METHODS = Map.of(
      "curated", "dorothea_curated",
      "chipseq", "dorothea_chipseq",
      "tfbs", "dorothea_tfbs",
      "coexp", "dorothea_coexp");
  static final Map<String, String> OPERATOR_SYNONYMS = Map.of("and", "AND", "or", "OR");

  private final Map<QueryType, QueryParameters> parameters;

  public QueryParameterMaps(Collection<QueryParameters> parameters) {
    var byType = new EnumMap<QueryType, QueryParameters>(QueryType.class);
    parameters.forEach(p -> byType.put(p.getQueryType(), p));
    this.parameters = byType;
  }

  /**
   * Parameter maps of the served tables.
   */
  public static QueryParameterMaps defaults() {
    return new QueryParameterMaps(List.of(
        interactions(), enzsub(), complexes(), annotations(), annotationsSummary(), intercell(), intercellSummary()));
  }

  public QueryParameters get(QueryType queryType) {
    var result = parameters.get(queryType);
    if (result == null) {
      throw new IllegalArgumentException("No parameters defined for query " + queryType.getQueryName());
    }
    return result;
  }

  public Collection<QueryParameters> all() {
    return parameters.values();
  }

  /**
   * Arguments every data query accepts.
   */
  public static List<ArgumentSpec> commonArguments() {
    return List.of(
        ArgumentSpec.string(FORMAT, OutputFormat.allNames()),
        ArgumentSpec.bool(HEADER),
        ArgumentSpec.integer(LIMIT),
        ArgumentSpec.string(LICENSE, licenseNames()),
        ArgumentSpec.string(PASSWORD));
  }

  static String[] licenseNames() {
    return Arrays.stream(LicenseTier.values())
        .flatMap(tier -> tier.getNames().stream())
        .sorted()
        .toArray(String[]::new);
  }

  static QueryParameters interactions() {
    var datasets = FlagGroup.builder()
        .argument(DATASETS)
        .fieldName(DATASETS);
    INTERACTION_DATASETS.forEach(dataset -> datasets.valueColumn(dataset, List.of(dataset)));
    datasets.override("dorothea", List.of(
        FlagOverride.arrayMembership("dorothea_levels", "dorothea_level", List.of("A", "B")),
        FlagOverride.booleanColumns("dorothea_methods", DOROTHEA_METHODS)));

    return QueryParameters.builder()
        .queryType(QueryType.INTERACTIONS)
        .argument(ArgumentSpec.list(DATASETS, INTERACTION_DATASETS.toArray(String[]::new))
            .withSynonyms(Map.of("tfregulons", "dorothea")))
        .argument(ArgumentSpec.list("types", "post_translational", "transcriptional", "post_transcriptional",
            "mirna_transcriptional", "lncrna_post_transcriptional", "small_molecule_protein"))
        .argument(ArgumentSpec.list("sources"))
        .argument(ArgumentSpec.list("targets"))
        .argument(ArgumentSpec.list("partners"))
        .argument(ArgumentSpec.list(RESOURCES))
        .argument(ArgumentSpec.bool("genesymbols"))
        .argument(ArgumentSpec.bool("evidences"))
        .argument(ArgumentSpec.bool("extra_attrs"))
        .argument(ArgumentSpec.list("dorothea_levels", DOROTHEA_LEVELS.toArray(String[]::new)))
        .argument(ArgumentSpec.list("dorothea_methods", "curated", "chipseq", "coexp", "tfbs"))
        .argument(ArgumentSpec.list("organisms", ORGANISMS.toArray(String[]::new)))
        .argument(ArgumentSpec.string("source_target", "AND", "OR").withSynonyms(OPERATOR_SYNONYMS))
        .argument(ArgumentSpec.bool("directed"))
        .argument(ArgumentSpec.bool("signed"))
        .argument(ArgumentSpec.bool("loops"))
        .argument(ArgumentSpec.list("entity_types", ENTITY_TYPES.toArray(String[]::new)))
        .argumentSynonym("databases", RESOURCES)
        .argumentSynonym("tfregulons_levels", "dorothea_levels")
        .argumentSynonym("tfregulons_methods", "dorothea_methods")
        .defaultColumn("source")
        .defaultColumn("target")
        .defaultColumn("is_directed")
        .defaultColumn("is_stimulation")
        .defaultColumn("is_inhibition")
        .defaultColumn("consensus_direction")
        .defaultColumn("consensus_stimulation")
        .defaultColumn("consensus_inhibition")
        .columnSwitch("genesymbols", List.of("source_genesymbol", "target_genesymbol"))
        .columnSwitch("evidences", List.of("evidences"))
        .columnSwitch("extra_attrs", List.of("extra_attrs"))
        .fieldColumn("references", List.of("references"))
        .fieldColumn("sources", List.of("sources"))
        .fieldColumn("dorothea_level", List.of("dorothea_level"))
        .fieldColumn("dorothea_curated", List.of("dorothea_curated"))
        .fieldColumn("dorothea_chipseq", List.of("dorothea_chipseq"))
        .fieldColumn("dorothea_tfbs", List.of("dorothea_tfbs"))
        .fieldColumn("dorothea_coexp", List.of("dorothea_coexp"))
        .fieldColumn("type", List.of("type"))
        .fieldColumn("ncbi_tax_id", List.of("ncbi_tax_id_source", "ncbi_tax_id_target"))
        .fieldColumn("entity_type", List.of("entity_type_source", "entity_type_target"))
        .fieldColumn("curation_effort", List.of("curation_effort"))
        .fieldColumn("extra_attrs", List.of("extra_attrs"))
        .fieldColumn("evidences", List.of("evidences"))
        .fieldSynonym("organism", "ncbi_tax_id")
        .fieldSynonym("databases", "sources")
        .fieldSynonym(RESOURCES, "sources")
        .fieldSynonym("tfregulons_level", "dorothea_level")
        .fieldSynonym("tfregulons_curated", "dorothea_curated")
        .fieldSynonym("tfregulons_chipseq", "dorothea_chipseq")
        .fieldSynonym("tfregulons_tfbs", "dorothea_tfbs")
        .fieldSynonym("tfregulons_coexp", "dorothea_coexp")
        .whereColumn(RESOURCES, ColumnGroup.of("sources"))
        .whereColumn("types", ColumnGroup.of("type"))
        .whereColumn("organisms", ColumnGroup.of("ncbi_tax_id_source", "ncbi_tax_id_target"))
        .whereColumn("entity_types",
            ColumnGroup.of("entity_type_source", "entity_type_target").conjunctiveFor("protein"))
        .partnerGroup(PartnerGroup.builder()
            .sideArgument("sources")
            .otherSideArgument("targets")
            .sideColumn("source")
            .sideColumn("source_genesymbol")
            .otherSideColumn("target")
            .otherSideColumn("target_genesymbol")
            .operatorArgument("source_target")
            .defaultOperator(ConjunctionCriteria.Operator.OR)
            .partnersArgument("partners")
            .loopsArgument("loops")
            .loopColumn("source")
            .otherLoopColumn("target")
            .build())
        .flagGroup(datasets.build())
        .booleanFilter("directed", BooleanFilter.whenTrue(true, "is_directed"))
        .booleanFilter("signed", BooleanFilter.whenTrue(null, "is_stimulation", "is_inhibition"))
        .defaultValues("organisms", List.of("9606"))
        .datasetDefault(new DatasetDefault(DATASETS, Set.of(RESOURCES, DATASETS, "types"), List.of("omnipath")))
        .licensePolicy(LicensePolicy.attribution("sources", "references"))
        .build();
  }

  static QueryParameters enzsub() {
    return QueryParameters.builder()
        .queryType(QueryType.ENZSUB)
        .argument(ArgumentSpec.list("enzymes"))
        .argument(ArgumentSpec.list("substrates"))
        .argument(ArgumentSpec.list("partners"))
        .argument(ArgumentSpec.bool("genesymbols"))
        .argument(ArgumentSpec.list("organisms", ORGANISMS.toArray(String[]::new)))
        .argument(ArgumentSpec.list(RESOURCES))
        .argument(ArgumentSpec.list("residues"))
        .argument(ArgumentSpec.list("modification"))
        .argument(ArgumentSpec.list("types"))
        .argument(ArgumentSpec.string("enzyme_substrate", "AND", "OR").withSynonyms(OPERATOR_SYNONYMS))
        .argument(ArgumentSpec.bool("loops"))
        .argumentSynonym("databases", RESOURCES)
        .defaultColumn("enzyme")
        .defaultColumn("substrate")
        .defaultColumn("residue_type")
        .defaultColumn("residue_offset")
        .defaultColumn("modification")
        .columnSwitch("genesymbols", List.of("enzyme_genesymbol", "substrate_genesymbol"))
        .fieldColumn("sources", List.of("sources"))
        .fieldColumn("references", List.of("references"))
        .fieldColumn("ncbi_tax_id", List.of("ncbi_tax_id"))
        .fieldColumn("isoforms", List.of("isoforms"))
        .fieldColumn("curation_effort", List.of("curation_effort"))
        .fieldSynonym("organism", "ncbi_tax_id")
        .fieldSynonym("databases", "sources")
        .fieldSynonym(RESOURCES, "sources")
        .whereColumn(RESOURCES, ColumnGroup.of("sources"))
        .whereColumn("organisms", ColumnGroup.of("ncbi_tax_id"))
        .whereColumn("residues", ColumnGroup.of("residue_type"))
        .whereColumn("types", ColumnGroup.of("modification"))
        .whereColumn("modification", ColumnGroup.of("modification"))
        .partnerGroup(PartnerGroup.builder()
            .sideArgument("enzymes")
            .otherSideArgument("substrates")
            .sideColumn("enzyme")
            .sideColumn("enzyme_genesymbol")
            .otherSideColumn("substrate")
            .otherSideColumn("substrate_genesymbol")
            .operatorArgument("enzyme_substrate")
            .defaultOperator(ConjunctionCriteria.Operator.AND)
            .partnersArgument("partners")
            .loopsArgument("loops")
            .loopColumn("enzyme")
            .otherLoopColumn("substrate")
            .build())
        .defaultValues("organisms", List.of("9606"))
        .licensePolicy(LicensePolicy.attribution("sources", "references"))
        .build();
  }

  static QueryParameters complexes() {
    return QueryParameters.builder()
        .queryType(QueryType.COMPLEXES)
        .argument(ArgumentSpec.list(RESOURCES))
        .argument(ArgumentSpec.list("proteins"))
        .argumentSynonym("databases", RESOURCES)
        .defaultColumn("name")
        .defaultColumn("components")
        .defaultColumn("components_genesymbols")
        .defaultColumn("stoichiometry")
        .defaultColumn("sources")
        .defaultColumn("references")
        .defaultColumn("identifiers")
        .openFields(true)
        .whereColumn(RESOURCES, ColumnGroup.of("sources"))
        .whereColumn("proteins", ColumnGroup.of("components"))
        .licensePolicy(LicensePolicy.attribution("sources", "identifiers"))
        .build();
  }

  static QueryParameters annotations() {
    return QueryParameters.builder()
        .queryType(QueryType.ANNOTATIONS)
        .argument(ArgumentSpec.list(RESOURCES))
        .argument(ArgumentSpec.list("proteins"))
        .argument(ArgumentSpec.bool("genesymbols"))
        .argument(ArgumentSpec.list("entity_types", ENTITY_TYPES.toArray(String[]::new)))
        .argumentSynonym("databases", RESOURCES)
        .defaultColumn("uniprot")
        .defaultColumn("entity_type")
        .defaultColumn("source")
        .defaultColumn("label")
        .defaultColumn("value")
        .defaultColumn("record_id")
        .columnSwitch("genesymbols", List.of("genesymbol"))
        .openFields(true)
        .whereColumn(RESOURCES, ColumnGroup.of("source"))
        .whereColumn("proteins", ColumnGroup.of("uniprot", "genesymbol"))
        .whereColumn("entity_types", ColumnGroup.of("entity_type"))
        .requiredArgument(RESOURCES)
        .requiredArgument("proteins")
        .licensePolicy(LicensePolicy.simple("source"))
        .build();
  }

  static QueryParameters annotationsSummary() {
    return QueryParameters.builder()
        .queryType(QueryType.ANNOTATIONS_SUMMARY)
        .argument(ArgumentSpec.list(RESOURCES))
        .argument(ArgumentSpec.bool("cytoscape"))
        .argumentSynonym("databases", RESOURCES)
        .defaultColumn("source")
        .defaultColumn("label")
        .openFields(true)
        .whereColumn(RESOURCES, ColumnGroup.of("source"))
        .pairFilter(new PairFilter("cytoscape", "source", "label", CytoscapeAttributes.PAIRS))
        .distinct(true)
        .build();
  }

  static QueryParameters intercell() {
    return intercellArguments(QueryParameters.builder().queryType(QueryType.INTERCELL))
        .argument(ArgumentSpec.list("proteins"))
        .argument(ArgumentSpec.list("entity_types", ENTITY_TYPES.toArray(String[]::new)))
        .argument(ArgumentSpec.list("causality", "transmitter", "receiver", "both")
            .withSynonyms(Map.of("trans", "transmitter", "rec", "receiver")))
        .argument(ArgumentSpec.list("topology",
                "secreted", "plasma_membrane_peripheral", "plasma_membrane_transmembrane")
            .withSynonyms(Map.of(
                "sec", "secreted",
                "pmp", "plasma_membrane_peripheral",
                "pmtm", "plasma_membrane_transmembrane")))
        .defaultColumn("category")
        .defaultColumn("parent")
        .defaultColumn("database")
        .defaultColumn("scope")
        .defaultColumn("aspect")
        .defaultColumn("source")
        .defaultColumn("uniprot")
        .defaultColumn("genesymbol")
        .defaultColumn("entity_type")
        .defaultColumn("consensus_score")
        .defaultColumn("transmitter")
        .defaultColumn("receiver")
        .defaultColumn("secreted")
        .defaultColumn("plasma_membrane_transmembrane")
        .defaultColumn("plasma_membrane_peripheral")
        .whereColumn("proteins", ColumnGroup.of("uniprot", "genesymbol"))
        .whereColumn("entity_types", ColumnGroup.of("entity_type"))
        .flagGroup(FlagGroup.builder()
            .argument("causality")
            .valueColumn("transmitter", List.of("transmitter"))
            .valueColumn("receiver", List.of("receiver"))
            .valueColumn("both", List.of("transmitter", "receiver"))
            .build())
        .flagGroup(FlagGroup.builder()
            .argument("topology")
            .valueColumn("secreted", List.of("secreted"))
            .valueColumn("plasma_membrane_peripheral", List.of("plasma_membrane_peripheral"))
            .valueColumn("plasma_membrane_transmembrane", List.of("plasma_membrane_transmembrane"))
            .build())
        .licensePolicy(LicensePolicy.simple("database"))
        .build();
  }

  static QueryParameters intercellSummary() {
    return intercellArguments(QueryParameters.builder().queryType(QueryType.INTERCELL_SUMMARY))
        .defaultColumn("category")
        .defaultColumn("parent")
        .defaultColumn("database")
        .distinct(true)
        .build();
  }

  private static QueryParameters.QueryParametersBuilder intercellArguments(
      QueryParameters.QueryParametersBuilder builder) {
    builder
        .argument(ArgumentSpec.list("scope", "specific", "generic"))
        .argument(ArgumentSpec.list("aspect", "functional", "locational"))
        .argument(ArgumentSpec.list("source", "resource_specific", "composite"))
        .argument(ArgumentSpec.list("categories"))
        .argument(ArgumentSpec.list(RESOURCES))
        .argument(ArgumentSpec.list("parent"))
        .argumentSynonym("databases", RESOURCES)
        .openFields(true)
        .whereColumn("scope", ColumnGroup.of("scope"))
        .whereColumn("aspect", ColumnGroup.of("aspect"))
        .whereColumn("source", ColumnGroup.of("source"))
        .whereColumn("categories", ColumnGroup.of("category"))
        .whereColumn(RESOURCES, ColumnGroup.of("database"))
        .whereColumn("parent", ColumnGroup.of("parent"));
    Map<String, String> shortNames = Map.of(
        "transmitter", "trans",
        "receiver", "rec",
        "secreted", "sec",
        "plasma_membrane_peripheral", "pmp",
        "plasma_membrane_transmembrane", "pmtm");
    shortNames.keySet().stream().sorted().forEach(column -> builder
        .argument(ArgumentSpec.bool(column))
        .argumentSynonym(shortNames.get(column), column)
        .booleanFilter(column, BooleanFilter.exact(column)));
    return builder;
  }
}
