package com.quantori.nqp.core.query;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.quantori.nqp.api.model.QueryType;
import com.quantori.nqp.core.TestSchemaCatalog;
import com.quantori.nqp.core.license.LicensePolicy;
import java.util.List;
import org.junit.jupiter.api.Test;

class QueryParametersValidatorTest {

  @Test
  void servedParameterMapsMatchTheSchema() {
    assertThatCode(() -> QueryParametersValidator.validate(QueryParameterMaps.defaults(), new TestSchemaCatalog()))
        .doesNotThrowAnyException();
  }

  @Test
  void reportsEveryInvalidReference() {
    QueryParameters broken = QueryParameters.builder()
        .queryType(QueryType.COMPLEXES)
        .defaultColumn("name")
        .defaultColumn("subunits")
        .booleanFilter("named", BooleanFilter.exact("name"))
        .licensePolicy(LicensePolicy.attribution("sources", "stoichiometry"))
        .build();

    assertThatThrownBy(() -> QueryParametersValidator.validate(
        new QueryParameterMaps(List.of(broken)), new TestSchemaCatalog()))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("complexes refers to unknown column subunits")
        .hasMessageContaining("complexes expects name to be boolean")
        .hasMessageContaining("stoichiometry");
  }
}
