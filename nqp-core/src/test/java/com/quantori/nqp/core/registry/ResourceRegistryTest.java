package com.quantori.nqp.core.registry;

import static org.assertj.core.api.Assertions.assertThat;

import com.quantori.nqp.api.model.EntityType;
import com.quantori.nqp.api.model.License;
import com.quantori.nqp.api.model.LicensePurpose;
import com.quantori.nqp.api.model.LicenseTier;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class ResourceRegistryTest {

  private final ResourceRegistry registry = new ResourceRegistry(List.of(
      entry("SIGNOR", LicensePurpose.ACADEMIC, Set.of("omnipath")),
      entry("Reactome", LicensePurpose.COMMERCIAL, Set.of("omnipath", "pathwayextra")),
      entry("ExTRI_CollecTRI", LicensePurpose.COMMERCIAL, Set.of("collectri")),
      entry("TRRUST_CollecTRI", LicensePurpose.ACADEMIC, Set.of("collectri")),
      ResourceEntry.builder()
          .name("CollecTRI")
          .license(license(LicensePurpose.COMPOSITE))
          .query(EntityType.INTERACTIONS, new QueryInfo(Set.of("collectri"), Set.of()))
          .component("ExTRI_CollecTRI")
          .component("TRRUST_CollecTRI")
          .build(),
      ResourceEntry.builder()
          .name("Umbrella")
          .license(license(LicensePurpose.COMPOSITE))
          .component("CollecTRI")
          .build(),
      entry("Mystery", LicensePurpose.NONE, Set.of())));

  @Test
  void compositesAreEnabledThroughTheirComponents() {
    assertThat(registry.enabledResources(LicenseTier.COMMERCIAL))
        .containsExactlyInAnyOrder("Reactome", "ExTRI_CollecTRI", "CollecTRI", "Umbrella");
    assertThat(registry.enabledResources(LicenseTier.ACADEMIC))
        .containsExactlyInAnyOrder("SIGNOR", "Reactome", "ExTRI_CollecTRI", "TRRUST_CollecTRI", "CollecTRI",
            "Umbrella");
  }

  @Test
  void higherTiersEnableSubsets() {
    assertThat(registry.enabledResources(LicenseTier.ACADEMIC))
        .containsAll(registry.enabledResources(LicenseTier.COMMERCIAL));
    assertThat(registry.enabledResources(LicenseTier.IGNORE))
        .containsAll(registry.enabledResources(LicenseTier.ACADEMIC))
        .contains("Mystery");
  }

  @Test
  void unknownResourcesOnlyWhenIgnoringLicenses() {
    assertThat(registry.isEnabled("Nowhere", LicenseTier.IGNORE)).isTrue();
    assertThat(registry.isEnabled("Nowhere", LicenseTier.ACADEMIC)).isFalse();
    assertThat(registry.isEnabled("Mystery", LicenseTier.ACADEMIC)).isFalse();
  }

  @Test
  void groupsResourcesByDataset() {
    assertThat(registry.datasets()).containsExactly("collectri", "omnipath", "pathwayextra");
    assertThat(registry.resourcesByDataset().get("collectri"))
        .containsExactly("CollecTRI", "ExTRI_CollecTRI", "TRRUST_CollecTRI");
    assertThat(registry.resources(EntityType.INTERACTIONS)).doesNotContain("Umbrella").contains("Mystery");
    assertThat(registry.components("CollecTRI")).containsExactlyInAnyOrder("ExTRI_CollecTRI", "TRRUST_CollecTRI");
    assertThat(registry.isComposite("Umbrella")).isTrue();
    assertThat(registry.isComposite("Nowhere")).isFalse();
  }

  @Test
  void emptyRegistryEnablesNothing() {
    ResourceRegistry empty = ResourceRegistry.empty();

    assertThat(empty.enabledResources(LicenseTier.ACADEMIC)).isEmpty();
    assertThat(empty.entries()).isEmpty();
  }

  private static ResourceEntry entry(String name, LicensePurpose purpose, Set<String> datasets) {
    return ResourceEntry.builder()
        .name(name)
        .license(license(purpose))
        .query(EntityType.INTERACTIONS, new QueryInfo(datasets, Set.of()))
        .build();
  }

  private static License license(LicensePurpose purpose) {
    return License.builder().name(purpose.name()).fullName(purpose.name()).purpose(purpose).build();
  }
}
