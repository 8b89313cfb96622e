package dev.inkmatch.architecture;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

@AnalyzeClasses(packages = "dev.inkmatch", importOptions = ImportOption.DoNotIncludeTests.class)
class ArchitectureTest {

  // The engine packages must not know how they are exposed or wired.
  @ArchTest
  static final ArchRule engine_should_not_depend_on_adapters =
      noClasses()
          .that()
          .resideInAnyPackage(
              "..profile..",
              "..request..",
              "..candidate..",
              "..feature..",
              "..evaluator..",
              "..consensus..",
              "..ranking..",
              "..error..")
          .should()
          .dependOnClassesThat()
          .resideInAnyPackage("..api..", "..config..");

  @ArchTest
  static final ArchRule config_should_not_depend_on_api =
      noClasses()
          .that()
          .resideInAPackage("..config..")
          .should()
          .dependOnClassesThat()
          .resideInAPackage("..api..");

  // Strategies only see features, never candidates or requests.
  @ArchTest
  static final ArchRule strategies_should_only_see_features =
      noClasses()
          .that()
          .resideInAPackage("..evaluator..")
          .should()
          .dependOnClassesThat()
          .resideInAnyPackage("..candidate..", "..request..", "..ranking..");

  // No cyclic dependencies between top-level packages
  @ArchTest
  static final ArchRule no_package_cycles =
      slices().matching("dev.inkmatch.(*)..").should().beFreeOfCycles();
}
