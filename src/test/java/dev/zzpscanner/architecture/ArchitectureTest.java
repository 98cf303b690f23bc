package dev.zzpscanner.architecture;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

@AnalyzeClasses(packages = "dev.zzpscanner", importOptions = ImportOption.DoNotIncludeTests.class)
class ArchitectureTest {

  // Feature packages should not depend on the REST adapter.
  @ArchTest
  static final ArchRule features_should_not_depend_on_api =
      noClasses()
          .that()
          .resideInAnyPackage(
              "..business..",
              "..job..",
              "..crawl..",
              "..website..",
              "..enrichment..",
              "..maintenance..",
              "..dashboard..",
              "..export..")
          .should()
          .dependOnClassesThat()
          .resideInAPackage("..api..");

  // Config package should not depend on feature or adapter packages
  @ArchTest
  static final ArchRule config_should_not_depend_on_features =
      noClasses()
          .that()
          .resideInAPackage("..config..")
          .should()
          .dependOnClassesThat()
          .resideInAnyPackage(
              "..api..", "..business..", "..job..", "..crawl..", "..website..", "..enrichment..");

  // The catalog knows nothing about the jobs that fill it.
  @ArchTest
  static final ArchRule business_should_not_depend_on_jobs =
      noClasses()
          .that()
          .resideInAPackage("dev.zzpscanner.business..")
          .should()
          .dependOnClassesThat()
          .resideInAnyPackage("..job..", "..crawl..", "..website..", "..enrichment..");

  // Executors are found by the dispatcher through the JobExecutor seam, never called directly.
  @ArchTest
  static final ArchRule executors_are_not_referenced_by_other_features =
      noClasses()
          .that()
          .resideInAnyPackage("..job..", "..maintenance..", "..dashboard..", "..export..")
          .should()
          .dependOnClassesThat()
          .resideInAnyPackage("..crawl..", "..enrichment..");

  // No cyclic dependencies between top-level packages
  @ArchTest
  static final ArchRule no_package_cycles =
      slices().matching("dev.zzpscanner.(*)..").should().beFreeOfCycles();
}
